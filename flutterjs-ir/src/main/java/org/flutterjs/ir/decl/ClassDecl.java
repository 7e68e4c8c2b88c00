package org.flutterjs.ir.decl;

import org.flutterjs.ir.type.TypeRef;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A class declaration as produced by the front end. Member names are unique within one class.
 *
 * @param flags free-form metadata such as {@code "extension-type"}
 */
public record ClassDecl(String name,
                        TypeRef superclass,
                        List<TypeRef> interfaces,
                        List<TypeRef> mixins,
                        List<FieldDecl> fields,
                        List<ConstructorDecl> constructors,
                        List<FunctionDecl> methods,
                        boolean isAbstract,
                        Set<String> flags) {

    public ClassDecl {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Class name must not be empty");
        }
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
        mixins = mixins == null ? List.of() : List.copyOf(mixins);
        fields = fields == null ? List.of() : List.copyOf(fields);
        constructors = constructors == null ? List.of() : List.copyOf(constructors);
        methods = methods == null ? List.of() : List.copyOf(methods);
        flags = flags == null ? Set.of() : Set.copyOf(flags);
    }

    public Optional<FunctionDecl> findMethod(String methodName) {
        return methods.stream().filter(m -> m.name().equals(methodName) && !m.isAccessor()).findFirst();
    }

    public List<FieldDecl> instanceFields() {
        return fields.stream().filter(f -> !f.isStatic()).toList();
    }

    public List<FieldDecl> staticFields() {
        return fields.stream().filter(FieldDecl::isStatic).toList();
    }

    public String superclassName() {
        return superclass == null ? null : superclass.name();
    }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }
}
