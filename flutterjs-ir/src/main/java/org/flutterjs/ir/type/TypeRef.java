package org.flutterjs.ir.type;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A reference to a named type as written in the source program, e.g. {@code List<String>?}.
 * <p>
 * Type references carry no resolution state; the generator only needs the display name,
 * the type arguments (to find {@code State<Foo>} pairings) and nullability.
 */
public record TypeRef(String name, List<TypeRef> typeArguments, boolean nullable) {

    public static final TypeRef DYNAMIC = new TypeRef("dynamic", List.of(), false);
    public static final TypeRef VOID = new TypeRef("void", List.of(), false);

    public TypeRef {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Type name must not be empty");
        }
        typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
    }

    public static TypeRef of(String name, TypeRef... typeArguments) {
        return new TypeRef(name, List.of(typeArguments), false);
    }

    public static TypeRef nullable(String name, TypeRef... typeArguments) {
        return new TypeRef(name, List.of(typeArguments), true);
    }

    public TypeRef asNullable() {
        return nullable ? this : new TypeRef(name, typeArguments, true);
    }

    public boolean isDynamic() {
        return "dynamic".equals(name) || "var".equals(name);
    }

    /**
     * Source-style rendering, e.g. {@code Map<String, int>?}.
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder(name);
        if (!typeArguments.isEmpty()) {
            sb.append(typeArguments.stream().map(TypeRef::displayName).collect(Collectors.joining(", ", "<", ">")));
        }
        if (nullable) {
            sb.append('?');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return displayName();
    }
}
