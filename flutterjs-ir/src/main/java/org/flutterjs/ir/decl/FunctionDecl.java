package org.flutterjs.ir.decl;

import org.flutterjs.ir.stmt.BlockStmt;
import org.flutterjs.ir.type.TypeRef;

import java.util.List;

/**
 * A method of a class or a top-level function. {@code body} is {@code null} for abstract
 * and external members.
 */
public record FunctionDecl(String name,
                           List<Parameter> parameters,
                           TypeRef returnType,
                           BlockStmt body,
                           boolean isAsync,
                           boolean isGetter,
                           boolean isSetter,
                           boolean isStatic) {

    public FunctionDecl {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Function name must not be empty");
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        if (isGetter && isSetter) {
            throw new IllegalArgumentException("'" + name + "' cannot be both a getter and a setter");
        }
    }

    public boolean isAccessor() {
        return isGetter || isSetter;
    }

    public boolean hasBody() {
        return body != null;
    }

    public FunctionDecl withBody(BlockStmt newBody) {
        return new FunctionDecl(name, parameters, returnType, newBody, isAsync, isGetter, isSetter, isStatic);
    }
}
