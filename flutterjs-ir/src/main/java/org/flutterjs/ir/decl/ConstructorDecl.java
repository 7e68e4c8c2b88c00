package org.flutterjs.ir.decl;

import org.flutterjs.ir.stmt.BlockStmt;

import java.util.List;

/**
 * {@code name} is {@code null} for the unnamed constructor.
 */
public record ConstructorDecl(String name,
                              List<Parameter> parameters,
                              BlockStmt body,
                              boolean isConst,
                              boolean isFactory) {

    public ConstructorDecl {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public boolean isUnnamed() {
        return name == null || name.isEmpty();
    }
}
