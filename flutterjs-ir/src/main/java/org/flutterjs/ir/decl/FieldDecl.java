package org.flutterjs.ir.decl;

import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.type.TypeRef;

public record FieldDecl(String name,
                        TypeRef type,
                        Expression initializer,
                        boolean isFinal,
                        boolean isConst,
                        boolean isStatic,
                        boolean isLate) {

    public FieldDecl {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Field name must not be empty");
        }
    }

    public boolean isPrivate() {
        return name.startsWith("_");
    }
}
