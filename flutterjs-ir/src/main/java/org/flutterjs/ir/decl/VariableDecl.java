package org.flutterjs.ir.decl;

import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.type.TypeRef;

/**
 * A top-level variable of a program unit.
 */
public record VariableDecl(String name, TypeRef type, Expression initializer, boolean isFinal, boolean isConst) {

    public boolean isPrivate() {
        return name.startsWith("_");
    }
}
