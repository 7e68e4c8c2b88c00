package org.flutterjs.ir.expr;

import org.flutterjs.ir.visitor.ExpressionVisitor;

public record IdentifierExpr(String name) implements Expression {

    public IdentifierExpr {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Identifier name must not be empty");
        }
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
