package org.flutterjs.ir.expr;

import org.flutterjs.ir.visitor.ExpressionVisitor;

public record BinaryExpr(Expression left, BinaryOperator operator, Expression right) implements Expression {

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
