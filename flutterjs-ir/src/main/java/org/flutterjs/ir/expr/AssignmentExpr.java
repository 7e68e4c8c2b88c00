package org.flutterjs.ir.expr;

import org.flutterjs.ir.visitor.ExpressionVisitor;

public record AssignmentExpr(Expression target, AssignmentOperator operator, Expression value) implements Expression {

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
