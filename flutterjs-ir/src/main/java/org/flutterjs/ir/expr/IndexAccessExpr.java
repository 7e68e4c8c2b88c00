package org.flutterjs.ir.expr;

import org.flutterjs.ir.visitor.ExpressionVisitor;

/**
 * {@code target[index]}. {@code nullableTarget} is set when the front end typed the target
 * as nullable (or the source used {@code ?[]}).
 */
public record IndexAccessExpr(Expression target, Expression index, boolean nullableTarget) implements Expression {

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
