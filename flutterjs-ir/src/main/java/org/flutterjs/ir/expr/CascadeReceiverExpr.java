package org.flutterjs.ir.expr;

import org.flutterjs.ir.visitor.ExpressionVisitor;

/**
 * The implicit receiver of a cascade section.
 */
public record CascadeReceiverExpr() implements Expression {

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
