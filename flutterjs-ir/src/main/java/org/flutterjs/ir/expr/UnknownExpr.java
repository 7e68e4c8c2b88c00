package org.flutterjs.ir.expr;

import org.flutterjs.ir.visitor.ExpressionVisitor;

/**
 * A construct the front end could not lower into a supported variant. {@code source} is
 * the original text, kept for diagnostics.
 */
public record UnknownExpr(String source) implements Expression {

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
