package org.flutterjs.ir.expr;

import org.flutterjs.ir.visitor.ExpressionVisitor;

import java.util.List;

/**
 * {@code target..a()..b = 1}. Each section refers to the cascade target through
 * {@link CascadeReceiverExpr}.
 */
public record CascadeExpr(Expression target, List<Expression> sections) implements Expression {

    public CascadeExpr {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
