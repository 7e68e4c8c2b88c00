package org.flutterjs.ir.expr;

import org.flutterjs.ir.visitor.ExpressionVisitor;

import java.util.List;

public record StringInterpolationExpr(List<InterpolationPart> parts) implements Expression {

    public StringInterpolationExpr {
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
