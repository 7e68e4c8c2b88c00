package org.flutterjs.ir.expr;

import org.flutterjs.ir.visitor.ExpressionVisitor;

import java.util.List;

public record SetLiteralExpr(List<Expression> elements, boolean isConst) implements Expression {

    public SetLiteralExpr {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
