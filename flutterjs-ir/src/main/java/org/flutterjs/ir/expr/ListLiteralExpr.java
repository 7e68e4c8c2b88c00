package org.flutterjs.ir.expr;

import org.flutterjs.ir.visitor.ExpressionVisitor;

import java.util.List;

public record ListLiteralExpr(List<Expression> elements, boolean isConst) implements Expression {

    public ListLiteralExpr {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
