package org.flutterjs.ir.expr;

import org.flutterjs.ir.visitor.ExpressionVisitor;

import java.util.List;

public record MapLiteralExpr(List<MapEntryExpr> entries, boolean isConst) implements Expression {

    public MapLiteralExpr {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
