package org.flutterjs.ir.expr;

import org.flutterjs.ir.type.TypeRef;
import org.flutterjs.ir.visitor.ExpressionVisitor;

public record IsExpr(Expression expression, TypeRef type, boolean negated) implements Expression {

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
