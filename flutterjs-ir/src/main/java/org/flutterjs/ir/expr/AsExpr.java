package org.flutterjs.ir.expr;

import org.flutterjs.ir.type.TypeRef;
import org.flutterjs.ir.visitor.ExpressionVisitor;

public record AsExpr(Expression expression, TypeRef type) implements Expression {

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
