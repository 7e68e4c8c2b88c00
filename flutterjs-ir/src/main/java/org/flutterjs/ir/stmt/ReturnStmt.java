package org.flutterjs.ir.stmt;

import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.visitor.StatementVisitor;

/**
 * {@code return;} when {@code expression} is {@code null}.
 */
public record ReturnStmt(Expression expression) implements Statement {

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
