package org.flutterjs.ir.stmt;

import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.visitor.StatementVisitor;

public record DoWhileStmt(Statement body, Expression condition) implements Statement {

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
