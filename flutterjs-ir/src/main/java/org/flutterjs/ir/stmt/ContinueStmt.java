package org.flutterjs.ir.stmt;

import org.flutterjs.ir.visitor.StatementVisitor;

public record ContinueStmt(String label) implements Statement {

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
