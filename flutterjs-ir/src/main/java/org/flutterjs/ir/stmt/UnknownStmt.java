package org.flutterjs.ir.stmt;

import org.flutterjs.ir.visitor.StatementVisitor;

/**
 * A statement the front end could not lower; {@code source} is kept for diagnostics.
 */
public record UnknownStmt(String source) implements Statement {

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
