package org.flutterjs.ir.stmt;

import org.flutterjs.ir.visitor.StatementVisitor;

import java.util.List;

public record BlockStmt(List<Statement> statements) implements Statement {

    public BlockStmt {
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    public static BlockStmt empty() {
        return new BlockStmt(List.of());
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
