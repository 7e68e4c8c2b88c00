package org.flutterjs.ir.stmt;

import org.flutterjs.ir.visitor.StatementVisitor;

import java.util.List;

public record TryStmt(BlockStmt body, List<CatchClause> catchClauses, BlockStmt finallyBlock) implements Statement {

    public TryStmt {
        catchClauses = catchClauses == null ? List.of() : List.copyOf(catchClauses);
    }

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
