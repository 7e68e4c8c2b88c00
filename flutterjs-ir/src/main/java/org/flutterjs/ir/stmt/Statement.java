package org.flutterjs.ir.stmt;

import org.flutterjs.ir.visitor.StatementVisitor;

/**
 * Closed hierarchy of statement nodes, dispatched through {@link StatementVisitor}.
 */
public sealed interface Statement permits
        ExpressionStmt, VariableDeclarationStmt, BlockStmt,
        IfStmt, ForStmt, ForEachStmt, WhileStmt, DoWhileStmt, SwitchStmt, TryStmt,
        ReturnStmt, BreakStmt, ContinueStmt, ThrowStmt, UnknownStmt {

    <R, A> R accept(StatementVisitor<R, A> visitor, A arg);
}
