package org.flutterjs.ir.visitor;

import org.flutterjs.ir.stmt.ExpressionStmt;
import org.flutterjs.ir.stmt.VariableDeclarationStmt;
import org.flutterjs.ir.stmt.BlockStmt;
import org.flutterjs.ir.stmt.IfStmt;
import org.flutterjs.ir.stmt.ForStmt;
import org.flutterjs.ir.stmt.ForEachStmt;
import org.flutterjs.ir.stmt.WhileStmt;
import org.flutterjs.ir.stmt.DoWhileStmt;
import org.flutterjs.ir.stmt.SwitchStmt;
import org.flutterjs.ir.stmt.TryStmt;
import org.flutterjs.ir.stmt.ReturnStmt;
import org.flutterjs.ir.stmt.BreakStmt;
import org.flutterjs.ir.stmt.ContinueStmt;
import org.flutterjs.ir.stmt.ThrowStmt;
import org.flutterjs.ir.stmt.UnknownStmt;

/**
 * A visitor with a return value and an argument, one method per {@code Statement} variant.
 */
public interface StatementVisitor<R, A> {

    R visit(ExpressionStmt n, A arg);

    R visit(VariableDeclarationStmt n, A arg);

    R visit(BlockStmt n, A arg);

    R visit(IfStmt n, A arg);

    R visit(ForStmt n, A arg);

    R visit(ForEachStmt n, A arg);

    R visit(WhileStmt n, A arg);

    R visit(DoWhileStmt n, A arg);

    R visit(SwitchStmt n, A arg);

    R visit(TryStmt n, A arg);

    R visit(ReturnStmt n, A arg);

    R visit(BreakStmt n, A arg);

    R visit(ContinueStmt n, A arg);

    R visit(ThrowStmt n, A arg);

    R visit(UnknownStmt n, A arg);
}
