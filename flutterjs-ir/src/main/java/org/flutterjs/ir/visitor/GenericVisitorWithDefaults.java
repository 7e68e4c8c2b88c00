package org.flutterjs.ir.visitor;

import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.expr.LiteralExpr;
import org.flutterjs.ir.expr.IdentifierExpr;
import org.flutterjs.ir.expr.ThisExpr;
import org.flutterjs.ir.expr.SuperExpr;
import org.flutterjs.ir.expr.BinaryExpr;
import org.flutterjs.ir.expr.UnaryExpr;
import org.flutterjs.ir.expr.AssignmentExpr;
import org.flutterjs.ir.expr.MethodCallExpr;
import org.flutterjs.ir.expr.InstanceCreationExpr;
import org.flutterjs.ir.expr.PropertyAccessExpr;
import org.flutterjs.ir.expr.IndexAccessExpr;
import org.flutterjs.ir.expr.ConditionalExpr;
import org.flutterjs.ir.expr.ListLiteralExpr;
import org.flutterjs.ir.expr.MapLiteralExpr;
import org.flutterjs.ir.expr.SetLiteralExpr;
import org.flutterjs.ir.expr.LambdaExpr;
import org.flutterjs.ir.expr.CascadeExpr;
import org.flutterjs.ir.expr.CascadeReceiverExpr;
import org.flutterjs.ir.expr.AwaitExpr;
import org.flutterjs.ir.expr.StringInterpolationExpr;
import org.flutterjs.ir.expr.IsExpr;
import org.flutterjs.ir.expr.AsExpr;
import org.flutterjs.ir.expr.ThrowExpr;
import org.flutterjs.ir.expr.ParenthesizedExpr;
import org.flutterjs.ir.expr.UnknownExpr;
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
import org.flutterjs.ir.stmt.Statement;

/**
 * Base visitor whose methods all fall through to {@link #defaultAction(Expression, Object)}
 * or {@link #defaultAction(Statement, Object)}. Subclasses override only the variants they care about.
 */
public abstract class GenericVisitorWithDefaults<R, A> implements ExpressionVisitor<R, A>, StatementVisitor<R, A> {

    public R defaultAction(Expression n, A arg) {
        return null;
    }

    public R defaultAction(Statement n, A arg) {
        return null;
    }

    @Override
    public R visit(LiteralExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(IdentifierExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ThisExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(SuperExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(BinaryExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(UnaryExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(AssignmentExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(MethodCallExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(InstanceCreationExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(PropertyAccessExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(IndexAccessExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ConditionalExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ListLiteralExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(MapLiteralExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(SetLiteralExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(LambdaExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(CascadeExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(CascadeReceiverExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(AwaitExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(StringInterpolationExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(IsExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(AsExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ThrowExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ParenthesizedExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(UnknownExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ExpressionStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(VariableDeclarationStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(BlockStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(IfStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ForStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ForEachStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(WhileStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(DoWhileStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(SwitchStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(TryStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ReturnStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(BreakStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ContinueStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ThrowStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(UnknownStmt n, A arg) {
        return defaultAction(n, arg);
    }
}
