package org.flutterjs.ir.visitor;

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

/**
 * A visitor with a return value and an argument, one method per {@code Expression} variant.
 *
 * @param <R> the return type
 * @param <A> the argument type
 */
public interface ExpressionVisitor<R, A> {

    R visit(LiteralExpr n, A arg);

    R visit(IdentifierExpr n, A arg);

    R visit(ThisExpr n, A arg);

    R visit(SuperExpr n, A arg);

    R visit(BinaryExpr n, A arg);

    R visit(UnaryExpr n, A arg);

    R visit(AssignmentExpr n, A arg);

    R visit(MethodCallExpr n, A arg);

    R visit(InstanceCreationExpr n, A arg);

    R visit(PropertyAccessExpr n, A arg);

    R visit(IndexAccessExpr n, A arg);

    R visit(ConditionalExpr n, A arg);

    R visit(ListLiteralExpr n, A arg);

    R visit(MapLiteralExpr n, A arg);

    R visit(SetLiteralExpr n, A arg);

    R visit(LambdaExpr n, A arg);

    R visit(CascadeExpr n, A arg);

    R visit(CascadeReceiverExpr n, A arg);

    R visit(AwaitExpr n, A arg);

    R visit(StringInterpolationExpr n, A arg);

    R visit(IsExpr n, A arg);

    R visit(AsExpr n, A arg);

    R visit(ThrowExpr n, A arg);

    R visit(ParenthesizedExpr n, A arg);

    R visit(UnknownExpr n, A arg);
}
