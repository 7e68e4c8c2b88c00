package org.flutterjs.ir.expr;

import org.flutterjs.ir.visitor.ExpressionVisitor;

/**
 * Closed hierarchy of expression nodes. Every variant is dispatched through
 * {@link ExpressionVisitor}, so adding a variant forces every emitter to handle it.
 */
public sealed interface Expression permits
        LiteralExpr, IdentifierExpr, ThisExpr, SuperExpr,
        BinaryExpr, UnaryExpr, AssignmentExpr,
        MethodCallExpr, InstanceCreationExpr,
        PropertyAccessExpr, IndexAccessExpr, ConditionalExpr,
        ListLiteralExpr, MapLiteralExpr, SetLiteralExpr,
        LambdaExpr, CascadeExpr, CascadeReceiverExpr,
        AwaitExpr, StringInterpolationExpr,
        IsExpr, AsExpr, ThrowExpr, ParenthesizedExpr, UnknownExpr {

    <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg);
}
