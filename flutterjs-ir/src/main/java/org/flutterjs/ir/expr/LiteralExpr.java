package org.flutterjs.ir.expr;

import org.flutterjs.ir.visitor.ExpressionVisitor;

/**
 * A literal value. {@code value} is a {@link String}, {@link Long}, {@link Double},
 * {@link Boolean} or {@code null}, matching {@link #kind()}.
 */
public record LiteralExpr(LiteralKind kind, Object value) implements Expression {

    public LiteralExpr {
        if (kind == null) {
            throw new IllegalArgumentException("Literal kind is required");
        }
        if (kind != LiteralKind.NULL && value == null) {
            throw new IllegalArgumentException("Literal of kind " + kind + " requires a value");
        }
    }

    public static LiteralExpr string(String value) {
        return new LiteralExpr(LiteralKind.STRING, value);
    }

    public static LiteralExpr integer(long value) {
        return new LiteralExpr(LiteralKind.INT, value);
    }

    public static LiteralExpr decimal(double value) {
        return new LiteralExpr(LiteralKind.DOUBLE, value);
    }

    public static LiteralExpr bool(boolean value) {
        return new LiteralExpr(LiteralKind.BOOL, value);
    }

    public static LiteralExpr nullValue() {
        return new LiteralExpr(LiteralKind.NULL, null);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
