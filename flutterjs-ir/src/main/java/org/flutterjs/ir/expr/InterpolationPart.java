package org.flutterjs.ir.expr;

/**
 * A segment of an interpolated string: either literal text or an embedded expression.
 */
public record InterpolationPart(String text, Expression expression) {

    public InterpolationPart {
        if ((text == null) == (expression == null)) {
            throw new IllegalArgumentException("An interpolation part is either text or an expression");
        }
    }

    public static InterpolationPart text(String text) {
        return new InterpolationPart(text, null);
    }

    public static InterpolationPart expression(Expression expression) {
        return new InterpolationPart(null, expression);
    }

    public boolean isExpression() {
        return expression != null;
    }
}
