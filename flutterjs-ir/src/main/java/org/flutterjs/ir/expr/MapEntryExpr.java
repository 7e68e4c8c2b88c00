package org.flutterjs.ir.expr;

/**
 * One {@code key: value} pair of a map literal.
 */
public record MapEntryExpr(Expression key, Expression value) {
}
