package org.flutterjs.ir.expr;

/**
 * A {@code name: value} argument of a call or constructor invocation.
 */
public record NamedArgument(String name, Expression value) {
}
