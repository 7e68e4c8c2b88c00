package org.flutterjs.ir.expr;

public enum UnaryOperator {
    NEGATE("-", true),
    NOT("!", true),
    BITWISE_NOT("~", true),
    PRE_INCREMENT("++", true),
    PRE_DECREMENT("--", true),
    POST_INCREMENT("++", false),
    POST_DECREMENT("--", false),
    /** Dart's postfix {@code !}: asserts the operand is non-null. */
    NULL_ASSERT("!", false);

    private final String token;
    private final boolean prefix;

    UnaryOperator(String token, boolean prefix) {
        this.token = token;
        this.prefix = prefix;
    }

    public String token() {
        return token;
    }

    public boolean isPrefix() {
        return prefix;
    }
}
