package org.flutterjs.gen.diagnostic;

/**
 * Ordered from most to least severe; reports list diagnostics in this order.
 */
public enum Severity {
    FATAL,
    ERROR,
    WARNING,
    INFO;

    public boolean isAtLeast(Severity other) {
        return ordinal() <= other.ordinal();
    }
}
