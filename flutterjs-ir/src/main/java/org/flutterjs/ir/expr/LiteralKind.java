package org.flutterjs.ir.expr;

public enum LiteralKind {
    STRING,
    INT,
    DOUBLE,
    BOOL,
    NULL
}
