package org.flutterjs.ir.expr;

public enum AssignmentOperator {
    ASSIGN("="),
    ADD_ASSIGN("+="),
    SUBTRACT_ASSIGN("-="),
    MULTIPLY_ASSIGN("*="),
    DIVIDE_ASSIGN("/="),
    FLOOR_DIVIDE_ASSIGN("~/="),
    MODULO_ASSIGN("%="),
    IF_NULL_ASSIGN("??="),
    BITWISE_AND_ASSIGN("&="),
    BITWISE_OR_ASSIGN("|="),
    BITWISE_XOR_ASSIGN("^="),
    SHIFT_LEFT_ASSIGN("<<="),
    SHIFT_RIGHT_ASSIGN(">>=");

    private final String token;

    AssignmentOperator(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }
}
