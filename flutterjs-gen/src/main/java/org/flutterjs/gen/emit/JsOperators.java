package org.flutterjs.gen.emit;

import org.flutterjs.ir.expr.BinaryOperator;

import java.util.EnumMap;
import java.util.Map;

/**
 * Operator mapping and JavaScript precedence levels. Higher binds tighter.
 */
final class JsOperators {

    static final int ASSIGNMENT = 1;
    static final int CONDITIONAL = 2;
    static final int LOGICAL_OR = 3;
    static final int LOGICAL_AND = 4;
    static final int BITWISE_OR = 5;
    static final int BITWISE_XOR = 6;
    static final int BITWISE_AND = 7;
    static final int EQUALITY = 8;
    static final int RELATIONAL = 9;
    static final int SHIFT = 10;
    static final int ADDITIVE = 11;
    static final int MULTIPLICATIVE = 12;
    static final int UNARY = 14;
    static final int POSTFIX = 15;
    static final int MEMBER = 18;
    static final int ATOM = 20;

    private static final Map<BinaryOperator, String> TOKENS = new EnumMap<>(BinaryOperator.class);
    private static final Map<BinaryOperator, Integer> PRECEDENCE = new EnumMap<>(BinaryOperator.class);

    static {
        for (BinaryOperator op : BinaryOperator.values()) {
            TOKENS.put(op, op.token());
        }
        TOKENS.put(BinaryOperator.EQUALS, "===");
        TOKENS.put(BinaryOperator.NOT_EQUALS, "!==");
        // the floor division is wrapped in Math.floor around a plain division
        TOKENS.put(BinaryOperator.FLOOR_DIVIDE, "/");

        PRECEDENCE.put(BinaryOperator.IF_NULL, LOGICAL_OR);
        PRECEDENCE.put(BinaryOperator.LOGICAL_OR, LOGICAL_OR);
        PRECEDENCE.put(BinaryOperator.LOGICAL_AND, LOGICAL_AND);
        PRECEDENCE.put(BinaryOperator.BITWISE_OR, BITWISE_OR);
        PRECEDENCE.put(BinaryOperator.BITWISE_XOR, BITWISE_XOR);
        PRECEDENCE.put(BinaryOperator.BITWISE_AND, BITWISE_AND);
        PRECEDENCE.put(BinaryOperator.EQUALS, EQUALITY);
        PRECEDENCE.put(BinaryOperator.NOT_EQUALS, EQUALITY);
        PRECEDENCE.put(BinaryOperator.LESS_THAN, RELATIONAL);
        PRECEDENCE.put(BinaryOperator.LESS_THAN_OR_EQUAL, RELATIONAL);
        PRECEDENCE.put(BinaryOperator.GREATER_THAN, RELATIONAL);
        PRECEDENCE.put(BinaryOperator.GREATER_THAN_OR_EQUAL, RELATIONAL);
        PRECEDENCE.put(BinaryOperator.SHIFT_LEFT, SHIFT);
        PRECEDENCE.put(BinaryOperator.SHIFT_RIGHT, SHIFT);
        PRECEDENCE.put(BinaryOperator.UNSIGNED_SHIFT_RIGHT, SHIFT);
        PRECEDENCE.put(BinaryOperator.ADD, ADDITIVE);
        PRECEDENCE.put(BinaryOperator.SUBTRACT, ADDITIVE);
        PRECEDENCE.put(BinaryOperator.MULTIPLY, MULTIPLICATIVE);
        PRECEDENCE.put(BinaryOperator.DIVIDE, MULTIPLICATIVE);
        PRECEDENCE.put(BinaryOperator.MODULO, MULTIPLICATIVE);
        PRECEDENCE.put(BinaryOperator.FLOOR_DIVIDE, ATOM);
    }

    private JsOperators() {
    }

    static String token(BinaryOperator op) {
        return TOKENS.get(op);
    }

    static int precedence(BinaryOperator op) {
        return PRECEDENCE.get(op);
    }

    /**
     * JavaScript rejects {@code ??} mixed with {@code &&} or {@code ||} unless one side is parenthesized.
     */
    static boolean mixesNullish(BinaryOperator parent, BinaryOperator child) {
        boolean parentNullish = parent == BinaryOperator.IF_NULL;
        boolean childNullish = child == BinaryOperator.IF_NULL;
        boolean parentLogical = parent == BinaryOperator.LOGICAL_AND || parent == BinaryOperator.LOGICAL_OR;
        boolean childLogical = child == BinaryOperator.LOGICAL_AND || child == BinaryOperator.LOGICAL_OR;
        return (parentNullish && childLogical) || (parentLogical && childNullish);
    }
}
