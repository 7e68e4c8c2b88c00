package org.flutterjs.ir.stmt;

import org.flutterjs.ir.expr.Expression;

import java.util.List;

/**
 * One arm of a switch: all {@code patterns} share the same {@code body}.
 */
public record SwitchCase(List<Expression> patterns, List<Statement> body) {

    public SwitchCase {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        body = body == null ? List.of() : List.copyOf(body);
    }
}
