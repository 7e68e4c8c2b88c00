package org.flutterjs.ir.stmt;

import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.visitor.StatementVisitor;

import java.util.List;

/**
 * C-style {@code for (init; condition; updaters) body}. Every part except the body is optional;
 * {@code initializers} holds variable declarations or expression statements.
 */
public record ForStmt(List<Statement> initializers,
                      Expression condition,
                      List<Expression> updaters,
                      Statement body) implements Statement {

    public ForStmt {
        initializers = initializers == null ? List.of() : List.copyOf(initializers);
        updaters = updaters == null ? List.of() : List.copyOf(updaters);
    }

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
