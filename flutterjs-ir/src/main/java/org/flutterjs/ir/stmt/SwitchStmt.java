package org.flutterjs.ir.stmt;

import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.visitor.StatementVisitor;

import java.util.List;

/**
 * {@code defaultBody} is {@code null} when the switch has no default arm.
 */
public record SwitchStmt(Expression selector, List<SwitchCase> cases, List<Statement> defaultBody) implements Statement {

    public SwitchStmt {
        cases = cases == null ? List.of() : List.copyOf(cases);
        defaultBody = defaultBody == null ? null : List.copyOf(defaultBody);
    }

    public boolean hasDefault() {
        return defaultBody != null;
    }

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
