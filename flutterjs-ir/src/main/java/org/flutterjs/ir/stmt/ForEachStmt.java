package org.flutterjs.ir.stmt;

import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.type.TypeRef;
import org.flutterjs.ir.visitor.StatementVisitor;

/**
 * {@code for (final item in iterable) body}, or {@code await for} when {@code isAwait}.
 */
public record ForEachStmt(String variableName,
                          TypeRef variableType,
                          boolean isFinal,
                          Expression iterable,
                          Statement body,
                          boolean isAwait) implements Statement {

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
