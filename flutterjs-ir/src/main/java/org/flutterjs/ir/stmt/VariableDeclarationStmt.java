package org.flutterjs.ir.stmt;

import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.type.TypeRef;
import org.flutterjs.ir.visitor.StatementVisitor;

/**
 * A local variable declaration. {@code type} may be {@code null} for {@code var}.
 */
public record VariableDeclarationStmt(String name,
                                      TypeRef type,
                                      Expression initializer,
                                      boolean isFinal,
                                      boolean isConst,
                                      boolean isLate) implements Statement {

    public VariableDeclarationStmt {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variable name must not be empty");
        }
    }

    @Override
    public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
