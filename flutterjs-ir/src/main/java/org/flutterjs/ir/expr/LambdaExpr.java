package org.flutterjs.ir.expr;

import org.flutterjs.ir.decl.Parameter;
import org.flutterjs.ir.stmt.BlockStmt;
import org.flutterjs.ir.visitor.ExpressionVisitor;

import java.util.List;

/**
 * A function literal. Exactly one of {@code expressionBody} and {@code blockBody} is set.
 */
public record LambdaExpr(List<Parameter> parameters,
                         Expression expressionBody,
                         BlockStmt blockBody,
                         boolean isAsync) implements Expression {

    public LambdaExpr {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        if ((expressionBody == null) == (blockBody == null)) {
            throw new IllegalArgumentException("A lambda needs exactly one of an expression body or a block body");
        }
    }

    public boolean hasBlockBody() {
        return blockBody != null;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
