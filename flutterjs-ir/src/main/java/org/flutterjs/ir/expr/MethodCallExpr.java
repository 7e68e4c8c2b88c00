package org.flutterjs.ir.expr;

import org.flutterjs.ir.visitor.ExpressionVisitor;

import java.util.List;

/**
 * A call {@code target.methodName(args)}. A {@code null} target is an unqualified call,
 * which may name a local function, an inherited member, a widget or {@code setState}.
 */
public record MethodCallExpr(Expression target,
                             String methodName,
                             List<Expression> arguments,
                             List<NamedArgument> namedArguments,
                             boolean nullSafe) implements Expression {

    public MethodCallExpr {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        namedArguments = namedArguments == null ? List.of() : List.copyOf(namedArguments);
    }

    public boolean isUnqualified() {
        return target == null;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
