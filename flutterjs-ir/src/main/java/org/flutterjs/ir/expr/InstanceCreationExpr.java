package org.flutterjs.ir.expr;

import org.flutterjs.ir.type.TypeRef;
import org.flutterjs.ir.visitor.ExpressionVisitor;

import java.util.List;

/**
 * {@code new Type.constructorName(args)} or {@code const Type(args)}. {@code constructorName}
 * is {@code null} for the unnamed constructor.
 */
public record InstanceCreationExpr(TypeRef type,
                                   String constructorName,
                                   List<Expression> arguments,
                                   List<NamedArgument> namedArguments,
                                   boolean isConst) implements Expression {

    public InstanceCreationExpr {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        namedArguments = namedArguments == null ? List.of() : List.copyOf(namedArguments);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
