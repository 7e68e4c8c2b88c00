package org.flutterjs.ir.decl;

import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.type.TypeRef;

/**
 * A formal parameter.
 *
 * @param fieldFormal {@code this.name} in a constructor: assigns the argument to the field
 * @param superFormal {@code super.name} in a constructor: forwards the argument to the super constructor
 */
public record Parameter(String name,
                        TypeRef type,
                        Expression defaultValue,
                        ParameterKind kind,
                        boolean required,
                        boolean fieldFormal,
                        boolean superFormal) {

    public Parameter {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Parameter name must not be empty");
        }
        kind = kind == null ? ParameterKind.POSITIONAL : kind;
    }

    public static Parameter positional(String name, TypeRef type) {
        return new Parameter(name, type, null, ParameterKind.POSITIONAL, true, false, false);
    }

    public static Parameter named(String name, TypeRef type, boolean required) {
        return new Parameter(name, type, null, ParameterKind.NAMED, required, false, false);
    }

    public boolean isNamed() {
        return kind == ParameterKind.NAMED;
    }
}
