package org.flutterjs.gen.emit;

import org.flutterjs.gen.printer.JsLiterals;
import org.flutterjs.gen.printer.JsNames;
import org.flutterjs.gen.printer.JsPrinter;
import org.flutterjs.gen.scope.VariableInfo;
import org.flutterjs.ir.decl.Parameter;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameter lists. Positional parameters stay positional; all named parameters collapse into
 * one destructured record parameter that defaults to {@code {}}.
 */
public final class Parameters {

    private Parameters() {
    }

    public static String signature(List<Parameter> parameters, ExpressionEmitter expressions) {
        List<String> parts = new ArrayList<>();
        List<String> named = new ArrayList<>();
        for (Parameter p : parameters) {
            String safe = JsNames.safe(p.name());
            String binding = p.isNamed() && !safe.equals(p.name()) ? p.name() + ": " + safe : safe;
            if (p.defaultValue() != null) {
                binding += " = " + expressions.emit(p.defaultValue());
            }
            if (p.isNamed()) {
                named.add(binding);
            } else {
                parts.add(binding);
            }
        }
        if (!named.isEmpty()) {
            parts.add("{ " + String.join(", ", named) + " } = {}");
        }
        return String.join(", ", parts);
    }

    public static void define(List<Parameter> parameters, EmitContext ctx) {
        for (Parameter p : parameters) {
            ctx.scope().define(VariableInfo.parameter(p.name(), p.type()));
        }
    }

    /**
     * Emits a {@code nullCheck} call for every required named parameter of non-nullable type.
     */
    public static void printRequiredChecks(List<Parameter> parameters, EmitContext ctx, JsPrinter out) {
        for (Parameter p : parameters) {
            if (RuntimeHelper.checksParameter(p)) {
                ctx.useHelper(RuntimeHelper.NULL_CHECK);
                out.println("nullCheck(" + JsNames.safe(p.name()) + ", " + JsLiterals.quote(p.name()) + ");");
            }
        }
    }
}
