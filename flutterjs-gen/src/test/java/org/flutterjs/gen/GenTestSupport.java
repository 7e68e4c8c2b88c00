package org.flutterjs.gen;

import org.flutterjs.gen.config.GenerationOptions;
import org.flutterjs.gen.diagnostic.DiagnosticCollector;
import org.flutterjs.gen.emit.EmitContext;
import org.flutterjs.gen.emit.ExpressionEmitter;
import org.flutterjs.gen.registry.WidgetRegistry;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.Scriptable;

/**
 * Shared fixtures: emission contexts over the standard widget registry and a script engine for
 * running emitted function bodies.
 */
public final class GenTestSupport {

    private GenTestSupport() {
    }

    public static EmitContext context() {
        return context(GenerationOptions.defaults());
    }

    public static EmitContext context(GenerationOptions options) {
        return new EmitContext(options, new DiagnosticCollector(), WidgetRegistry.standard());
    }

    public static ExpressionEmitter emitter() {
        return new ExpressionEmitter(context());
    }

    public static ExpressionEmitter emitter(GenerationOptions options) {
        return new ExpressionEmitter(context(options));
    }

    /**
     * Evaluates plain function-level script code and returns the value of the last statement as a string.
     */
    public static String evaluate(String script) {
        Context cx = Context.enter();
        try {
            cx.setLanguageVersion(Context.VERSION_ES6);
            Scriptable scope = cx.initStandardObjects();
            Object result = cx.evaluateString(scope, script, "generated.js", 1, null);
            return Context.toString(result);
        } finally {
            Context.exit();
        }
    }
}
