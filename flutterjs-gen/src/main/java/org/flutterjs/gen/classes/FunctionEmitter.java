package org.flutterjs.gen.classes;

import org.flutterjs.gen.WidgetValidationException;
import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.gen.emit.EmitContext;
import org.flutterjs.gen.emit.ExpressionEmitter;
import org.flutterjs.gen.emit.Parameters;
import org.flutterjs.gen.printer.JsLiterals;
import org.flutterjs.gen.printer.JsNames;
import org.flutterjs.gen.printer.JsPrinter;
import org.flutterjs.ir.decl.FunctionDecl;
import org.flutterjs.ir.stmt.BlockStmt;
import org.flutterjs.ir.stmt.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Emits methods and top-level functions. Each function is isolated: one that fails to convert
 * becomes a stub that throws when called, and the rest of the file is unaffected.
 */
public final class FunctionEmitter {

    private static final Logger log = LoggerFactory.getLogger(FunctionEmitter.class);

    private static final Consumer<JsPrinter> NOTHING = out -> {
    };

    private final EmitContext ctx;
    private final ExpressionEmitter expressions;

    public FunctionEmitter(ExpressionEmitter expressions) {
        this.ctx = expressions.context();
        this.expressions = expressions;
    }

    public String emitFunction(FunctionDecl function) {
        String head = (function.isAsync() ? "async " : "") + "function " + JsNames.safe(function.name());
        return isolated("top level", function, () -> render(function, head, NOTHING, bodyOf(function), NOTHING));
    }

    public String emitMethod(String owner, FunctionDecl method) {
        return emitMethod(owner, method, NOTHING, bodyOf(method), NOTHING);
    }

    /**
     * A method whose body is {@code prologue}, then {@code body}, then {@code epilogue}.
     */
    public String emitMethod(String owner, FunctionDecl method, Consumer<JsPrinter> prologue,
                             List<Statement> body, Consumer<JsPrinter> epilogue) {
        return isolated(owner, method, () -> render(method, methodHead(method), prologue, body, epilogue));
    }

    static List<Statement> bodyOf(FunctionDecl function) {
        return function.hasBody() ? function.body().statements() : List.of();
    }

    private static String methodHead(FunctionDecl method) {
        StringBuilder sb = new StringBuilder();
        if (method.isStatic()) {
            sb.append("static ");
        }
        if (method.isAsync()) {
            sb.append("async ");
        }
        if (method.isGetter()) {
            sb.append("get ");
        } else if (method.isSetter()) {
            sb.append("set ");
        }
        return sb.append(method.name()).toString();
    }

    private String render(FunctionDecl function, String head, Consumer<JsPrinter> prologue,
                          List<Statement> body, Consumer<JsPrinter> epilogue) {
        return ctx.scope().inScope("function " + function.name(), () -> ctx.inFunction(function.isAsync(), () -> {
            String signature = Parameters.signature(function.parameters(), expressions);
            Parameters.define(function.parameters(), ctx);
            JsPrinter out = new JsPrinter();
            out.println(head + "(" + signature + ") {");
            out.indent();
            Parameters.printRequiredChecks(function.parameters(), ctx, out);
            prologue.accept(out);
            expressions.statements().emitBody(new BlockStmt(body), out);
            epilogue.accept(out);
            out.unindent();
            out.print("}");
            return out.toString();
        }));
    }

    private String isolated(String owner, FunctionDecl function, Supplier<String> body) {
        try {
            return body.get();
        } catch (WidgetValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            String qualified = owner + "." + function.name();
            log.debug("Generation of {} failed", qualified, e);
            ctx.diagnostics().add(Diagnostic.of(Severity.WARNING, DiagnosticCode.METHOD_GENERATION_FAILED,
                            "Generation of '" + qualified + "' failed: " + e.getMessage())
                    .withNode(qualified)
                    .withCause(e));
            return placeholder(owner, function, e);
        }
    }

    private static String placeholder(String owner, FunctionDecl function, RuntimeException cause) {
        String head;
        if (owner.equals("top level")) {
            head = "function " + JsNames.safe(function.name()) + "(...args)";
        } else if (function.isGetter()) {
            head = methodHead(function) + "()";
        } else if (function.isSetter()) {
            head = methodHead(function) + "(value)";
        } else {
            head = methodHead(function) + "(...args)";
        }
        return head + " {\n"
                + "  /* GENERATION FAILED: " + JsLiterals.commentText(cause.getMessage()) + " */\n"
                + "  throw new Error(" + JsLiterals.quote("Generation failed for " + owner + "." + function.name()) + ");\n"
                + "}";
    }
}
