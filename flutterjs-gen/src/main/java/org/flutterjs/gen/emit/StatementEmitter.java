package org.flutterjs.gen.emit;

import org.flutterjs.gen.WidgetValidationException;
import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.gen.printer.JsLiterals;
import org.flutterjs.gen.printer.JsNames;
import org.flutterjs.gen.printer.JsPrinter;
import org.flutterjs.gen.scope.VariableInfo;
import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.stmt.BlockStmt;
import org.flutterjs.ir.stmt.BreakStmt;
import org.flutterjs.ir.stmt.CatchClause;
import org.flutterjs.ir.stmt.ContinueStmt;
import org.flutterjs.ir.stmt.DoWhileStmt;
import org.flutterjs.ir.stmt.ExpressionStmt;
import org.flutterjs.ir.stmt.ForEachStmt;
import org.flutterjs.ir.stmt.ForStmt;
import org.flutterjs.ir.stmt.IfStmt;
import org.flutterjs.ir.stmt.ReturnStmt;
import org.flutterjs.ir.stmt.Statement;
import org.flutterjs.ir.stmt.SwitchCase;
import org.flutterjs.ir.stmt.SwitchStmt;
import org.flutterjs.ir.stmt.ThrowStmt;
import org.flutterjs.ir.stmt.TryStmt;
import org.flutterjs.ir.stmt.UnknownStmt;
import org.flutterjs.ir.stmt.VariableDeclarationStmt;
import org.flutterjs.ir.stmt.WhileStmt;
import org.flutterjs.ir.type.TypeRef;
import org.flutterjs.ir.visitor.StatementVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts IR statements to JavaScript lines printed into a {@link JsPrinter}.
 * <p>
 * Every block, loop body, switch case and catch branch runs in its own scope, popped on every
 * exit path. A statement that fails to convert is replaced by a marker comment and a diagnostic.
 */
public final class StatementEmitter implements StatementVisitor<Void, JsPrinter> {

    private static final Logger log = LoggerFactory.getLogger(StatementEmitter.class);

    static final String CATCH_PARAMETER = "error";

    private final EmitContext ctx;
    private final ExpressionEmitter expressions;

    StatementEmitter(EmitContext ctx, ExpressionEmitter expressions) {
        this.ctx = ctx;
        this.expressions = expressions;
    }

    public String emit(Statement statement) {
        JsPrinter out = new JsPrinter();
        emit(statement, out);
        return out.toString();
    }

    /**
     * Emits one statement. The statement is rendered into a scratch printer first so that a
     * failure leaves no half-written lines behind.
     */
    public void emit(Statement statement, JsPrinter out) {
        JsPrinter scratch = new JsPrinter();
        try {
            statement.accept(this, scratch);
        } catch (WidgetValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            String node = statement.getClass().getSimpleName();
            log.debug("Emission of {} failed", node, e);
            ctx.diagnostics().add(Diagnostic.of(Severity.ERROR, DiagnosticCode.UNSUPPORTED_STATEMENT,
                            "Could not emit statement: " + e.getMessage())
                    .withNode(node)
                    .withCause(e));
            out.println("/* STATEMENT FAILED: " + JsLiterals.commentText(e.getMessage()) + " */");
            return;
        }
        String text = scratch.toString();
        if (text.endsWith("\n")) {
            text = text.substring(0, text.length() - 1);
        }
        out.printlnLines(text);
    }

    public void emitStatements(List<Statement> statements, JsPrinter out) {
        for (Statement s : statements) {
            emit(s, out);
        }
    }

    /**
     * The statements of {@code body} at the printer's current level, inside a fresh scope.
     */
    public void emitBody(BlockStmt body, JsPrinter out) {
        ctx.scope().inScope("block", () -> emitStatements(body.statements(), out));
    }

    private void branch(Statement body, JsPrinter out) {
        out.indent();
        if (body instanceof BlockStmt block) {
            emitBody(block, out);
        } else if (body != null) {
            ctx.scope().inScope("block", () -> emit(body, out));
        }
        out.unindent();
    }

    private String expr(Expression e) {
        return expressions.emit(e);
    }

    // ── Visits ───────────────────────────────────────────────────

    @Override
    public Void visit(ExpressionStmt n, JsPrinter out) {
        out.printlnLines(expr(n.expression()) + ";");
        return null;
    }

    @Override
    public Void visit(VariableDeclarationStmt n, JsPrinter out) {
        String initializer = n.initializer() == null ? null : expr(n.initializer());
        ctx.scope().define(VariableInfo.local(n.name(), n.type(), n.isFinal() || n.isConst()));
        boolean immutable = n.isConst() || (n.isFinal() && initializer != null);
        StringBuilder line = new StringBuilder(immutable ? "const " : "let ").append(JsNames.safe(n.name()));
        if (initializer != null) {
            line.append(" = ").append(initializer);
        }
        line.append(';');
        if (ctx.options().emitTypeComments() && n.type() != null && !n.type().isDynamic()) {
            line.append(" // ").append(n.type().displayName());
        }
        out.printlnLines(line.toString());
        return null;
    }

    @Override
    public Void visit(BlockStmt n, JsPrinter out) {
        out.println("{");
        branch(n, out);
        out.println("}");
        return null;
    }

    @Override
    public Void visit(IfStmt n, JsPrinter out) {
        out.printlnLines("if (" + expr(n.condition()) + ") {");
        branch(n.thenStatement(), out);
        Statement otherwise = n.elseStatement();
        while (otherwise instanceof IfStmt elseIf) {
            out.printlnLines("} else if (" + expr(elseIf.condition()) + ") {");
            branch(elseIf.thenStatement(), out);
            otherwise = elseIf.elseStatement();
        }
        if (otherwise != null) {
            out.println("} else {");
            branch(otherwise, out);
        }
        out.println("}");
        return null;
    }

    @Override
    public Void visit(ForStmt n, JsPrinter out) {
        ctx.scope().inScope("for", () -> {
            String init = forInitializers(n.initializers());
            String condition = n.condition() == null ? "" : expr(n.condition());
            List<String> updaters = new ArrayList<>();
            for (Expression u : n.updaters()) {
                updaters.add(expr(u));
            }
            out.printlnLines("for (" + init + "; " + condition + "; " + String.join(", ", updaters) + ") {");
            branch(n.body(), out);
            out.println("}");
        });
        return null;
    }

    private String forInitializers(List<Statement> initializers) {
        List<String> declarations = new ArrayList<>();
        List<String> expressionsList = new ArrayList<>();
        for (Statement s : initializers) {
            if (s instanceof VariableDeclarationStmt v) {
                String value = v.initializer() == null ? null : expr(v.initializer());
                ctx.scope().define(VariableInfo.local(v.name(), v.type(), false));
                declarations.add(JsNames.safe(v.name()) + (value == null ? "" : " = " + value));
            } else if (s instanceof ExpressionStmt e) {
                expressionsList.add(expr(e.expression()));
            } else {
                throw new IllegalArgumentException("Unsupported for-loop initializer " + s.getClass().getSimpleName());
            }
        }
        if (!declarations.isEmpty() && !expressionsList.isEmpty()) {
            throw new IllegalArgumentException("A for-loop initializer cannot mix declarations and expressions");
        }
        return declarations.isEmpty() ? String.join(", ", expressionsList) : "let " + String.join(", ", declarations);
    }

    @Override
    public Void visit(ForEachStmt n, JsPrinter out) {
        String iterable = expr(n.iterable());
        ctx.scope().inScope("for-each", () -> {
            ctx.scope().define(VariableInfo.local(n.variableName(), n.variableType(), n.isFinal()));
            String keyword = n.isAwait() ? "for await" : "for";
            out.printlnLines(keyword + " (" + (n.isFinal() ? "const " : "let ") + JsNames.safe(n.variableName())
                    + " of " + iterable + ") {");
            branch(n.body(), out);
            out.println("}");
        });
        return null;
    }

    @Override
    public Void visit(WhileStmt n, JsPrinter out) {
        out.printlnLines("while (" + expr(n.condition()) + ") {");
        branch(n.body(), out);
        out.println("}");
        return null;
    }

    @Override
    public Void visit(DoWhileStmt n, JsPrinter out) {
        out.println("do {");
        branch(n.body(), out);
        out.printlnLines("} while (" + expr(n.condition()) + ");");
        return null;
    }

    @Override
    public Void visit(SwitchStmt n, JsPrinter out) {
        out.printlnLines("switch (" + expr(n.selector()) + ") {");
        out.indent();
        for (SwitchCase c : n.cases()) {
            List<Expression> patterns = c.patterns();
            for (int i = 0; i < patterns.size(); i++) {
                String label = "case " + expr(patterns.get(i)) + ":";
                out.printlnLines(i == patterns.size() - 1 ? label + " {" : label);
            }
            caseBody(c.body(), out);
        }
        if (n.hasDefault()) {
            out.println("default: {");
            caseBody(n.defaultBody(), out);
        }
        out.unindent();
        out.println("}");
        return null;
    }

    /**
     * Case bodies always end in {@code break}, since JavaScript cases fall through.
     */
    private void caseBody(List<Statement> body, JsPrinter out) {
        out.indent();
        ctx.scope().inScope("case", () -> {
            emitStatements(body, out);
            if (body.isEmpty() || !(body.get(body.size() - 1) instanceof BreakStmt)) {
                out.println("break;");
            }
        });
        out.unindent();
        out.println("}");
    }

    @Override
    public Void visit(TryStmt n, JsPrinter out) {
        out.println("try {");
        branch(n.body(), out);
        List<CatchClause> clauses = reachableClauses(n.catchClauses());
        if (!clauses.isEmpty()) {
            String parameter = sharedParameter(clauses);
            out.println("} catch (" + parameter + ") {");
            out.indent();
            if (clauses.size() == 1 && clauses.get(0).isCatchAll()) {
                catchBranch(clauses.get(0), parameter, out);
            } else {
                typedCatchChain(clauses, parameter, out);
            }
            out.unindent();
        }
        if (n.finallyBlock() != null) {
            out.println("} finally {");
            branch(n.finallyBlock(), out);
        }
        out.println("}");
        return null;
    }

    private static List<CatchClause> reachableClauses(List<CatchClause> clauses) {
        List<CatchClause> reachable = new ArrayList<>();
        for (CatchClause c : clauses) {
            reachable.add(c);
            if (c.isCatchAll()) {
                break;
            }
        }
        return reachable;
    }

    private static String sharedParameter(List<CatchClause> clauses) {
        String first = clauses.get(0).exceptionParameter();
        for (CatchClause c : clauses) {
            if (c.exceptionParameter() == null || !c.exceptionParameter().equals(first)) {
                return CATCH_PARAMETER;
            }
        }
        return JsNames.safe(first);
    }

    /**
     * Typed clauses become one if/else-if chain over the caught value; without a catch-all
     * clause the final else rethrows.
     */
    private void typedCatchChain(List<CatchClause> clauses, String parameter, JsPrinter out) {
        boolean first = true;
        boolean hasCatchAll = false;
        for (CatchClause c : clauses) {
            if (c.isCatchAll()) {
                out.println(first ? "{" : "} else {");
                hasCatchAll = true;
            } else {
                String test = TypeTests.predicate(parameter, c.exceptionType());
                out.println((first ? "if (" : "} else if (") + test + ") {");
            }
            out.indent();
            catchBranch(c, parameter, out);
            out.unindent();
            first = false;
        }
        if (!hasCatchAll) {
            out.println("} else {");
            out.indent();
            out.println("throw " + parameter + ";");
            out.unindent();
        }
        out.println("}");
    }

    private void catchBranch(CatchClause clause, String parameter, JsPrinter out) {
        ctx.scope().inScope("catch", () -> {
            String name = clause.exceptionParameter();
            if (name != null) {
                ctx.scope().define(VariableInfo.local(name, clause.exceptionType(), false));
                if (!JsNames.safe(name).equals(parameter)) {
                    out.println("let " + JsNames.safe(name) + " = " + parameter + ";");
                }
            }
            String stackTrace = clause.stackTraceParameter();
            if (stackTrace != null) {
                ctx.scope().define(VariableInfo.local(stackTrace, TypeRef.of("StackTrace"), true));
                out.println("const " + JsNames.safe(stackTrace) + " = " + parameter + "?.stack;");
            }
            emitStatements(clause.body().statements(), out);
        });
    }

    @Override
    public Void visit(ReturnStmt n, JsPrinter out) {
        out.printlnLines(n.expression() == null ? "return;" : "return " + expr(n.expression()) + ";");
        return null;
    }

    @Override
    public Void visit(BreakStmt n, JsPrinter out) {
        out.println(n.label() == null ? "break;" : "break " + n.label() + ";");
        return null;
    }

    @Override
    public Void visit(ContinueStmt n, JsPrinter out) {
        out.println(n.label() == null ? "continue;" : "continue " + n.label() + ";");
        return null;
    }

    @Override
    public Void visit(ThrowStmt n, JsPrinter out) {
        out.printlnLines("throw " + expr(n.exception()) + ";");
        return null;
    }

    @Override
    public Void visit(UnknownStmt n, JsPrinter out) {
        ctx.diagnostics().add(Diagnostic.of(Severity.ERROR, DiagnosticCode.UNSUPPORTED_STATEMENT,
                        "Unsupported statement: " + n.source())
                .withNode(ctx.currentClass().orElse("top level"))
                .withSuggestion("Rewrite the statement with supported constructs"));
        out.println("/* UNSUPPORTED STATEMENT: " + JsLiterals.commentText(n.source()) + " */");
        return null;
    }
}
