package org.flutterjs.gen.emit;

import org.flutterjs.gen.CodeGenerationException;
import org.flutterjs.gen.WidgetValidationException;
import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.gen.imports.ImportResolver;
import org.flutterjs.gen.printer.JsLiterals;
import org.flutterjs.gen.printer.JsNames;
import org.flutterjs.gen.printer.JsPrinter;
import org.flutterjs.gen.widget.WidgetInstantiationEmitter;
import org.flutterjs.ir.expr.AsExpr;
import org.flutterjs.ir.expr.AssignmentExpr;
import org.flutterjs.ir.expr.AssignmentOperator;
import org.flutterjs.ir.expr.AwaitExpr;
import org.flutterjs.ir.expr.BinaryExpr;
import org.flutterjs.ir.expr.BinaryOperator;
import org.flutterjs.ir.expr.CascadeExpr;
import org.flutterjs.ir.expr.CascadeReceiverExpr;
import org.flutterjs.ir.expr.ConditionalExpr;
import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.expr.IdentifierExpr;
import org.flutterjs.ir.expr.IndexAccessExpr;
import org.flutterjs.ir.expr.InstanceCreationExpr;
import org.flutterjs.ir.expr.InterpolationPart;
import org.flutterjs.ir.expr.IsExpr;
import org.flutterjs.ir.expr.LambdaExpr;
import org.flutterjs.ir.expr.ListLiteralExpr;
import org.flutterjs.ir.expr.LiteralExpr;
import org.flutterjs.ir.expr.LiteralKind;
import org.flutterjs.ir.expr.MapEntryExpr;
import org.flutterjs.ir.expr.MapLiteralExpr;
import org.flutterjs.ir.expr.MethodCallExpr;
import org.flutterjs.ir.expr.NamedArgument;
import org.flutterjs.ir.expr.ParenthesizedExpr;
import org.flutterjs.ir.expr.PropertyAccessExpr;
import org.flutterjs.ir.expr.SetLiteralExpr;
import org.flutterjs.ir.expr.StringInterpolationExpr;
import org.flutterjs.ir.expr.SuperExpr;
import org.flutterjs.ir.expr.ThisExpr;
import org.flutterjs.ir.expr.ThrowExpr;
import org.flutterjs.ir.expr.UnaryExpr;
import org.flutterjs.ir.expr.UnaryOperator;
import org.flutterjs.ir.expr.UnknownExpr;
import org.flutterjs.ir.type.TypeRef;
import org.flutterjs.ir.visitor.ExpressionVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Converts IR expressions to JavaScript expression text.
 * <p>
 * Output depends only on the node and the state of the {@link EmitContext}; the only side
 * effects are diagnostics and helper usage recorded there. A node that cannot be converted
 * yields a marked placeholder and a diagnostic, never an exception, except for strict-mode
 * widget violations which are meant to abort the run.
 */
public final class ExpressionEmitter implements ExpressionVisitor<String, Void> {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEmitter.class);

    private final EmitContext ctx;
    private final StatementEmitter statements;
    private final WidgetInstantiationEmitter widgets;

    public ExpressionEmitter(EmitContext ctx) {
        this.ctx = ctx;
        this.statements = new StatementEmitter(ctx, this);
        this.widgets = new WidgetInstantiationEmitter(ctx, this);
    }

    public EmitContext context() {
        return ctx;
    }

    public StatementEmitter statements() {
        return statements;
    }

    public WidgetInstantiationEmitter widgets() {
        return widgets;
    }

    public String emit(Expression expression) {
        try {
            return expression.accept(this, null);
        } catch (WidgetValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            String node = expression.getClass().getSimpleName();
            log.debug("Emission of {} failed", node, e);
            ctx.diagnostics().add(Diagnostic.of(Severity.ERROR, DiagnosticCode.UNSUPPORTED_EXPRESSION,
                            "Could not emit expression: " + e.getMessage())
                    .withNode(node)
                    .withCause(e));
            return "/* EXPRESSION FAILED: " + JsLiterals.commentText(e.getMessage()) + " */ undefined";
        }
    }

    /**
     * A reference to {@code name}: prefixed per scope when declared, routed through the deferred
     * proxy when its import was cut to break a cycle, bare when external, marked when unknown.
     */
    public String reference(String name) {
        String safe = JsNames.safe(name);
        if (ctx.scope().isDefined(name)) {
            String prefix = ctx.scope().getPrefixForVariable(name);
            return prefix.isEmpty() ? safe : prefix + name;
        }
        if (ctx.isDeferred(name)) {
            return ImportResolver.DEFERRED_PROXY + "." + name;
        }
        if (ctx.isExternal(name)) {
            return name;
        }
        return ctx.scope().qualify(name, safe);
    }

    /**
     * Positional arguments followed by one record holding the named arguments.
     */
    public String arguments(List<Expression> positional, List<NamedArgument> named) {
        List<String> parts = new ArrayList<>();
        for (Expression e : positional) {
            parts.add(emit(e));
        }
        if (!named.isEmpty()) {
            parts.add(named.stream()
                    .map(a -> JsNames.propertyKey(a.name()) + ": " + emit(a.value()))
                    .collect(Collectors.joining(", ", "{ ", " }")));
        }
        return String.join(", ", parts);
    }

    // ── Precedence ───────────────────────────────────────────────

    static int precedenceOf(Expression e) {
        if (e instanceof BinaryExpr b) {
            return JsOperators.precedence(b.operator());
        }
        if (e instanceof ConditionalExpr) {
            return JsOperators.CONDITIONAL;
        }
        if (e instanceof AssignmentExpr || e instanceof LambdaExpr) {
            return JsOperators.ASSIGNMENT;
        }
        if (e instanceof UnaryExpr u) {
            if (u.operator() == UnaryOperator.NULL_ASSERT) {
                return JsOperators.ATOM;
            }
            return u.operator().isPrefix() ? JsOperators.UNARY : JsOperators.POSTFIX;
        }
        if (e instanceof AwaitExpr) {
            return JsOperators.UNARY;
        }
        if (e instanceof IsExpr) {
            return JsOperators.EQUALITY;
        }
        if (e instanceof AsExpr a) {
            return RuntimeHelper.forCast(a).isPresent() ? JsOperators.ATOM : precedenceOf(a.expression());
        }
        return JsOperators.ATOM;
    }

    private String wrapped(Expression e, int minimum) {
        String text = emit(e);
        return precedenceOf(e) < minimum ? "(" + text + ")" : text;
    }

    private String target(Expression e) {
        if (e instanceof SuperExpr) {
            return "super";
        }
        String text = emit(e);
        boolean numeric = e instanceof LiteralExpr l && (l.kind() == LiteralKind.INT || l.kind() == LiteralKind.DOUBLE);
        return numeric || precedenceOf(e) < JsOperators.MEMBER ? "(" + text + ")" : text;
    }

    private String operand(Expression e, int precedence, boolean right, BinaryOperator parent) {
        int own = precedenceOf(e);
        boolean wrap = right ? own <= precedence : own < precedence;
        if (e instanceof BinaryExpr child && JsOperators.mixesNullish(parent, child.operator())) {
            wrap = true;
        }
        String text = emit(e);
        return wrap ? "(" + text + ")" : text;
    }

    private static boolean isNullLiteral(Expression e) {
        return e instanceof LiteralExpr l && l.kind() == LiteralKind.NULL;
    }

    /**
     * Widget routing: registry and unit widgets, and capitalized names known nowhere else.
     */
    private boolean isWidget(String name) {
        if (ctx.registry().isWidget(name) || ctx.isUserWidget(name)) {
            return true;
        }
        return Character.isUpperCase(name.charAt(0))
                && !ctx.scope().isDefined(name)
                && !ctx.isExternal(name)
                && !ctx.isDeferred(name);
    }

    private String typeName(TypeRef type) {
        return ctx.isDeferred(type.name()) ? ImportResolver.DEFERRED_PROXY + "." + type.name() : type.name();
    }

    // ── Visits ───────────────────────────────────────────────────

    @Override
    public String visit(LiteralExpr n, Void arg) {
        return switch (n.kind()) {
            case STRING -> JsLiterals.quote(n.value().toString());
            case INT -> Long.toString(((Number) n.value()).longValue());
            case DOUBLE -> {
                double d = ((Number) n.value()).doubleValue();
                if (Double.isNaN(d)) {
                    yield "NaN";
                }
                if (Double.isInfinite(d)) {
                    yield d > 0 ? "Infinity" : "-Infinity";
                }
                yield Double.toString(d);
            }
            case BOOL -> n.value().toString();
            case NULL -> "null";
        };
    }

    @Override
    public String visit(IdentifierExpr n, Void arg) {
        String ref = reference(n.name());
        return ctx.isMergedAccessor(n.name()) ? ref + "()" : ref;
    }

    @Override
    public String visit(ThisExpr n, Void arg) {
        return "this";
    }

    @Override
    public String visit(SuperExpr n, Void arg) {
        return "super";
    }

    @Override
    public String visit(BinaryExpr n, Void arg) {
        BinaryOperator op = n.operator();
        if (op == BinaryOperator.FLOOR_DIVIDE) {
            return "Math.floor(" + operand(n.left(), JsOperators.MULTIPLICATIVE, false, op)
                    + " / " + operand(n.right(), JsOperators.MULTIPLICATIVE, true, op) + ")";
        }
        String token = JsOperators.token(op);
        // comparing with null also matches undefined
        if ((op == BinaryOperator.EQUALS || op == BinaryOperator.NOT_EQUALS)
                && (isNullLiteral(n.left()) || isNullLiteral(n.right()))) {
            token = op == BinaryOperator.EQUALS ? "==" : "!=";
        }
        int precedence = JsOperators.precedence(op);
        return operand(n.left(), precedence, false, op) + " " + token + " " + operand(n.right(), precedence, true, op);
    }

    @Override
    public String visit(UnaryExpr n, Void arg) {
        UnaryOperator op = n.operator();
        if (op == UnaryOperator.NULL_ASSERT) {
            ctx.useHelper(RuntimeHelper.NULL_ASSERT);
            return "nullAssert(" + emit(n.operand()) + ")";
        }
        if (!op.isPrefix()) {
            return wrapped(n.operand(), JsOperators.POSTFIX) + op.token();
        }
        String inner = wrapped(n.operand(), JsOperators.UNARY);
        boolean clash = (op.token().startsWith("-") && inner.startsWith("-"))
                || (op.token().startsWith("+") && inner.startsWith("+"));
        return op.token() + (clash ? " " : "") + inner;
    }

    @Override
    public String visit(AssignmentExpr n, Void arg) {
        Optional<String> accessor = mergedAccessorTarget(n.target());
        if (accessor.isPresent()) {
            return accessorAssignment(accessor.get(), n);
        }
        String target = emit(n.target());
        if (n.operator() == AssignmentOperator.FLOOR_DIVIDE_ASSIGN) {
            return target + " = Math.floor(" + target + " / "
                    + operand(n.value(), JsOperators.MULTIPLICATIVE, true, BinaryOperator.FLOOR_DIVIDE) + ")";
        }
        return target + " " + n.operator().token() + " " + emit(n.value());
    }

    /**
     * The callee text when {@code target} names a merged accessor: {@code x} or {@code this.x}.
     */
    private Optional<String> mergedAccessorTarget(Expression target) {
        if (target instanceof IdentifierExpr id && ctx.isMergedAccessor(id.name())) {
            return Optional.of(reference(id.name()));
        }
        if (target instanceof PropertyAccessExpr access && access.target() instanceof ThisExpr
                && ctx.isClassAccessor(access.propertyName())) {
            return Optional.of("this." + access.propertyName());
        }
        return Optional.empty();
    }

    /**
     * Writes through a merged accessor: {@code x = v} calls {@code x(v)}; compound operators read first.
     */
    private String accessorAssignment(String callee, AssignmentExpr n) {
        String value = emit(n.value());
        return switch (n.operator()) {
            case ASSIGN -> callee + "(" + value + ")";
            case FLOOR_DIVIDE_ASSIGN -> callee + "(Math.floor(" + callee + "() / (" + value + ")))";
            case IF_NULL_ASSIGN -> callee + "(" + callee + "() ?? (" + value + "))";
            default -> {
                String token = n.operator().token();
                yield callee + "(" + callee + "() " + token.substring(0, token.length() - 1) + " (" + value + "))";
            }
        };
    }

    @Override
    public String visit(MethodCallExpr n, Void arg) {
        if (n.isUnqualified()) {
            return unqualifiedCall(n);
        }
        return target(n.target()) + (n.nullSafe() ? "?." : ".") + n.methodName()
                + "(" + arguments(n.arguments(), n.namedArguments()) + ")";
    }

    private String unqualifiedCall(MethodCallExpr n) {
        String name = n.methodName();
        if (name.equals("setState")) {
            // a map literal is merged into the state; anything else is run as the update callback
            String update = n.arguments().isEmpty() ? "() => {}" : emit(n.arguments().get(0));
            return "this.setState(" + update + ")";
        }
        if (isWidget(name)) {
            return widgets.emit(name, n.arguments(), n.namedArguments());
        }
        String args = "(" + arguments(n.arguments(), n.namedArguments()) + ")";
        if (Character.isUpperCase(name.charAt(0))) {
            return "new " + reference(name) + args;
        }
        return reference(name) + args;
    }

    @Override
    public String visit(InstanceCreationExpr n, Void arg) {
        String type = n.type().name();
        boolean unnamed = n.constructorName() == null || n.constructorName().isEmpty();
        if (unnamed && isWidget(type)) {
            return widgets.emit(type, n.arguments(), n.namedArguments());
        }
        String args = "(" + arguments(n.arguments(), n.namedArguments()) + ")";
        if (unnamed) {
            return "new " + reference(type) + args;
        }
        return reference(type) + "." + n.constructorName() + args;
    }

    @Override
    public String visit(PropertyAccessExpr n, Void arg) {
        if (n.target() instanceof ThisExpr && ctx.isClassAccessor(n.propertyName())) {
            return "this." + n.propertyName() + "()";
        }
        return target(n.target()) + (n.nullSafe() ? "?." : ".") + n.propertyName();
    }

    @Override
    public String visit(IndexAccessExpr n, Void arg) {
        return target(n.target()) + (n.nullableTarget() ? "?.[" : "[") + emit(n.index()) + "]";
    }

    @Override
    public String visit(ConditionalExpr n, Void arg) {
        return "(" + emit(n.condition()) + ") ? (" + emit(n.thenExpression()) + ") : (" + emit(n.elseExpression()) + ")";
    }

    @Override
    public String visit(ListLiteralExpr n, Void arg) {
        String list = n.elements().stream().map(this::emit).collect(Collectors.joining(", ", "[", "]"));
        return n.isConst() ? "Object.freeze(" + list + ")" : list;
    }

    @Override
    public String visit(MapLiteralExpr n, Void arg) {
        String record;
        if (n.entries().isEmpty()) {
            record = "{}";
        } else {
            List<String> entries = new ArrayList<>();
            for (MapEntryExpr entry : n.entries()) {
                entries.add(mapKey(entry.key()) + ": " + emit(entry.value()));
            }
            record = "{ " + String.join(", ", entries) + " }";
        }
        return n.isConst() ? "Object.freeze(" + record + ")" : record;
    }

    private String mapKey(Expression key) {
        if (key instanceof LiteralExpr literal) {
            if (literal.kind() == LiteralKind.STRING) {
                return JsNames.propertyKey(literal.value().toString());
            }
            if (literal.kind() == LiteralKind.INT || literal.kind() == LiteralKind.DOUBLE) {
                return emit(literal);
            }
        }
        return "[" + emit(key) + "]";
    }

    @Override
    public String visit(SetLiteralExpr n, Void arg) {
        return n.elements().stream().map(this::emit).collect(Collectors.joining(", ", "new Set([", "])"));
    }

    @Override
    public String visit(LambdaExpr n, Void arg) {
        String prefix = n.isAsync() ? "async " : "";
        return ctx.scope().inScope("lambda", () -> ctx.inFunction(n.isAsync(), () -> {
            String head = prefix + "(" + Parameters.signature(n.parameters(), this) + ") => ";
            Parameters.define(n.parameters(), ctx);
            if (!n.hasBlockBody()) {
                String body = emit(n.expressionBody());
                return head + (body.startsWith("{") ? "(" + body + ")" : body);
            }
            if (n.blockBody().isEmpty()) {
                return head + "{}";
            }
            JsPrinter out = new JsPrinter();
            out.println(head + "{");
            out.indent();
            statements.emitStatements(n.blockBody().statements(), out);
            out.unindent();
            out.print("}");
            return out.toString();
        }));
    }

    @Override
    public String visit(CascadeExpr n, Void arg) {
        String target = emit(n.target());
        String receiver = ctx.enterCascade();
        try {
            JsPrinter out = new JsPrinter();
            out.println("((" + receiver + ") => {");
            out.indent();
            for (Expression section : n.sections()) {
                out.printlnLines(emit(section) + ";");
            }
            out.println("return " + receiver + ";");
            out.unindent();
            out.print("})(" + target + ")");
            return out.toString();
        } finally {
            ctx.exitCascade();
        }
    }

    @Override
    public String visit(CascadeReceiverExpr n, Void arg) {
        if (!ctx.inCascade()) {
            throw new CodeGenerationException("Cascade receiver used outside of a cascade", "CascadeReceiverExpr");
        }
        return ctx.cascadeReceiver();
    }

    @Override
    public String visit(AwaitExpr n, Void arg) {
        if (ctx.isAsync()) {
            return "await " + wrapped(n.expression(), JsOperators.UNARY);
        }
        ctx.diagnostics().add(Diagnostic.of(Severity.WARNING, DiagnosticCode.AWAIT_OUTSIDE_ASYNC,
                        "'await' outside an async function; the expression is emitted without it")
                .withNode(ctx.currentClass().orElse("top level"))
                .withSuggestion("Mark the enclosing function async"));
        return emit(n.expression());
    }

    @Override
    public String visit(StringInterpolationExpr n, Void arg) {
        StringBuilder sb = new StringBuilder("`");
        for (InterpolationPart part : n.parts()) {
            if (part.isExpression()) {
                sb.append("${").append(emit(part.expression())).append('}');
            } else {
                sb.append(JsLiterals.templateText(part.text()));
            }
        }
        return sb.append('`').toString();
    }

    @Override
    public String visit(IsExpr n, Void arg) {
        String predicate = TypeTests.predicate(target(n.expression()), n.type());
        return n.negated() ? "!(" + predicate + ")" : predicate;
    }

    @Override
    public String visit(AsExpr n, Void arg) {
        String value = emit(n.expression());
        Optional<RuntimeHelper> helper = RuntimeHelper.forCast(n);
        if (helper.isEmpty()) {
            return value;
        }
        ctx.useHelper(helper.get());
        List<TypeRef> typeArgs = n.type().typeArguments();
        return switch (helper.get()) {
            case LIST_CAST -> "listCast(" + value + ", " + typeName(typeArgs.get(0)) + ")";
            case MAP_CAST -> "mapCast(" + value + ", " + typeName(typeArgs.get(0)) + ", " + typeName(typeArgs.get(1)) + ")";
            default -> "typeAssertion(" + value + ", " + typeName(n.type()) + ", "
                    + JsLiterals.quote(describeValue(n.expression())) + ")";
        };
    }

    private static String describeValue(Expression e) {
        if (e instanceof IdentifierExpr id) {
            return id.name();
        }
        if (e instanceof PropertyAccessExpr access) {
            return access.propertyName();
        }
        return "value";
    }

    @Override
    public String visit(ThrowExpr n, Void arg) {
        return "(() => { throw " + emit(n.exception()) + "; })()";
    }

    @Override
    public String visit(ParenthesizedExpr n, Void arg) {
        return "(" + emit(n.expression()) + ")";
    }

    @Override
    public String visit(UnknownExpr n, Void arg) {
        ctx.diagnostics().add(Diagnostic.of(Severity.ERROR, DiagnosticCode.UNSUPPORTED_EXPRESSION,
                        "Unsupported expression: " + n.source())
                .withNode(ctx.currentClass().orElse("top level"))
                .withSuggestion("Rewrite the expression with supported constructs"));
        return "/* UNSUPPORTED EXPRESSION: " + JsLiterals.commentText(n.source()) + " */ undefined";
    }
}
