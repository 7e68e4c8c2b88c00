package org.flutterjs.gen.classes;

import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.gen.emit.EmitContext;
import org.flutterjs.gen.emit.ExpressionEmitter;
import org.flutterjs.gen.printer.JsNames;
import org.flutterjs.gen.printer.JsPrinter;
import org.flutterjs.ir.decl.ClassDecl;
import org.flutterjs.ir.decl.ConstructorDecl;
import org.flutterjs.ir.decl.FieldDecl;
import org.flutterjs.ir.decl.FieldRole;
import org.flutterjs.ir.decl.FunctionDecl;
import org.flutterjs.ir.decl.StateAnalysis;
import org.flutterjs.ir.decl.StateFieldInfo;
import org.flutterjs.ir.expr.MethodCallExpr;
import org.flutterjs.ir.expr.SuperExpr;
import org.flutterjs.ir.stmt.ExpressionStmt;
import org.flutterjs.ir.stmt.Statement;
import org.flutterjs.ir.type.TypeRef;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Emits a {@code StatefulWidget} subclass together with its {@code State} class.
 * <p>
 * Lifecycle ordering in the state class: {@code initState}, {@code didChangeDependencies} and
 * {@code didUpdateWidget} call their super method before the body; {@code dispose} releases
 * resource fields, runs the body, then calls {@code super.dispose()} last. Custom methods follow,
 * {@code build} is always the final member.
 */
public final class StatefulWidgetEmitter {

    static final String SET_STATE_WRAPPER = """
            setState(update) {
              if (typeof update === 'function') {
                update.call(this);
              } else if (update) {
                Object.assign(this, update);
              }
              super.setState(() => {});
            }""";

    private static final Set<String> LIFECYCLE = Set.of(
            "initState", "didChangeDependencies", "didUpdateWidget", "dispose", "setState", "build");

    private final EmitContext ctx;
    private final ExpressionEmitter expressions;
    private final ClassEmitter classes;

    public StatefulWidgetEmitter(ClassEmitter classes) {
        this.classes = classes;
        this.expressions = classes.expressions();
        this.ctx = expressions.context();
    }

    /**
     * @param analysis field classification of the state class; fields it does not list are internal
     */
    public String emit(ClassDecl widget, ClassDecl state, Optional<StateAnalysis> analysis) {
        validate(widget, state);
        String widgetText = classes.emitStatefulWidget(widget, state.name());
        String stateText = classes.isolated(state, () -> renderState(state, analysis));
        return widgetText + "\n\n" + stateText;
    }

    private void validate(ClassDecl widget, ClassDecl state) {
        if (state.findMethod("build").isEmpty()) {
            ctx.diagnostics().add(Diagnostic.of(Severity.ERROR, DiagnosticCode.MISSING_BUILD_METHOD,
                            "State class '" + state.name() + "' of widget '" + widget.name() + "' has no build method")
                    .withNode(state.name())
                    .withSuggestion("Add 'Widget build(BuildContext context)' to " + state.name()));
        }
        String expected = "_" + widget.name() + "State";
        if (!state.name().equals(expected)) {
            ctx.diagnostics().add(Diagnostic.of(Severity.WARNING, DiagnosticCode.STATE_NAMING,
                            "State class '" + state.name() + "' does not follow the '" + expected + "' convention")
                    .withNode(state.name())
                    .withSuggestion("Rename it to " + expected));
        }
        if (state.superclass() == null) {
            ctx.diagnostics().add(Diagnostic.of(Severity.WARNING, DiagnosticCode.STATE_MISSING_SUPERCLASS,
                            "State class '" + state.name() + "' declares no superclass")
                    .withNode(state.name())
                    .withSuggestion("Extend State<" + widget.name() + ">"));
        }
    }

    private String renderState(ClassDecl state, Optional<StateAnalysis> analysis) {
        List<FunctionDecl> methods = AccessorMerger.merge(state.name(), state.methods(), ctx.diagnostics());
        Set<String> accessors = new HashSet<>(AccessorMerger.mergedNames(state.methods(), methods));
        return classes.inClassScope(state, methods, accessors, () -> {
            Optional<String> base = state.superclass() == null
                    ? Optional.of(FrameworkBase.STATE.className())
                    : classes.baseClassName(state);
            List<String> members = new ArrayList<>();
            classes.staticFields(state).ifPresent(members::add);
            constructor(state, analysis).ifPresent(members::add);

            lifecycle(state, methods, "initState").ifPresent(members::add);
            lifecycle(state, methods, "didChangeDependencies").ifPresent(members::add);
            lifecycle(state, methods, "didUpdateWidget").ifPresent(members::add);
            dispose(state, methods, analysis).ifPresent(members::add);
            members.add(SET_STATE_WRAPPER);

            for (FunctionDecl m : methods) {
                if (m.hasBody() && !(LIFECYCLE.contains(m.name()) && !m.isAccessor())) {
                    members.add(classes.functions().emitMethod(state.name(), m));
                }
            }
            findMethod(methods, "build").ifPresent(build -> members.add(classes.functions().emitMethod(state.name(), build)));
            return ClassEmitter.classText(state.name(), base, members);
        });
    }

    private static Optional<FunctionDecl> findMethod(List<FunctionDecl> methods, String name) {
        return methods.stream()
                .filter(m -> m.name().equals(name) && !m.isAccessor() && !m.isStatic() && m.hasBody())
                .findFirst();
    }

    private Optional<String> constructor(ClassDecl state, Optional<StateAnalysis> analysis) {
        List<FieldDecl> reactive = new ArrayList<>();
        List<FieldDecl> internal = new ArrayList<>();
        for (FieldDecl f : state.instanceFields()) {
            FieldRole role = analysis.flatMap(a -> a.field(f.name())).map(StateFieldInfo::role).orElse(FieldRole.INTERNAL);
            (role == FieldRole.REACTIVE ? reactive : internal).add(f);
        }
        Optional<ConstructorDecl> declared = state.constructors().stream()
                .filter(c -> c.isUnnamed() && c.body() != null && !c.body().isEmpty())
                .findFirst();
        if (reactive.isEmpty() && internal.isEmpty() && declared.isEmpty()) {
            return Optional.empty();
        }
        JsPrinter out = new JsPrinter();
        out.println("constructor(...args) {");
        out.indent();
        out.println("super(...args);");
        printFields(out, "// Reactive state", reactive);
        printFields(out, "// Internal state", internal);
        declared.ifPresent(c -> ctx.scope().inScope("constructor", () -> expressions.statements().emitBody(c.body(), out)));
        out.unindent();
        out.print("}");
        return Optional.of(out.toString());
    }

    private void printFields(JsPrinter out, String banner, List<FieldDecl> fields) {
        if (fields.isEmpty()) {
            return;
        }
        out.println(banner);
        for (FieldDecl f : fields) {
            String value = f.initializer() == null ? "null" : expressions.emit(f.initializer());
            out.printlnLines("this." + f.name() + " = " + value + ";");
        }
    }

    /**
     * {@code initState}, {@code didChangeDependencies} or {@code didUpdateWidget}: super call
     * first, then the body without any explicit super call of the same method.
     */
    private Optional<String> lifecycle(ClassDecl state, List<FunctionDecl> methods, String name) {
        return findMethod(methods, name).map(m -> {
            String arguments = name.equals("didUpdateWidget") && !m.parameters().isEmpty()
                    ? JsNames.safe(m.parameters().get(0).name())
                    : "";
            Consumer<JsPrinter> superCall = out -> {
                if (ctx.options().emitSuperCalls()) {
                    out.println("super." + name + "(" + arguments + ");");
                }
            };
            return classes.functions().emitMethod(state.name(), m, superCall, withoutSuperCall(m, name), out -> {
            });
        });
    }

    /**
     * Resource fields are released first, then the body runs, then {@code super.dispose()}.
     * A state class with resource fields gets a {@code dispose} even if it declares none.
     */
    private Optional<String> dispose(ClassDecl state, List<FunctionDecl> methods, Optional<StateAnalysis> analysis) {
        List<String> releases = new ArrayList<>();
        for (FieldDecl f : state.instanceFields()) {
            analysis.flatMap(a -> a.field(f.name()))
                    .filter(StateFieldInfo::isDisposable)
                    .ifPresent(info -> releases.add("this." + f.name() + "?." + info.disposeMethod() + "();"));
        }
        Optional<FunctionDecl> declared = findMethod(methods, "dispose");
        if (declared.isEmpty() && releases.isEmpty()) {
            return Optional.empty();
        }
        FunctionDecl dispose = declared.orElseGet(() ->
                new FunctionDecl("dispose", List.of(), TypeRef.VOID, null, false, false, false, false));
        List<Statement> body = declared.isPresent() ? withoutSuperCall(dispose, "dispose") : List.of();
        return Optional.of(classes.functions().emitMethod(state.name(), dispose,
                out -> releases.forEach(out::println),
                body,
                out -> {
                    if (ctx.options().emitSuperCalls()) {
                        out.println("super.dispose();");
                    }
                }));
    }

    static List<Statement> withoutSuperCall(FunctionDecl method, String superMethod) {
        List<Statement> statements = new ArrayList<>();
        for (Statement s : FunctionEmitter.bodyOf(method)) {
            if (!isSuperCall(s, superMethod)) {
                statements.add(s);
            }
        }
        return statements;
    }

    private static boolean isSuperCall(Statement statement, String superMethod) {
        return statement instanceof ExpressionStmt es
                && es.expression() instanceof MethodCallExpr call
                && call.target() instanceof SuperExpr
                && call.methodName().equals(superMethod);
    }
}
