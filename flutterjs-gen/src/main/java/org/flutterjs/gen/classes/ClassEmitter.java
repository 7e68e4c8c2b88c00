package org.flutterjs.gen.classes;

import org.flutterjs.gen.WidgetValidationException;
import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.gen.emit.EmitContext;
import org.flutterjs.gen.emit.ExpressionEmitter;
import org.flutterjs.gen.emit.Parameters;
import org.flutterjs.gen.imports.ImportResolver;
import org.flutterjs.gen.printer.JsLiterals;
import org.flutterjs.gen.printer.JsNames;
import org.flutterjs.gen.printer.JsPrinter;
import org.flutterjs.gen.scope.VariableInfo;
import org.flutterjs.ir.decl.ClassDecl;
import org.flutterjs.ir.decl.ConstructorDecl;
import org.flutterjs.ir.decl.FieldDecl;
import org.flutterjs.ir.decl.FunctionDecl;
import org.flutterjs.ir.decl.Parameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Emits one class declaration: static fields, the constructor, named and factory constructors,
 * {@code createState()} for stateful widgets, then the methods in declaration order with getter/setter
 * pairs merged. Members are separated by one blank line.
 */
public final class ClassEmitter {

    private static final Logger log = LoggerFactory.getLogger(ClassEmitter.class);

    private final EmitContext ctx;
    private final ExpressionEmitter expressions;
    private final FunctionEmitter functions;

    public ClassEmitter(ExpressionEmitter expressions) {
        this.ctx = expressions.context();
        this.expressions = expressions;
        this.functions = new FunctionEmitter(expressions);
    }

    FunctionEmitter functions() {
        return functions;
    }

    ExpressionEmitter expressions() {
        return expressions;
    }

    public String emit(ClassDecl cls) {
        return isolated(cls, () -> render(cls, null));
    }

    /**
     * A {@code StatefulWidget} subclass: every constructor parameter is stored on {@code this} and
     * {@code createState()} returns a new {@code stateClassName}.
     */
    public String emitStatefulWidget(ClassDecl cls, String stateClassName) {
        return isolated(cls, () -> render(cls, stateClassName));
    }

    String isolated(ClassDecl cls, Supplier<String> body) {
        try {
            return body.get();
        } catch (WidgetValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Generation of class {} failed", cls.name(), e);
            ctx.diagnostics().add(Diagnostic.of(Severity.ERROR, DiagnosticCode.CLASS_GENERATION_FAILED,
                            "Generation of class '" + cls.name() + "' failed: " + e.getMessage())
                    .withNode(cls.name())
                    .withCause(e));
            return "/* CLASS GENERATION FAILED: " + JsLiterals.commentText(cls.name() + ": " + e.getMessage()) + " */\n"
                    + "class " + cls.name() + " {\n}";
        }
    }

    /**
     * The name after {@code extends}: framework bases and declared superclasses keep their name,
     * a superclass-less class declaring {@code build} extends the generic widget base.
     */
    public Optional<String> baseClassName(ClassDecl cls) {
        String declared = cls.superclassName();
        if (declared == null) {
            return cls.findMethod("build").isPresent() ? Optional.of(FrameworkBase.GENERIC_WIDGET) : Optional.empty();
        }
        if (FrameworkBase.of(declared).isEmpty() && ctx.isDeferred(declared)) {
            return Optional.of(ImportResolver.DEFERRED_PROXY + "." + declared);
        }
        return Optional.of(declared);
    }

    private String render(ClassDecl cls, String stateClassName) {
        List<FunctionDecl> methods = AccessorMerger.merge(cls.name(), cls.methods(), ctx.diagnostics());
        Set<String> accessors = new HashSet<>(AccessorMerger.mergedNames(cls.methods(), methods));
        return inClassScope(cls, methods, accessors, () -> {
            Optional<String> base = baseClassName(cls);
            List<String> members = new ArrayList<>();
            staticFields(cls).ifPresent(members::add);
            constructor(cls, base, stateClassName != null).ifPresent(members::add);
            members.addAll(namedConstructors(cls, base));
            if (stateClassName != null) {
                members.add("createState() {\n  return new " + stateClassName + "();\n}");
            }
            for (FunctionDecl m : methods) {
                if (!m.hasBody() || (stateClassName != null && m.name().equals("createState"))) {
                    continue;
                }
                members.add(functions.emitMethod(cls.name(), m));
            }
            return classText(cls.name(), base, members);
        });
    }

    /**
     * Runs {@code body} with the class's members in scope: instance members resolve to {@code this.x},
     * static members to {@code Owner.x}.
     */
    <T> T inClassScope(ClassDecl cls, List<FunctionDecl> methods, Set<String> accessors, Supplier<T> body) {
        Set<String> instanceMethods = methods.stream()
                .filter(m -> !m.isStatic())
                .map(FunctionDecl::name)
                .collect(Collectors.toSet());
        return ctx.inClass(cls.name(), instanceMethods, accessors, () -> ctx.scope().inScope("class " + cls.name(), () -> {
            for (FieldDecl f : cls.fields()) {
                ctx.scope().define(f.isStatic()
                        ? VariableInfo.staticField(f.name(), f.type(), f.isFinal(), cls.name())
                        : VariableInfo.field(f.name(), f.type(), f.isFinal(), cls.name()));
            }
            for (FunctionDecl m : methods) {
                ctx.scope().define(m.isStatic()
                        ? VariableInfo.staticField(m.name(), m.returnType(), true, cls.name())
                        : VariableInfo.field(m.name(), m.returnType(), true, cls.name()));
            }
            return body.get();
        }));
    }

    static String classText(String name, Optional<String> base, List<String> members) {
        JsPrinter out = new JsPrinter();
        out.println("class " + name + base.map(b -> " extends " + b).orElse("") + " {");
        out.indent();
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) {
                out.println();
            }
            out.printlnLines(members.get(i));
        }
        out.unindent();
        out.print("}");
        return out.toString();
    }

    Optional<String> staticFields(ClassDecl cls) {
        List<FieldDecl> statics = cls.staticFields();
        if (statics.isEmpty()) {
            return Optional.empty();
        }
        List<String> lines = new ArrayList<>();
        for (FieldDecl f : statics) {
            String value = f.initializer() == null ? "null" : expressions.emit(f.initializer());
            lines.add("static " + f.name() + " = " + value + ";");
        }
        return Optional.of(String.join("\n", lines));
    }

    // ── Constructors ─────────────────────────────────────────────

    private Optional<ConstructorDecl> unnamedConstructor(ClassDecl cls) {
        return cls.constructors().stream().filter(ConstructorDecl::isUnnamed).findFirst();
    }

    private Optional<String> constructor(ClassDecl cls, Optional<String> base, boolean assignAllParameters) {
        Optional<ConstructorDecl> unnamed = unnamedConstructor(cls);
        boolean superCall = base.isPresent() && ctx.options().emitSuperCalls();
        if (unnamed.isPresent() && unnamed.get().isFactory()) {
            return Optional.of(factoryBody("constructor", unnamed.get()));
        }
        if (unnamed.isEmpty()) {
            List<String> fieldLines = fieldInitializers(cls, Set.of());
            if (fieldLines.isEmpty()) {
                return Optional.empty();
            }
            JsPrinter out = new JsPrinter();
            out.println(superCall ? "constructor(...args) {" : "constructor() {");
            out.indent();
            if (superCall) {
                out.println("super(...args);");
            }
            fieldLines.forEach(out::printlnLines);
            out.unindent();
            out.print("}");
            return Optional.of(out.toString());
        }
        return Optional.of(initializer("constructor", unnamed.get(), cls, superCall, assignAllParameters));
    }

    /**
     * Constructor or named-constructor initializer: super call, field initializers, parameters
     * stored on {@code this}, then the body.
     */
    private String initializer(String head, ConstructorDecl ctor, ClassDecl cls, boolean superCall, boolean assignAllParameters) {
        Set<String> assignedFromParameters = new HashSet<>();
        for (Parameter p : ctor.parameters()) {
            if (p.fieldFormal() || (assignAllParameters && !p.superFormal())) {
                assignedFromParameters.add(p.name());
            }
        }
        List<String> fieldLines = fieldInitializers(cls, assignedFromParameters);
        return ctx.scope().inScope(head, () -> ctx.inFunction(false, () -> {
            String signature = Parameters.signature(ctor.parameters(), expressions);
            Parameters.define(ctor.parameters(), ctx);
            JsPrinter out = new JsPrinter();
            out.println(head + "(" + signature + ") {");
            out.indent();
            if (superCall) {
                out.println("super(" + superArguments(ctor.parameters()) + ");");
            }
            Parameters.printRequiredChecks(ctor.parameters(), ctx, out);
            fieldLines.forEach(out::printlnLines);
            for (Parameter p : ctor.parameters()) {
                if (assignedFromParameters.contains(p.name())) {
                    out.println("this." + p.name() + " = " + JsNames.safe(p.name()) + ";");
                }
            }
            if (ctor.body() != null) {
                expressions.statements().emitBody(ctor.body(), out);
            }
            out.unindent();
            out.print("}");
            return out.toString();
        }));
    }

    private List<String> fieldInitializers(ClassDecl cls, Set<String> assignedFromParameters) {
        List<String> lines = new ArrayList<>();
        for (FieldDecl f : cls.instanceFields()) {
            if (assignedFromParameters.contains(f.name())) {
                continue;
            }
            String value = f.initializer() == null ? "null" : expressions.emit(f.initializer());
            lines.add("this." + f.name() + " = " + value + ";");
        }
        return lines;
    }

    /**
     * Super-formal parameters are forwarded in declaration order; named ones as one record.
     */
    private static String superArguments(List<Parameter> parameters) {
        List<String> positional = new ArrayList<>();
        List<String> named = new ArrayList<>();
        for (Parameter p : parameters) {
            if (!p.superFormal()) {
                continue;
            }
            String safe = JsNames.safe(p.name());
            if (p.isNamed()) {
                named.add(safe.equals(p.name()) ? safe : p.name() + ": " + safe);
            } else {
                positional.add(safe);
            }
        }
        if (!named.isEmpty()) {
            positional.add("{ " + String.join(", ", named) + " }");
        }
        return String.join(", ", positional);
    }

    /**
     * Named constructors become a static factory plus an {@code _init<Name>} method; factory
     * constructors become static methods with their original body. A subclass instance is built by
     * the base constructor through {@code Reflect.construct}, which receives the super-formal
     * arguments; the class's own fields are set by the initializer.
     */
    private List<String> namedConstructors(ClassDecl cls, Optional<String> base) {
        boolean superCall = base.isPresent() && ctx.options().emitSuperCalls();
        List<String> members = new ArrayList<>();
        for (ConstructorDecl ctor : cls.constructors()) {
            if (ctor.isUnnamed()) {
                continue;
            }
            if (ctor.isFactory()) {
                members.add(factoryBody("static " + ctor.name(), ctor));
                continue;
            }
            String init = "_init" + Character.toUpperCase(ctor.name().charAt(0)) + ctor.name().substring(1);
            members.add(ctx.scope().inScope("factory " + ctor.name(), () -> {
                String signature = Parameters.signature(ctor.parameters(), expressions);
                String creation = superCall
                        ? "Reflect.construct(" + base.get() + ", [" + superArguments(ctor.parameters()) + "], " + cls.name() + ")"
                        : "Object.create(" + cls.name() + ".prototype)";
                return "static " + ctor.name() + "(" + signature + ") {\n"
                        + "  const instance = " + creation + ";\n"
                        + "  instance." + init + "(" + forwardedArguments(ctor.parameters()) + ");\n"
                        + "  return instance;\n"
                        + "}";
            }));
            members.add(initializer(init, ctor, cls, false, false));
        }
        return members;
    }

    private static String forwardedArguments(List<Parameter> parameters) {
        List<String> positional = new ArrayList<>();
        List<String> named = new ArrayList<>();
        for (Parameter p : parameters) {
            String safe = JsNames.safe(p.name());
            if (p.isNamed()) {
                named.add(safe.equals(p.name()) ? safe : p.name() + ": " + safe);
            } else {
                positional.add(safe);
            }
        }
        if (!named.isEmpty()) {
            positional.add("{ " + String.join(", ", named) + " }");
        }
        return String.join(", ", positional);
    }

    private String factoryBody(String head, ConstructorDecl ctor) {
        return ctx.scope().inScope(head, () -> ctx.inFunction(false, () -> {
            String signature = Parameters.signature(ctor.parameters(), expressions);
            Parameters.define(ctor.parameters(), ctx);
            JsPrinter out = new JsPrinter();
            out.println(head + "(" + signature + ") {");
            out.indent();
            Parameters.printRequiredChecks(ctor.parameters(), ctx, out);
            if (ctor.body() != null) {
                expressions.statements().emitBody(ctor.body(), out);
            }
            out.unindent();
            out.print("}");
            return out.toString();
        }));
    }
}
