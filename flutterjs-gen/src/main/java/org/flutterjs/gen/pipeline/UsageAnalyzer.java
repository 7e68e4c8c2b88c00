package org.flutterjs.gen.pipeline;

import org.flutterjs.gen.classes.FrameworkBase;
import org.flutterjs.gen.emit.RuntimeHelper;
import org.flutterjs.gen.emit.TypeTests;
import org.flutterjs.gen.registry.WidgetRegistry;
import org.flutterjs.ir.ProgramUnit;
import org.flutterjs.ir.decl.ClassDecl;
import org.flutterjs.ir.decl.ConstructorDecl;
import org.flutterjs.ir.decl.EnumDecl;
import org.flutterjs.ir.decl.FieldDecl;
import org.flutterjs.ir.decl.FunctionDecl;
import org.flutterjs.ir.decl.Parameter;
import org.flutterjs.ir.decl.VariableDecl;
import org.flutterjs.ir.expr.AsExpr;
import org.flutterjs.ir.expr.IdentifierExpr;
import org.flutterjs.ir.expr.InstanceCreationExpr;
import org.flutterjs.ir.expr.IsExpr;
import org.flutterjs.ir.expr.LambdaExpr;
import org.flutterjs.ir.expr.MethodCallExpr;
import org.flutterjs.ir.expr.UnaryExpr;
import org.flutterjs.ir.expr.UnaryOperator;
import org.flutterjs.ir.stmt.CatchClause;
import org.flutterjs.ir.stmt.ForEachStmt;
import org.flutterjs.ir.stmt.TryStmt;
import org.flutterjs.ir.stmt.VariableDeclarationStmt;
import org.flutterjs.ir.type.TypeRef;
import org.flutterjs.ir.visitor.TreeVisitor;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Analyze phase: one walk over every declaration and body of a unit, collecting referenced
 * symbols, types, widgets and helpers, and every declared name.
 * <p>
 * An analyzer instance accumulates into its own sets and serves exactly one unit.
 */
final class UsageAnalyzer extends TreeVisitor<Void> {

    private final WidgetRegistry registry;

    private final SortedSet<String> usedSymbols = new TreeSet<>();
    private final SortedSet<String> usedTypes = new TreeSet<>();
    private final SortedSet<String> usedWidgets = new TreeSet<>();
    private final Set<RuntimeHelper> usedHelpers = EnumSet.noneOf(RuntimeHelper.class);
    private final Set<String> declaredNames = new HashSet<>();

    private UsageAnalyzer(WidgetRegistry registry) {
        this.registry = registry;
    }

    static AnalysisResult analyze(ProgramUnit unit, WidgetRegistry registry) {
        UsageAnalyzer analyzer = new UsageAnalyzer(registry);
        analyzer.unit(unit);
        return new AnalysisResult(analyzer.usedSymbols, analyzer.usedTypes, analyzer.usedWidgets,
                analyzer.usedHelpers, analyzer.declaredNames);
    }

    private void unit(ProgramUnit unit) {
        declaredNames.addAll(unit.typedefNames());
        for (VariableDecl v : unit.variables()) {
            declaredNames.add(v.name());
            walk(v.initializer(), null);
        }
        for (EnumDecl e : unit.enums()) {
            declaredNames.add(e.name());
        }
        for (ClassDecl c : unit.classes()) {
            classDecl(c);
        }
        for (ClassDecl state : FileAssembler.statePairs(unit.classes()).values()) {
            if (state.superclass() == null) {
                usedSymbols.add(FrameworkBase.STATE.className());
            }
        }
        for (FunctionDecl f : unit.functions()) {
            function(f);
        }
    }

    private void classDecl(ClassDecl c) {
        declaredNames.add(c.name());
        if (c.superclass() != null) {
            type(c.superclass());
        } else if (c.findMethod("build").isPresent()) {
            usedSymbols.add(FrameworkBase.GENERIC_WIDGET);
        }
        for (FieldDecl f : c.fields()) {
            declaredNames.add(f.name());
            walk(f.initializer(), null);
        }
        for (ConstructorDecl ctor : c.constructors()) {
            parameters(ctor.parameters());
            walk(ctor.body(), null);
        }
        for (FunctionDecl m : c.methods()) {
            function(m);
        }
    }

    private void function(FunctionDecl f) {
        declaredNames.add(f.name());
        parameters(f.parameters());
        walk(f.body(), null);
    }

    private void parameters(List<Parameter> parameters) {
        for (Parameter p : parameters) {
            declaredNames.add(p.name());
            if (RuntimeHelper.checksParameter(p)) {
                usedHelpers.add(RuntimeHelper.NULL_CHECK);
            }
        }
        walkParameters(parameters, null);
    }

    private void type(TypeRef type) {
        usedSymbols.add(type.name());
        usedTypes.add(type.name());
        if (registry.isWidget(type.name())) {
            usedWidgets.add(type.name());
        }
    }

    /**
     * A type that only matters at runtime when the emitted code names it, e.g. {@code instanceof T}.
     */
    private void testedType(TypeRef type) {
        if (type != null && TypeTests.isClassType(new TypeRef(type.name(), List.of(), false))) {
            type(type);
        }
    }

    // ── Expressions ──────────────────────────────────────────────

    @Override
    public Void visit(IdentifierExpr n, Void arg) {
        usedSymbols.add(n.name());
        if (registry.isWidget(n.name())) {
            usedWidgets.add(n.name());
        }
        return null;
    }

    @Override
    public Void visit(MethodCallExpr n, Void arg) {
        if (n.isUnqualified()) {
            usedSymbols.add(n.methodName());
            if (registry.isWidget(n.methodName())) {
                usedWidgets.add(n.methodName());
            }
        }
        return super.visit(n, arg);
    }

    @Override
    public Void visit(InstanceCreationExpr n, Void arg) {
        type(n.type());
        return super.visit(n, arg);
    }

    @Override
    public Void visit(IsExpr n, Void arg) {
        testedType(n.type());
        return super.visit(n, arg);
    }

    @Override
    public Void visit(AsExpr n, Void arg) {
        RuntimeHelper.forCast(n).ifPresent(helper -> {
            usedHelpers.add(helper);
            if (helper == RuntimeHelper.TYPE_ASSERTION) {
                testedType(n.type());
            } else {
                n.type().typeArguments().forEach(this::testedType);
            }
        });
        return super.visit(n, arg);
    }

    @Override
    public Void visit(UnaryExpr n, Void arg) {
        if (n.operator() == UnaryOperator.NULL_ASSERT) {
            usedHelpers.add(RuntimeHelper.NULL_ASSERT);
        }
        return super.visit(n, arg);
    }

    @Override
    public Void visit(LambdaExpr n, Void arg) {
        for (Parameter p : n.parameters()) {
            declaredNames.add(p.name());
        }
        return super.visit(n, arg);
    }

    // ── Statements ───────────────────────────────────────────────

    @Override
    public Void visit(VariableDeclarationStmt n, Void arg) {
        declaredNames.add(n.name());
        return super.visit(n, arg);
    }

    @Override
    public Void visit(ForEachStmt n, Void arg) {
        declaredNames.add(n.variableName());
        return super.visit(n, arg);
    }

    @Override
    public Void visit(TryStmt n, Void arg) {
        for (CatchClause clause : n.catchClauses()) {
            testedType(clause.exceptionType());
            if (clause.exceptionParameter() != null) {
                declaredNames.add(clause.exceptionParameter());
            }
            if (clause.stackTraceParameter() != null) {
                declaredNames.add(clause.stackTraceParameter());
            }
        }
        return super.visit(n, arg);
    }
}
