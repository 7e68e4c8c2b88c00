package org.flutterjs.gen.pipeline;

import org.flutterjs.gen.classes.AccessorMerger;
import org.flutterjs.gen.classes.ClassEmitter;
import org.flutterjs.gen.classes.FrameworkBase;
import org.flutterjs.gen.classes.FunctionEmitter;
import org.flutterjs.gen.classes.StatefulWidgetEmitter;
import org.flutterjs.gen.config.GenerationOptions;
import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.DiagnosticCollector;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.gen.emit.EmitContext;
import org.flutterjs.gen.emit.ExpressionEmitter;
import org.flutterjs.gen.emit.RuntimeHelper;
import org.flutterjs.gen.imports.CircularImportTable;
import org.flutterjs.gen.imports.GlobalSymbolTable;
import org.flutterjs.gen.imports.ImportPlan;
import org.flutterjs.gen.imports.ImportResolver;
import org.flutterjs.gen.optimize.JsOptimizer;
import org.flutterjs.gen.optimize.OptimizationResult;
import org.flutterjs.gen.printer.JsLiterals;
import org.flutterjs.gen.printer.JsNames;
import org.flutterjs.gen.registry.WidgetRegistry;
import org.flutterjs.gen.validate.OutputValidator;
import org.flutterjs.gen.validate.ValidationIssue;
import org.flutterjs.gen.validate.ValidationReport;
import org.flutterjs.ir.ProgramUnit;
import org.flutterjs.ir.decl.ClassDecl;
import org.flutterjs.ir.decl.EnumDecl;
import org.flutterjs.ir.decl.FunctionDecl;
import org.flutterjs.ir.decl.VariableDecl;
import org.flutterjs.ir.type.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Turns one {@link ProgramUnit} into one JavaScript module in four phases: analyze, generate,
 * validate, optimize.
 * <p>
 * The generated file is laid out as header, imports, deferred proxy, runtime helpers, top-level
 * variables, enums, classes (dependencies first), functions, exports and the {@code main()} call.
 * <p>
 * An assembler holds only read-only collaborators; every {@link #generate} call builds its own
 * context, so one assembler may serve several threads.
 */
public final class FileAssembler {

    private static final Logger log = LoggerFactory.getLogger(FileAssembler.class);

    static final String HELPERS_BANNER = "// ===== RUNTIME HELPERS (%d) =====";

    private final GenerationOptions options;
    private final WidgetRegistry registry;
    private final GlobalSymbolTable symbolTable;
    private final CircularImportTable circularImports;

    public FileAssembler(GenerationOptions options) {
        this(options, WidgetRegistry.standard(), GlobalSymbolTable.empty(), CircularImportTable.standard());
    }

    public FileAssembler(GenerationOptions options,
                         WidgetRegistry registry,
                         GlobalSymbolTable symbolTable,
                         CircularImportTable circularImports) {
        this.options = options;
        this.registry = registry;
        this.symbolTable = symbolTable;
        this.circularImports = circularImports;
    }

    public GenerationOptions options() {
        return options;
    }

    /**
     * Never throws: any failure is returned as a failed result.
     */
    public GenerationResult generate(ProgramUnit unit) {
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        String filePath = unit == null ? "<none>" : unit.filePath();
        try {
            if (unit == null) {
                throw new IllegalArgumentException("No program unit given");
            }
            return run(unit, diagnostics);
        } catch (RuntimeException e) {
            log.warn("Generation of {} failed", filePath, e);
            diagnostics.add(Diagnostic.of(Severity.FATAL, DiagnosticCode.GENERATION_FAILED,
                            "Generation failed: " + e.getMessage())
                    .withNode(filePath)
                    .withCause(e));
            return GenerationResult.failed(filePath, "Generation failed: " + e.getMessage(), diagnostics.sorted());
        }
    }

    private GenerationResult run(ProgramUnit unit, DiagnosticCollector diagnostics) {
        long start = System.nanoTime();
        if (unit.isEmpty()) {
            diagnostics.add(Diagnostic.of(Severity.FATAL, DiagnosticCode.EMPTY_PROGRAM_UNIT,
                            "'" + unit.filePath() + "' declares nothing to generate")
                    .withNode(unit.filePath()));
            return GenerationResult.failed(unit.filePath(), "Nothing to generate for " + unit.filePath(), diagnostics.sorted());
        }
        int level = optimizationLevel(diagnostics);

        // 1. analyze
        log.debug("Analyzing {}", unit.filePath());
        AnalysisResult analysis = UsageAnalyzer.analyze(unit, registry);
        ImportResolver imports = new ImportResolver(unit, options, registry, symbolTable, circularImports, diagnostics);
        ImportPlan plan = imports.resolve(analysis.usedSymbols(), analysis.declaredNames());

        // 2. generate
        log.debug("Generating {}", unit.filePath());
        EmitContext ctx = context(unit, plan, diagnostics);
        List<FunctionDecl> functions = AccessorMerger.merge("top level", unit.functions(), diagnostics);
        ctx.addTopLevelAccessors(AccessorMerger.mergedNames(unit.functions(), functions));
        String code = assemble(unit, analysis, plan, imports, functions, ctx);
        if (!ctx.scope().isBalanced()) {
            throw new IllegalStateException("Scope stack is unbalanced after generating " + unit.filePath());
        }
        int generatedSize = code.length();

        // 3. validate
        ValidationReport validation = null;
        if (options.validate()) {
            validation = new OutputValidator(options.minimumOutputSize()).validate(code);
            for (ValidationIssue issue : validation.issues()) {
                diagnostics.add(Diagnostic.of(issue.severity(), DiagnosticCode.VALIDATION, issue.toString())
                        .withNode(unit.filePath()));
            }
        }

        // 4. optimize
        OptimizationResult optimization = null;
        if (options.optimize()) {
            optimization = new JsOptimizer(diagnostics).optimize(code, level, options.dryRun());
            code = optimization.text();
        }

        // the banner goes on last so that no optimization level strips it
        if (validation != null && validation.hasCriticalIssues() && options.errorBanner()) {
            log.warn("{} has structural errors, emitting it behind an error banner", unit.filePath());
            code = banner(validation) + code;
        }

        Set<RuntimeHelper> helpers = helpers(analysis, ctx);
        GenerationStatistics statistics = new GenerationStatistics(
                unit.classes().size(), unit.functions().size(), unit.variables().size(), unit.enums().size(),
                plan.importStatementCount(), analysis.usedWidgets(), analysis.usedTypes(),
                helpers.stream().map(RuntimeHelper::functionName).toList(),
                generatedSize, code.length(), (System.nanoTime() - start) / 1_000_000);
        log.info("Generated {}: {} classes, {} functions, {} characters, {} error(s), {} warning(s)",
                unit.filePath(), statistics.classCount(), statistics.functionCount(), code.length(),
                diagnostics.count(Severity.ERROR), diagnostics.count(Severity.WARNING));
        return GenerationResult.succeeded(unit.filePath(), code, statistics, validation, optimization, diagnostics.sorted());
    }

    private int optimizationLevel(DiagnosticCollector diagnostics) {
        int level = options.optimizationLevel();
        if (options.optimize() && (level < JsOptimizer.MIN_LEVEL || level > JsOptimizer.MAX_LEVEL)) {
            log.warn("Optimization level {} is out of range, using {}", level, JsOptimizer.MIN_LEVEL);
            diagnostics.add(Diagnostic.of(Severity.WARNING, DiagnosticCode.INVALID_OPTIMIZATION_LEVEL,
                            "Optimization level " + level + " is not between " + JsOptimizer.MIN_LEVEL
                                    + " and " + JsOptimizer.MAX_LEVEL + "; level " + JsOptimizer.MIN_LEVEL + " is used")
                    .withSuggestion("Use a level from 1 to 3"));
            return JsOptimizer.MIN_LEVEL;
        }
        return level;
    }

    private EmitContext context(ProgramUnit unit, ImportPlan plan, DiagnosticCollector diagnostics) {
        EmitContext ctx = new EmitContext(options, diagnostics, registry);
        for (ClassDecl c : unit.classes()) {
            ctx.scope().defineGlobal(c.name());
            if (isUserWidget(c)) {
                ctx.registerUserWidget(c.name());
            }
        }
        unit.functions().forEach(f -> ctx.scope().defineGlobal(f.name()));
        unit.variables().forEach(v -> ctx.scope().defineGlobal(v.name()));
        unit.enums().forEach(e -> ctx.scope().defineGlobal(e.name()));
        unit.typedefNames().forEach(ctx.scope()::defineGlobal);
        for (String symbol : plan.importedSymbols()) {
            if (!plan.isDeferred(symbol)) {
                ctx.scope().defineGlobal(symbol);
            }
        }
        ctx.deferSymbols(plan.deferredSymbols());
        return ctx;
    }

    private static boolean isUserWidget(ClassDecl c) {
        String base = c.superclassName();
        return base != null && FrameworkBase.of(base).map(FrameworkBase::isWidget).orElse(false);
    }

    /**
     * Widget class name to its state class: the class extending {@code State<Widget>}, or failing
     * that the class named {@code _WidgetState}.
     */
    static Map<String, ClassDecl> statePairs(List<ClassDecl> classes) {
        Map<String, ClassDecl> pairs = new LinkedHashMap<>();
        for (ClassDecl widget : classes) {
            if (!FrameworkBase.STATEFUL_WIDGET.className().equals(widget.superclassName())) {
                continue;
            }
            Optional<ClassDecl> state = classes.stream().filter(c -> isStateOf(c, widget.name())).findFirst();
            if (state.isEmpty()) {
                state = classes.stream().filter(c -> c.name().equals("_" + widget.name() + "State")).findFirst();
            }
            state.ifPresent(s -> pairs.put(widget.name(), s));
        }
        return pairs;
    }

    private static boolean isStateOf(ClassDecl candidate, String widgetName) {
        TypeRef superclass = candidate.superclass();
        return superclass != null
                && superclass.name().equals(FrameworkBase.STATE.className())
                && superclass.typeArguments().size() == 1
                && superclass.typeArguments().get(0).name().equals(widgetName);
    }

    // ── Generate phase ───────────────────────────────────────────

    private String assemble(ProgramUnit unit, AnalysisResult analysis, ImportPlan plan, ImportResolver imports,
                            List<FunctionDecl> functions, EmitContext ctx) {
        ExpressionEmitter expressions = new ExpressionEmitter(ctx);
        ClassEmitter classEmitter = new ClassEmitter(expressions);
        StatefulWidgetEmitter statefulEmitter = new StatefulWidgetEmitter(classEmitter);
        FunctionEmitter functionEmitter = new FunctionEmitter(expressions);

        // bodies first: they record the helpers the helper section must define
        List<String> variables = new ArrayList<>();
        for (VariableDecl v : unit.variables()) {
            variables.add(variable(v, expressions));
        }
        List<String> enums = new ArrayList<>();
        for (EnumDecl e : unit.enums()) {
            enums.add(enumObject(e));
        }
        List<String> classes = classes(unit, classEmitter, statefulEmitter, ctx.diagnostics());
        List<String> functionTexts = new ArrayList<>();
        for (FunctionDecl f : functions) {
            if (f.hasBody()) {
                functionTexts.add(functionEmitter.emitFunction(f));
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append("// Generated by FlutterJS from ").append(unit.filePath()).append('\n')
          .append("// Do not edit by hand.\n\n");
        section(sb, imports.renderImports(plan));
        section(sb, imports.renderDeferred(plan));
        section(sb, helperSection(helpers(analysis, ctx)));
        section(sb, String.join("\n", variables));
        section(sb, String.join("\n\n", enums));
        section(sb, String.join("\n\n", classes));
        section(sb, String.join("\n\n", functionTexts));
        section(sb, imports.renderExports(localExports(unit, functions)));
        if (options.invokeMain() && functions.stream().anyMatch(f -> f.name().equals("main") && f.hasBody())) {
            section(sb, "main();");
        }
        return sb.toString().stripTrailing() + "\n";
    }

    private static void section(StringBuilder sb, String text) {
        if (!text.isBlank()) {
            sb.append(text.stripTrailing()).append("\n\n");
        }
    }

    private static Set<RuntimeHelper> helpers(AnalysisResult analysis, EmitContext ctx) {
        Set<RuntimeHelper> helpers = EnumSet.noneOf(RuntimeHelper.class);
        helpers.addAll(analysis.usedHelpers());
        helpers.addAll(ctx.usedHelpers());
        return helpers;
    }

    private static String helperSection(Set<RuntimeHelper> helpers) {
        if (helpers.isEmpty()) {
            return "";
        }
        return String.format(HELPERS_BANNER, helpers.size()) + "\n\n"
                + helpers.stream().map(RuntimeHelper::definition).collect(Collectors.joining("\n\n"));
    }

    private String variable(VariableDecl v, ExpressionEmitter expressions) {
        String keyword = v.isConst() || (v.isFinal() && v.initializer() != null) ? "const" : "let";
        String name = JsNames.safe(v.name());
        String comment = options.emitTypeComments() && v.type() != null ? " // " + v.type().displayName() : "";
        if (v.initializer() == null) {
            return keyword + " " + name + ";" + comment;
        }
        return keyword + " " + name + " = " + expressions.emit(v.initializer()) + ";" + comment;
    }

    /**
     * A frozen object with one frozen {@code {index, name}} value per constant and a
     * {@code values} array in declaration order.
     */
    static String enumObject(EnumDecl e) {
        StringBuilder sb = new StringBuilder("const ").append(e.name()).append(" = (() => {\n");
        List<String> entries = new ArrayList<>();
        List<String> locals = new ArrayList<>();
        for (int i = 0; i < e.values().size(); i++) {
            String value = e.values().get(i);
            String local = JsNames.safe(value);
            sb.append("  const ").append(local).append(" = Object.freeze({ index: ").append(i)
              .append(", name: ").append(JsLiterals.quote(value))
              .append(", toString() { return ").append(JsLiterals.quote(e.name() + "." + value)).append("; } });\n");
            entries.add(local.equals(value) ? value : JsNames.propertyKey(value) + ": " + local);
            locals.add(local);
        }
        entries.add("values: Object.freeze([" + String.join(", ", locals) + "])");
        return sb.append("  return Object.freeze({ ").append(String.join(", ", entries)).append(" });\n")
                 .append("})();").toString();
    }

    private static List<String> classes(ProgramUnit unit, ClassEmitter classEmitter,
                                        StatefulWidgetEmitter statefulEmitter, DiagnosticCollector diagnostics) {
        Map<String, ClassDecl> pairs = statePairs(unit.classes());
        Set<String> pairedStates = pairs.values().stream().map(ClassDecl::name).collect(Collectors.toSet());
        List<String> texts = new ArrayList<>();
        for (ClassDecl cls : ClassOrdering.order(unit.classes(), diagnostics)) {
            if (pairedStates.contains(cls.name())) {
                continue;
            }
            if (!FrameworkBase.STATEFUL_WIDGET.className().equals(cls.superclassName())) {
                texts.add(classEmitter.emit(cls));
                continue;
            }
            ClassDecl state = pairs.get(cls.name());
            if (state == null) {
                String expected = "_" + cls.name() + "State";
                diagnostics.add(Diagnostic.of(Severity.WARNING, DiagnosticCode.STATE_CLASS_NOT_FOUND,
                                "No state class found for stateful widget '" + cls.name() + "'")
                        .withNode(cls.name())
                        .withSuggestion("Declare " + expected + " extends State<" + cls.name() + "> in the same file"));
                texts.add(classEmitter.emitStatefulWidget(cls, expected));
            } else {
                texts.add(statefulEmitter.emit(cls, state, unit.stateAnalysis(state.name())));
            }
        }
        return texts;
    }

    private static SortedSet<String> localExports(ProgramUnit unit, List<FunctionDecl> functions) {
        SortedSet<String> names = new TreeSet<>();
        unit.classes().forEach(c -> names.add(c.name()));
        unit.enums().forEach(e -> names.add(e.name()));
        unit.variables().forEach(v -> names.add(JsNames.safe(v.name())));
        functions.stream().filter(FunctionDecl::hasBody).forEach(f -> names.add(JsNames.safe(f.name())));
        names.removeIf(name -> name.startsWith("_"));
        return names;
    }

    private static String banner(ValidationReport validation) {
        StringBuilder sb = new StringBuilder("/*\n * ========================================\n")
                .append(" * GENERATED CODE HAS STRUCTURAL ERRORS\n");
        for (ValidationIssue issue : validation.criticalIssues()) {
            sb.append(" * ").append(JsLiterals.commentText(issue.toString())).append('\n');
        }
        return sb.append(" * The output below is kept for inspection.\n")
                 .append(" * ========================================\n */\n").toString();
    }
}
