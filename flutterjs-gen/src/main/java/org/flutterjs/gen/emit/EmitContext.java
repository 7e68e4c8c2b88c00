package org.flutterjs.gen.emit;

import org.flutterjs.gen.config.GenerationOptions;
import org.flutterjs.gen.diagnostic.DiagnosticCollector;
import org.flutterjs.gen.imports.RuntimeModules;
import org.flutterjs.gen.registry.WidgetRegistry;
import org.flutterjs.gen.scope.ScopeResolver;
import org.flutterjs.gen.scope.VariableInfo;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Mutable state of one file's emission: scope chain, diagnostics, the async flag of the
 * enclosing function, cascade nesting and the helpers the emitted code calls.
 * <p>
 * Created per pipeline run and never shared across threads. The registry is the only shared,
 * read-only collaborator.
 */
public final class EmitContext {

    private final GenerationOptions options;
    private final DiagnosticCollector diagnostics;
    private final WidgetRegistry registry;
    private final ScopeResolver scope;

    private final Set<RuntimeHelper> usedHelpers = EnumSet.noneOf(RuntimeHelper.class);
    private final Set<String> deferredSymbols = new HashSet<>();
    private final Set<String> userWidgets = new HashSet<>();
    private final Set<String> externalNames = new HashSet<>();
    private final Deque<Boolean> asyncStack = new ArrayDeque<>();

    private int cascadeDepth;
    private String currentClass;
    private Set<String> currentMethods = Set.of();
    private Set<String> currentAccessors = Set.of();
    private final Set<String> topLevelAccessors = new HashSet<>();

    public EmitContext(GenerationOptions options, DiagnosticCollector diagnostics, WidgetRegistry registry) {
        this.options = options;
        this.diagnostics = diagnostics;
        this.registry = registry;
        this.scope = new ScopeResolver(diagnostics);
    }

    public GenerationOptions options() {
        return options;
    }

    public DiagnosticCollector diagnostics() {
        return diagnostics;
    }

    public WidgetRegistry registry() {
        return registry;
    }

    public ScopeResolver scope() {
        return scope;
    }

    // ── Helpers ──────────────────────────────────────────────────

    public void useHelper(RuntimeHelper helper) {
        usedHelpers.add(helper);
    }

    public Set<RuntimeHelper> usedHelpers() {
        return Collections.unmodifiableSet(usedHelpers);
    }

    // ── Symbols ──────────────────────────────────────────────────

    public void deferSymbols(Collection<String> symbols) {
        deferredSymbols.addAll(symbols);
    }

    public boolean isDeferred(String name) {
        return deferredSymbols.contains(name);
    }

    public void registerUserWidget(String className) {
        userWidgets.add(className);
    }

    public boolean isUserWidget(String name) {
        return userWidgets.contains(name);
    }

    public void addExternalNames(Collection<String> names) {
        externalNames.addAll(names);
    }

    /**
     * Names provided by the runtime or by an import; referenced bare and never reported as unresolved.
     */
    public boolean isExternal(String name) {
        return externalNames.contains(name)
                || registry.isWidget(name)
                || RuntimeModules.isLanguageGlobal(name)
                || RuntimeModules.isLowercaseExport(name)
                || RuntimeModules.frameworkModule(name).isPresent()
                || RuntimeModules.coreLibrary(name).isPresent();
    }

    // ── Function and class nesting ───────────────────────────────

    public <T> T inFunction(boolean isAsync, Supplier<T> body) {
        asyncStack.push(isAsync);
        try {
            return body.get();
        } finally {
            asyncStack.pop();
        }
    }

    public boolean isAsync() {
        return !asyncStack.isEmpty() && asyncStack.peek();
    }

    /**
     * @param instanceMethods names of the class's instance methods, for callback binding
     * @param accessors       names of merged getter/setter pairs, read and written by calling them
     */
    public <T> T inClass(String className, Set<String> instanceMethods, Set<String> accessors, Supplier<T> body) {
        String previousClass = currentClass;
        Set<String> previousMethods = currentMethods;
        Set<String> previousAccessors = currentAccessors;
        currentClass = className;
        currentMethods = Set.copyOf(instanceMethods);
        currentAccessors = Set.copyOf(accessors);
        try {
            return body.get();
        } finally {
            currentClass = previousClass;
            currentMethods = previousMethods;
            currentAccessors = previousAccessors;
        }
    }

    public void addTopLevelAccessors(Collection<String> names) {
        topLevelAccessors.addAll(names);
    }

    /**
     * Whether a reference to {@code name} denotes a merged accessor rather than a plain member.
     */
    public boolean isMergedAccessor(String name) {
        Optional<VariableInfo> info = scope.resolveVariable(name);
        if (info.isEmpty()) {
            return false;
        }
        if (info.get().isField()) {
            return currentAccessors.contains(name);
        }
        return scope.isGlobal(name) && topLevelAccessors.contains(name);
    }

    public boolean isClassAccessor(String name) {
        return currentAccessors.contains(name);
    }

    public Optional<String> currentClass() {
        return Optional.ofNullable(currentClass);
    }

    public boolean isInstanceMethod(String name) {
        return currentMethods.contains(name);
    }

    // ── Cascades ─────────────────────────────────────────────────

    String enterCascade() {
        cascadeDepth++;
        return cascadeReceiver();
    }

    void exitCascade() {
        cascadeDepth--;
    }

    boolean inCascade() {
        return cascadeDepth > 0;
    }

    String cascadeReceiver() {
        return "_casc" + cascadeDepth;
    }
}
