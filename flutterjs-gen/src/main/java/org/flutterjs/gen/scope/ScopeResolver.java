package org.flutterjs.gen.scope;

import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.DiagnosticCollector;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.gen.printer.JsLiterals;
import org.flutterjs.ir.type.TypeRef;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Tracks declared names per lexical scope and decides how a free identifier is emitted:
 * bare for locals, parameters and unit-level names; {@code this.}-prefixed for instance members
 * of the enclosing class; {@code Owner.}-prefixed for static members.
 * <p>
 * The root scope holds unit-level declarations and imported symbols. Every push must be paired
 * with exactly one pop; {@link #inScope(String, Supplier)} guarantees it on every exit path.
 * One resolver belongs to one pipeline run.
 */
public final class ScopeResolver {

    public static final String ROOT_SCOPE = "unit";

    private final DiagnosticCollector diagnostics;
    private final Scope root;
    private Scope current;

    public ScopeResolver(DiagnosticCollector diagnostics) {
        this.diagnostics = diagnostics;
        this.root = new Scope(ROOT_SCOPE, null);
        this.current = root;
    }

    public Scope pushScope(String name) {
        current = new Scope(name, current);
        return current;
    }

    public void popScope() {
        if (current == root) {
            throw new IllegalStateException("Scope push/pop is unbalanced: cannot pop the root scope");
        }
        current = current.parent();
    }

    /**
     * Runs {@code body} inside a fresh scope and pops it whether {@code body} returns or throws.
     */
    public <T> T inScope(String name, Supplier<T> body) {
        Scope pushed = pushScope(name);
        try {
            return body.get();
        } finally {
            current = pushed.parent();
        }
    }

    public void inScope(String name, Runnable body) {
        inScope(name, () -> {
            body.run();
            return null;
        });
    }

    public void addVariable(String name, TypeRef type, boolean isField, boolean isFinal, boolean isParameter) {
        current.define(new VariableInfo(name, type, isField, isFinal, isParameter, false, null));
    }

    public void define(VariableInfo info) {
        current.define(info);
    }

    public void defineGlobal(String name) {
        root.define(VariableInfo.global(name));
    }

    public Optional<VariableInfo> resolveVariable(String name) {
        return current.lookup(name);
    }

    public boolean isDefined(String name) {
        return current.lookup(name).isPresent();
    }

    /**
     * Whether {@code name} resolves to a unit-level declaration, i.e. nothing nested shadows it.
     */
    public boolean isGlobal(String name) {
        Optional<VariableInfo> global = root.local(name);
        return global.isPresent() && current.lookup(name).orElse(null) == global.get();
    }

    /**
     * {@code "this."} when {@code name} resolves to an instance member not shadowed by a local or
     * parameter, {@code "Owner."} for a static member, {@code ""} otherwise.
     */
    public String getPrefixForVariable(String name) {
        return current.lookup(name).map(ScopeResolver::prefixOf).orElse("");
    }

    private static String prefixOf(VariableInfo info) {
        if (!info.isField()) {
            return "";
        }
        return info.isStatic() ? info.owner() + "." : "this.";
    }

    /**
     * Emits a reference to {@code name}. Member access keeps the property name as declared, bare
     * bindings use {@code safeName}. An unknown name is recorded as
     * {@link DiagnosticCode#UNRESOLVED_IDENTIFIER} and emitted bare behind a marker comment.
     */
    public String qualify(String name, String safeName) {
        Optional<VariableInfo> info = current.lookup(name);
        if (info.isPresent()) {
            String prefix = prefixOf(info.get());
            return prefix.isEmpty() ? safeName : prefix + name;
        }
        diagnostics.add(Diagnostic.of(Severity.ERROR, DiagnosticCode.UNRESOLVED_IDENTIFIER,
                        "Unresolved identifier '" + name + "'")
                .withNode("scope " + current)
                .withSuggestion("Declare '" + name + "' or import the library that defines it"));
        return "/* unresolved: " + JsLiterals.commentText(name) + " */ " + safeName;
    }

    public Scope currentScope() {
        return current;
    }

    public int depth() {
        return current.depth();
    }

    public boolean isBalanced() {
        return current == root;
    }
}
