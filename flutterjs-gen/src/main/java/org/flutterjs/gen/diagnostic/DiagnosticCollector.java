package org.flutterjs.gen.diagnostic;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Accumulates the diagnostics of one pipeline run. Owned by exactly one run and never shared
 * between threads, so it does no locking.
 */
public final class DiagnosticCollector {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public Diagnostic add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        return diagnostic;
    }

    public Diagnostic error(DiagnosticCode code, String message) {
        return add(Diagnostic.of(Severity.ERROR, code, message));
    }

    public Diagnostic warning(DiagnosticCode code, String message) {
        return add(Diagnostic.of(Severity.WARNING, code, message));
    }

    public Diagnostic info(DiagnosticCode code, String message) {
        return add(Diagnostic.of(Severity.INFO, code, message));
    }

    public void addAll(List<Diagnostic> others) {
        diagnostics.addAll(others);
    }

    public List<Diagnostic> all() {
        return List.copyOf(diagnostics);
    }

    /**
     * All diagnostics, most severe first; insertion order is kept within one severity.
     */
    public List<Diagnostic> sorted() {
        List<Diagnostic> copy = new ArrayList<>(diagnostics);
        copy.sort(Comparator.comparing(Diagnostic::severity));
        return List.copyOf(copy);
    }

    public List<Diagnostic> withSeverity(Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).toList();
    }

    public List<Diagnostic> withCode(DiagnosticCode code) {
        return diagnostics.stream().filter(d -> d.code() == code).toList();
    }

    public long count(Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).count();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public int size() {
        return diagnostics.size();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }
}
