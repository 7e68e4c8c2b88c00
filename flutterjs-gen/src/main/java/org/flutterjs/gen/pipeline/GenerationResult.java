package org.flutterjs.gen.pipeline;

import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.gen.optimize.OptimizationResult;
import org.flutterjs.gen.validate.ValidationReport;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one {@link FileAssembler#generate} call.
 * <p>
 * A successful result always carries code, even when error diagnostics were recorded. A failed
 * result carries no code and explains the failure in {@code failureMessage}.
 *
 * @param diagnostics every diagnostic of the run, most severe first
 */
public record GenerationResult(String filePath,
                               boolean success,
                               String code,
                               String failureMessage,
                               GenerationStatistics statistics,
                               ValidationReport validation,
                               OptimizationResult optimization,
                               List<Diagnostic> diagnostics) {

    public GenerationResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    static GenerationResult succeeded(String filePath, String code, GenerationStatistics statistics,
                                      ValidationReport validation, OptimizationResult optimization,
                                      List<Diagnostic> diagnostics) {
        return new GenerationResult(filePath, true, code, null, statistics, validation, optimization, diagnostics);
    }

    public static GenerationResult failed(String filePath, String message, List<Diagnostic> diagnostics) {
        return new GenerationResult(filePath, false, null, message, null, null, null, diagnostics);
    }

    public Optional<String> codeIfPresent() {
        return Optional.ofNullable(code);
    }

    public Optional<ValidationReport> validationReport() {
        return Optional.ofNullable(validation);
    }

    public Optional<OptimizationResult> optimizationResult() {
        return Optional.ofNullable(optimization);
    }

    public List<Diagnostic> withSeverity(Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).toList();
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return withSeverity(Severity.WARNING);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
