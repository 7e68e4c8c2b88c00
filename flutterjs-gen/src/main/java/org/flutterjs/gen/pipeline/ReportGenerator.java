package org.flutterjs.gen.pipeline;

import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.gen.optimize.OptimizationResult;
import org.flutterjs.gen.validate.ValidationReport;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Human-readable summary of a {@link GenerationResult} for build logs. The layout is not a
 * stable format.
 */
public final class ReportGenerator {

    private static final String RULE = "=".repeat(60);

    public String render(GenerationResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n')
          .append("FlutterJS generation report: ").append(result.filePath()).append('\n')
          .append(RULE).append('\n')
          .append("Status: ").append(result.success() ? "SUCCESS" : "FAILED").append('\n');
        if (!result.success()) {
            sb.append("Reason: ").append(result.failureMessage()).append('\n');
        }
        GenerationStatistics stats = result.statistics();
        if (stats != null) {
            sb.append('\n')
              .append("Input:\n")
              .append("  classes:   ").append(stats.classCount()).append('\n')
              .append("  functions: ").append(stats.functionCount()).append('\n')
              .append("  variables: ").append(stats.variableCount()).append('\n')
              .append("  enums:     ").append(stats.enumCount()).append('\n')
              .append("  imports:   ").append(stats.importCount()).append('\n')
              .append("Detected:\n")
              .append("  widgets: ").append(list(stats.usedWidgets())).append('\n')
              .append("  helpers: ").append(list(stats.usedHelpers())).append('\n')
              .append("  types:   ").append(list(stats.usedTypes())).append('\n');
        }
        sb.append('\n').append("Validation: ").append(validation(result)).append('\n');
        sb.append("Optimization: ").append(optimization(result)).append('\n');

        section(sb, "Errors", result.errors());
        section(sb, "Warnings", result.withSeverity(Severity.WARNING));
        section(sb, "Info", result.withSeverity(Severity.INFO));
        return sb.append(RULE).append('\n').toString();
    }

    private static String list(Collection<String> values) {
        return values.isEmpty() ? "none" : String.join(", ", values);
    }

    private static String validation(GenerationResult result) {
        if (result.validation() == null) {
            return "skipped";
        }
        ValidationReport report = result.validation();
        if (report.isClean()) {
            return "passed";
        }
        return report.issues().size() + " issue(s)" + (report.hasCriticalIssues() ? ", CRITICAL" : "");
    }

    private static String optimization(GenerationResult result) {
        OptimizationResult optimization = result.optimization();
        if (optimization == null) {
            return "skipped";
        }
        return String.format(Locale.ROOT, "%d -> %d characters (%.1f%% smaller)%s",
                optimization.originalSize(), optimization.optimizedSize(), optimization.reductionPercent(),
                optimization.dryRun() ? ", dry run" : "");
    }

    private static void section(StringBuilder sb, String title, List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return;
        }
        sb.append('\n').append(title).append(" (").append(diagnostics.size()).append("):\n");
        for (Diagnostic d : diagnostics) {
            sb.append("  ").append(d).append('\n');
        }
    }
}
