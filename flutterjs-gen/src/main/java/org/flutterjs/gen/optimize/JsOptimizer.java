package org.flutterjs.gen.optimize;

import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.DiagnosticCollector;
import org.flutterjs.gen.diagnostic.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-based size reduction of generated JavaScript.
 * <ul>
 *     <li>Level 1: trailing whitespace, repeated blank lines and the final newline are normalised.
 *     Applying it twice gives the same text as applying it once.</li>
 *     <li>Level 2: level 1, plus full-line {@code //} comments and statements after
 *     {@code return}, {@code throw}, {@code break} or {@code continue} in the same block are removed.
 *     The result starts with a comment stating the reduction.</li>
 *     <li>Level 3: level 2 without the header, plus full-line block comments, indentation and
 *     blank lines are removed.</li>
 * </ul>
 * A comment containing {@code KEEP} anywhere in its text survives every level verbatim. The passes
 * rely on the generator's output shape: one statement per line and template literals that never
 * span lines. Reported sizes leave out the level 2 header.
 */
public final class JsOptimizer {

    private static final Logger log = LoggerFactory.getLogger(JsOptimizer.class);

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 3;
    public static final String KEEP = "KEEP";

    private static final Pattern TERMINAL = Pattern.compile("^(return\\b.*|throw\\b.*|break( \\w+)?|continue( \\w+)?);$");
    private static final Pattern BLANK_RUN = Pattern.compile("\n{3,}");

    /**
     * One text-to-text step that records what it changed.
     */
    @FunctionalInterface
    interface Pass {
        String apply(String text, List<String> changes);
    }

    private final DiagnosticCollector diagnostics;
    private final Pass minifier;

    public JsOptimizer(DiagnosticCollector diagnostics) {
        this(diagnostics, JsOptimizer::minify);
    }

    JsOptimizer(DiagnosticCollector diagnostics, Pass minifier) {
        this.diagnostics = diagnostics;
        this.minifier = minifier;
    }

    /**
     * @param level {@link #MIN_LEVEL} to {@link #MAX_LEVEL}; callers clamp out-of-range values
     * @return the optimized text, or {@code source} itself in a dry run or when optimization fails
     */
    public OptimizationResult optimize(String source, int level, boolean dryRun) {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Optimization level must be between " + MIN_LEVEL + " and " + MAX_LEVEL + ": " + level);
        }
        try {
            List<String> changes = new ArrayList<>();
            String text = normalise(source, changes);
            if (level >= 2) {
                text = removeLineComments(text, changes);
                text = removeUnreachable(text, changes);
                text = normalise(text, new ArrayList<>());
            }
            if (level == 3) {
                text = minifier.apply(text, changes);
            }
            int optimizedSize = text.length();
            if (level == 2) {
                text = String.format(Locale.ROOT, "// Optimized (level 2): reduced %.1f%% (%d -> %d bytes)\n",
                        OptimizationResult.reduction(source.length(), optimizedSize), source.length(), optimizedSize) + text;
            }
            log.debug("Level {} optimization: {} -> {} characters, {} change(s){}", level, source.length(),
                    optimizedSize, changes.size(), dryRun ? " (dry run)" : "");
            if (dryRun) {
                return new OptimizationResult(source, source.length(), optimizedSize, true, changes);
            }
            return new OptimizationResult(text, source.length(), optimizedSize, false, changes);
        } catch (RuntimeException e) {
            log.warn("Optimization failed, keeping the unoptimized output", e);
            diagnostics.add(Diagnostic.of(Severity.WARNING, DiagnosticCode.OPTIMIZATION_FAILED,
                            "Optimization failed: " + e.getMessage())
                    .withSuggestion("The unoptimized output was kept")
                    .withCause(e));
            return OptimizationResult.unchanged(source);
        }
    }

    // ── Level 1 ──────────────────────────────────────────────────

    static String normalise(String source, List<String> changes) {
        StringBuilder sb = new StringBuilder(source.length());
        int trimmed = 0;
        for (String line : source.split("\n", -1)) {
            String stripped = line.stripTrailing();
            if (stripped.length() != line.length()) {
                trimmed++;
            }
            sb.append(stripped).append('\n');
        }
        if (trimmed > 0) {
            changes.add("Removed trailing whitespace from " + trimmed + " line(s)");
        }
        Matcher blankRuns = BLANK_RUN.matcher(sb);
        String text = blankRuns.replaceAll("\n\n");
        if (text.length() < sb.length()) {
            changes.add("Collapsed repeated blank lines");
        }
        return text.isBlank() ? "" : stripTrailingNewlines(text) + "\n";
    }

    private static String stripTrailingNewlines(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\n') {
            end--;
        }
        return text.substring(0, end);
    }

    // ── Level 2 ──────────────────────────────────────────────────

    private static boolean isKept(String line) {
        return line.contains(KEEP);
    }

    static String removeLineComments(String source, List<String> changes) {
        List<String> kept = new ArrayList<>();
        int removed = 0;
        for (String line : source.split("\n", -1)) {
            if (line.stripLeading().startsWith("//") && !isKept(line)) {
                removed++;
            } else {
                kept.add(line);
            }
        }
        if (removed > 0) {
            changes.add("Removed " + removed + " comment line(s)");
        }
        return String.join("\n", kept);
    }

    /**
     * Drops the lines that follow a terminal statement and are indented at least as deep, up to
     * the end of the enclosing block.
     */
    static String removeUnreachable(String source, List<String> changes) {
        String[] lines = source.split("\n", -1);
        List<String> kept = new ArrayList<>();
        int removed = 0;
        int i = 0;
        while (i < lines.length) {
            String line = lines[i];
            kept.add(line);
            i++;
            if (!TERMINAL.matcher(line.strip()).matches()) {
                continue;
            }
            int depth = indentation(line);
            while (i < lines.length && !lines[i].isBlank() && indentation(lines[i]) >= depth
                    && !isLabel(lines[i]) && !isKept(lines[i])) {
                removed++;
                i++;
            }
        }
        if (removed > 0) {
            changes.add("Removed " + removed + " unreachable line(s)");
        }
        return String.join("\n", kept);
    }

    private static boolean isLabel(String line) {
        String s = line.strip();
        return s.startsWith("case ") || s.startsWith("default:") || s.startsWith("}");
    }

    private static int indentation(String line) {
        int n = 0;
        while (n < line.length() && line.charAt(n) == ' ') {
            n++;
        }
        return n;
    }

    // ── Level 3 ──────────────────────────────────────────────────

    /**
     * Strips indentation and blank lines, and drops comments that sit on lines of their own. A block
     * comment is judged as a whole: when any of its lines mentions {@code KEEP}, all of its lines
     * are kept as written.
     */
    static String minify(String source, List<String> changes) {
        StringBuilder sb = new StringBuilder(source.length());
        int comments = 0;
        String[] lines = source.split("\n", -1);
        int i = 0;
        while (i < lines.length) {
            String s = lines[i].strip();
            i++;
            if (s.isEmpty()) {
                continue;
            }
            if (!s.startsWith("/*") || (s.contains("*/") && s.indexOf("*/") != s.length() - 2)) {
                sb.append(s).append('\n');
                continue;
            }
            List<String> comment = new ArrayList<>();
            comment.add(lines[i - 1]);
            while (!comment.get(comment.size() - 1).contains("*/") && i < lines.length) {
                comment.add(lines[i]);
                i++;
            }
            if (comment.stream().anyMatch(JsOptimizer::isKept)) {
                comment.forEach(line -> sb.append(line).append('\n'));
            } else {
                comments += comment.size();
                String last = comment.get(comment.size() - 1);
                int end = last.indexOf("*/");
                String rest = end < 0 ? "" : last.substring(end + 2).strip();
                if (comment.size() > 1 && !rest.isEmpty()) {
                    sb.append(rest).append('\n');
                }
            }
        }
        if (comments > 0) {
            changes.add("Removed " + comments + " block comment line(s)");
        }
        changes.add("Removed indentation and blank lines");
        return sb.toString();
    }
}
