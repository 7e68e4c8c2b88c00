package org.flutterjs.gen.validate;

import org.flutterjs.gen.diagnostic.Severity;

/**
 * @param line     1-based line of the generated text, or 0 when the issue concerns the whole output
 * @param critical whether the output is structurally broken
 */
public record ValidationIssue(Severity severity, String message, int line, boolean critical) {

    static ValidationIssue critical(String message, int line) {
        return new ValidationIssue(Severity.ERROR, message, line, true);
    }

    static ValidationIssue warning(String message, int line) {
        return new ValidationIssue(Severity.WARNING, message, line, false);
    }

    @Override
    public String toString() {
        return (line > 0 ? "line " + line + ": " : "") + message;
    }
}
