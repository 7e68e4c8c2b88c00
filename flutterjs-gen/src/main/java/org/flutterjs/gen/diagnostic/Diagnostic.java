package org.flutterjs.gen.diagnostic;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * One warning or error raised during a pipeline run. Immutable once created.
 *
 * @param suggestion optional remedy shown in reports
 * @param node       optional description of the affected IR node
 * @param stackTrace optional stack trace of the exception that caused the diagnostic
 */
public record Diagnostic(Severity severity,
                         DiagnosticCode code,
                         String message,
                         String suggestion,
                         String node,
                         String stackTrace) {

    public Diagnostic {
        if (severity == null || code == null || message == null) {
            throw new IllegalArgumentException("severity, code and message are required");
        }
    }

    public static Diagnostic of(Severity severity, DiagnosticCode code, String message) {
        return new Diagnostic(severity, code, message, null, null, null);
    }

    public Diagnostic withSuggestion(String newSuggestion) {
        return new Diagnostic(severity, code, message, newSuggestion, node, stackTrace);
    }

    public Diagnostic withNode(String newNode) {
        return new Diagnostic(severity, code, message, suggestion, newNode, stackTrace);
    }

    public Diagnostic withCause(Throwable cause) {
        StringWriter sw = new StringWriter();
        cause.printStackTrace(new PrintWriter(sw));
        return new Diagnostic(severity, code, message, suggestion, node, sw.toString());
    }

    public boolean isError() {
        return severity.isAtLeast(Severity.ERROR);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder()
                .append('[').append(severity).append("] ")
                .append(code).append(": ")
                .append(message);
        if (node != null) {
            sb.append(" (at ").append(node).append(')');
        }
        if (suggestion != null) {
            sb.append(" -> ").append(suggestion);
        }
        return sb.toString();
    }
}
