package org.flutterjs.gen.validate;

import java.util.List;

public record ValidationReport(List<ValidationIssue> issues) {

    public ValidationReport {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean hasCriticalIssues() {
        return issues.stream().anyMatch(ValidationIssue::critical);
    }

    public List<ValidationIssue> criticalIssues() {
        return issues.stream().filter(ValidationIssue::critical).toList();
    }

    public boolean isClean() {
        return issues.isEmpty();
    }
}
