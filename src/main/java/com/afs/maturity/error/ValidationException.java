package com.afs.maturity.error;

import com.afs.maturity.validation.ValidationIssue;

import java.util.List;

public class ValidationException extends RuntimeException {
    private final List<ValidationIssue> issues;

    public ValidationException(List<ValidationIssue> issues) {
        super("Validation failed: " + (issues == null ? 0 : issues.size()) + " issue(s)");
        this.issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }
}
