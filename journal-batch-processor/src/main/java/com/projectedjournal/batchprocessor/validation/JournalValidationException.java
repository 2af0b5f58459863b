package com.projectedjournal.batchprocessor.validation;

import java.util.List;

/**
 * Base class for input problems that stop a journal run. Carries every issue found, not just the
 * first.
 */
public abstract class JournalValidationException extends RuntimeException {

    private final List<ValidationIssue> issues;

    protected JournalValidationException(String message, List<ValidationIssue> issues) {
        super(message + describe(issues));
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    private static String describe(List<ValidationIssue> issues) {
        if (issues.isEmpty()) {
            return "";
        }
        ValidationIssue first = issues.get(0);
        String more = issues.size() > 1 ? " (+" + (issues.size() - 1) + " more)" : "";
        return ": " + first.file() + (first.row() != null ? " row " + first.row() : "") + " — " + first.issue() + more;
    }
}
