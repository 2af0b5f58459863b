package com.projectedjournal.batchprocessor.validation;

import java.util.List;

/**
 * Accounts used by the balance sheet or the cash grid have no GAAP mapping.
 */
public class MappingConflictException extends JournalValidationException {

    public MappingConflictException(List<ValidationIssue> issues) {
        super("GAAP mapping does not cover all accounts", issues);
    }
}
