package com.projectedjournal.batchprocessor.validation;

import java.util.List;

/**
 * A workbook is missing, unreadable, or does not match its fixed schema.
 */
public class InputSchemaException extends JournalValidationException {

    public InputSchemaException(List<ValidationIssue> issues) {
        super("Input schema validation failed", issues);
    }

    public InputSchemaException(ValidationIssue issue) {
        this(List.of(issue));
    }
}
