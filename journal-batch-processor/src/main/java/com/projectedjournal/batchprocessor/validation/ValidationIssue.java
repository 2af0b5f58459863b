package com.projectedjournal.batchprocessor.validation;

/**
 * A single problem found in an input workbook.
 *
 * @param file  workbook file name
 * @param row   1-based spreadsheet row (header = 1), or {@code null} for file-level issues
 * @param issue what is wrong
 * @param hint  how to fix it
 */
public record ValidationIssue(String file, Integer row, String issue, String hint) {

    public static ValidationIssue ofFile(String file, String issue, String hint) {
        return new ValidationIssue(file, null, issue, hint);
    }
}
