package com.projectedjournal.batchprocessor.report;

import java.util.List;

/**
 * Structured failure report printed by the command line and returned by the status endpoint.
 *
 * <pre>
 * {"status":"error","errors":[{"type":"SchemaError","file":"...","row":3,"issue":"...","hint":"..."}]}
 * </pre>
 */
public record ErrorReport(String status, List<Entry> errors) {

    public static final String STATUS_ERROR = "error";

    public ErrorReport {
        errors = List.copyOf(errors);
    }

    public static ErrorReport of(List<Entry> errors) {
        return new ErrorReport(STATUS_ERROR, errors);
    }

    /**
     * @param type  one of {@link ErrorType}'s names
     * @param row   1-based spreadsheet row, or {@code null}
     */
    public record Entry(String type, String file, Integer row, String issue, String hint) {
    }
}
