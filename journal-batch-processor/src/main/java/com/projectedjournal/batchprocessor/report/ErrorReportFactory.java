package com.projectedjournal.batchprocessor.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.projectedjournal.batchprocessor.validation.InputSchemaException;
import com.projectedjournal.batchprocessor.validation.MappingConflictException;
import com.projectedjournal.batchprocessor.validation.ValidationIssue;
import com.projectedjournal.cashgrid.GridSchemaException;
import com.projectedjournal.cashgrid.UnsupportedGridFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps job failures to {@link ErrorReport}s.
 *
 * <p>Spring Batch may wrap the exception thrown by a step, so each failure's cause chain is searched
 * for a known exception before falling back to {@link ErrorType#UnexpectedError}.
 */
@Slf4j
@Component
public class ErrorReportFactory {

    static final String UNSUPPORTED_FORMAT_HINT =
            "Provide either 13 weekly amount columns plus a vendor/customer column, or a date column and an amount column";
    static final String GRID_SCHEMA_HINT = "Check that the AP Cash Grid has a header row and at least one data row";
    static final String UNEXPECTED_HINT = "Check input files and try again. Enable --verbose for more details.";

    private final ObjectMapper objectMapper;

    public ErrorReportFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @param apGridLabel file name reported for AP Cash Grid failures
     */
    public ErrorReport fromFailures(List<Throwable> failures, String apGridLabel) {
        List<ErrorReport.Entry> entries = new ArrayList<>();
        failures.forEach(failure -> entries.addAll(entriesFor(failure, apGridLabel)));
        return ErrorReport.of(entries);
    }

    public ErrorReport fromFailure(Throwable failure, String apGridLabel) {
        return ErrorReport.of(entriesFor(failure, apGridLabel));
    }

    public ErrorReport fromIssues(ErrorType type, List<ValidationIssue> issues) {
        return ErrorReport.of(issues.stream().map(issue -> entry(type, issue)).toList());
    }

    public String toJson(ErrorReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise error report", e);
        }
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private List<ErrorReport.Entry> entriesFor(Throwable failure, String apGridLabel) {
        for (Throwable t = failure; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof InputSchemaException e) {
                return fromIssues(ErrorType.SchemaError, e.getIssues()).errors();
            }
            if (t instanceof MappingConflictException e) {
                return fromIssues(ErrorType.MappingConflict, e.getIssues()).errors();
            }
            if (t instanceof UnsupportedGridFormatException) {
                return List.of(new ErrorReport.Entry(ErrorType.UnsupportedGridFormat.name(), apGridLabel, null,
                        t.getMessage(), UNSUPPORTED_FORMAT_HINT));
            }
            if (t instanceof GridSchemaException) {
                return List.of(new ErrorReport.Entry(ErrorType.SchemaError.name(), apGridLabel, null,
                        t.getMessage(), GRID_SCHEMA_HINT));
            }
        }
        log.debug("No structured error found in {}", failure.getClass().getName());
        return List.of(new ErrorReport.Entry(ErrorType.UnexpectedError.name(), null, null,
                describe(failure), UNEXPECTED_HINT));
    }

    private static ErrorReport.Entry entry(ErrorType type, ValidationIssue issue) {
        return new ErrorReport.Entry(type.name(), issue.file(), issue.row(), issue.issue(), issue.hint());
    }

    /** Message of the innermost cause; wrappers added by Spring Batch only repeat it. */
    private static String describe(Throwable failure) {
        Throwable root = failure;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
