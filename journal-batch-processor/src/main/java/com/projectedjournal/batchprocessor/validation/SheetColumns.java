package com.projectedjournal.batchprocessor.validation;

import com.projectedjournal.batchprocessor.workbook.LoadedSheet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves expected column names against a sheet's actual headers. Matching ignores case, spaces
 * and underscores, so {@code "GAAP Account"} satisfies {@code GAAPAccount}.
 */
final class SheetColumns {

    private final Map<String, String> actualByKey = new LinkedHashMap<>();

    private SheetColumns(List<String> headers) {
        for (String header : headers) {
            actualByKey.putIfAbsent(key(header), header);
        }
    }

    static SheetColumns of(LoadedSheet sheet) {
        return new SheetColumns(sheet.grid().getColumnNames());
    }

    /** Adds one issue per required column the sheet lacks. */
    void requireAll(LoadedSheet sheet, List<String> required, List<ValidationIssue> issues) {
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (find(column).isEmpty()) {
                missing.add(column);
            }
        }
        for (String column : missing) {
            issues.add(new ValidationIssue(sheet.fileLabel(), 1,
                    "Missing required column '" + column + "'",
                    "Expected columns: " + String.join(", ", required) + ". Found: " + sheet.grid().getColumnNames()));
        }
    }

    Optional<String> find(String expected) {
        return Optional.ofNullable(actualByKey.get(key(expected)));
    }

    /** Actual header for a column already checked by {@link #requireAll}. */
    String actual(String expected) {
        return find(expected).orElseThrow(() -> new IllegalStateException("Column '" + expected + "' not resolved"));
    }

    private static String key(String header) {
        return header.toLowerCase(Locale.ROOT).replace(" ", "").replace("_", "");
    }
}
