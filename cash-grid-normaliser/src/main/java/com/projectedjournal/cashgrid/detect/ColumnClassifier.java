package com.projectedjournal.cashgrid.detect;

import com.projectedjournal.cashgrid.grid.CellValues;
import com.projectedjournal.cashgrid.grid.RawGrid;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tags grid columns as date-like or amount-like.
 *
 * <p>Classification runs in two independent passes:
 * <ol>
 *   <li>{@link #classifyNames(List)}: header text against fixed substring sets, case-insensitive.</li>
 *   <li>{@link #probeContent(RawGrid, ColumnClassification)}: cell values of the columns the first
 *       pass did not claim.</li>
 * </ol>
 * {@link #classify(RawGrid)} lists name matches first, then content matches, each in the grid's
 * column order.
 */
@Slf4j
public class ColumnClassifier {

    static final List<String> DATE_NAME_PATTERNS = List.of(
            "date", "due", "schedule", "payment_date", "cash_date",
            "invoice_date", "bill_date", "txn_date", "transaction_date");

    static final List<String> AMOUNT_NAME_PATTERNS = List.of(
            "amount", "value", "total", "sum", "balance", "cash", "dollar", "usd", "price");

    /** Names carrying any of these are never amounts, even when they also match an amount pattern. */
    static final List<String> AMOUNT_EXCLUSION_PATTERNS = List.of("date", "time", "day", "month", "year");

    static final int DATE_PROBE_SAMPLE_SIZE = 10;

    public ColumnClassification classify(RawGrid grid) {
        ColumnClassification byName = classifyNames(grid.getColumnNames());
        ColumnClassification byContent = probeContent(grid, byName);
        ColumnClassification result = byName.followedBy(byContent);
        log.debug("Column classification — dates={} (by content {}), amounts={} (by content {})",
                result.dateColumns(), byContent.dateColumns(), result.amountColumns(), byContent.amountColumns());
        return result;
    }

    /** First pass: header text only. */
    public ColumnClassification classifyNames(List<String> columnNames) {
        List<String> dates = new ArrayList<>();
        List<String> amounts = new ArrayList<>();
        for (String name : columnNames) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (containsAny(lower, DATE_NAME_PATTERNS)) {
                dates.add(name);
            }
            if (containsAny(lower, AMOUNT_NAME_PATTERNS) && !isExcludedFromAmounts(lower)) {
                amounts.add(name);
            }
        }
        return new ColumnClassification(dates, amounts);
    }

    /**
     * Second pass over the columns {@code byName} did not claim.
     * <ul>
     *   <li>Date: the first {@value #DATE_PROBE_SAMPLE_SIZE} non-blank cells all read as calendar dates.</li>
     *   <li>Amount: at least one non-blank cell and every non-blank cell is a number, unless the
     *       header carries a date/time word.</li>
     * </ul>
     */
    public ColumnClassification probeContent(RawGrid grid, ColumnClassification byName) {
        List<String> dates = new ArrayList<>();
        List<String> amounts = new ArrayList<>();
        for (String name : grid.getColumnNames()) {
            List<Object> values = grid.column(name);
            if (!byName.dateColumns().contains(name) && sampleParsesAsDates(values)) {
                dates.add(name);
            }
            if (!byName.amountColumns().contains(name)
                    && !isExcludedFromAmounts(name.toLowerCase(Locale.ROOT))
                    && hasAnyValue(values)
                    && CellValues.isUniformlyNumeric(values)) {
                amounts.add(name);
            }
        }
        return new ColumnClassification(dates, amounts);
    }

    /** Columns whose non-blank cells are all numbers, in grid order. */
    public List<String> numericColumns(RawGrid grid) {
        return grid.getColumnNames().stream()
                .filter(name -> CellValues.isUniformlyNumeric(grid.column(name)))
                .toList();
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private static boolean sampleParsesAsDates(List<Object> values) {
        int sampled = 0;
        for (Object value : values) {
            if (CellValues.isBlank(value)) {
                continue;
            }
            if (CellValues.toDate(value) == null) {
                return false;
            }
            if (++sampled == DATE_PROBE_SAMPLE_SIZE) {
                break;
            }
        }
        return sampled > 0;
    }

    private static boolean hasAnyValue(List<Object> values) {
        return values.stream().anyMatch(v -> !CellValues.isBlank(v));
    }

    private static boolean isExcludedFromAmounts(String lowerName) {
        return containsAny(lowerName, AMOUNT_EXCLUSION_PATTERNS);
    }

    private static boolean containsAny(String lowerName, List<String> patterns) {
        for (String pattern : patterns) {
            if (lowerName.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
