package com.projectedjournal.cashgrid.canonical;

import java.util.List;

/**
 * Immutable output of one normalisation call.
 */
public record CanonicalTable(List<CanonicalTransaction> rows) {

    /** Canonical column names, in output order. */
    public static final List<String> COLUMNS =
            List.of("txn_type", "counterparty", "scheduled_date", "amount", "line_source");

    public CanonicalTable {
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<String> columns() {
        return COLUMNS;
    }
}
