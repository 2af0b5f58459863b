package com.projectedjournal.cashgrid.detect;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Columns that look like dates and columns that look like monetary amounts, each in discovery
 * order. The first entry of each list is the one a processor uses.
 */
public record ColumnClassification(List<String> dateColumns, List<String> amountColumns) {

    public ColumnClassification {
        dateColumns = List.copyOf(dateColumns);
        amountColumns = List.copyOf(amountColumns);
    }

    public static ColumnClassification none() {
        return new ColumnClassification(List.of(), List.of());
    }

    public Optional<String> firstDateColumn() {
        return dateColumns.stream().findFirst();
    }

    public Optional<String> firstAmountColumn() {
        return amountColumns.stream().findFirst();
    }

    public boolean isEventListCandidate() {
        return !dateColumns.isEmpty() && !amountColumns.isEmpty();
    }

    /** Appends {@code other}'s columns after this one's, skipping duplicates. */
    public ColumnClassification followedBy(ColumnClassification other) {
        return new ColumnClassification(
                concatDistinct(dateColumns, other.dateColumns),
                concatDistinct(amountColumns, other.amountColumns));
    }

    private static List<String> concatDistinct(List<String> first, List<String> second) {
        LinkedHashSet<String> merged = new LinkedHashSet<>(first);
        merged.addAll(second);
        return new ArrayList<>(merged);
    }
}
