package com.projectedjournal.batchprocessor.batch;

import com.projectedjournal.batchprocessor.domain.BalanceSheetEntry;
import com.projectedjournal.cashgrid.canonical.CanonicalTransaction;

import java.util.Objects;

/**
 * Item read by the journal step: either an opening balance or a normalised AP/AR transaction.
 * Exactly one of the two is set.
 */
public record JournalSource(BalanceSheetEntry opening, CanonicalTransaction cash) {

    public JournalSource {
        if ((opening == null) == (cash == null)) {
            throw new IllegalArgumentException("Exactly one of opening or cash must be set");
        }
    }

    public static JournalSource opening(BalanceSheetEntry entry) {
        return new JournalSource(Objects.requireNonNull(entry), null);
    }

    public static JournalSource cash(CanonicalTransaction transaction) {
        return new JournalSource(null, Objects.requireNonNull(transaction));
    }

    public boolean isOpening() {
        return opening != null;
    }
}
