package com.projectedjournal.cashgrid.canonical;

import com.projectedjournal.cashgrid.GridSchemaException;
import com.projectedjournal.cashgrid.layout.GridLine;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns typed grid lines into the canonical table.
 *
 * <p>Per line: blank counterparty → {@code "Unknown"}; missing date, missing amount or zero
 * amount → dropped; amount → absolute value rounded half-up to two places (dropped if that rounds
 * to zero). A line without a transaction type or source reference means an upstream stage skipped
 * its job and fails the whole call with {@link GridSchemaException}.
 */
@Slf4j
public class Canonicalizer {

    static final String UNKNOWN_COUNTERPARTY = "Unknown";
    static final int AMOUNT_SCALE = 2;

    public CanonicalTable canonicalize(List<GridLine> lines) {
        List<CanonicalTransaction> rows = new ArrayList<>(lines.size());
        int dropped = 0;
        for (int i = 0; i < lines.size(); i++) {
            GridLine line = lines.get(i);
            requireColumns(line, i);

            if (line.getScheduledDate() == null || line.getAmount() == null || line.getAmount().signum() == 0) {
                dropped++;
                continue;
            }
            BigDecimal amount = line.getAmount().abs().setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
            if (amount.signum() == 0) {
                dropped++;
                continue;
            }
            String counterparty = line.getCounterparty() == null || line.getCounterparty().isBlank()
                    ? UNKNOWN_COUNTERPARTY
                    : line.getCounterparty();

            rows.add(new CanonicalTransaction(
                    line.getTxnType(), counterparty, line.getScheduledDate(), amount, line.getLineSource()));
        }

        if (dropped > 0) {
            log.warn("Canonicalisation dropped {} of {} lines without a date or a non-zero amount",
                    dropped, lines.size());
        }
        return new CanonicalTable(rows);
    }

    private static void requireColumns(GridLine line, int index) {
        if (line.getTxnType() == null) {
            throw new GridSchemaException("Canonical column 'txn_type' missing on line " + index
                    + " (" + line.getLineSource() + ")");
        }
        if (line.getLineSource() == null) {
            throw new GridSchemaException("Canonical column 'line_source' missing on line " + index);
        }
    }
}
