package com.projectedjournal.cashgrid.layout;

import com.projectedjournal.cashgrid.canonical.TxnType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Intermediate row produced by a layout processor.
 *
 * <p>Deliberately permissive: any field may still be {@code null} or out of range here. The
 * canonicaliser is the only place these rows are checked and turned into
 * {@link com.projectedjournal.cashgrid.canonical.CanonicalTransaction}s.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GridLine {

    /** Counterparty text as found in the grid; {@code null} when blank or absent. */
    private String counterparty;

    /** When cash is expected to move. */
    private LocalDate scheduledDate;

    /** Signed amount as read from the grid. */
    private BigDecimal amount;

    /** {@code row:column} reference back into the source grid. */
    private String lineSource;

    // ── Populated by TransactionTypeInferencer ───────────────────────────────

    private TxnType txnType;
}
