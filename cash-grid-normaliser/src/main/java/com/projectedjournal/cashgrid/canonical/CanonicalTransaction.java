package com.projectedjournal.cashgrid.canonical;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One normalised AP/AR cash movement.
 *
 * @param txnType       direction of the cash flow
 * @param counterparty  never blank; {@code "Unknown"} when the grid had none
 * @param scheduledDate when cash is expected to move
 * @param amount        strictly positive, exactly two fractional digits
 * @param lineSource    reference back to the source row and column
 */
public record CanonicalTransaction(
        TxnType txnType,
        String counterparty,
        LocalDate scheduledDate,
        BigDecimal amount,
        String lineSource) {

    public CanonicalTransaction {
        Objects.requireNonNull(txnType, "txnType");
        Objects.requireNonNull(scheduledDate, "scheduledDate");
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(lineSource, "lineSource");
        if (counterparty == null || counterparty.isBlank()) {
            throw new IllegalArgumentException("counterparty must not be blank");
        }
        if (amount.signum() <= 0 || amount.scale() != 2) {
            throw new IllegalArgumentException("amount must be positive with scale 2, was " + amount);
        }
    }
}
