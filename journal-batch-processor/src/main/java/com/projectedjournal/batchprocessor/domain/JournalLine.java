package com.projectedjournal.batchprocessor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * One row of the projected journal.
 *
 * <p>Column order in the exported workbook:
 * <pre>
 *   JournalID, TxnID, TxnDate, CashDate, DCFlag, GAAPAccount, CashFlowSection,
 *   Department, Product, CustomerID, VendorID, Location, Class,
 *   Amount, CurrencyCode, CreatedAt, UpdatedAt
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JournalLine {

    public static final List<String> COLUMNS = List.of(
            "JournalID", "TxnID", "TxnDate", "CashDate", "DCFlag", "GAAPAccount", "CashFlowSection",
            "Department", "Product", "CustomerID", "VendorID", "Location", "Class",
            "Amount", "CurrencyCode", "CreatedAt", "UpdatedAt");

    /** {@code J} + 6-digit sequence, restarting at 1 each run. */
    private String journalId;

    /** {@code T} + 6-digit sequence, restarting at 1 each run. */
    private String txnId;

    private LocalDate txnDate;

    /** Date cash moves; equal to {@link #txnDate} for projected lines. */
    private LocalDate cashDate;

    private DcFlag dcFlag;

    private String gaapAccount;

    private String cashFlowSection;

    private String department;

    private String product;

    /** Counterparty of AR lines. */
    private String customerId;

    /** Counterparty of AP lines. */
    private String vendorId;

    private String location;

    /** Accounting class; {@code class} is reserved. */
    private String accountingClass;

    /** Always positive; direction is carried by {@link #dcFlag}. */
    private BigDecimal amount;

    private String currencyCode;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /** Cell values in {@link #COLUMNS} order. */
    public List<Object> values() {
        return Arrays.asList(
                journalId, txnId, txnDate, cashDate, dcFlag == null ? null : dcFlag.name(), gaapAccount,
                cashFlowSection, department, product, customerId, vendorId, location, accountingClass,
                amount, currencyCode, createdAt, updatedAt);
    }
}
