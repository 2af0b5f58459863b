package com.projectedjournal.batchprocessor.domain;

import java.math.BigDecimal;

/**
 * One validated row of the beginning balance sheet.
 *
 * @param rowNumber 1-based spreadsheet row, for error reporting
 */
public record BalanceSheetEntry(
        String account,
        String description,
        BigDecimal balance,
        AccountType accountType,
        int rowNumber) {
}
