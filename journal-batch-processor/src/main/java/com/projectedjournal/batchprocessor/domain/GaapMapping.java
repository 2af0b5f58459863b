package com.projectedjournal.batchprocessor.domain;

/**
 * Chart-of-accounts entry from the GAAP mapping workbook.
 */
public record GaapMapping(String account, String description, String accountType, DcFlag normalBalance) {
}
