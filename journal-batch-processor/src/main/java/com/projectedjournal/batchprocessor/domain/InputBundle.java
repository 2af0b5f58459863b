package com.projectedjournal.batchprocessor.domain;

import com.projectedjournal.cashgrid.canonical.CanonicalTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a journal run needs, after loading and validation.
 *
 * @param gaapMappings     keyed by GAAP account, in workbook order
 * @param cashflowMappings keyed by GAAP account, in workbook order
 * @param cashGrid         the normalised AP/AR grid
 */
public record InputBundle(
        List<BalanceSheetEntry> balanceSheet,
        Map<String, GaapMapping> gaapMappings,
        Map<String, CashflowMapping> cashflowMappings,
        CanonicalTable cashGrid) {

    public InputBundle {
        balanceSheet = List.copyOf(balanceSheet);
        gaapMappings = Collections.unmodifiableMap(new LinkedHashMap<>(gaapMappings));
        cashflowMappings = Collections.unmodifiableMap(new LinkedHashMap<>(cashflowMappings));
    }
}
