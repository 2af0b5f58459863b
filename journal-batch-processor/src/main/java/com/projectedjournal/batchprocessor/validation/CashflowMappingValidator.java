package com.projectedjournal.batchprocessor.validation;

import com.projectedjournal.batchprocessor.domain.CashflowMapping;
import com.projectedjournal.batchprocessor.workbook.LoadedSheet;
import com.projectedjournal.cashgrid.grid.CellValues;
import com.projectedjournal.cashgrid.grid.RawGrid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates the cash-flow section mapping: required columns, unique non-blank accounts, and a
 * section on every row.
 */
@Slf4j
@Component
public class CashflowMappingValidator {

    static final List<String> REQUIRED_COLUMNS = List.of("GAAPAccount", "CashFlowSection", "Description");

    public Map<String, CashflowMapping> validate(LoadedSheet sheet) {
        List<ValidationIssue> issues = new ArrayList<>();
        SheetColumns columns = SheetColumns.of(sheet);
        columns.requireAll(sheet, REQUIRED_COLUMNS, issues);
        if (!issues.isEmpty()) {
            throw new InputSchemaException(issues);
        }

        RawGrid grid = sheet.grid();
        String file = sheet.fileLabel();
        Map<String, CashflowMapping> mappings = new LinkedHashMap<>();

        for (int i = 0; i < grid.getRowCount(); i++) {
            int row = sheet.rowNumber(i);
            String account = CellValues.toText(grid.cell(i, columns.actual("GAAPAccount")));
            String section = CellValues.toText(grid.cell(i, columns.actual("CashFlowSection")));

            if (account == null) {
                issues.add(new ValidationIssue(file, row, "GAAPAccount is blank", "Every mapping row needs an account."));
                continue;
            }
            if (mappings.containsKey(account)) {
                issues.add(new ValidationIssue(file, row, "Duplicate GAAPAccount '" + account + "'",
                        "Map account " + account + " to a single cash-flow section."));
                continue;
            }
            if (section == null) {
                issues.add(new ValidationIssue(file, row, "CashFlowSection is blank for account " + account,
                        "Enter a section such as Operating, Investing or Financing."));
                continue;
            }
            mappings.put(account, new CashflowMapping(account, section,
                    CellValues.toText(grid.cell(i, columns.actual("Description")))));
        }

        if (!issues.isEmpty()) {
            log.warn("Cash-flow mapping '{}' failed validation with {} issue(s)", file, issues.size());
            throw new InputSchemaException(issues);
        }
        log.info("Cash-flow mapping '{}' valid — {} accounts", file, mappings.size());
        return mappings;
    }
}
