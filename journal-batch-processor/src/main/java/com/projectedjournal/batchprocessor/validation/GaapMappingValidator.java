package com.projectedjournal.batchprocessor.validation;

import com.projectedjournal.batchprocessor.domain.DcFlag;
import com.projectedjournal.batchprocessor.domain.GaapMapping;
import com.projectedjournal.batchprocessor.workbook.LoadedSheet;
import com.projectedjournal.cashgrid.grid.CellValues;
import com.projectedjournal.cashgrid.grid.RawGrid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validates the GAAP chart-of-accounts mapping: required columns, unique non-blank accounts, and a
 * {@code NormalBalance} of exactly {@code D} or {@code C}.
 */
@Slf4j
@Component
public class GaapMappingValidator {

    static final List<String> REQUIRED_COLUMNS = List.of("GAAPAccount", "Description", "AccountType", "NormalBalance");

    public Map<String, GaapMapping> validate(LoadedSheet sheet) {
        List<ValidationIssue> issues = new ArrayList<>();
        SheetColumns columns = SheetColumns.of(sheet);
        columns.requireAll(sheet, REQUIRED_COLUMNS, issues);
        if (!issues.isEmpty()) {
            throw new InputSchemaException(issues);
        }

        RawGrid grid = sheet.grid();
        String file = sheet.fileLabel();
        Map<String, GaapMapping> mappings = new LinkedHashMap<>();

        for (int i = 0; i < grid.getRowCount(); i++) {
            int row = sheet.rowNumber(i);
            String account = CellValues.toText(grid.cell(i, columns.actual("GAAPAccount")));
            String rawFlag = CellValues.toText(grid.cell(i, columns.actual("NormalBalance")));
            Optional<DcFlag> normalBalance = DcFlag.fromCode(rawFlag);

            if (account == null) {
                issues.add(new ValidationIssue(file, row, "GAAPAccount is blank", "Every mapping row needs an account."));
            } else if (mappings.containsKey(account)) {
                issues.add(new ValidationIssue(file, row, "Duplicate GAAPAccount '" + account + "'",
                        "Keep a single mapping row for account " + account + "."));
                continue;
            }
            if (normalBalance.isEmpty()) {
                issues.add(new ValidationIssue(file, row, "NormalBalance '" + rawFlag + "' must be D or C",
                        "Use an upper-case D for debit-normal or C for credit-normal accounts."));
            }
            if (account != null && normalBalance.isPresent()) {
                mappings.put(account, new GaapMapping(account,
                        CellValues.toText(grid.cell(i, columns.actual("Description"))),
                        CellValues.toText(grid.cell(i, columns.actual("AccountType"))),
                        normalBalance.get()));
            }
        }

        if (!issues.isEmpty()) {
            log.warn("GAAP mapping '{}' failed validation with {} issue(s)", file, issues.size());
            throw new InputSchemaException(issues);
        }
        log.info("GAAP mapping '{}' valid — {} accounts", file, mappings.size());
        return mappings;
    }
}
