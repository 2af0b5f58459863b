package com.projectedjournal.batchprocessor.validation;

import com.projectedjournal.batchprocessor.config.JournalProperties;
import com.projectedjournal.batchprocessor.domain.AccountType;
import com.projectedjournal.batchprocessor.domain.BalanceSheetEntry;
import com.projectedjournal.batchprocessor.workbook.LoadedSheet;
import com.projectedjournal.cashgrid.grid.CellValues;
import com.projectedjournal.cashgrid.grid.RawGrid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validates the beginning balance sheet.
 *
 * <h3>Checks</h3>
 * <ol>
 *   <li>Columns {@code Account, Description, Balance, AccountType} are present.</li>
 *   <li>Every row has a unique, non-blank account.</li>
 *   <li>{@code Balance} is a number with at most two decimal places.</li>
 *   <li>{@code AccountType} is Asset, Liability or Equity.</li>
 *   <li>An optional {@code CurrencyCode} column only carries the journal currency.</li>
 *   <li>Assets equal liabilities plus equity.</li>
 * </ol>
 * All issues are collected before an {@link InputSchemaException} is raised.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BalanceSheetValidator {

    static final List<String> REQUIRED_COLUMNS = List.of("Account", "Description", "Balance", "AccountType");

    private final JournalProperties properties;

    public List<BalanceSheetEntry> validate(LoadedSheet sheet) {
        List<ValidationIssue> issues = new ArrayList<>();
        SheetColumns columns = SheetColumns.of(sheet);
        columns.requireAll(sheet, REQUIRED_COLUMNS, issues);
        if (!issues.isEmpty()) {
            throw new InputSchemaException(issues);
        }

        RawGrid grid = sheet.grid();
        String file = sheet.fileLabel();
        Optional<String> currencyColumn = columns.find("CurrencyCode");
        List<BalanceSheetEntry> entries = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < grid.getRowCount(); i++) {
            int row = sheet.rowNumber(i);
            int issuesBefore = issues.size();

            String account = CellValues.toText(grid.cell(i, columns.actual("Account")));
            if (account == null) {
                issues.add(new ValidationIssue(file, row, "Account is blank", "Every balance line needs a GL account."));
            } else if (!seen.add(account)) {
                issues.add(new ValidationIssue(file, row, "Duplicate account '" + account + "'",
                        "Combine the balances of account " + account + " into one row."));
            }

            Object rawBalance = grid.cell(i, columns.actual("Balance"));
            BigDecimal balance = CellValues.toDecimal(rawBalance);
            if (balance == null) {
                issues.add(new ValidationIssue(file, row, "Balance '" + rawBalance + "' is not a number",
                        "Enter the balance as a plain number, e.g. 12500.00."));
            } else if (balance.stripTrailingZeros().scale() > 2) {
                issues.add(new ValidationIssue(file, row, "Balance " + balance.toPlainString()
                        + " has more than 2 decimal places", "Round balances to cents."));
            }

            String rawType = CellValues.toText(grid.cell(i, columns.actual("AccountType")));
            Optional<AccountType> accountType = AccountType.fromText(rawType);
            if (accountType.isEmpty()) {
                issues.add(new ValidationIssue(file, row, "AccountType '" + rawType + "' is not recognised",
                        "Use one of Asset, Liability, Equity."));
            }

            if (currencyColumn.isPresent()) {
                String currency = CellValues.toText(grid.cell(i, currencyColumn.get()));
                if (currency != null && !currency.equalsIgnoreCase(properties.getCurrency())) {
                    issues.add(new ValidationIssue(file, row, "CurrencyCode '" + currency + "' is not supported",
                            "All balances must be in " + properties.getCurrency() + "; convert before loading."));
                }
            }

            if (issues.size() == issuesBefore) {
                entries.add(new BalanceSheetEntry(account,
                        CellValues.toText(grid.cell(i, columns.actual("Description"))),
                        balance, accountType.get(), row));
            }
        }

        if (issues.isEmpty()) {
            checkBalanced(entries, file).ifPresent(issues::add);
        }
        if (!issues.isEmpty()) {
            log.warn("Balance sheet '{}' failed validation with {} issue(s)", file, issues.size());
            throw new InputSchemaException(issues);
        }
        log.info("Balance sheet '{}' valid — {} accounts", file, entries.size());
        return entries;
    }

    /** Assets must equal liabilities plus equity, to the cent. */
    static Optional<ValidationIssue> checkBalanced(List<BalanceSheetEntry> entries, String file) {
        Map<AccountType, BigDecimal> totals = new EnumMap<>(AccountType.class);
        for (AccountType type : AccountType.values()) {
            totals.put(type, BigDecimal.ZERO);
        }
        for (BalanceSheetEntry entry : entries) {
            totals.merge(entry.accountType(), entry.balance(), BigDecimal::add);
        }
        BigDecimal assets = totals.get(AccountType.ASSET);
        BigDecimal liabilitiesAndEquity = totals.get(AccountType.LIABILITY).add(totals.get(AccountType.EQUITY));
        if (assets.compareTo(liabilitiesAndEquity) == 0) {
            return Optional.empty();
        }
        return Optional.of(ValidationIssue.ofFile(file,
                "Balance sheet does not balance: Assets " + assets.toPlainString()
                        + " vs Liabilities + Equity " + liabilitiesAndEquity.toPlainString(),
                "Difference of " + assets.subtract(liabilitiesAndEquity).abs().toPlainString()
                        + "; check the opening balances."));
    }
}
