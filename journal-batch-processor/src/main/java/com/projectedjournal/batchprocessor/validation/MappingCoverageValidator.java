package com.projectedjournal.batchprocessor.validation;

import com.projectedjournal.batchprocessor.config.JournalProperties;
import com.projectedjournal.batchprocessor.domain.BalanceSheetEntry;
import com.projectedjournal.batchprocessor.domain.CashflowMapping;
import com.projectedjournal.batchprocessor.domain.GaapMapping;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cross-checks the inputs against the GAAP mapping.
 *
 * <p>Balance-sheet accounts and both cash control accounts must be mapped; a gap is a
 * {@link MappingConflictException}. Accounts missing only from the cash-flow mapping are logged and
 * later posted to the unscheduled-cash section.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MappingCoverageValidator {

    private final JournalProperties properties;

    public void check(List<BalanceSheetEntry> balanceSheet, String balanceSheetFile,
                      Map<String, GaapMapping> gaapMappings, String gaapFile,
                      Map<String, CashflowMapping> cashflowMappings) {
        List<ValidationIssue> issues = new ArrayList<>();

        for (BalanceSheetEntry entry : balanceSheet) {
            if (!gaapMappings.containsKey(entry.account())) {
                issues.add(new ValidationIssue(balanceSheetFile, entry.rowNumber(),
                        "GAAPAccount " + entry.account() + " missing in mapping",
                        "Add " + entry.account() + " to " + gaapFile + " or correct the balance sheet account."));
            }
        }
        checkControlAccount("AP", properties.getPayableAccount(), "journal.payable-account", gaapMappings, gaapFile, issues);
        checkControlAccount("AR", properties.getReceivableAccount(), "journal.receivable-account", gaapMappings, gaapFile, issues);

        if (!issues.isEmpty()) {
            log.warn("GAAP mapping '{}' leaves {} account(s) unmapped", gaapFile, issues.size());
            throw new MappingConflictException(issues);
        }

        List<String> unscheduled = new ArrayList<>();
        for (BalanceSheetEntry entry : balanceSheet) {
            if (!cashflowMappings.containsKey(entry.account())) {
                unscheduled.add(entry.account());
            }
        }
        if (!unscheduled.isEmpty()) {
            log.warn("Accounts {} have no cash-flow mapping — posting to '{}'",
                    unscheduled, properties.getUnscheduledCashSection());
        }
    }

    private static void checkControlAccount(String side, String account, String property,
                                            Map<String, GaapMapping> gaapMappings, String gaapFile,
                                            List<ValidationIssue> issues) {
        if (!gaapMappings.containsKey(account)) {
            issues.add(ValidationIssue.ofFile(gaapFile,
                    side + " control account " + account + " missing in mapping",
                    "Add " + account + " to " + gaapFile + " or change " + property + "."));
        }
    }
}
