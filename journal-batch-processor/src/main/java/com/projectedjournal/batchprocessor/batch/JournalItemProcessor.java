package com.projectedjournal.batchprocessor.batch;

import com.projectedjournal.batchprocessor.config.JournalProperties;
import com.projectedjournal.batchprocessor.domain.BalanceSheetEntry;
import com.projectedjournal.batchprocessor.domain.CashflowMapping;
import com.projectedjournal.batchprocessor.domain.DcFlag;
import com.projectedjournal.batchprocessor.domain.GaapMapping;
import com.projectedjournal.batchprocessor.domain.InputBundle;
import com.projectedjournal.batchprocessor.domain.JournalLine;
import com.projectedjournal.cashgrid.canonical.CanonicalTransaction;
import com.projectedjournal.cashgrid.canonical.TxnType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Turns a {@link JournalSource} into a journal line.
 *
 * <h3>Opening balances</h3>
 * Dated on the as-of date, posted to the balance-sheet account. The flag is the account's GAAP
 * normal balance, reversed for a negative balance. Every balance-sheet account gets a line, a zero
 * balance included.
 *
 * <h3>AP/AR transactions</h3>
 * Dated on the scheduled date and posted to the payable or receivable control account: AP lines are
 * debits with the counterparty as vendor, AR lines are credits with the counterparty as customer.
 * Transactions outside {@code [asOf, asOf + horizon)} are filtered.
 *
 * <p>Filtered items return {@code null} and show up in the step's filter count. Only kept lines
 * consume a sequence number.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JournalItemProcessor implements ItemProcessor<JournalSource, JournalLine> {

    private final JournalRunContext runContext;
    private final JournalProperties properties;

    @Override
    public JournalLine process(JournalSource source) {
        return source.isOpening() ? openingLine(source.opening()) : cashLine(source.cash());
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private JournalLine openingLine(BalanceSheetEntry entry) {
        GaapMapping mapping = runContext.getInputs().gaapMappings().get(entry.account());
        DcFlag flag = entry.balance().signum() < 0 ? mapping.normalBalance().opposite() : mapping.normalBalance();
        return line(runContext.getAsOfDate(), flag, entry.account(), entry.balance().abs())
                .build();
    }

    private JournalLine cashLine(CanonicalTransaction txn) {
        LocalDate asOf = runContext.getAsOfDate();
        LocalDate horizonEnd = asOf.plusWeeks(properties.getHorizonWeeks());
        if (txn.scheduledDate().isBefore(asOf) || !txn.scheduledDate().isBefore(horizonEnd)) {
            log.debug("Transaction {} on {} is outside the horizon [{}, {}) — filtered",
                    txn.lineSource(), txn.scheduledDate(), asOf, horizonEnd);
            return null;
        }

        boolean payable = txn.txnType() == TxnType.AP;
        String account = payable ? properties.getPayableAccount() : properties.getReceivableAccount();
        JournalLine.JournalLineBuilder builder = line(txn.scheduledDate(), payable ? DcFlag.D : DcFlag.C, account, txn.amount());
        return payable
                ? builder.vendorId(txn.counterparty()).build()
                : builder.customerId(txn.counterparty()).build();
    }

    private JournalLine.JournalLineBuilder line(LocalDate date, DcFlag flag, String account, BigDecimal amount) {
        InputBundle inputs = runContext.getInputs();
        CashflowMapping cashflow = inputs.cashflowMappings().get(account);
        int seq = runContext.nextSequence();
        return JournalLine.builder()
                .journalId(String.format("J%06d", seq))
                .txnId(String.format("T%06d", seq))
                .txnDate(date)
                .cashDate(date)
                .dcFlag(flag)
                .gaapAccount(account)
                .cashFlowSection(cashflow != null ? cashflow.section() : properties.getUnscheduledCashSection())
                .amount(amount.setScale(2, RoundingMode.HALF_UP))
                .currencyCode(properties.getCurrency())
                .createdAt(runContext.getRunTimestamp())
                .updatedAt(runContext.getRunTimestamp());
    }
}
