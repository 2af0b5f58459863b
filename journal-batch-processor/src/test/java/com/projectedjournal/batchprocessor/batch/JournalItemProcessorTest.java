package com.projectedjournal.batchprocessor.batch;

import com.projectedjournal.batchprocessor.config.JournalProperties;
import com.projectedjournal.batchprocessor.domain.AccountType;
import com.projectedjournal.batchprocessor.domain.BalanceSheetEntry;
import com.projectedjournal.batchprocessor.domain.CashflowMapping;
import com.projectedjournal.batchprocessor.domain.DcFlag;
import com.projectedjournal.batchprocessor.domain.GaapMapping;
import com.projectedjournal.batchprocessor.domain.InputBundle;
import com.projectedjournal.batchprocessor.domain.JournalLine;
import com.projectedjournal.cashgrid.canonical.CanonicalTable;
import com.projectedjournal.cashgrid.canonical.CanonicalTransaction;
import com.projectedjournal.cashgrid.canonical.TxnType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JournalItemProcessorTest {

    private static final LocalDate AS_OF = LocalDate.of(2025, 1, 6);
    private static final LocalDateTime RUN_AT = LocalDateTime.of(2025, 1, 6, 9, 30, 0);

    private JournalRunContext runContext;
    private JournalItemProcessor processor;

    @BeforeEach
    void setUp() {
        JournalProperties properties = new JournalProperties();
        runContext = new JournalRunContext();
        runContext.start(new InputBundle(
                List.of(),
                Map.of(
                        "1000", new GaapMapping("1000", "Cash", "Asset", DcFlag.D),
                        "2000", new GaapMapping("2000", "Accounts Payable", "Liability", DcFlag.C),
                        "1200", new GaapMapping("1200", "Accounts Receivable", "Asset", DcFlag.D)),
                Map.of(
                        "1000", new CashflowMapping("1000", "Operating", "Cash"),
                        "2000", new CashflowMapping("2000", "Operating", "Payments")),
                new CanonicalTable(List.of())), AS_OF, RUN_AT);
        processor = new JournalItemProcessor(runContext, properties);
    }

    @Test
    @DisplayName("Opening balance — dated as-of, normal balance flag, mapped cash-flow section")
    void opening_positiveBalance() {
        JournalLine line = processor.process(JournalSource.opening(entry("1000", "50000.00", AccountType.ASSET)));

        assertThat(line.getJournalId()).isEqualTo("J000001");
        assertThat(line.getTxnId()).isEqualTo("T000001");
        assertThat(line.getTxnDate()).isEqualTo(AS_OF);
        assertThat(line.getCashDate()).isEqualTo(AS_OF);
        assertThat(line.getDcFlag()).isEqualTo(DcFlag.D);
        assertThat(line.getGaapAccount()).isEqualTo("1000");
        assertThat(line.getCashFlowSection()).isEqualTo("Operating");
        assertThat(line.getAmount()).isEqualByComparingTo("50000.00");
        assertThat(line.getCurrencyCode()).isEqualTo("USD");
        assertThat(line.getCreatedAt()).isEqualTo(RUN_AT);
        assertThat(line.getUpdatedAt()).isEqualTo(RUN_AT);
        assertThat(line.getDepartment()).isNull();
        assertThat(line.getAccountingClass()).isNull();
    }

    @Test
    @DisplayName("Opening balance — negative balance flips the flag and posts the absolute amount")
    void opening_negativeBalance_flipsFlag() {
        JournalLine line = processor.process(JournalSource.opening(entry("1000", "-250.75", AccountType.ASSET)));

        assertThat(line.getDcFlag()).isEqualTo(DcFlag.C);
        assertThat(line.getAmount()).isEqualByComparingTo("250.75");
        assertThat(line.getAmount().scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("Opening balance — account without a cash-flow mapping goes to Unscheduled Cash")
    void opening_unmappedCashflow() {
        JournalLine line = processor.process(JournalSource.opening(entry("1200", "10", AccountType.ASSET)));

        assertThat(line.getCashFlowSection()).isEqualTo("Unscheduled Cash");
    }

    @Test
    @DisplayName("AP transaction — debit to the payables control account with the vendor set")
    void cash_payable() {
        JournalLine line = processor.process(JournalSource.cash(txn(TxnType.AP, "Acme", LocalDate.of(2025, 1, 10))));

        assertThat(line.getDcFlag()).isEqualTo(DcFlag.D);
        assertThat(line.getGaapAccount()).isEqualTo("2000");
        assertThat(line.getTxnDate()).isEqualTo(LocalDate.of(2025, 1, 10));
        assertThat(line.getVendorId()).isEqualTo("Acme");
        assertThat(line.getCustomerId()).isNull();
        assertThat(line.getCashFlowSection()).isEqualTo("Operating");
    }

    @Test
    @DisplayName("AR transaction — credit to the receivables control account with the customer set")
    void cash_receivable() {
        JournalLine line = processor.process(JournalSource.cash(txn(TxnType.AR, "Globex", LocalDate.of(2025, 2, 3))));

        assertThat(line.getDcFlag()).isEqualTo(DcFlag.C);
        assertThat(line.getGaapAccount()).isEqualTo("1200");
        assertThat(line.getCustomerId()).isEqualTo("Globex");
        assertThat(line.getVendorId()).isNull();
        assertThat(line.getCashFlowSection()).isEqualTo("Unscheduled Cash");
    }

    @Test
    @DisplayName("Horizon — as-of date is inside, as-of + 13 weeks is outside, earlier dates are outside")
    void cash_horizonBoundaries() {
        assertThat(processor.process(JournalSource.cash(txn(TxnType.AP, "A", AS_OF)))).isNotNull();
        assertThat(processor.process(JournalSource.cash(txn(TxnType.AP, "B", AS_OF.plusWeeks(13).minusDays(1))))).isNotNull();
        assertThat(processor.process(JournalSource.cash(txn(TxnType.AP, "C", AS_OF.plusWeeks(13))))).isNull();
        assertThat(processor.process(JournalSource.cash(txn(TxnType.AP, "D", AS_OF.minusDays(1))))).isNull();
    }

    @Test
    @DisplayName("Sequence — filtered items do not consume an ID")
    void sequence_skipsFilteredItems() {
        processor.process(JournalSource.cash(txn(TxnType.AP, "Old", AS_OF.minusWeeks(1))));
        JournalLine first = processor.process(JournalSource.cash(txn(TxnType.AP, "A", AS_OF)));
        JournalLine second = processor.process(JournalSource.opening(entry("1000", "1", AccountType.ASSET)));

        assertThat(first.getJournalId()).isEqualTo("J000001");
        assertThat(second.getJournalId()).isEqualTo("J000002");
        assertThat(second.getTxnId()).isEqualTo("T000002");
    }

    private static BalanceSheetEntry entry(String account, String balance, AccountType type) {
        return new BalanceSheetEntry(account, "desc", new BigDecimal(balance), type, 2);
    }

    private static CanonicalTransaction txn(TxnType type, String counterparty, LocalDate date) {
        return new CanonicalTransaction(type, counterparty, date, new BigDecimal("125.00"), "0:Amount");
    }
}
