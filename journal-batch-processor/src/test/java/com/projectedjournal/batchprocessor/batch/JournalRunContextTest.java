package com.projectedjournal.batchprocessor.batch;

import com.projectedjournal.batchprocessor.domain.AccountType;
import com.projectedjournal.batchprocessor.domain.BalanceSheetEntry;
import com.projectedjournal.batchprocessor.domain.InputBundle;
import com.projectedjournal.cashgrid.canonical.CanonicalTable;
import com.projectedjournal.cashgrid.canonical.CanonicalTransaction;
import com.projectedjournal.cashgrid.canonical.TxnType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JournalRunContextTest {

    @Test
    void sources_openingsFirstThenCashByDateKeepingInputOrderOnTies() {
        CanonicalTransaction late = txn("Late", LocalDate.of(2025, 2, 1), "0:Amount");
        CanonicalTransaction earlyA = txn("Early A", LocalDate.of(2025, 1, 10), "1:Amount");
        CanonicalTransaction earlyB = txn("Early B", LocalDate.of(2025, 1, 10), "2:Amount");
        BalanceSheetEntry cash = new BalanceSheetEntry("1000", "Cash", BigDecimal.TEN, AccountType.ASSET, 2);
        BalanceSheetEntry equity = new BalanceSheetEntry("3000", "Equity", BigDecimal.TEN, AccountType.EQUITY, 3);

        JournalRunContext context = new JournalRunContext();
        context.start(new InputBundle(List.of(cash, equity), Map.of(), Map.of(),
                new CanonicalTable(List.of(late, earlyA, earlyB))), LocalDate.of(2025, 1, 6), LocalDateTime.now());

        assertThat(context.sources()).containsExactly(
                JournalSource.opening(cash),
                JournalSource.opening(equity),
                JournalSource.cash(earlyA),
                JournalSource.cash(earlyB),
                JournalSource.cash(late));
    }

    @Test
    void inputs_unavailableBeforeStart() {
        assertThatThrownBy(() -> new JournalRunContext().getInputs())
                .isInstanceOf(IllegalStateException.class);
    }

    private static CanonicalTransaction txn(String counterparty, LocalDate date, String source) {
        return new CanonicalTransaction(TxnType.AP, counterparty, date, new BigDecimal("1.00"), source);
    }
}
