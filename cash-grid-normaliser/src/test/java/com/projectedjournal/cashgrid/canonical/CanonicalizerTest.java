package com.projectedjournal.cashgrid.canonical;

import com.projectedjournal.cashgrid.GridSchemaException;
import com.projectedjournal.cashgrid.layout.GridLine;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CanonicalizerTest {

    private static final LocalDate DAY = LocalDate.of(2025, 1, 6);

    private final Canonicalizer canonicalizer = new Canonicalizer();

    @Test
    void canonicalize_fillsCounterpartyAndForcesPositiveTwoDecimalAmounts() {
        CanonicalTable table = canonicalizer.canonicalize(List.of(
                line(null, "-1234.5", TxnType.AP),
                line("", "10.005", TxnType.AR),
                line("Acme", "7", TxnType.AR)));

        assertThat(table.rows()).extracting(CanonicalTransaction::counterparty)
                .containsExactly("Unknown", "Unknown", "Acme");
        assertThat(table.rows()).extracting(CanonicalTransaction::amount)
                .containsExactly(new BigDecimal("1234.50"), new BigDecimal("10.01"), new BigDecimal("7.00"));
    }

    @Test
    void canonicalize_dropsZeroMissingAndSubCentRows() {
        GridLine noDate = line("A", "5", TxnType.AP);
        noDate.setScheduledDate(null);

        CanonicalTable table = canonicalizer.canonicalize(List.of(
                line("A", "0", TxnType.AP),
                line("B", null, TxnType.AP),
                line("C", "0.004", TxnType.AR),
                noDate,
                line("D", "0.005", TxnType.AR)));

        assertThat(table.rows()).singleElement()
                .satisfies(row -> {
                    assertThat(row.counterparty()).isEqualTo("D");
                    assertThat(row.amount()).isEqualTo(new BigDecimal("0.01"));
                });
    }

    @Test
    void canonicalize_lineWithoutTxnType_isSchemaError() {
        assertThatThrownBy(() -> canonicalizer.canonicalize(List.of(line("A", "5", null))))
                .isInstanceOf(GridSchemaException.class)
                .hasMessageContaining("txn_type");
    }

    @Test
    void canonicalize_lineWithoutLineSource_isSchemaError() {
        GridLine unsourced = line("A", "5", TxnType.AP);
        unsourced.setLineSource(null);

        assertThatThrownBy(() -> canonicalizer.canonicalize(List.of(unsourced)))
                .isInstanceOf(GridSchemaException.class)
                .hasMessageContaining("line_source");
    }

    @Test
    void canonicalTable_isImmutableWithFixedColumns() {
        CanonicalTable table = canonicalizer.canonicalize(List.of(line("A", "5", TxnType.AP)));

        assertThat(table.columns()).containsExactly("txn_type", "counterparty", "scheduled_date", "amount", "line_source");
        assertThatThrownBy(() -> table.rows().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void canonicalTransaction_rejectsNonPositiveAmount() {
        assertThatThrownBy(() -> new CanonicalTransaction(TxnType.AP, "A", DAY, new BigDecimal("-1.00"), "0:x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CanonicalTransaction(TxnType.AP, " ", DAY, new BigDecimal("1.00"), "0:x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static GridLine line(String counterparty, String amount, TxnType type) {
        return GridLine.builder()
                .counterparty(counterparty)
                .scheduledDate(DAY)
                .amount(amount == null ? null : new BigDecimal(amount))
                .lineSource("0:Amount")
                .txnType(type)
                .build();
    }
}
