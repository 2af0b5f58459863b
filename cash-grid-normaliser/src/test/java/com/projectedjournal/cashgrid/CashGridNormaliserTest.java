package com.projectedjournal.cashgrid;

import com.projectedjournal.cashgrid.canonical.CanonicalTable;
import com.projectedjournal.cashgrid.canonical.CanonicalTransaction;
import com.projectedjournal.cashgrid.canonical.TxnType;
import com.projectedjournal.cashgrid.grid.RawGrid;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static com.projectedjournal.cashgrid.GridFixtures.dec;
import static com.projectedjournal.cashgrid.GridFixtures.wideRow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CashGridNormaliserTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 1, 6);

    private final CashGridNormaliser normaliser = new CashGridNormaliser(clockAt(TODAY));

    // ─── Wide time-series ─────────────────────────────────────────────────────

    @Test
    @DisplayName("Vendor + Week_1..Week_13 grid with sparse rows yields one row per non-zero cell")
    void wideGrid_producesOneRowPerNonZeroCell() {
        RawGrid grid = GridFixtures.wideGrid(List.of(
                wideRow("Acme", 1, dec("100"), 2, BigDecimal.ZERO, 5, dec("-250.255")),
                wideRow("Beta", 3, dec("40"), 13, dec("12.5"))));

        CanonicalTable table = normaliser.normalise(grid);

        assertThat(table.size()).isEqualTo(4);
        assertThat(table.rows()).allSatisfy(row -> assertThat(row.amount()).isPositive());
        assertThat(table.rows()).extracting(CanonicalTransaction::lineSource)
                .containsExactly("0:Week_1", "1:Week_3", "0:Week_5", "1:Week_13");
        assertThat(table.rows()).extracting(CanonicalTransaction::scheduledDate)
                .containsExactly(TODAY, TODAY.plusWeeks(2), TODAY.plusWeeks(4), TODAY.plusWeeks(12));
        assertThat(table.rows()).extracting(CanonicalTransaction::txnType)
                .containsExactly(TxnType.AR, TxnType.AR, TxnType.AP, TxnType.AR);
        assertThat(table.rows().get(2).amount()).isEqualTo(new BigDecimal("250.26"));
    }

    @Test
    @DisplayName("Wide grids are anchored to the run date; period spacing is stable across days")
    void wideGrid_offsetsStableAcrossRunDates() {
        RawGrid grid = GridFixtures.wideGrid(List.of(wideRow("Acme", 1, dec("1"), 2, dec("2"), 13, dec("3"))));

        CanonicalTable monday = new CashGridNormaliser(clockAt(TODAY)).normalise(grid);
        CanonicalTable thursday = new CashGridNormaliser(clockAt(TODAY.plusDays(3))).normalise(grid);

        assertThat(monday.rows().get(0).scheduledDate()).isNotEqualTo(thursday.rows().get(0).scheduledDate());
        for (CanonicalTable table : List.of(monday, thursday)) {
            LocalDate first = table.rows().get(0).scheduledDate();
            assertThat(table.rows().get(1).scheduledDate()).isEqualTo(first.plusDays(7));
            assertThat(table.rows().get(2).scheduledDate()).isEqualTo(first.plusDays(84));
        }
    }

    @Test
    @DisplayName("An explicit anchor date overrides the clock for wide grids")
    void wideGrid_explicitAnchorOverridesClock() {
        RawGrid grid = GridFixtures.wideGrid(List.of(wideRow("Acme", 1, dec("1000"))));
        LocalDate anchor = TODAY.plusDays(1);

        CanonicalTable table = normaliser.normalise(grid, "Payables", anchor);

        assertThat(table.rows()).extracting(CanonicalTransaction::scheduledDate).containsExactly(anchor);
    }

    // ─── Event list ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("Event list without a sheet hint takes its type from the amount sign")
    void eventList_withoutHint_infersTypeFromSign() {
        CanonicalTable table = normaliser.normalise(eventListGrid(), null);

        assertThat(table.rows()).extracting(CanonicalTransaction::txnType)
                .containsExactly(TxnType.AR, TxnType.AP, TxnType.AR);
        assertThat(table.rows()).extracting(CanonicalTransaction::amount)
                .containsExactly(new BigDecimal("1000.00"), new BigDecimal("2000.00"), new BigDecimal("3000.00"));
        assertThat(table.rows()).extracting(CanonicalTransaction::counterparty)
                .containsExactly("Acme", "Beta", "Gamma");
    }

    @Test
    @DisplayName("Sheet hint 'Accounts_Payable' labels every row AP")
    void eventList_payableHint_forcesAp() {
        CanonicalTable table = normaliser.normalise(eventListGrid(), "Accounts_Payable");

        assertThat(table.rows()).extracting(CanonicalTransaction::txnType).containsOnly(TxnType.AP);
        assertThat(table.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Row with an unparseable date is dropped, the rest survive")
    void eventList_badDateRowDropped() {
        RawGrid grid = RawGrid.builder()
                .column("Date", "2025-01-10", "TBD", "2025-01-24")
                .column("Vendor", "Acme", "Beta", "Gamma")
                .column("Amount", dec("1000"), dec("-2000"), dec("3000"))
                .build();

        CanonicalTable table = normaliser.normalise(grid);

        assertThat(table.size()).isEqualTo(2);
        assertThat(table.rows()).extracting(CanonicalTransaction::counterparty).containsExactly("Acme", "Gamma");
    }

    @Test
    @DisplayName("java.sql.Date cells are read as event dates")
    void eventList_sqlDateCellsAreDates() {
        RawGrid grid = RawGrid.builder()
                .column("Date", java.sql.Date.valueOf("2025-01-10"))
                .column("Vendor", "Acme")
                .column("Amount", 10)
                .build();

        CanonicalTable table = normaliser.normalise(grid);

        assertThat(table.rows()).extracting(CanonicalTransaction::scheduledDate)
                .containsExactly(LocalDate.of(2025, 1, 10));
        assertThat(table.rows().get(0).amount()).isEqualTo(new BigDecimal("10.00"));
    }

    // ─── Failures ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Grid of two unrelated text columns is an unsupported format")
    void textOnlyGrid_isUnsupported() {
        RawGrid grid = RawGrid.builder()
                .column("Notes", "follow up", "done")
                .column("Owner", "Ann", "Raj")
                .build();

        assertThatThrownBy(() -> normaliser.normalise(grid))
                .isInstanceOf(UnsupportedGridFormatException.class)
                .hasMessageContaining("Unsupported AP Cash Grid format");
    }

    @Test
    @DisplayName("Empty grid is a schema error")
    void emptyGrid_isSchemaError() {
        assertThatThrownBy(() -> normaliser.normalise(RawGrid.empty()))
                .isInstanceOf(GridSchemaException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> normaliser.normalise(RawGrid.ofRows(List.of("Date", "Amount"), List.of())))
                .isInstanceOf(GridSchemaException.class);
    }

    @Test
    void inputGridIsNotMutated() {
        RawGrid grid = eventListGrid();
        List<Object> amountsBefore = List.copyOf(grid.column("Amount"));

        normaliser.normalise(grid, "AP");

        assertThat(grid.column("Amount")).containsExactlyElementsOf(amountsBefore);
    }

    // ─── helpers ──────────────────────────────────────────────────────────────

    private static RawGrid eventListGrid() {
        return RawGrid.builder()
                .column("Date", TODAY.plusDays(4), TODAY.plusDays(11), TODAY.plusDays(18))
                .column("Vendor", "Acme", "Beta", "Gamma")
                .column("Amount", dec("1000"), dec("-2000"), dec("3000"))
                .build();
    }

    private static Clock clockAt(LocalDate date) {
        return Clock.fixed(date.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    }
}
