package com.projectedjournal.cashgrid.layout;

import com.projectedjournal.cashgrid.UnsupportedGridFormatException;
import com.projectedjournal.cashgrid.detect.ColumnClassification;
import com.projectedjournal.cashgrid.grid.CellValues;
import com.projectedjournal.cashgrid.grid.RawGrid;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads a grid holding one transaction per row.
 *
 * <p>Only the first date column and the first amount column of the classification are used.
 * Rows whose date does not parse, or whose amount is missing or zero, are dropped.
 */
@Slf4j
public class EventListProcessor {

    static final List<String> COUNTERPARTY_NAME_PATTERNS = List.of(
            "vendor", "customer", "counterparty", "party", "description",
            "memo", "details", "name", "company");

    static final String UNKNOWN_COUNTERPARTY = "Unknown";

    public List<GridLine> process(RawGrid grid, ColumnClassification classification) {
        String dateColumn = classification.firstDateColumn()
                .orElseThrow(() -> new UnsupportedGridFormatException(
                        "Event-list grid requires a date column (e.g. 'Date', 'Due Date', 'Payment_Date')"));
        String amountColumn = classification.firstAmountColumn()
                .orElseThrow(() -> new UnsupportedGridFormatException(
                        "Event-list grid requires an amount column (e.g. 'Amount', 'Total', 'Value')"));
        Optional<String> counterpartyColumn = findCounterpartyColumn(grid.getColumnNames());

        log.debug("Event list — date column '{}', amount column '{}', counterparty column {}",
                dateColumn, amountColumn, counterpartyColumn.orElse("<none>"));

        List<GridLine> lines = new ArrayList<>();
        for (int row = 0; row < grid.getRowCount(); row++) {
            LocalDate date = CellValues.toDate(grid.cell(row, dateColumn));
            BigDecimal amount = CellValues.toDecimal(grid.cell(row, amountColumn));
            if (date == null || amount == null || amount.signum() == 0) {
                log.debug("Row {} dropped — date={}, amount={}", row,
                        grid.cell(row, dateColumn), grid.cell(row, amountColumn));
                continue;
            }
            String counterparty = counterpartyColumn.isPresent()
                    ? CellValues.toText(grid.cell(row, counterpartyColumn.get()))
                    : UNKNOWN_COUNTERPARTY;
            lines.add(GridLine.builder()
                    .counterparty(counterparty)
                    .scheduledDate(date)
                    .amount(amount)
                    .lineSource(row + ":" + dateColumn + "+" + amountColumn)
                    .build());
        }

        int dropped = grid.getRowCount() - lines.size();
        if (dropped > 0) {
            log.warn("Event list — {} of {} rows dropped for an unreadable date or a missing/zero amount",
                    dropped, grid.getRowCount());
        }
        return lines;
    }

    /** First column, in grid order, whose header names a party; underscores count as spaces. */
    static Optional<String> findCounterpartyColumn(List<String> columnNames) {
        return columnNames.stream()
                .filter(name -> {
                    String normalised = name.toLowerCase(Locale.ROOT).replace('_', ' ');
                    return COUNTERPARTY_NAME_PATTERNS.stream().anyMatch(normalised::contains);
                })
                .findFirst();
    }
}
