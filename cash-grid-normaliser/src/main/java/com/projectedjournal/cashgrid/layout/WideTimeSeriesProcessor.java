package com.projectedjournal.cashgrid.layout;

import com.projectedjournal.cashgrid.UnsupportedGridFormatException;
import com.projectedjournal.cashgrid.detect.LayoutDetector;
import com.projectedjournal.cashgrid.grid.CellValues;
import com.projectedjournal.cashgrid.grid.RawGrid;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Unpivots a wide grid (one row per counterparty, one numeric column per week) into one
 * {@link GridLine} per non-zero cell.
 *
 * <p>Period columns are mapped to dates by position, never by header text: the i-th numeric
 * column (0-based, left to right) is scheduled {@code i} weeks after the anchor date. The first
 * non-numeric column supplies the counterparty. Output is ordered period by period.
 */
@Slf4j
public class WideTimeSeriesProcessor {

    public List<GridLine> process(RawGrid grid, List<String> periodColumns, LocalDate anchorDate) {
        if (periodColumns.size() != LayoutDetector.WIDE_PERIOD_COUNT) {
            throw new UnsupportedGridFormatException("Wide time-series grid requires exactly "
                    + LayoutDetector.WIDE_PERIOD_COUNT + " numeric period columns, found " + periodColumns.size());
        }
        String counterpartyColumn = grid.getColumnNames().stream()
                .filter(name -> !periodColumns.contains(name))
                .findFirst()
                .orElseThrow(() -> new UnsupportedGridFormatException(
                        "Wide time-series grid requires at least one text column for counterparty"));

        List<GridLine> lines = new ArrayList<>();
        int skipped = 0;
        for (int period = 0; period < periodColumns.size(); period++) {
            String periodColumn = periodColumns.get(period);
            LocalDate scheduledDate = anchorDate.plusWeeks(period);
            for (int row = 0; row < grid.getRowCount(); row++) {
                BigDecimal amount = CellValues.toDecimal(grid.cell(row, periodColumn));
                if (amount == null || amount.signum() == 0) {
                    skipped++;
                    continue;
                }
                lines.add(GridLine.builder()
                        .counterparty(CellValues.toText(grid.cell(row, counterpartyColumn)))
                        .scheduledDate(scheduledDate)
                        .amount(amount)
                        .lineSource(row + ":" + periodColumn)
                        .build());
            }
        }

        log.debug("Wide grid — counterparty column '{}', {} active cells, {} empty or zero cells skipped",
                counterpartyColumn, lines.size(), skipped);
        return lines;
    }
}
