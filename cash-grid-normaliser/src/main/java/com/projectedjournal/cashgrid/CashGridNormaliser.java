package com.projectedjournal.cashgrid;

import com.projectedjournal.cashgrid.canonical.CanonicalTable;
import com.projectedjournal.cashgrid.canonical.Canonicalizer;
import com.projectedjournal.cashgrid.canonical.TransactionTypeInferencer;
import com.projectedjournal.cashgrid.detect.ColumnClassifier;
import com.projectedjournal.cashgrid.detect.DetectedLayout;
import com.projectedjournal.cashgrid.detect.LayoutDetector;
import com.projectedjournal.cashgrid.grid.RawGrid;
import com.projectedjournal.cashgrid.layout.EventListProcessor;
import com.projectedjournal.cashgrid.layout.GridLine;
import com.projectedjournal.cashgrid.layout.WideTimeSeriesProcessor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Converts an AP/AR cash grid of unknown layout into a {@link CanonicalTable}.
 *
 * <p>One forward pass: detect layout → run the matching processor → label AP/AR → canonicalise.
 * Instances hold no per-call state and may be shared between threads.
 *
 * <p>Wide time-series grids are anchored to "today" as read from the injected {@link Clock}, so the
 * same grid normalised on two different days yields different scheduled dates. The spacing between
 * periods is always exactly one week.
 */
@Slf4j
public class CashGridNormaliser {

    private final Clock clock;
    private final LayoutDetector layoutDetector;
    private final WideTimeSeriesProcessor wideProcessor = new WideTimeSeriesProcessor();
    private final EventListProcessor eventListProcessor = new EventListProcessor();
    private final TransactionTypeInferencer typeInferencer = new TransactionTypeInferencer();
    private final Canonicalizer canonicalizer = new Canonicalizer();

    public CashGridNormaliser() {
        this(Clock.systemDefaultZone());
    }

    public CashGridNormaliser(Clock clock) {
        this.clock = clock;
        this.layoutDetector = new LayoutDetector(new ColumnClassifier());
    }

    public CanonicalTable normalise(RawGrid grid) {
        return normalise(grid, null);
    }

    /**
     * @param grid      the parsed worksheet; never mutated
     * @param sheetHint worksheet name used to label every row AP or AR; may be {@code null}
     * @throws GridSchemaException            if the grid is empty
     * @throws UnsupportedGridFormatException if the grid matches neither layout, or lacks a column
     *                                        its layout requires
     */
    public CanonicalTable normalise(RawGrid grid, String sheetHint) {
        return normalise(grid, sheetHint, LocalDate.now(clock));
    }

    /**
     * Same as {@link #normalise(RawGrid, String)}, with wide grids anchored to {@code today} instead
     * of the clock. Callers that already fixed their run date pass it here so both agree.
     */
    public CanonicalTable normalise(RawGrid grid, String sheetHint, LocalDate today) {
        if (grid == null || grid.isEmpty()) {
            throw new GridSchemaException("Cannot normalise an empty AP Cash Grid");
        }

        DetectedLayout detected = layoutDetector.detect(grid);
        log.info("Detected {} layout for {} ({} numeric columns)",
                detected.layout(), grid, detected.numericColumns().size());

        List<GridLine> lines = switch (detected.layout()) {
            case WIDE_TIME_SERIES -> wideProcessor.process(grid, detected.numericColumns(), today);
            case EVENT_LIST -> eventListProcessor.process(grid, detected.classification());
            case UNSUPPORTED -> throw new UnsupportedGridFormatException("Unsupported AP Cash Grid format: expected either "
                    + LayoutDetector.WIDE_PERIOD_COUNT + " numeric weekly columns plus a counterparty column, "
                    + "or a date column and an amount column. Found columns " + grid.getColumnNames());
        };

        typeInferencer.assign(lines, sheetHint);
        CanonicalTable table = canonicalizer.canonicalize(lines);
        log.info("Normalised {} grid rows into {} canonical transactions", grid.getRowCount(), table.size());
        return table;
    }
}
