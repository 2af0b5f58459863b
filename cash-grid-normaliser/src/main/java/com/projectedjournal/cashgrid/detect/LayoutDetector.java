package com.projectedjournal.cashgrid.detect;

import com.projectedjournal.cashgrid.grid.RawGrid;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Decides which layout family a grid belongs to.
 *
 * <ol>
 *   <li>Exactly {@value #WIDE_PERIOD_COUNT} uniformly numeric columns → {@link GridLayout#WIDE_TIME_SERIES}.
 *       This check wins even when one of those columns is named like a date.</li>
 *   <li>Otherwise at least one date-like and one amount-like column → {@link GridLayout#EVENT_LIST}.</li>
 *   <li>Otherwise → {@link GridLayout#UNSUPPORTED}.</li>
 * </ol>
 */
@Slf4j
public class LayoutDetector {

    /** One numeric column per week of the projection horizon. */
    public static final int WIDE_PERIOD_COUNT = 13;

    private final ColumnClassifier classifier;

    public LayoutDetector(ColumnClassifier classifier) {
        this.classifier = classifier;
    }

    public DetectedLayout detect(RawGrid grid) {
        List<String> numericColumns = classifier.numericColumns(grid);
        ColumnClassification classification = classifier.classify(grid);

        GridLayout layout;
        if (numericColumns.size() == WIDE_PERIOD_COUNT) {
            layout = GridLayout.WIDE_TIME_SERIES;
        } else if (classification.isEventListCandidate()) {
            layout = GridLayout.EVENT_LIST;
        } else {
            layout = GridLayout.UNSUPPORTED;
        }

        log.debug("Layout {} — {} numeric columns, dates={}, amounts={}",
                layout, numericColumns.size(), classification.dateColumns(), classification.amountColumns());
        return new DetectedLayout(layout, numericColumns, classification);
    }
}
