package com.projectedjournal.cashgrid.detect;

import java.util.List;

/**
 * Outcome of layout detection together with the column evidence it was based on.
 *
 * @param layout         the detected layout family
 * @param numericColumns uniformly numeric columns in grid order
 * @param classification date/amount column candidates
 */
public record DetectedLayout(GridLayout layout, List<String> numericColumns, ColumnClassification classification) {

    public DetectedLayout {
        numericColumns = List.copyOf(numericColumns);
    }
}
