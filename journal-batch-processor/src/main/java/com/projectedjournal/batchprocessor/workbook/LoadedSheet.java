package com.projectedjournal.batchprocessor.workbook;

import com.projectedjournal.cashgrid.grid.RawGrid;

import java.util.List;

/**
 * A worksheet read from disk.
 *
 * @param fileLabel  file name used in error reports
 * @param sheetName  worksheet actually read
 * @param grid       header and data cells
 * @param rowNumbers 1-based spreadsheet row of each grid row; blank rows are not in the grid
 */
public record LoadedSheet(String fileLabel, String sheetName, RawGrid grid, List<Integer> rowNumbers) {

    public LoadedSheet {
        rowNumbers = List.copyOf(rowNumbers);
    }

    public int rowNumber(int gridRow) {
        return rowNumbers.get(gridRow);
    }
}
