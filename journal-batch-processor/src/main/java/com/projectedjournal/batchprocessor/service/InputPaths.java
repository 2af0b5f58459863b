package com.projectedjournal.batchprocessor.service;

import java.nio.file.Path;

/**
 * Locations of the four input workbooks of one run.
 *
 * @param apSheet worksheet of the AP grid to read; {@code null} for the first sheet
 */
public record InputPaths(Path apGrid, String apSheet, Path balanceSheet, Path gaapMapping, Path cashflowMapping) {
}
