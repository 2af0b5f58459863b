package com.projectedjournal.cashgrid;

/**
 * The input grid is empty, or normalisation produced rows that break the canonical column
 * contract. The latter is a processing defect, not a problem with the user's workbook.
 */
public class GridSchemaException extends CashGridException {

    public GridSchemaException(String message) {
        super(message);
    }
}
