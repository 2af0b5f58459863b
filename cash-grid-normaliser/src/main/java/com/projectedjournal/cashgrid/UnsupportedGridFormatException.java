package com.projectedjournal.cashgrid;

/**
 * The grid does not match a supported layout, or the selected layout lacks a column it
 * structurally requires. The message names the missing requirement.
 */
public class UnsupportedGridFormatException extends CashGridException {

    public UnsupportedGridFormatException(String message) {
        super(message);
    }
}
