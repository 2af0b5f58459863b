package com.projectedjournal.cashgrid;

/**
 * Base class for the two failure kinds of cash-grid normalisation. Both are terminal for the grid
 * being normalised and are never caught inside this library.
 */
public abstract class CashGridException extends RuntimeException {

    protected CashGridException(String message) {
        super(message);
    }
}
