package com.projectedjournal.cashgrid.detect;

/**
 * The layout families a cash grid can be classified into.
 */
public enum GridLayout {
    /** One row per counterparty, one numeric column per weekly period. */
    WIDE_TIME_SERIES,
    /** One row per transaction with explicit date and amount columns. */
    EVENT_LIST,
    /** Neither family matches; the grid cannot be normalised. */
    UNSUPPORTED
}
