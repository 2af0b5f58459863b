package com.projectedjournal.cashgrid.canonical;

/**
 * Direction of a scheduled cash movement.
 */
public enum TxnType {
    /** Accounts payable: cash owed by the entity. */
    AP,
    /** Accounts receivable: cash owed to the entity. */
    AR
}
