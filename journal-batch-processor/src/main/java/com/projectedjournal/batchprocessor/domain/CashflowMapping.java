package com.projectedjournal.batchprocessor.domain;

/**
 * Cash-flow statement section an account rolls up into.
 */
public record CashflowMapping(String account, String section, String description) {
}
