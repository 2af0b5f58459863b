package com.projectedjournal.batchprocessor.domain;

import java.util.Optional;

/**
 * Debit / credit marker, as written in the journal and the GAAP mapping.
 */
public enum DcFlag {
    D,
    C;

    public DcFlag opposite() {
        return this == D ? C : D;
    }

    /** Exact, case-sensitive match on {@code "D"} or {@code "C"}. */
    public static Optional<DcFlag> fromCode(String code) {
        if ("D".equals(code)) {
            return Optional.of(D);
        }
        if ("C".equals(code)) {
            return Optional.of(C);
        }
        return Optional.empty();
    }
}
