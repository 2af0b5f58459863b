package com.projectedjournal.batchprocessor.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Balance-sheet classification of an account.
 */
public enum AccountType {
    ASSET,
    LIABILITY,
    EQUITY;

    /** Case-insensitive lookup; surrounding whitespace ignored. */
    public static Optional<AccountType> fromText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        return Arrays.stream(values())
                .filter(type -> type.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
