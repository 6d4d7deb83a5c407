package com.rankpivot.rankpivot.plan;

import java.util.Locale;

/**
 * What the caller chose to apply out of a detected delta.
 */
public enum UpdateDecision {
    MONTHS_ONLY,
    CATEGORIES_ONLY,
    BOTH,
    NONE;

    /**
     * Parses {@code both}, {@code months-only}, {@code CATEGORIES_ONLY} and similar spellings.
     */
    public static UpdateDecision parse(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (UpdateDecision decision : values()) {
            if (decision.name().equals(normalized)) {
                return decision;
            }
        }
        throw new IllegalArgumentException("Unknown update decision: " + value);
    }
}
