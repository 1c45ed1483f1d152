package com.entity.integration.core.model;

import java.util.Locale;

/**
 * Granularity of a resolved date. The rank orders precisions from coarsest to finest
 * and drives the time attribute upgrade rule.
 */
public enum TimePrecision {
    UNKNOWN(0),
    YEAR(1),
    MONTH(2),
    DAY(3),
    HOUR(4),
    MINUTE(5);

    private final int rank;

    TimePrecision(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean isFinerThan(TimePrecision other) {
        return other == null || rank > other.rank;
    }

    /**
     * Parses a precision value; unrecognized values map to {@link #UNKNOWN}.
     */
    public static TimePrecision fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
