package com.entity.integration.core.model;

import java.util.Locale;

/**
 * Whether a time entity denotes a single point or a period.
 */
public enum TimeType {
    UNKNOWN,
    POINT,
    PERIOD;

    /**
     * Parses a time type value; unrecognized values map to {@link #UNKNOWN}.
     */
    public static TimeType fromValue(String value) {
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
