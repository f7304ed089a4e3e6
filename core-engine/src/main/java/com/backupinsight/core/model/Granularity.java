package com.backupinsight.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Size of an aggregation period.
 *
 * @since 1.0.0
 */
public enum Granularity {
    DAY("day"),
    WEEK("week"),
    MONTH("month");

    private final String code;

    Granularity(String code) {
        this.code = code;
    }

    /**
     * @return lowercase configuration code, e.g. {@code "week"}
     */
    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Resolve a granularity from its configuration code.
     *
     * @param code {@code day}, {@code week} or {@code month}, case-insensitive
     * @return the matching granularity
     * @throws IllegalArgumentException if {@code code} is {@code null} or unknown
     */
    public static Granularity fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (Granularity g : values()) {
                if (g.code.equals(normalized)) {
                    return g;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unknown granularity: '" + code + "'. Supported: day, week, month");
    }
}
