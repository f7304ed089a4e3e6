package com.backupinsight.core.model;

import java.util.Locale;

/**
 * Outcome of a single backup job execution.
 *
 * @since 1.0.0
 */
public enum RecordStatus {
    SUCCESS,
    FAILURE,
    PARTIAL;

    /**
     * Resolve a status from its case-insensitive name.
     *
     * @param value status name, e.g. {@code "success"}
     * @return the matching status
     * @throws NullPointerException     if {@code value} is {@code null}
     * @throws IllegalArgumentException if the name is unknown
     */
    public static RecordStatus fromString(String value) {
        return RecordStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
