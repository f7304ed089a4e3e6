package com.backupinsight.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of deviation an {@link Anomaly} reports.
 *
 * @since 1.0.0
 */
public enum AnomalyType {
    DURATION_HIGH("duration_high"),
    DURATION_LOW("duration_low"),
    COUNT_HIGH("count_high"),
    COUNT_LOW("count_low"),
    FAILURE_RATE_HIGH("failure_rate_high"),
    SUCCESS_RATE_LOW("success_rate_low");

    private final String code;

    AnomalyType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
