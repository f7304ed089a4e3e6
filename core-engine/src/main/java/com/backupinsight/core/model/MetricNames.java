package com.backupinsight.core.model;

/**
 * Names under which metrics appear in deltas and anomalies.
 *
 * @since 1.0.0
 */
public final class MetricNames {

    public static final String AVERAGE_DURATION = "average_duration";
    public static final String MAX_DURATION = "max_duration";
    public static final String MIN_DURATION = "min_duration";
    public static final String TOTAL_DURATION = "total_duration";
    public static final String TOTAL_COUNT = "total_count";
    public static final String SUCCESS_COUNT = "success_count";
    public static final String FAILURE_COUNT = "failure_count";
    public static final String PARTIAL_COUNT = "partial_count";
    public static final String SUCCESS_RATE = "success_rate";
    public static final String FAILURE_RATE = "failure_rate";

    private MetricNames() {
        // constants holder - not instantiable
    }
}
