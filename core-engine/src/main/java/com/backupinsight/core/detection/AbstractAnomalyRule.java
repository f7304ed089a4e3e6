package com.backupinsight.core.detection;

import com.backupinsight.core.config.InvalidConfigurationException;
import com.backupinsight.core.model.AggregatedMetrics;
import com.backupinsight.core.model.Anomaly;
import com.backupinsight.core.model.AnomalySeverity;
import com.backupinsight.core.model.AnomalyType;

/**
 * Shared plumbing for the ratio-bound rule families: the configured
 * multiplier, the deviation formula and anomaly construction.
 *
 * @since 1.0.0
 */
public abstract class AbstractAnomalyRule implements AnomalyRule {

    /** Deviation reported when the historical expectation is zero. */
    protected static final double ZERO_BASELINE_DEVIATION = 100.0;

    protected final double thresholdMultiplier;

    /**
     * @param thresholdMultiplier ratio between the mean and the high/low bounds
     * @throws InvalidConfigurationException if the multiplier is not positive
     */
    protected AbstractAnomalyRule(double thresholdMultiplier) {
        if (!(thresholdMultiplier > 0)) {
            throw new InvalidConfigurationException(
                    "thresholdMultiplier must be > 0 for rule '" + getRuleName() + "', got: " + thresholdMultiplier);
        }
        this.thresholdMultiplier = thresholdMultiplier;
    }

    protected double upperBound(double mean) {
        return mean * thresholdMultiplier;
    }

    protected double lowerBound(double mean) {
        return mean / thresholdMultiplier;
    }

    /**
     * @return {@code (current - expected) / expected * 100}, or
     *         {@value #ZERO_BASELINE_DEVIATION} when {@code expected} is zero
     */
    protected static double deviation(double current, double expected) {
        if (expected == 0) {
            return ZERO_BASELINE_DEVIATION;
        }
        return (current - expected) / expected * 100.0;
    }

    protected static Anomaly anomaly(AggregatedMetrics current, AnomalyType type, AnomalySeverity severity,
                                     String metricName, double currentValue, double expectedValue,
                                     double thresholdValue, double deviationPercentage) {
        return Anomaly.builder()
                .type(type)
                .severity(severity)
                .metricName(metricName)
                .currentValue(currentValue)
                .expectedValue(expectedValue)
                .thresholdValue(thresholdValue)
                .deviationPercentage(deviationPercentage)
                .context(current)
                .build();
    }
}
