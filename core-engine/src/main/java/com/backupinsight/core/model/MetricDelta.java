package com.backupinsight.core.model;

import java.util.Objects;

/**
 * Change of one metric between a period and its predecessor.
 *
 * @since 1.0.0
 */
public final class MetricDelta {

    /** Absolute changes smaller than this are treated as no change. */
    public static final double UNCHANGED_TOLERANCE = 1e-4;

    private final String metricName;
    private final double currentValue;
    private final double previousValue;
    private final double absoluteDelta;
    private final double percentageDelta;

    public MetricDelta(String metricName, double currentValue, double previousValue,
                       double absoluteDelta, double percentageDelta) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.currentValue = currentValue;
        this.previousValue = previousValue;
        this.absoluteDelta = absoluteDelta;
        this.percentageDelta = percentageDelta;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getPreviousValue() {
        return previousValue;
    }

    public double getAbsoluteDelta() {
        return absoluteDelta;
    }

    public double getPercentageDelta() {
        return percentageDelta;
    }

    public boolean isIncrease() {
        return !isUnchanged() && absoluteDelta > 0;
    }

    public boolean isDecrease() {
        return !isUnchanged() && absoluteDelta < 0;
    }

    public boolean isUnchanged() {
        return Math.abs(absoluteDelta) < UNCHANGED_TOLERANCE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricDelta that))
            return false;
        return metricName.equals(that.metricName)
                && Double.compare(currentValue, that.currentValue) == 0
                && Double.compare(previousValue, that.previousValue) == 0
                && Double.compare(absoluteDelta, that.absoluteDelta) == 0
                && Double.compare(percentageDelta, that.percentageDelta) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, currentValue, previousValue, absoluteDelta, percentageDelta);
    }

    @Override
    public String toString() {
        return "MetricDelta{" +
                "metricName='" + metricName + '\'' +
                ", currentValue=" + currentValue +
                ", previousValue=" + previousValue +
                ", absoluteDelta=" + absoluteDelta +
                ", percentageDelta=" + percentageDelta +
                '}';
    }
}
