package com.backupinsight.core.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single metric of one period that fell outside its historical bounds.
 *
 * <p>
 * {@code deviationPercentage} is always {@code (current - expected) /
 * expected * 100}: positive for the {@code *_HIGH} types, negative for the
 * {@code *_LOW} ones. When the expectation is zero it is reported as
 * {@code +100}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Anomaly {

    private final AnomalyType type;
    private final AnomalySeverity severity;
    private final String metricName;
    private final double currentValue;
    private final double expectedValue;
    private final double thresholdValue;
    private final double deviationPercentage;
    private final LocalDate periodStart;
    private final LocalDate periodEnd;
    private final String classificationKey;
    private final Granularity granularity;
    private final Map<String, Object> metadata;

    private Anomaly(Builder b) {
        this.type = Objects.requireNonNull(b.type, "type must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        this.currentValue = b.currentValue;
        this.expectedValue = b.expectedValue;
        this.thresholdValue = b.thresholdValue;
        this.deviationPercentage = b.deviationPercentage;
        this.periodStart = Objects.requireNonNull(b.periodStart, "periodStart must not be null");
        this.periodEnd = Objects.requireNonNull(b.periodEnd, "periodEnd must not be null");
        this.classificationKey = Objects.requireNonNull(b.classificationKey, "classificationKey must not be null");
        this.granularity = Objects.requireNonNull(b.granularity, "granularity must not be null");
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    public AnomalyType getType() {
        return type;
    }

    public AnomalySeverity getSeverity() {
        return severity;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public double getThresholdValue() {
        return thresholdValue;
    }

    public double getDeviationPercentage() {
        return deviationPercentage;
    }

    public LocalDate getPeriodStart() {
        return periodStart;
    }

    public LocalDate getPeriodEnd() {
        return periodEnd;
    }

    public String getClassificationKey() {
        return classificationKey;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public boolean isCritical() {
        return severity == AnomalySeverity.CRITICAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return type == that.type
                && severity == that.severity
                && metricName.equals(that.metricName)
                && Double.compare(currentValue, that.currentValue) == 0
                && Double.compare(expectedValue, that.expectedValue) == 0
                && Double.compare(thresholdValue, that.thresholdValue) == 0
                && Double.compare(deviationPercentage, that.deviationPercentage) == 0
                && periodStart.equals(that.periodStart)
                && periodEnd.equals(that.periodEnd)
                && classificationKey.equals(that.classificationKey)
                && granularity == that.granularity
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, severity, metricName, currentValue, periodStart, classificationKey, granularity);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "type=" + type.getCode() +
                ", severity=" + severity +
                ", metricName='" + metricName + '\'' +
                ", currentValue=" + currentValue +
                ", expectedValue=" + expectedValue +
                ", thresholdValue=" + thresholdValue +
                ", deviationPercentage=" + deviationPercentage +
                ", period=" + periodStart + ".." + periodEnd +
                ", classificationKey='" + classificationKey + '\'' +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link Anomaly}. Everything except the metadata is
     * required.
     */
    public static class Builder {
        private AnomalyType type;
        private AnomalySeverity severity;
        private String metricName;
        private double currentValue;
        private double expectedValue;
        private double thresholdValue;
        private double deviationPercentage;
        private LocalDate periodStart;
        private LocalDate periodEnd;
        private String classificationKey;
        private Granularity granularity;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public Builder severity(AnomalySeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder expectedValue(double expectedValue) {
            this.expectedValue = expectedValue;
            return this;
        }

        public Builder thresholdValue(double thresholdValue) {
            this.thresholdValue = thresholdValue;
            return this;
        }

        public Builder deviationPercentage(double deviationPercentage) {
            this.deviationPercentage = deviationPercentage;
            return this;
        }

        /**
         * Copy period boundaries, key and granularity from the analyzed
         * aggregate.
         *
         * @param metrics the aggregate the anomaly was found in
         * @return this builder
         */
        public Builder context(AggregatedMetrics metrics) {
            this.periodStart = metrics.getPeriodStart();
            this.periodEnd = metrics.getPeriodEnd();
            this.classificationKey = metrics.getClassificationKey();
            this.granularity = metrics.getGranularity();
            return this;
        }

        public Builder putMetadata(String key, Object value) {
            this.metadata.put(Objects.requireNonNull(key, "metadata key must not be null"), value);
            return this;
        }

        /**
         * @return a new {@link Anomaly}
         * @throws NullPointerException if a required field is missing
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }
}
