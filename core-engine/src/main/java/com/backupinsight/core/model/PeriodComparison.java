package com.backupinsight.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Metric-by-metric comparison of one period against the period before it.
 *
 * <p>
 * When no real previous period exists the comparison is made against a zero
 * baseline: {@link #isHasPreviousData()} is {@code false},
 * {@link #getPreviousMetrics()} is {@code null}, and the previous period
 * boundaries are those of the calendar predecessor.
 * </p>
 *
 * <p>
 * Delta maps are keyed by metric name and keep insertion order.
 * </p>
 *
 * @since 1.0.0
 */
public final class PeriodComparison {

    private final Granularity granularity;
    private final String classificationKey;
    private final LocalDate currentPeriodStart;
    private final LocalDate currentPeriodEnd;
    private final LocalDate previousPeriodStart;
    private final LocalDate previousPeriodEnd;
    private final AggregatedMetrics currentMetrics;
    private final AggregatedMetrics previousMetrics;
    private final Map<String, MetricDelta> durationDeltas;
    private final Map<String, MetricDelta> countDeltas;
    private final Map<String, MetricDelta> rateDeltas;
    private final boolean hasPreviousData;

    private PeriodComparison(Builder b) {
        this.granularity = Objects.requireNonNull(b.granularity, "granularity must not be null");
        this.classificationKey = Objects.requireNonNull(b.classificationKey, "classificationKey must not be null");
        this.currentPeriodStart = Objects.requireNonNull(b.currentPeriodStart, "currentPeriodStart must not be null");
        this.currentPeriodEnd = Objects.requireNonNull(b.currentPeriodEnd, "currentPeriodEnd must not be null");
        this.previousPeriodStart = Objects.requireNonNull(b.previousPeriodStart, "previousPeriodStart must not be null");
        this.previousPeriodEnd = Objects.requireNonNull(b.previousPeriodEnd, "previousPeriodEnd must not be null");
        this.currentMetrics = Objects.requireNonNull(b.currentMetrics, "currentMetrics must not be null");
        this.previousMetrics = b.previousMetrics;
        this.durationDeltas = Collections.unmodifiableMap(new LinkedHashMap<>(b.durationDeltas));
        this.countDeltas = Collections.unmodifiableMap(new LinkedHashMap<>(b.countDeltas));
        this.rateDeltas = Collections.unmodifiableMap(new LinkedHashMap<>(b.rateDeltas));
        this.hasPreviousData = b.hasPreviousData;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public String getClassificationKey() {
        return classificationKey;
    }

    public LocalDate getCurrentPeriodStart() {
        return currentPeriodStart;
    }

    public LocalDate getCurrentPeriodEnd() {
        return currentPeriodEnd;
    }

    public LocalDate getPreviousPeriodStart() {
        return previousPeriodStart;
    }

    public LocalDate getPreviousPeriodEnd() {
        return previousPeriodEnd;
    }

    public AggregatedMetrics getCurrentMetrics() {
        return currentMetrics;
    }

    /**
     * @return the real previous aggregate, or {@code null} for a zero-baseline
     *         comparison
     */
    public AggregatedMetrics getPreviousMetrics() {
        return previousMetrics;
    }

    public Map<String, MetricDelta> getDurationDeltas() {
        return durationDeltas;
    }

    public Map<String, MetricDelta> getCountDeltas() {
        return countDeltas;
    }

    public Map<String, MetricDelta> getRateDeltas() {
        return rateDeltas;
    }

    /**
     * @return duration, count and rate deltas merged, in that order
     */
    @JsonIgnore
    public Map<String, MetricDelta> getAllDeltas() {
        Map<String, MetricDelta> all = new LinkedHashMap<>(durationDeltas);
        all.putAll(countDeltas);
        all.putAll(rateDeltas);
        return Collections.unmodifiableMap(all);
    }

    public boolean isHasPreviousData() {
        return hasPreviousData;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PeriodComparison that))
            return false;
        return hasPreviousData == that.hasPreviousData
                && granularity == that.granularity
                && classificationKey.equals(that.classificationKey)
                && currentMetrics.equals(that.currentMetrics)
                && Objects.equals(previousMetrics, that.previousMetrics)
                && previousPeriodStart.equals(that.previousPeriodStart)
                && previousPeriodEnd.equals(that.previousPeriodEnd)
                && getAllDeltas().equals(that.getAllDeltas());
    }

    @Override
    public int hashCode() {
        return Objects.hash(granularity, classificationKey, currentMetrics, previousPeriodStart, hasPreviousData);
    }

    @Override
    public String toString() {
        return "PeriodComparison{" +
                "granularity=" + granularity.getCode() +
                ", classificationKey='" + classificationKey + '\'' +
                ", current=" + currentPeriodStart + ".." + currentPeriodEnd +
                ", previous=" + previousPeriodStart + ".." + previousPeriodEnd +
                ", hasPreviousData=" + hasPreviousData +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private Granularity granularity;
        private String classificationKey;
        private LocalDate currentPeriodStart;
        private LocalDate currentPeriodEnd;
        private LocalDate previousPeriodStart;
        private LocalDate previousPeriodEnd;
        private AggregatedMetrics currentMetrics;
        private AggregatedMetrics previousMetrics;
        private Map<String, MetricDelta> durationDeltas = Map.of();
        private Map<String, MetricDelta> countDeltas = Map.of();
        private Map<String, MetricDelta> rateDeltas = Map.of();
        private boolean hasPreviousData;

        public Builder granularity(Granularity granularity) {
            this.granularity = granularity;
            return this;
        }

        public Builder classificationKey(String classificationKey) {
            this.classificationKey = classificationKey;
            return this;
        }

        public Builder currentPeriod(LocalDate start, LocalDate end) {
            this.currentPeriodStart = start;
            this.currentPeriodEnd = end;
            return this;
        }

        public Builder previousPeriod(LocalDate start, LocalDate end) {
            this.previousPeriodStart = start;
            this.previousPeriodEnd = end;
            return this;
        }

        public Builder currentMetrics(AggregatedMetrics currentMetrics) {
            this.currentMetrics = currentMetrics;
            return this;
        }

        public Builder previousMetrics(AggregatedMetrics previousMetrics) {
            this.previousMetrics = previousMetrics;
            return this;
        }

        public Builder durationDeltas(Map<String, MetricDelta> durationDeltas) {
            this.durationDeltas = Objects.requireNonNull(durationDeltas);
            return this;
        }

        public Builder countDeltas(Map<String, MetricDelta> countDeltas) {
            this.countDeltas = Objects.requireNonNull(countDeltas);
            return this;
        }

        public Builder rateDeltas(Map<String, MetricDelta> rateDeltas) {
            this.rateDeltas = Objects.requireNonNull(rateDeltas);
            return this;
        }

        public Builder hasPreviousData(boolean hasPreviousData) {
            this.hasPreviousData = hasPreviousData;
            return this;
        }

        /**
         * @return a new {@link PeriodComparison}
         * @throws NullPointerException if a required field is missing
         */
        public PeriodComparison build() {
            return new PeriodComparison(this);
        }
    }
}
