package com.backupinsight.core.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Summary statistics of all records sharing one period and one
 * classification key.
 *
 * <p>
 * The granularity-specific identity (day, ISO week or month) is carried by
 * the {@link PeriodDetail} payload; this class holds what every granularity
 * has in common. Durations are in seconds.
 * </p>
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>{@code totalCount == successCount + failureCount + partialCount}</li>
 * <li>{@code maxDuration >= minDuration} whenever {@code totalCount > 0}</li>
 * <li>{@code periodStart <= periodEnd}, guaranteed by the payload</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class AggregatedMetrics {

    private final PeriodDetail period;
    private final String classificationKey;

    private final double averageDuration;
    private final double maxDuration;
    private final double minDuration;
    private final double totalDuration;

    private final int totalCount;
    private final int successCount;
    private final int failureCount;
    private final int partialCount;

    private final boolean anomalyFlag;
    private final Map<String, Object> metadata;

    private AggregatedMetrics(Builder b) {
        this.period = b.period;
        this.classificationKey = b.classificationKey;
        this.averageDuration = b.averageDuration;
        this.maxDuration = b.maxDuration;
        this.minDuration = b.minDuration;
        this.totalDuration = b.totalDuration;
        this.totalCount = b.totalCount;
        this.successCount = b.successCount;
        this.failureCount = b.failureCount;
        this.partialCount = b.partialCount;
        this.anomalyFlag = b.anomalyFlag;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build the all-zero aggregate used as a stand-in for a missing period.
     *
     * @param period            the period the baseline represents
     * @param classificationKey key it is compared under
     * @return an aggregate with every count and duration at zero
     */
    public static AggregatedMetrics zeroBaseline(PeriodDetail period, String classificationKey) {
        return builder()
                .period(period)
                .classificationKey(classificationKey)
                .build();
    }

    /**
     * @param flag new anomaly flag
     * @return this instance if unchanged, otherwise a copy carrying {@code flag}
     */
    public AggregatedMetrics withAnomalyFlag(boolean flag) {
        if (flag == anomalyFlag) {
            return this;
        }
        return toBuilder().anomalyFlag(flag).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .period(period)
                .classificationKey(classificationKey)
                .averageDuration(averageDuration)
                .maxDuration(maxDuration)
                .minDuration(minDuration)
                .totalDuration(totalDuration)
                .totalCount(totalCount)
                .successCount(successCount)
                .failureCount(failureCount)
                .partialCount(partialCount)
                .anomalyFlag(anomalyFlag)
                .metadata(metadata);
    }

    // ---------------------------------------------------------------
    // Period
    // ---------------------------------------------------------------

    public PeriodDetail getPeriod() {
        return period;
    }

    public Granularity getGranularity() {
        return period.getGranularity();
    }

    public LocalDate getPeriodStart() {
        return period.getPeriodStart();
    }

    public LocalDate getPeriodEnd() {
        return period.getPeriodEnd();
    }

    public String getClassificationKey() {
        return classificationKey;
    }

    // ---------------------------------------------------------------
    // Durations
    // ---------------------------------------------------------------

    public double getAverageDuration() {
        return averageDuration;
    }

    public double getMaxDuration() {
        return maxDuration;
    }

    public double getMinDuration() {
        return minDuration;
    }

    public double getTotalDuration() {
        return totalDuration;
    }

    // ---------------------------------------------------------------
    // Counts and rates
    // ---------------------------------------------------------------

    public int getTotalCount() {
        return totalCount;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public int getPartialCount() {
        return partialCount;
    }

    /**
     * @return successful share of all runs in percent, 0 when there were none
     */
    public double getSuccessRate() {
        return percentage(successCount);
    }

    /**
     * @return failed share of all runs in percent, 0 when there were none
     */
    public double getFailureRate() {
        return percentage(failureCount);
    }

    private double percentage(int count) {
        if (totalCount == 0) {
            return 0.0;
        }
        return (double) count / totalCount * 100.0;
    }

    public boolean isAnomalyFlag() {
        return anomalyFlag;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AggregatedMetrics that))
            return false;
        return Double.compare(averageDuration, that.averageDuration) == 0
                && Double.compare(maxDuration, that.maxDuration) == 0
                && Double.compare(minDuration, that.minDuration) == 0
                && Double.compare(totalDuration, that.totalDuration) == 0
                && totalCount == that.totalCount
                && successCount == that.successCount
                && failureCount == that.failureCount
                && partialCount == that.partialCount
                && anomalyFlag == that.anomalyFlag
                && period.equals(that.period)
                && classificationKey.equals(that.classificationKey)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, classificationKey, averageDuration, maxDuration, minDuration,
                totalDuration, totalCount, successCount, failureCount, partialCount, anomalyFlag, metadata);
    }

    @Override
    public String toString() {
        return "AggregatedMetrics{" +
                "period=" + period.getLabel() +
                ", granularity=" + period.getGranularity().getCode() +
                ", classificationKey='" + classificationKey + '\'' +
                ", averageDuration=" + averageDuration +
                ", maxDuration=" + maxDuration +
                ", minDuration=" + minDuration +
                ", totalDuration=" + totalDuration +
                ", totalCount=" + totalCount +
                ", successCount=" + successCount +
                ", failureCount=" + failureCount +
                ", partialCount=" + partialCount +
                ", anomalyFlag=" + anomalyFlag +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AggregatedMetrics}.
     *
     * <p>
     * {@code period} and {@code classificationKey} are required; every
     * numeric field defaults to zero. {@link #build()} checks the count and
     * duration invariants.
     * </p>
     */
    public static class Builder {
        private PeriodDetail period;
        private String classificationKey;
        private double averageDuration;
        private double maxDuration;
        private double minDuration;
        private double totalDuration;
        private int totalCount;
        private int successCount;
        private int failureCount;
        private int partialCount;
        private boolean anomalyFlag;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder period(PeriodDetail period) {
            this.period = period;
            return this;
        }

        public Builder classificationKey(String classificationKey) {
            this.classificationKey = classificationKey;
            return this;
        }

        public Builder averageDuration(double averageDuration) {
            this.averageDuration = averageDuration;
            return this;
        }

        public Builder maxDuration(double maxDuration) {
            this.maxDuration = maxDuration;
            return this;
        }

        public Builder minDuration(double minDuration) {
            this.minDuration = minDuration;
            return this;
        }

        public Builder totalDuration(double totalDuration) {
            this.totalDuration = totalDuration;
            return this;
        }

        public Builder totalCount(int totalCount) {
            this.totalCount = totalCount;
            return this;
        }

        public Builder successCount(int successCount) {
            this.successCount = successCount;
            return this;
        }

        public Builder failureCount(int failureCount) {
            this.failureCount = failureCount;
            return this;
        }

        public Builder partialCount(int partialCount) {
            this.partialCount = partialCount;
            return this;
        }

        public Builder anomalyFlag(boolean anomalyFlag) {
            this.anomalyFlag = anomalyFlag;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        /**
         * @return a new {@link AggregatedMetrics}
         * @throws NullPointerException  if {@code period} or
         *                               {@code classificationKey} is missing
         * @throws IllegalStateException if the counts or durations are
         *                               inconsistent
         */
        public AggregatedMetrics build() {
            Objects.requireNonNull(period, "period must not be null");
            Objects.requireNonNull(classificationKey, "classificationKey must not be null");

            List<String> errors = new ArrayList<>();
            if (successCount < 0 || failureCount < 0 || partialCount < 0) {
                errors.add("status counts must not be negative");
            }
            if (totalCount != successCount + failureCount + partialCount) {
                errors.add("totalCount " + totalCount + " != success " + successCount
                        + " + failure " + failureCount + " + partial " + partialCount);
            }
            if (totalCount > 0 && maxDuration < minDuration) {
                errors.add("maxDuration " + maxDuration + " < minDuration " + minDuration);
            }
            if (!errors.isEmpty()) {
                throw new IllegalStateException(
                        "Invalid AggregatedMetrics: " + String.join("; ", errors));
            }
            return new AggregatedMetrics(this);
        }
    }
}
