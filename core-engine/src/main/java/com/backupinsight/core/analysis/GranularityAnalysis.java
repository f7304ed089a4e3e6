package com.backupinsight.core.analysis;

import com.backupinsight.core.model.AggregatedMetrics;
import com.backupinsight.core.model.AnomalyDetectionResult;
import com.backupinsight.core.model.Granularity;
import com.backupinsight.core.model.PeriodComparison;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * Aggregates, comparisons and detection results for one granularity.
 *
 * @since 1.0.0
 */
public final class GranularityAnalysis {

    private final Granularity granularity;
    private final List<AggregatedMetrics> aggregates;
    private final List<PeriodComparison> comparisons;
    private final List<AnomalyDetectionResult> detections;

    public GranularityAnalysis(Granularity granularity, List<AggregatedMetrics> aggregates,
                               List<PeriodComparison> comparisons, List<AnomalyDetectionResult> detections) {
        this.granularity = Objects.requireNonNull(granularity, "granularity must not be null");
        this.aggregates = List.copyOf(aggregates);
        this.comparisons = List.copyOf(comparisons);
        this.detections = List.copyOf(detections);
    }

    public Granularity getGranularity() {
        return granularity;
    }

    /**
     * @return aggregates sorted by period then key, anomaly flags set
     */
    public List<AggregatedMetrics> getAggregates() {
        return aggregates;
    }

    /**
     * @return comparisons grouped by key, each group oldest first
     */
    public List<PeriodComparison> getComparisons() {
        return comparisons;
    }

    /**
     * @return detection results grouped by key, each group oldest first
     */
    public List<AnomalyDetectionResult> getDetections() {
        return detections;
    }

    @JsonIgnore
    public List<AnomalyDetectionResult> getAnomalousDetections() {
        return detections.stream().filter(AnomalyDetectionResult::isHasAnomaly).toList();
    }

    @Override
    public String toString() {
        return "GranularityAnalysis{" +
                "granularity=" + granularity.getCode() +
                ", aggregates=" + aggregates.size() +
                ", comparisons=" + comparisons.size() +
                ", anomalous=" + getAnomalousDetections().size() +
                '}';
    }
}
