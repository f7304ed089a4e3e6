package com.backupinsight.core.analysis;

import com.backupinsight.core.model.AggregatedMetrics;
import com.backupinsight.core.model.AnomalyDetectionResult;
import com.backupinsight.core.model.Granularity;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Everything computed for one batch of records, by granularity.
 *
 * @since 1.0.0
 */
public final class AnalysisReport {

    private final int recordCount;
    private final List<GranularityAnalysis> analyses;

    public AnalysisReport(int recordCount, List<GranularityAnalysis> analyses) {
        this.recordCount = recordCount;
        this.analyses = List.copyOf(Objects.requireNonNull(analyses, "analyses must not be null"));
    }

    public int getRecordCount() {
        return recordCount;
    }

    /**
     * @return one entry per configured granularity, in day, week, month order
     */
    public List<GranularityAnalysis> getAnalyses() {
        return analyses;
    }

    /**
     * @param granularity period size
     * @return the analysis, or empty if that granularity was not configured
     */
    public Optional<GranularityAnalysis> forGranularity(Granularity granularity) {
        return analyses.stream()
                .filter(a -> a.getGranularity() == granularity)
                .findFirst();
    }

    /**
     * @return every detection result with at least one anomaly, across all
     *         granularities
     */
    @JsonIgnore
    public List<AnomalyDetectionResult> getAnomalousResults() {
        List<AnomalyDetectionResult> results = new ArrayList<>();
        for (GranularityAnalysis analysis : analyses) {
            results.addAll(analysis.getAnomalousDetections());
        }
        return Collections.unmodifiableList(results);
    }

    public int getTotalAnomalyCount() {
        int count = 0;
        for (GranularityAnalysis analysis : analyses) {
            for (AnomalyDetectionResult result : analysis.getDetections()) {
                count += result.getAnomalyCount();
            }
        }
        return count;
    }

    /**
     * @return sorted distinct classification keys seen in any aggregate
     */
    public Set<String> getClassificationKeys() {
        Set<String> keys = new TreeSet<>();
        for (GranularityAnalysis analysis : analyses) {
            for (AggregatedMetrics metrics : analysis.getAggregates()) {
                keys.add(metrics.getClassificationKey());
            }
        }
        return Collections.unmodifiableSet(keys);
    }

    @Override
    public String toString() {
        return "AnalysisReport{" +
                "recordCount=" + recordCount +
                ", analyses=" + analyses +
                '}';
    }
}
