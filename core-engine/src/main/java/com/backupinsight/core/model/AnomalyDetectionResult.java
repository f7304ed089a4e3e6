package com.backupinsight.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of evaluating one aggregate against its history.
 *
 * <p>
 * Too little history is not an error: the result simply reports
 * {@code hasAnomaly == false} together with the number of samples that
 * were available.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyDetectionResult {

    private final boolean hasAnomaly;
    private final List<Anomaly> anomalies;
    private final AggregatedMetrics metrics;
    private final Double historicalAverage;
    private final int samplesUsed;

    /**
     * @param anomalies         detected anomalies in evaluation order
     * @param metrics           the analyzed aggregate
     * @param historicalAverage mean historical average duration, or
     *                          {@code null} when no evaluation took place
     * @param samplesUsed       number of historical aggregates considered
     */
    public AnomalyDetectionResult(List<Anomaly> anomalies, AggregatedMetrics metrics,
                                  Double historicalAverage, int samplesUsed) {
        this.anomalies = List.copyOf(Objects.requireNonNull(anomalies, "anomalies must not be null"));
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.hasAnomaly = !this.anomalies.isEmpty();
        this.historicalAverage = historicalAverage;
        this.samplesUsed = samplesUsed;
    }

    /**
     * Result for an aggregate that was not evaluated.
     *
     * @param metrics     the aggregate
     * @param samplesUsed history available at the time
     * @return a result without anomalies or historical average
     */
    public static AnomalyDetectionResult notEvaluated(AggregatedMetrics metrics, int samplesUsed) {
        return new AnomalyDetectionResult(List.of(), metrics, null, samplesUsed);
    }

    public boolean isHasAnomaly() {
        return hasAnomaly;
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    public AggregatedMetrics getMetrics() {
        return metrics;
    }

    public Double getHistoricalAverage() {
        return historicalAverage;
    }

    public int getSamplesUsed() {
        return samplesUsed;
    }

    public int getAnomalyCount() {
        return anomalies.size();
    }

    @JsonIgnore
    public List<Anomaly> getCriticalAnomalies() {
        return anomalies.stream().filter(Anomaly::isCritical).toList();
    }

    @JsonIgnore
    public Optional<AnomalySeverity> getHighestSeverity() {
        return anomalies.stream()
                .map(Anomaly::getSeverity)
                .max(Comparator.comparingInt(AnomalySeverity::getLevel));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyDetectionResult that))
            return false;
        return samplesUsed == that.samplesUsed
                && anomalies.equals(that.anomalies)
                && metrics.equals(that.metrics)
                && Objects.equals(historicalAverage, that.historicalAverage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomalies, metrics, historicalAverage, samplesUsed);
    }

    @Override
    public String toString() {
        return "AnomalyDetectionResult{" +
                "hasAnomaly=" + hasAnomaly +
                ", anomalies=" + anomalies.size() +
                ", period=" + metrics.getPeriod().getLabel() +
                ", classificationKey='" + metrics.getClassificationKey() + '\'' +
                ", historicalAverage=" + historicalAverage +
                ", samplesUsed=" + samplesUsed +
                '}';
    }
}
