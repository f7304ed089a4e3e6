package com.backupinsight.core.detection;

import com.backupinsight.core.model.AggregatedMetrics;

import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Trailing, same-key history an aggregate is judged against.
 *
 * <p>
 * Samples are kept in the caller's order (oldest first). The window is
 * never empty once rules are evaluated, because the detector abstains below
 * its minimum sample count.
 * </p>
 *
 * @since 1.0.0
 */
public final class HistoryWindow {

    private final List<AggregatedMetrics> samples;

    public HistoryWindow(List<AggregatedMetrics> samples) {
        this.samples = List.copyOf(Objects.requireNonNull(samples, "samples must not be null"));
    }

    public List<AggregatedMetrics> getSamples() {
        return samples;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /**
     * @param metric value extracted from each sample
     * @return arithmetic mean, 0 for an empty window
     */
    public double mean(ToDoubleFunction<AggregatedMetrics> metric) {
        if (samples.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (AggregatedMetrics m : samples) {
            sum += metric.applyAsDouble(m);
        }
        return sum / samples.size();
    }

    /**
     * Sample standard deviation (Bessel-corrected, divides by n - 1).
     *
     * @param metric value extracted from each sample
     * @return standard deviation, 0 with fewer than two samples
     */
    public double standardDeviation(ToDoubleFunction<AggregatedMetrics> metric) {
        if (samples.size() < 2) {
            return 0.0;
        }
        double mean = mean(metric);
        double sumSquaredDiff = 0;
        for (AggregatedMetrics m : samples) {
            double diff = metric.applyAsDouble(m) - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (samples.size() - 1));
    }
}
