package com.backupinsight.core.comparison;

import com.backupinsight.core.model.AggregatedMetrics;
import com.backupinsight.core.model.MetricDelta;
import com.backupinsight.core.model.MetricNames;
import com.backupinsight.core.model.PeriodComparison;
import com.backupinsight.core.model.PeriodDetail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes metric deltas between consecutive periods.
 *
 * <h3>Percentage convention</h3>
 * <p>
 * {@code percentage = (current - previous) / previous * 100}. A zero previous
 * value yields {@code 0} when the current value is also zero and a flat
 * {@code +100} / {@code -100} otherwise, following the sign of the current
 * value.
 * </p>
 *
 * <h3>Zero baseline</h3>
 * <p>
 * Without a previous aggregate the comparison is made against an all-zero
 * aggregate of the calendar predecessor (previous day, ISO week or month).
 * </p>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class PeriodComparator {

    private static final Logger LOG = LoggerFactory.getLogger(PeriodComparator.class);

    /**
     * Compare a period with its predecessor.
     *
     * @param current  the period of interest; must not be {@code null}
     * @param previous the preceding period, or {@code null} to compare
     *                 against a zero baseline
     * @return the comparison
     */
    public PeriodComparison compare(AggregatedMetrics current, AggregatedMetrics previous) {
        Objects.requireNonNull(current, "Current metrics must not be null");

        boolean hasPrevious = previous != null;
        AggregatedMetrics baseline = hasPrevious
                ? previous
                : zeroBaselineFor(current);

        if (hasPrevious && previous.getGranularity() != current.getGranularity()) {
            LOG.warn("Comparing {} period {} against {} period {}",
                    current.getGranularity().getCode(), current.getPeriod().getLabel(),
                    previous.getGranularity().getCode(), previous.getPeriod().getLabel());
        }

        return PeriodComparison.builder()
                .granularity(current.getGranularity())
                .classificationKey(current.getClassificationKey())
                .currentPeriod(current.getPeriodStart(), current.getPeriodEnd())
                .previousPeriod(baseline.getPeriodStart(), baseline.getPeriodEnd())
                .currentMetrics(current)
                .previousMetrics(hasPrevious ? previous : null)
                .durationDeltas(durationDeltas(current, baseline))
                .countDeltas(countDeltas(current, baseline))
                .rateDeltas(rateDeltas(current, baseline))
                .hasPreviousData(hasPrevious)
                .build();
    }

    /**
     * Compare each entry of a chronologically ordered series with the entry
     * before it.
     *
     * <p>
     * Pairs whose classification keys differ are skipped. A single-entry
     * series yields one comparison against the zero baseline; an empty series
     * yields nothing.
     * </p>
     *
     * @param metrics aggregates ordered oldest first
     * @return unmodifiable list of comparisons
     */
    public List<PeriodComparison> compareSequence(List<AggregatedMetrics> metrics) {
        Objects.requireNonNull(metrics, "Metrics list must not be null");

        if (metrics.isEmpty()) {
            return List.of();
        }
        if (metrics.size() == 1) {
            return List.of(compare(metrics.get(0), null));
        }

        List<PeriodComparison> comparisons = new ArrayList<>(metrics.size() - 1);
        for (int i = 1; i < metrics.size(); i++) {
            AggregatedMetrics current = metrics.get(i);
            AggregatedMetrics previous = metrics.get(i - 1);

            if (!current.getClassificationKey().equals(previous.getClassificationKey())) {
                LOG.trace("Skipping pair at index {}: key changed from '{}' to '{}'",
                        i, previous.getClassificationKey(), current.getClassificationKey());
                continue;
            }
            comparisons.add(compare(current, previous));
        }

        LOG.debug("Compared {} aggregate(s) into {} comparison(s)", metrics.size(), comparisons.size());
        return Collections.unmodifiableList(comparisons);
    }

    /**
     * @param metricName    metric identifier
     * @param currentValue  value in the current period
     * @param previousValue value in the previous period
     * @return the delta, never {@code null}
     */
    public static MetricDelta delta(String metricName, double currentValue, double previousValue) {
        double absolute = currentValue - previousValue;
        double percentage;
        if (previousValue == 0) {
            if (currentValue == 0) {
                percentage = 0.0;
            } else {
                percentage = currentValue > 0 ? 100.0 : -100.0;
            }
        } else {
            percentage = absolute / previousValue * 100.0;
        }
        return new MetricDelta(metricName, currentValue, previousValue, absolute, percentage);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AggregatedMetrics zeroBaselineFor(AggregatedMetrics current) {
        PeriodDetail previousPeriod = current.getPeriod().previous();
        return AggregatedMetrics.zeroBaseline(previousPeriod, current.getClassificationKey());
    }

    private static Map<String, MetricDelta> durationDeltas(AggregatedMetrics current, AggregatedMetrics previous) {
        Map<String, MetricDelta> deltas = new LinkedHashMap<>();
        put(deltas, delta(MetricNames.AVERAGE_DURATION, current.getAverageDuration(), previous.getAverageDuration()));
        put(deltas, delta(MetricNames.MAX_DURATION, current.getMaxDuration(), previous.getMaxDuration()));
        put(deltas, delta(MetricNames.MIN_DURATION, current.getMinDuration(), previous.getMinDuration()));
        put(deltas, delta(MetricNames.TOTAL_DURATION, current.getTotalDuration(), previous.getTotalDuration()));
        return deltas;
    }

    private static Map<String, MetricDelta> countDeltas(AggregatedMetrics current, AggregatedMetrics previous) {
        Map<String, MetricDelta> deltas = new LinkedHashMap<>();
        put(deltas, delta(MetricNames.TOTAL_COUNT, current.getTotalCount(), previous.getTotalCount()));
        put(deltas, delta(MetricNames.SUCCESS_COUNT, current.getSuccessCount(), previous.getSuccessCount()));
        put(deltas, delta(MetricNames.FAILURE_COUNT, current.getFailureCount(), previous.getFailureCount()));
        put(deltas, delta(MetricNames.PARTIAL_COUNT, current.getPartialCount(), previous.getPartialCount()));
        return deltas;
    }

    // Rates are compared as derived values, not rebuilt from count deltas.
    private static Map<String, MetricDelta> rateDeltas(AggregatedMetrics current, AggregatedMetrics previous) {
        Map<String, MetricDelta> deltas = new LinkedHashMap<>();
        put(deltas, delta(MetricNames.SUCCESS_RATE, current.getSuccessRate(), previous.getSuccessRate()));
        put(deltas, delta(MetricNames.FAILURE_RATE, current.getFailureRate(), previous.getFailureRate()));
        return deltas;
    }

    private static void put(Map<String, MetricDelta> deltas, MetricDelta delta) {
        deltas.put(delta.getMetricName(), delta);
    }
}
