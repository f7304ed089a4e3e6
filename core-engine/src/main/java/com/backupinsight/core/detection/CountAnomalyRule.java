package com.backupinsight.core.detection;

import com.backupinsight.core.model.AggregatedMetrics;
import com.backupinsight.core.model.Anomaly;
import com.backupinsight.core.model.AnomalySeverity;
import com.backupinsight.core.model.AnomalyType;
import com.backupinsight.core.model.MetricNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Flags periods with an unusual number of job runs.
 *
 * <p>
 * {@code total_count} above {@code mean * multiplier} is {@code COUNT_HIGH},
 * below {@code mean / multiplier} is {@code COUNT_LOW}. When the history
 * holds no runs at all, any run in the current period is a medium
 * {@code COUNT_HIGH} with 100% deviation.
 * </p>
 *
 * @since 1.0.0
 */
public class CountAnomalyRule extends AbstractAnomalyRule {

    private static final Logger LOG = LoggerFactory.getLogger(CountAnomalyRule.class);

    public static final String NAME = "count";

    public CountAnomalyRule(double thresholdMultiplier) {
        super(thresholdMultiplier);
    }

    @Override
    public List<Anomaly> evaluate(AggregatedMetrics current, HistoryWindow history) {
        double mean = history.mean(AggregatedMetrics::getTotalCount);
        double count = current.getTotalCount();

        if (mean == 0) {
            if (count > 0) {
                LOG.debug("Rule [{}] fired for {} '{}': {} run(s) after an empty history",
                        NAME, current.getPeriod().getLabel(), current.getClassificationKey(), (int) count);
                return List.of(anomaly(current, AnomalyType.COUNT_HIGH, AnomalySeverity.MEDIUM,
                        MetricNames.TOTAL_COUNT, count, 0.0, 0.0, ZERO_BASELINE_DEVIATION));
            }
            return List.of();
        }

        double high = upperBound(mean);
        double low = lowerBound(mean);

        if (count > high) {
            double deviation = deviation(count, mean);
            LOG.debug("Rule [{}] fired for {} '{}': count={} > {}",
                    NAME, current.getPeriod().getLabel(), current.getClassificationKey(), (int) count, high);
            return List.of(anomaly(current, AnomalyType.COUNT_HIGH, SeverityGrader.grade(deviation, 0, mean),
                    MetricNames.TOTAL_COUNT, count, mean, high, deviation));
        }
        if (count < low) {
            double deviation = deviation(count, mean);
            LOG.debug("Rule [{}] fired for {} '{}': count={} < {}",
                    NAME, current.getPeriod().getLabel(), current.getClassificationKey(), (int) count, low);
            return List.of(anomaly(current, AnomalyType.COUNT_LOW, SeverityGrader.grade(deviation, 0, mean),
                    MetricNames.TOTAL_COUNT, count, mean, low, deviation));
        }
        return List.of();
    }

    @Override
    public String getRuleName() {
        return NAME;
    }
}
