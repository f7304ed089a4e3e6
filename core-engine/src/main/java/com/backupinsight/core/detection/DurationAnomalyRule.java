package com.backupinsight.core.detection;

import com.backupinsight.core.model.AggregatedMetrics;
import com.backupinsight.core.model.Anomaly;
import com.backupinsight.core.model.AnomalyType;
import com.backupinsight.core.model.MetricNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags periods whose jobs ran unusually long or short.
 *
 * <ul>
 * <li>{@code average_duration} above {@code mean * multiplier} is
 * {@code DURATION_HIGH}; below {@code mean / multiplier} (only with a
 * positive mean) is {@code DURATION_LOW}. Graded with the window's standard
 * deviation.</li>
 * <li>{@code max_duration} above {@code mean(max) * multiplier} is
 * {@code DURATION_HIGH}. There is no lower bound.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class DurationAnomalyRule extends AbstractAnomalyRule {

    private static final Logger LOG = LoggerFactory.getLogger(DurationAnomalyRule.class);

    public static final String NAME = "duration";

    public DurationAnomalyRule(double thresholdMultiplier) {
        super(thresholdMultiplier);
    }

    @Override
    public List<Anomaly> evaluate(AggregatedMetrics current, HistoryWindow history) {
        List<Anomaly> anomalies = new ArrayList<>(2);

        double mean = history.mean(AggregatedMetrics::getAverageDuration);
        double stdev = history.standardDeviation(AggregatedMetrics::getAverageDuration);
        double high = upperBound(mean);
        double low = lowerBound(mean);
        double average = current.getAverageDuration();

        if (average > high) {
            double deviation = deviation(average, mean);
            anomalies.add(anomaly(current, AnomalyType.DURATION_HIGH,
                    SeverityGrader.grade(deviation, stdev, mean),
                    MetricNames.AVERAGE_DURATION, average, mean, high, deviation));
        } else if (average < low && mean > 0) {
            double deviation = deviation(average, mean);
            anomalies.add(anomaly(current, AnomalyType.DURATION_LOW,
                    SeverityGrader.grade(deviation, stdev, mean),
                    MetricNames.AVERAGE_DURATION, average, mean, low, deviation));
        }

        double maxMean = history.mean(AggregatedMetrics::getMaxDuration);
        double maxHigh = upperBound(maxMean);
        double max = current.getMaxDuration();

        if (max > maxHigh) {
            double deviation = deviation(max, maxMean);
            anomalies.add(anomaly(current, AnomalyType.DURATION_HIGH,
                    SeverityGrader.grade(deviation, 0, maxMean),
                    MetricNames.MAX_DURATION, max, maxMean, maxHigh, deviation));
        }

        if (!anomalies.isEmpty()) {
            LOG.debug("Rule [{}] fired {} time(s) for {} '{}': average={} (mean={}), max={} (mean={})",
                    NAME, anomalies.size(), current.getPeriod().getLabel(), current.getClassificationKey(),
                    average, mean, max, maxMean);
        }
        return anomalies;
    }

    @Override
    public String getRuleName() {
        return NAME;
    }
}
