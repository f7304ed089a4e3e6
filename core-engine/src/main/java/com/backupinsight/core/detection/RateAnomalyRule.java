package com.backupinsight.core.detection;

import com.backupinsight.core.model.AggregatedMetrics;
import com.backupinsight.core.model.Anomaly;
import com.backupinsight.core.model.AnomalySeverity;
import com.backupinsight.core.model.AnomalyType;
import com.backupinsight.core.model.MetricNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags periods whose failure rate rose or success rate dropped.
 *
 * <ul>
 * <li>{@code failure_rate} above {@code mean * multiplier} is
 * {@code FAILURE_RATE_HIGH}. After a failure-free history any failure is a
 * high-severity anomaly with 100% deviation.</li>
 * <li>{@code success_rate} below {@code mean / multiplier} is
 * {@code SUCCESS_RATE_LOW}; only checked when the history had
 * successes.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class RateAnomalyRule extends AbstractAnomalyRule {

    private static final Logger LOG = LoggerFactory.getLogger(RateAnomalyRule.class);

    public static final String NAME = "rate";

    public RateAnomalyRule(double thresholdMultiplier) {
        super(thresholdMultiplier);
    }

    @Override
    public List<Anomaly> evaluate(AggregatedMetrics current, HistoryWindow history) {
        List<Anomaly> anomalies = new ArrayList<>(2);

        double failureMean = history.mean(AggregatedMetrics::getFailureRate);
        double failureRate = current.getFailureRate();

        if (failureMean == 0) {
            if (failureRate > 0) {
                anomalies.add(anomaly(current, AnomalyType.FAILURE_RATE_HIGH, AnomalySeverity.HIGH,
                        MetricNames.FAILURE_RATE, failureRate, 0.0, 0.0, ZERO_BASELINE_DEVIATION));
            }
        } else {
            double high = upperBound(failureMean);
            if (failureRate > high) {
                double deviation = deviation(failureRate, failureMean);
                anomalies.add(anomaly(current, AnomalyType.FAILURE_RATE_HIGH,
                        SeverityGrader.grade(deviation, 0, failureMean),
                        MetricNames.FAILURE_RATE, failureRate, failureMean, high, deviation));
            }
        }

        double successMean = history.mean(AggregatedMetrics::getSuccessRate);
        double successRate = current.getSuccessRate();

        if (successMean > 0) {
            double low = lowerBound(successMean);
            if (successRate < low) {
                double deviation = deviation(successRate, successMean);
                anomalies.add(anomaly(current, AnomalyType.SUCCESS_RATE_LOW,
                        SeverityGrader.grade(deviation, 0, successMean),
                        MetricNames.SUCCESS_RATE, successRate, successMean, low, deviation));
            }
        } else {
            LOG.trace("Rule [{}]: no historical successes for '{}', success rate not checked",
                    NAME, current.getClassificationKey());
        }

        if (!anomalies.isEmpty()) {
            LOG.debug("Rule [{}] fired {} time(s) for {} '{}': failureRate={} (mean={}), successRate={} (mean={})",
                    NAME, anomalies.size(), current.getPeriod().getLabel(), current.getClassificationKey(),
                    failureRate, failureMean, successRate, successMean);
        }
        return anomalies;
    }

    @Override
    public String getRuleName() {
        return NAME;
    }
}
