package com.backupinsight.core.detection;

import com.backupinsight.core.model.AggregatedMetrics;
import com.backupinsight.core.model.Anomaly;

import java.util.List;

/**
 * Contract for one family of anomaly checks.
 *
 * <p>
 * Implementations are stateless: every call judges {@code current} against
 * the supplied window only. The window always holds at least the detector's
 * minimum number of samples.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyRule {

    /**
     * @param current aggregate under evaluation
     * @param history same-key, same-granularity trailing history
     * @return anomalies found, in check order; empty when normal
     */
    List<Anomaly> evaluate(AggregatedMetrics current, HistoryWindow history);

    /**
     * @return unique rule family name, e.g. {@code duration}
     */
    String getRuleName();
}
