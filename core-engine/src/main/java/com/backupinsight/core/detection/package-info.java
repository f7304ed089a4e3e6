/**
 * Statistical anomaly detection over aggregated metrics.
 *
 * <p>
 * {@link com.backupinsight.core.detection.AnomalyDetector} selects the
 * history window and delegates to
 * {@link com.backupinsight.core.detection.AnomalyRule}
 * families created by
 * {@link com.backupinsight.core.detection.AnomalyRuleFactory}:
 * </p>
 * <ul>
 * <li>{@link com.backupinsight.core.detection.DurationAnomalyRule} - average
 * and maximum duration</li>
 * <li>{@link com.backupinsight.core.detection.CountAnomalyRule} - number of
 * runs</li>
 * <li>{@link com.backupinsight.core.detection.RateAnomalyRule} - failure and
 * success rates</li>
 * </ul>
 *
 * <p>
 * Severity is assigned by
 * {@link com.backupinsight.core.detection.SeverityGrader}.
 * </p>
 *
 * @since 1.0.0
 */
package com.backupinsight.core.detection;
