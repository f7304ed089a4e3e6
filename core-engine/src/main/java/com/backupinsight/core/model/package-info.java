/**
 * Immutable value types shared by the aggregation, comparison and detection
 * engines.
 *
 * <ul>
 * <li>{@link com.backupinsight.core.model.EventRecord} - one normalized backup
 * job execution</li>
 * <li>{@link com.backupinsight.core.model.AggregatedMetrics} - per-period,
 * per-key summary carrying a
 * {@link com.backupinsight.core.model.PeriodDetail} variant</li>
 * <li>{@link com.backupinsight.core.model.PeriodComparison} and
 * {@link com.backupinsight.core.model.MetricDelta} - period-over-period
 * change</li>
 * <li>{@link com.backupinsight.core.model.AnomalyDetectionResult} and
 * {@link com.backupinsight.core.model.Anomaly} - graded deviations</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.backupinsight.core.model;
