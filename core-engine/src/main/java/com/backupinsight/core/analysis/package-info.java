/**
 * End-to-end analysis of a batch of records.
 *
 * <p>
 * {@link com.backupinsight.core.analysis.BackupMetricsAnalyzer} wires the
 * aggregation engine, comparator and detector together and produces an
 * {@link com.backupinsight.core.analysis.AnalysisReport};
 * {@link com.backupinsight.core.analysis.AnalysisJson} hands the output to
 * external reporting as JSON.
 * </p>
 *
 * @since 1.0.0
 */
package com.backupinsight.core.analysis;
