package com.backupinsight.core.analysis;

import com.backupinsight.core.aggregation.AggregationEngine;
import com.backupinsight.core.comparison.PeriodComparator;
import com.backupinsight.core.config.AnalysisConfig;
import com.backupinsight.core.detection.AnomalyDetector;
import com.backupinsight.core.model.AggregatedMetrics;
import com.backupinsight.core.model.AnomalyDetectionResult;
import com.backupinsight.core.model.EventRecord;
import com.backupinsight.core.model.Granularity;
import com.backupinsight.core.model.PeriodComparison;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Runs aggregation, comparison and detection over one batch of records.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   records
 *     → aggregate per configured granularity
 *     → split into per-key series (oldest first)
 *     → detectBatch per series  → flag anomalous aggregates
 *     → compareSequence per series
 * </pre>
 *
 * <p>
 * Series are processed in classification-key order. Detection results refer
 * to aggregates as they were evaluated, before their anomaly flag was set.
 * </p>
 *
 * @since 1.0.0
 */
public class BackupMetricsAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(BackupMetricsAnalyzer.class);

    private final AggregationEngine aggregationEngine;
    private final PeriodComparator comparator;
    private final AnomalyDetector detector;

    public BackupMetricsAnalyzer() {
        this(AnalysisConfig.defaults());
    }

    /**
     * @param config analysis configuration
     * @throws com.backupinsight.core.config.InvalidConfigurationException if the
     *         configuration is invalid
     */
    public BackupMetricsAnalyzer(AnalysisConfig config) {
        this(new AggregationEngine(config), new PeriodComparator(), new AnomalyDetector(config));
    }

    public BackupMetricsAnalyzer(AggregationEngine aggregationEngine, PeriodComparator comparator,
                                 AnomalyDetector detector) {
        this.aggregationEngine = Objects.requireNonNull(aggregationEngine, "AggregationEngine must not be null");
        this.comparator = Objects.requireNonNull(comparator, "PeriodComparator must not be null");
        this.detector = Objects.requireNonNull(detector, "AnomalyDetector must not be null");
    }

    /**
     * @param records validated, normalized records in any order
     * @return the report, one analysis per configured granularity
     */
    public AnalysisReport analyze(Collection<EventRecord> records) {
        Objects.requireNonNull(records, "Records must not be null");

        List<GranularityAnalysis> analyses = new ArrayList<>();
        for (Granularity granularity : aggregationEngine.getGranularities()) {
            analyses.add(analyze(granularity, aggregationEngine.aggregate(granularity, records)));
        }

        AnalysisReport report = new AnalysisReport(records.size(), analyses);
        LOG.info("Analyzed {} record(s) across {} granularity(ies): {} anomalous period(s), {} anomaly(ies)",
                records.size(), analyses.size(), report.getAnomalousResults().size(), report.getTotalAnomalyCount());
        return report;
    }

    private GranularityAnalysis analyze(Granularity granularity, List<AggregatedMetrics> aggregates) {
        Map<String, List<AggregatedMetrics>> seriesByKey = new TreeMap<>();
        for (AggregatedMetrics metrics : aggregates) {
            seriesByKey.computeIfAbsent(metrics.getClassificationKey(), k -> new ArrayList<>()).add(metrics);
        }

        List<AnomalyDetectionResult> detections = new ArrayList<>();
        Map<AggregatedMetrics, AggregatedMetrics> flagged = new IdentityHashMap<>();
        for (List<AggregatedMetrics> series : seriesByKey.values()) {
            for (AnomalyDetectionResult result : detector.detectBatch(series)) {
                detections.add(result);
                flagged.put(result.getMetrics(), result.getMetrics().withAnomalyFlag(result.isHasAnomaly()));
            }
        }

        List<PeriodComparison> comparisons = new ArrayList<>();
        for (List<AggregatedMetrics> series : seriesByKey.values()) {
            comparisons.addAll(comparator.compareSequence(series.stream().map(flagged::get).toList()));
        }

        List<AggregatedMetrics> flaggedAggregates = aggregates.stream().map(flagged::get).toList();
        long anomalous = flaggedAggregates.stream().filter(AggregatedMetrics::isAnomalyFlag).count();

        LOG.debug("{}: {} aggregate(s) in {} series, {} comparison(s), {} anomalous",
                granularity.getCode(), aggregates.size(), seriesByKey.size(), comparisons.size(), anomalous);
        return new GranularityAnalysis(granularity, flaggedAggregates, comparisons, detections);
    }
}
