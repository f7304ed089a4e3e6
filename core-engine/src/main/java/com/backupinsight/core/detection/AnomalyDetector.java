package com.backupinsight.core.detection;

import com.backupinsight.core.config.AnalysisConfig;
import com.backupinsight.core.config.AnomalyDetectionSettings;
import com.backupinsight.core.model.AggregatedMetrics;
import com.backupinsight.core.model.Anomaly;
import com.backupinsight.core.model.AnomalyDetectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Judges each aggregate against a trailing window of its own history.
 *
 * <h3>Evaluation</h3>
 * <ol>
 * <li>Keep candidates with the same classification key and granularity.</li>
 * <li>Keep the last {@code lookbackPeriods} of those, in caller order.</li>
 * <li>With fewer than {@code minSamples} left, abstain: no anomaly, but
 * {@code samplesUsed} reports what was available.</li>
 * <li>Otherwise run every {@link AnomalyRule} family and collect what they
 * report.</li>
 * </ol>
 *
 * <p>
 * History must be ordered oldest first; the detector does not sort it.
 * Configuration is copied at construction, so instances are immutable and
 * thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    private final boolean enabled;
    private final double thresholdMultiplier;
    private final int minSamples;
    private final int lookbackPeriods;
    private final List<AnomalyRule> rules;

    /**
     * Detector with default settings.
     */
    public AnomalyDetector() {
        this(new AnomalyDetectionSettings());
    }

    public AnomalyDetector(AnalysisConfig config) {
        this(Objects.requireNonNull(config, "AnalysisConfig must not be null").getAnomalyDetection());
    }

    /**
     * @param settings detector settings
     * @throws com.backupinsight.core.config.InvalidConfigurationException if a
     *         setting is out of range
     */
    public AnomalyDetector(AnomalyDetectionSettings settings) {
        this(settings, null);
    }

    /**
     * @param settings detector settings
     * @param rules    rule families to run, or {@code null} for the defaults
     * @throws com.backupinsight.core.config.InvalidConfigurationException if a
     *         setting is out of range
     */
    public AnomalyDetector(AnomalyDetectionSettings settings, List<AnomalyRule> rules) {
        Objects.requireNonNull(settings, "AnomalyDetectionSettings must not be null");
        settings.validate();
        this.enabled = settings.isEnabled();
        this.thresholdMultiplier = settings.getThresholdMultiplier();
        this.minSamples = settings.getMinSamples();
        this.lookbackPeriods = settings.getLookbackPeriods();
        this.rules = rules != null
                ? List.copyOf(rules)
                : AnomalyRuleFactory.createDefaults(settings);
        LOG.debug("Anomaly detector created: enabled={}, thresholdMultiplier={}, minSamples={}, lookbackPeriods={}",
                enabled, thresholdMultiplier, minSamples, lookbackPeriods);
    }

    /**
     * Evaluate one aggregate against historical candidates.
     *
     * @param current              the aggregate to judge
     * @param historicalCandidates earlier aggregates, oldest first; may
     *                             contain other keys and granularities
     * @return the result, never {@code null}
     */
    public AnomalyDetectionResult detect(AggregatedMetrics current, List<AggregatedMetrics> historicalCandidates) {
        Objects.requireNonNull(current, "Current metrics must not be null");
        Objects.requireNonNull(historicalCandidates, "Historical metrics must not be null");

        if (!enabled) {
            return AnomalyDetectionResult.notEvaluated(current, 0);
        }

        HistoryWindow window = windowFor(current, historicalCandidates);

        if (window.size() < minSamples) {
            LOG.trace("Not enough history for {} '{}': {} of {} sample(s)",
                    current.getPeriod().getLabel(), current.getClassificationKey(), window.size(), minSamples);
            return AnomalyDetectionResult.notEvaluated(current, window.size());
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (AnomalyRule rule : rules) {
            anomalies.addAll(rule.evaluate(current, window));
        }

        double historicalAverage = window.mean(AggregatedMetrics::getAverageDuration);

        if (!anomalies.isEmpty()) {
            LOG.debug("{} anomaly(ies) in {} {} '{}' against {} sample(s)",
                    anomalies.size(), current.getGranularity().getCode(), current.getPeriod().getLabel(),
                    current.getClassificationKey(), window.size());
        }
        return new AnomalyDetectionResult(anomalies, current, historicalAverage, window.size());
    }

    /**
     * Evaluate each entry against the entries before it.
     *
     * @param metrics aggregates ordered oldest first
     * @return one result per entry, in the same order
     */
    public List<AnomalyDetectionResult> detectBatch(List<AggregatedMetrics> metrics) {
        Objects.requireNonNull(metrics, "Metrics list must not be null");

        List<AnomalyDetectionResult> results = new ArrayList<>(metrics.size());
        for (int i = 0; i < metrics.size(); i++) {
            results.add(detect(metrics.get(i), metrics.subList(0, i)));
        }

        long flagged = results.stream().filter(AnomalyDetectionResult::isHasAnomaly).count();
        LOG.debug("Batch detection over {} aggregate(s): {} with anomalies", metrics.size(), flagged);
        return Collections.unmodifiableList(results);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public boolean isEnabled() {
        return enabled;
    }

    public double getThresholdMultiplier() {
        return thresholdMultiplier;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public int getLookbackPeriods() {
        return lookbackPeriods;
    }

    public List<AnomalyRule> getRules() {
        return rules;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private HistoryWindow windowFor(AggregatedMetrics current, List<AggregatedMetrics> candidates) {
        List<AggregatedMetrics> matching = new ArrayList<>();
        for (AggregatedMetrics candidate : candidates) {
            if (candidate.getClassificationKey().equals(current.getClassificationKey())
                    && candidate.getGranularity() == current.getGranularity()) {
                matching.add(candidate);
            }
        }
        int from = Math.max(0, matching.size() - lookbackPeriods);
        return new HistoryWindow(matching.subList(from, matching.size()));
    }
}
