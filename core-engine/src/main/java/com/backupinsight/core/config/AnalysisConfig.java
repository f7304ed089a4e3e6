package com.backupinsight.core.config;

import com.backupinsight.core.model.Granularity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the analysis YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * granularities: [day, week, month]
 * anomalyDetection:
 *   enabled: true
 *   thresholdMultiplier: 2.0
 *   minSamples: 5
 *   lookbackPeriods: 7
 * </pre>
 *
 * <p>
 * Omitted keys keep their defaults. Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisConfig {

    private List<String> granularities = new ArrayList<>(List.of("day", "week", "month"));

    private AnomalyDetectionSettings anomalyDetection = new AnomalyDetectionSettings();

    /**
     * @return a configuration holding every default
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig();
    }

    /**
     * Validate granularities and detector settings, reporting every problem
     * in a single exception.
     *
     * @throws InvalidConfigurationException if anything is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (granularities.isEmpty()) {
            errors.add("'granularities' must name at least one of day, week, month");
        }
        for (String code : granularities) {
            try {
                Granularity.fromCode(code);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        try {
            anomalyDetection.validate();
        } catch (InvalidConfigurationException e) {
            errors.add(e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException(
                    "Analysis configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * Parsed granularities in day, week, month order with duplicates removed.
     *
     * @return unmodifiable set of configured granularities
     * @throws IllegalArgumentException if an entry is unknown
     */
    public Set<Granularity> getGranularitySet() {
        Set<String> codes = new LinkedHashSet<>();
        for (String code : granularities) {
            codes.add(Granularity.fromCode(code).getCode());
        }
        Set<Granularity> result = new LinkedHashSet<>();
        for (Granularity g : Granularity.values()) {
            if (codes.contains(g.getCode())) {
                result.add(g);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public List<String> getGranularities() {
        return Collections.unmodifiableList(granularities);
    }

    public void setGranularities(List<String> granularities) {
        this.granularities = granularities != null ? new ArrayList<>(granularities) : new ArrayList<>();
    }

    public AnomalyDetectionSettings getAnomalyDetection() {
        return anomalyDetection;
    }

    public void setAnomalyDetection(AnomalyDetectionSettings anomalyDetection) {
        this.anomalyDetection = anomalyDetection != null ? anomalyDetection : new AnomalyDetectionSettings();
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" +
                "granularities=" + granularities +
                ", anomalyDetection=" + anomalyDetection +
                '}';
    }
}
