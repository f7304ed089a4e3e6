package com.backupinsight.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Tuning knobs of the anomaly detector.
 *
 * <p>
 * Mutable JavaBean so SnakeYAML can populate it; the detector copies the
 * values it needs at construction time.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetectionSettings {

    public static final double DEFAULT_THRESHOLD_MULTIPLIER = 2.0;
    public static final int DEFAULT_MIN_SAMPLES = 5;
    public static final int DEFAULT_LOOKBACK_PERIODS = 7;

    /** When {@code false} every aggregate is reported as normal. */
    private boolean enabled = true;

    /** Ratio between the historical mean and the high/low bounds. */
    private double thresholdMultiplier = DEFAULT_THRESHOLD_MULTIPLIER;

    /** Minimum same-key history required before rules are evaluated. */
    private int minSamples = DEFAULT_MIN_SAMPLES;

    /** Maximum number of trailing periods in the history window. */
    private int lookbackPeriods = DEFAULT_LOOKBACK_PERIODS;

    /**
     * @throws InvalidConfigurationException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(thresholdMultiplier > 0) || Double.isInfinite(thresholdMultiplier)) {
            errors.add("'thresholdMultiplier' must be a finite number > 0, got: " + thresholdMultiplier);
        }
        if (minSamples < 1) {
            errors.add("'minSamples' must be >= 1, got: " + minSamples);
        }
        if (lookbackPeriods < 1) {
            errors.add("'lookbackPeriods' must be >= 1, got: " + lookbackPeriods);
        }

        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException(
                    "Invalid anomaly detection settings: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getThresholdMultiplier() {
        return thresholdMultiplier;
    }

    public void setThresholdMultiplier(double thresholdMultiplier) {
        this.thresholdMultiplier = thresholdMultiplier;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public int getLookbackPeriods() {
        return lookbackPeriods;
    }

    public void setLookbackPeriods(int lookbackPeriods) {
        this.lookbackPeriods = lookbackPeriods;
    }

    @Override
    public String toString() {
        return "AnomalyDetectionSettings{" +
                "enabled=" + enabled +
                ", thresholdMultiplier=" + thresholdMultiplier +
                ", minSamples=" + minSamples +
                ", lookbackPeriods=" + lookbackPeriods +
                '}';
    }
}
