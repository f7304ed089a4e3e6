package com.backupinsight.core.config;

import com.backupinsight.core.model.Granularity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        AnalysisConfig config = ConfigLoader.fromClasspath("test-analysis.yml");

        assertThat(config.getGranularities()).containsExactly("week", "day");
        assertThat(config.getGranularitySet()).containsExactly(Granularity.DAY, Granularity.WEEK);
        assertThat(config.getAnomalyDetection().getThresholdMultiplier()).isEqualTo(3.0);
        assertThat(config.getAnomalyDetection().getMinSamples()).isEqualTo(2);
        assertThat(config.getAnomalyDetection().getLookbackPeriods()).isEqualTo(4);
    }

    @Test
    @DisplayName("Bundled configuration should hold the defaults")
    void bundledConfigShouldHoldDefaults() {
        AnalysisConfig config = ConfigLoader.fromClasspath(ConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getGranularitySet()).containsExactly(Granularity.values());
        assertThat(config.getAnomalyDetection().isEnabled()).isTrue();
        assertThat(config.getAnomalyDetection().getThresholdMultiplier())
                .isEqualTo(AnomalyDetectionSettings.DEFAULT_THRESHOLD_MULTIPLIER);
        assertThat(config.getAnomalyDetection().getMinSamples())
                .isEqualTo(AnomalyDetectionSettings.DEFAULT_MIN_SAMPLES);
        assertThat(config.getAnomalyDetection().getLookbackPeriods())
                .isEqualTo(AnomalyDetectionSettings.DEFAULT_LOOKBACK_PERIODS);
    }

    @Test
    @DisplayName("Missing keys should keep their defaults")
    void shouldApplyDefaultsForMissingKeys() {
        AnalysisConfig config = ConfigLoader.fromClasspath("partial-analysis.yml");

        assertThat(config.getGranularitySet()).hasSize(3);
        assertThat(config.getAnomalyDetection().getMinSamples()).isEqualTo(3);
        assertThat(config.getAnomalyDetection().getThresholdMultiplier()).isEqualTo(2.0);
        assertThat(config.getAnomalyDetection().getLookbackPeriods()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should report every validation problem at once")
    void shouldReportAllValidationErrors() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("invalid-analysis.yml"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("fortnight")
                .hasMessageContaining("thresholdMultiplier")
                .hasMessageContaining("minSamples");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("duplicate-keys-analysis.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed analysis configuration");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load from a file and fall back to defaults when it is empty")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("analysis.yml");
        Files.writeString(file, "granularities: [month]\n");
        Path empty = Files.createFile(dir.resolve("empty.yml"));

        assertThat(ConfigLoader.fromFile(file.toString()).getGranularitySet())
                .containsExactly(Granularity.MONTH);
        assertThat(ConfigLoader.fromFile(empty.toString()).getGranularitySet()).hasSize(3);
        assertThatThrownBy(() -> ConfigLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Config file not found");
    }

    @Test
    @DisplayName("Settings should reject out-of-range values")
    void settingsShouldValidate() {
        AnomalyDetectionSettings settings = new AnomalyDetectionSettings();
        settings.setThresholdMultiplier(Double.POSITIVE_INFINITY);
        settings.setLookbackPeriods(0);

        assertThatThrownBy(settings::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("thresholdMultiplier")
                .hasMessageContaining("lookbackPeriods");
    }
}
