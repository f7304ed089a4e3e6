package com.backupinsight.core.analysis;

import com.backupinsight.core.config.AnalysisConfig;
import com.backupinsight.core.model.AggregatedMetrics;
import com.backupinsight.core.model.MonthlyPeriod;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnalysisJson}.
 */
class AnalysisJsonTest {

    private final ObjectMapper reader = new ObjectMapper();

    @Test
    @DisplayName("Aggregates should serialize with snake_case keys and ISO dates")
    void shouldSerializeAggregate() throws Exception {
        AggregatedMetrics metrics = AggregatedMetrics.builder()
                .period(MonthlyPeriod.of(2024, 2))
                .classificationKey("database")
                .averageDuration(120)
                .maxDuration(150)
                .minDuration(90)
                .totalDuration(240)
                .totalCount(2)
                .successCount(1)
                .failureCount(1)
                .build();

        JsonNode json = reader.readTree(AnalysisJson.toJson(metrics));

        assertThat(json.get("classification_key").asText()).isEqualTo("database");
        assertThat(json.get("granularity").asText()).isEqualTo("month");
        assertThat(json.get("period_start").asText()).isEqualTo("2024-02-01");
        assertThat(json.get("period_end").asText()).isEqualTo("2024-02-29");
        assertThat(json.get("average_duration").asDouble()).isEqualTo(120.0);
        assertThat(json.get("failure_rate").asDouble()).isEqualTo(50.0);
        assertThat(json.get("anomaly_flag").asBoolean()).isFalse();
        assertThat(json.get("period").get("label").asText()).isEqualTo("2024-02");
    }

    @Test
    @DisplayName("Reports should serialize anomalies with lowercase codes")
    void shouldSerializeReport() throws Exception {
        AnalysisConfig config = AnalysisConfig.defaults();
        config.setGranularities(List.of("day"));
        AnalysisReport report = new BackupMetricsAnalyzer(config)
                .analyze(BackupMetricsAnalyzerTest.sampleRecords());

        JsonNode json = reader.readTree(AnalysisJson.toPrettyJson(report));

        assertThat(json.get("record_count").asInt()).isEqualTo(10);
        JsonNode daily = json.get("analyses").get(0);
        assertThat(daily.get("granularity").asText()).isEqualTo("day");
        assertThat(daily.has("anomalous_detections")).isFalse();

        JsonNode anomaly = daily.get("detections").findValues("anomalies").stream()
                .filter(node -> node.size() > 0)
                .findFirst()
                .orElseThrow()
                .get(0);
        assertThat(anomaly.get("type").asText()).isEqualTo("duration_high");
        assertThat(anomaly.get("severity").asText()).isEqualTo("high");
        assertThat(anomaly.get("metric_name").asText()).isEqualTo("average_duration");
        assertThat(anomaly.get("period_start").asText()).isEqualTo("2024-01-08");

        JsonNode comparison = daily.get("comparisons").get(0);
        assertThat(comparison.has("all_deltas")).isFalse();
        assertThat(comparison.get("duration_deltas").has("average_duration")).isTrue();
    }
}
