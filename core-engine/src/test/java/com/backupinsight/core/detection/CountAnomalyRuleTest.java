package com.backupinsight.core.detection;

import com.backupinsight.core.model.AggregatedMetrics;
import com.backupinsight.core.model.Anomaly;
import com.backupinsight.core.model.AnomalySeverity;
import com.backupinsight.core.model.AnomalyType;
import com.backupinsight.core.model.DailyPeriod;
import com.backupinsight.core.model.MetricNames;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CountAnomalyRule}.
 */
class CountAnomalyRuleTest {

    private final CountAnomalyRule rule = new CountAnomalyRule(2.0);

    @Test
    @DisplayName("Should flag a burst of runs as count_high")
    void shouldFlagHighCount() {
        List<Anomaly> anomalies = rule.evaluate(withCount(9), history(3, 3, 3));

        assertThat(anomalies).singleElement().satisfies(a -> {
            assertThat(a.getType()).isEqualTo(AnomalyType.COUNT_HIGH);
            assertThat(a.getMetricName()).isEqualTo(MetricNames.TOTAL_COUNT);
            assertThat(a.getDeviationPercentage()).isEqualTo(200.0);
            assertThat(a.getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
        });
    }

    @Test
    @DisplayName("Should flag missing runs as count_low")
    void shouldFlagLowCount() {
        List<Anomaly> anomalies = rule.evaluate(withCount(1), history(4, 4, 4));

        assertThat(anomalies).singleElement().satisfies(a -> {
            assertThat(a.getType()).isEqualTo(AnomalyType.COUNT_LOW);
            assertThat(a.getThresholdValue()).isEqualTo(2.0);
            assertThat(a.getDeviationPercentage()).isEqualTo(-75.0);
            assertThat(a.getSeverity()).isEqualTo(AnomalySeverity.MEDIUM);
        });
    }

    @Test
    @DisplayName("Runs after an empty history should be a medium count_high")
    void shouldFlagRunsAfterEmptyHistory() {
        List<Anomaly> anomalies = rule.evaluate(withCount(2), history(0, 0, 0));

        assertThat(anomalies).singleElement().satisfies(a -> {
            assertThat(a.getType()).isEqualTo(AnomalyType.COUNT_HIGH);
            assertThat(a.getSeverity()).isEqualTo(AnomalySeverity.MEDIUM);
            assertThat(a.getExpectedValue()).isZero();
            assertThat(a.getDeviationPercentage()).isEqualTo(100.0);
        });
        assertThat(rule.evaluate(withCount(0), history(0, 0, 0))).isEmpty();
    }

    @Test
    @DisplayName("Counts within the bounds should pass")
    void shouldPassNormalCounts() {
        assertThat(rule.evaluate(withCount(5), history(3, 3, 3))).isEmpty();
        assertThat(rule.evaluate(withCount(6), history(3, 3, 3))).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static HistoryWindow history(int... counts) {
        AggregatedMetrics[] samples = new AggregatedMetrics[counts.length];
        for (int i = 0; i < counts.length; i++) {
            samples[i] = metrics(LocalDate.of(2024, 1, 1).plusDays(i), counts[i]);
        }
        return new HistoryWindow(List.of(samples));
    }

    private static AggregatedMetrics withCount(int count) {
        return metrics(LocalDate.of(2024, 2, 1), count);
    }

    private static AggregatedMetrics metrics(LocalDate day, int count) {
        return AggregatedMetrics.builder()
                .period(DailyPeriod.of(day))
                .classificationKey("database")
                .averageDuration(count == 0 ? 0 : 60)
                .maxDuration(count == 0 ? 0 : 60)
                .minDuration(count == 0 ? 0 : 60)
                .totalDuration(60.0 * count)
                .totalCount(count)
                .successCount(count)
                .build();
    }
}
