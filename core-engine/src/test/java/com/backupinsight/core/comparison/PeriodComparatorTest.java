package com.backupinsight.core.comparison;

import com.backupinsight.core.model.AggregatedMetrics;
import com.backupinsight.core.model.DailyPeriod;
import com.backupinsight.core.model.Granularity;
import com.backupinsight.core.model.MetricDelta;
import com.backupinsight.core.model.MetricNames;
import com.backupinsight.core.model.MonthlyPeriod;
import com.backupinsight.core.model.PeriodComparison;
import com.backupinsight.core.model.PeriodDetail;
import com.backupinsight.core.model.WeeklyPeriod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PeriodComparator}.
 */
class PeriodComparatorTest {

    private final PeriodComparator comparator = new PeriodComparator();

    @Test
    @DisplayName("Should compute absolute and percentage deltas")
    void shouldComputeDeltas() {
        AggregatedMetrics previous = metrics(day(10), "database", 100, 4, 4, 0);
        AggregatedMetrics current = metrics(day(11), "database", 150, 5, 4, 1);

        PeriodComparison comparison = comparator.compare(current, previous);

        MetricDelta average = comparison.getDurationDeltas().get(MetricNames.AVERAGE_DURATION);
        assertThat(average.getAbsoluteDelta()).isEqualTo(50.0);
        assertThat(average.getPercentageDelta()).isCloseTo(50.0, within(1e-9));
        assertThat(average.isIncrease()).isTrue();

        MetricDelta total = comparison.getCountDeltas().get(MetricNames.TOTAL_COUNT);
        assertThat(total.getAbsoluteDelta()).isEqualTo(1.0);
        assertThat(total.getPercentageDelta()).isCloseTo(25.0, within(1e-9));

        MetricDelta successRate = comparison.getRateDeltas().get(MetricNames.SUCCESS_RATE);
        assertThat(successRate.getPreviousValue()).isEqualTo(100.0);
        assertThat(successRate.getCurrentValue()).isCloseTo(80.0, within(1e-9));
        assertThat(successRate.getPercentageDelta()).isCloseTo(-20.0, within(1e-9));
        assertThat(successRate.isDecrease()).isTrue();

        assertThat(comparison.isHasPreviousData()).isTrue();
        assertThat(comparison.getPreviousMetrics()).isSameAs(previous);
        assertThat(comparison.getAllDeltas()).hasSize(10);
    }

    @Test
    @DisplayName("Should compare against a zero baseline of the preceding period when previous is missing")
    void shouldUseZeroBaseline() {
        AggregatedMetrics current = metrics(MonthlyPeriod.of(2024, 1), "database", 120, 3, 3, 0);

        PeriodComparison comparison = comparator.compare(current, null);

        assertThat(comparison.isHasPreviousData()).isFalse();
        assertThat(comparison.getPreviousMetrics()).isNull();
        assertThat(comparison.getPreviousPeriodStart()).isEqualTo(LocalDate.of(2023, 12, 1));
        assertThat(comparison.getPreviousPeriodEnd()).isEqualTo(LocalDate.of(2023, 12, 31));
        assertThat(comparison.getAllDeltas().values()).allSatisfy(d -> {
            assertThat(d.getPreviousValue()).isZero();
            assertThat(d.getAbsoluteDelta()).isEqualTo(d.getCurrentValue());
        });
        assertThat(comparison.getDurationDeltas().get(MetricNames.AVERAGE_DURATION).getPercentageDelta())
                .isEqualTo(100.0);
        // zero to zero stays zero
        assertThat(comparison.getCountDeltas().get(MetricNames.FAILURE_COUNT).getPercentageDelta()).isZero();
    }

    @Test
    @DisplayName("Zero previous value should give +100, -100 or 0 percent")
    void shouldApplyZeroPreviousRule() {
        assertThat(PeriodComparator.delta("x", 5, 0).getPercentageDelta()).isEqualTo(100.0);
        assertThat(PeriodComparator.delta("x", -5, 0).getPercentageDelta()).isEqualTo(-100.0);
        assertThat(PeriodComparator.delta("x", 0, 0).getPercentageDelta()).isZero();
        assertThat(PeriodComparator.delta("x", 0, 0).isUnchanged()).isTrue();
    }

    @Test
    @DisplayName("Previous week boundaries should span the preceding Monday to Sunday")
    void shouldUsePreviousWeekBoundaries() {
        AggregatedMetrics current = metrics(WeeklyPeriod.containing(LocalDate.of(2024, 1, 3)), "vm", 60, 1, 1, 0);

        PeriodComparison comparison = comparator.compare(current, null);

        assertThat(comparison.getGranularity()).isEqualTo(Granularity.WEEK);
        assertThat(comparison.getPreviousPeriodStart()).isEqualTo(LocalDate.of(2023, 12, 25));
        assertThat(comparison.getPreviousPeriodEnd()).isEqualTo(LocalDate.of(2023, 12, 31));
    }

    @Test
    @DisplayName("A three-entry series should yield two comparisons")
    void shouldCompareConsecutivePairs() {
        List<AggregatedMetrics> series = List.of(
                metrics(day(1), "database", 100, 1, 1, 0),
                metrics(day(2), "database", 110, 1, 1, 0),
                metrics(day(3), "database", 90, 1, 0, 1));

        List<PeriodComparison> comparisons = comparator.compareSequence(series);

        assertThat(comparisons).hasSize(2);
        assertThat(comparisons.get(0).getCurrentPeriodStart()).isEqualTo(LocalDate.of(2024, 1, 2));
        assertThat(comparisons.get(1).getPreviousMetrics()).isSameAs(series.get(1));
        assertThat(comparisons).allMatch(PeriodComparison::isHasPreviousData);
    }

    @Test
    @DisplayName("Should skip pairs whose classification key changes")
    void shouldSkipKeyChanges() {
        List<AggregatedMetrics> series = List.of(
                metrics(day(1), "database", 100, 1, 1, 0),
                metrics(day(2), "database", 100, 1, 1, 0),
                metrics(day(1), "filesystem", 100, 1, 1, 0),
                metrics(day(2), "filesystem", 100, 1, 1, 0));

        List<PeriodComparison> comparisons = comparator.compareSequence(series);

        assertThat(comparisons).extracting(PeriodComparison::getClassificationKey)
                .containsExactly("database", "filesystem");
    }

    @Test
    @DisplayName("Single-entry series should compare against the baseline; empty yields nothing")
    void shouldHandleShortSeries() {
        AggregatedMetrics only = metrics(day(5), "database", 100, 1, 1, 0);

        assertThat(comparator.compareSequence(List.of())).isEmpty();
        assertThat(comparator.compareSequence(List.of(only))).singleElement().satisfies(c -> {
            assertThat(c.isHasPreviousData()).isFalse();
            assertThat(c.getPreviousPeriodStart()).isEqualTo(LocalDate.of(2024, 1, 4));
        });
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static DailyPeriod day(int dayOfMonth) {
        return DailyPeriod.of(LocalDate.of(2024, 1, dayOfMonth));
    }

    private static AggregatedMetrics metrics(PeriodDetail period, String key, double averageDuration,
                                             int total, int success, int failure) {
        return AggregatedMetrics.builder()
                .period(period)
                .classificationKey(key)
                .averageDuration(averageDuration)
                .maxDuration(averageDuration)
                .minDuration(averageDuration)
                .totalDuration(averageDuration * total)
                .totalCount(total)
                .successCount(success)
                .failureCount(failure)
                .partialCount(total - success - failure)
                .build();
    }
}
