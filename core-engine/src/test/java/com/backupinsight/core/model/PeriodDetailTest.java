package com.backupinsight.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link PeriodDetail} variants.
 */
class PeriodDetailTest {

    @Test
    @DisplayName("Every day of 2024-01-01..07 should fall in ISO week 1 starting 2024-01-01")
    void shouldBucketFirstWeekOf2024() {
        for (int day = 1; day <= 7; day++) {
            WeeklyPeriod week = WeeklyPeriod.containing(LocalDate.of(2024, 1, day));

            assertThat(week.getWeekStart()).isEqualTo(LocalDate.of(2024, 1, 1));
            assertThat(week.getWeekEnd()).isEqualTo(LocalDate.of(2024, 1, 7));
            assertThat(week.getWeekNumber()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Should anchor a Sunday to the preceding Monday")
    void shouldAnchorSundayToMonday() {
        WeeklyPeriod week = WeeklyPeriod.containing(LocalDate.of(2024, 3, 17));

        assertThat(week.getWeekStart()).isEqualTo(LocalDate.of(2024, 3, 11));
    }

    @Test
    @DisplayName("Should use ISO week numbering across a year boundary")
    void shouldHandleIsoWeekAcrossYears() {
        WeeklyPeriod lastOf2020 = WeeklyPeriod.containing(LocalDate.of(2021, 1, 3));
        WeeklyPeriod firstOf2025 = WeeklyPeriod.containing(LocalDate.of(2024, 12, 31));

        assertThat(lastOf2020.getWeekNumber()).isEqualTo(53);
        assertThat(lastOf2020.getLabel()).isEqualTo("2020-W53");
        assertThat(firstOf2025.getWeekStart()).isEqualTo(LocalDate.of(2024, 12, 30));
        assertThat(firstOf2025.getWeekNumber()).isEqualTo(1);
        assertThat(firstOf2025.getLabel()).isEqualTo("2025-W01");
    }

    @Test
    @DisplayName("Previous week should start seven days earlier")
    void previousWeekShouldStartSevenDaysEarlier() {
        WeeklyPeriod previous = WeeklyPeriod.containing(LocalDate.of(2024, 1, 3)).previous();

        assertThat(previous.getWeekStart()).isEqualTo(LocalDate.of(2023, 12, 25));
        assertThat(previous.getWeekEnd()).isEqualTo(LocalDate.of(2023, 12, 31));
        assertThat(previous.getWeekNumber()).isEqualTo(52);
    }

    @Test
    @DisplayName("Month end should respect month length and leap years")
    void monthEndShouldBeCalendarCorrect() {
        assertThat(MonthlyPeriod.of(2024, 2).getPeriodEnd()).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(MonthlyPeriod.of(2023, 2).getPeriodEnd()).isEqualTo(LocalDate.of(2023, 2, 28));
        assertThat(MonthlyPeriod.of(2024, 4).getPeriodEnd()).isEqualTo(LocalDate.of(2024, 4, 30));
        assertThat(MonthlyPeriod.of(2024, 12).getPeriodEnd()).isEqualTo(LocalDate.of(2024, 12, 31));
    }

    @Test
    @DisplayName("January should roll back to December of the previous year")
    void januaryShouldRollBackToDecember() {
        MonthlyPeriod previous = MonthlyPeriod.of(2024, 1).previous();

        assertThat(previous.getYear()).isEqualTo(2023);
        assertThat(previous.getMonth()).isEqualTo(12);
        assertThat(previous.getPeriodStart()).isEqualTo(LocalDate.of(2023, 12, 1));
        assertThat(previous.getPeriodEnd()).isEqualTo(LocalDate.of(2023, 12, 31));
    }

    @Test
    @DisplayName("Previous day should cross month boundaries")
    void previousDayShouldCrossMonths() {
        DailyPeriod previous = DailyPeriod.of(LocalDate.of(2024, 3, 1)).previous();

        assertThat(previous.getDate()).isEqualTo(LocalDate.of(2024, 2, 29));
    }

    @Test
    @DisplayName("containing() should dispatch on granularity")
    void containingShouldDispatch() {
        LocalDate date = LocalDate.of(2024, 5, 15);

        assertThat(PeriodDetail.containing(Granularity.DAY, date)).isEqualTo(DailyPeriod.of(date));
        assertThat(PeriodDetail.containing(Granularity.WEEK, date).getPeriodStart())
                .isEqualTo(LocalDate.of(2024, 5, 13));
        assertThat(PeriodDetail.containing(Granularity.MONTH, date)).isEqualTo(MonthlyPeriod.of(2024, 5));
    }
}
