package com.backupinsight.core.model;

import java.time.LocalDate;

/**
 * Granularity-specific identity of an aggregation period.
 *
 * <p>
 * Every {@link AggregatedMetrics} carries exactly one of the permitted
 * variants. Variants order naturally by {@link #getPeriodStart()}, which is
 * also the bucket identifier used during aggregation.
 * </p>
 *
 * @since 1.0.0
 */
public sealed interface PeriodDetail permits DailyPeriod, WeeklyPeriod, MonthlyPeriod {

    Granularity getGranularity();

    /** First calendar day covered, inclusive. */
    LocalDate getPeriodStart();

    /** Last calendar day covered, inclusive. */
    LocalDate getPeriodEnd();

    /**
     * @return short human-readable label, e.g. {@code 2024-W01}
     */
    String getLabel();

    /**
     * @return the immediately preceding period of the same granularity
     */
    PeriodDetail previous();

    /**
     * Build the period of the given granularity that contains {@code date}.
     *
     * @param granularity period size
     * @param date        any day inside the period
     * @return the containing period
     */
    static PeriodDetail containing(Granularity granularity, LocalDate date) {
        return switch (granularity) {
            case DAY -> DailyPeriod.of(date);
            case WEEK -> WeeklyPeriod.containing(date);
            case MONTH -> MonthlyPeriod.containing(date);
        };
    }
}
