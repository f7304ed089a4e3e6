package com.backupinsight.core.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * A Monday-anchored ISO week.
 *
 * <p>
 * The week number is the ISO-8601 week of the week-based year, so the days
 * of 2024-12-30..2025-01-05 form week 1 (of 2025).
 * </p>
 *
 * @since 1.0.0
 */
public final class WeeklyPeriod implements PeriodDetail {

    private static final int DAYS_PER_WEEK = 7;

    private final LocalDate weekStart;

    private WeeklyPeriod(LocalDate weekStart) {
        this.weekStart = weekStart;
    }

    /**
     * @param date any day of the week
     * @return the week containing {@code date}
     */
    public static WeeklyPeriod containing(LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        return new WeeklyPeriod(date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)));
    }

    public LocalDate getWeekStart() {
        return weekStart;
    }

    public LocalDate getWeekEnd() {
        return weekStart.plusDays(DAYS_PER_WEEK - 1);
    }

    public int getWeekNumber() {
        return weekStart.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }

    @Override
    public Granularity getGranularity() {
        return Granularity.WEEK;
    }

    @Override
    public LocalDate getPeriodStart() {
        return weekStart;
    }

    @Override
    public LocalDate getPeriodEnd() {
        return getWeekEnd();
    }

    @Override
    public String getLabel() {
        return String.format("%d-W%02d", weekStart.get(IsoFields.WEEK_BASED_YEAR), getWeekNumber());
    }

    @Override
    public WeeklyPeriod previous() {
        return new WeeklyPeriod(weekStart.minusDays(DAYS_PER_WEEK));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WeeklyPeriod that))
            return false;
        return weekStart.equals(that.weekStart);
    }

    @Override
    public int hashCode() {
        return weekStart.hashCode();
    }

    @Override
    public String toString() {
        return "WeeklyPeriod{" + weekStart + ".." + getWeekEnd() + ", week=" + getWeekNumber() + '}';
    }
}
