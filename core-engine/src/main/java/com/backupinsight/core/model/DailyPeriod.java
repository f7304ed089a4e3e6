package com.backupinsight.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A single calendar day.
 *
 * @since 1.0.0
 */
public final class DailyPeriod implements PeriodDetail {

    private final LocalDate date;

    private DailyPeriod(LocalDate date) {
        this.date = Objects.requireNonNull(date, "date must not be null");
    }

    public static DailyPeriod of(LocalDate date) {
        return new DailyPeriod(date);
    }

    public LocalDate getDate() {
        return date;
    }

    @Override
    public Granularity getGranularity() {
        return Granularity.DAY;
    }

    @Override
    public LocalDate getPeriodStart() {
        return date;
    }

    @Override
    public LocalDate getPeriodEnd() {
        return date;
    }

    @Override
    public String getLabel() {
        return date.toString();
    }

    @Override
    public DailyPeriod previous() {
        return new DailyPeriod(date.minusDays(1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DailyPeriod that))
            return false;
        return date.equals(that.date);
    }

    @Override
    public int hashCode() {
        return date.hashCode();
    }

    @Override
    public String toString() {
        return "DailyPeriod{" + date + '}';
    }
}
