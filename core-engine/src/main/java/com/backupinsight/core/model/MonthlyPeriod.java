package com.backupinsight.core.model;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Objects;

/**
 * A calendar month. The period end is the true last day of the month,
 * leap years included.
 *
 * @since 1.0.0
 */
public final class MonthlyPeriod implements PeriodDetail {

    private final YearMonth yearMonth;

    private MonthlyPeriod(YearMonth yearMonth) {
        this.yearMonth = yearMonth;
    }

    /**
     * @param year  calendar year
     * @param month month of year, 1..12
     * @return the month
     * @throws java.time.DateTimeException if {@code month} is out of range
     */
    public static MonthlyPeriod of(int year, int month) {
        return new MonthlyPeriod(YearMonth.of(year, month));
    }

    public static MonthlyPeriod containing(LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        return new MonthlyPeriod(YearMonth.from(date));
    }

    public int getYear() {
        return yearMonth.getYear();
    }

    /**
     * @return month of year, 1..12
     */
    public int getMonth() {
        return yearMonth.getMonthValue();
    }

    @Override
    public Granularity getGranularity() {
        return Granularity.MONTH;
    }

    @Override
    public LocalDate getPeriodStart() {
        return yearMonth.atDay(1);
    }

    @Override
    public LocalDate getPeriodEnd() {
        return yearMonth.atEndOfMonth();
    }

    @Override
    public String getLabel() {
        return yearMonth.toString();
    }

    /**
     * January rolls back to December of the previous year.
     */
    @Override
    public MonthlyPeriod previous() {
        return new MonthlyPeriod(yearMonth.minusMonths(1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MonthlyPeriod that))
            return false;
        return yearMonth.equals(that.yearMonth);
    }

    @Override
    public int hashCode() {
        return yearMonth.hashCode();
    }

    @Override
    public String toString() {
        return "MonthlyPeriod{" + yearMonth + '}';
    }
}
