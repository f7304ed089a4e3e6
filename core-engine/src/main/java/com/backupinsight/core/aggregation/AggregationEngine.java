package com.backupinsight.core.aggregation;

import com.backupinsight.core.config.AnalysisConfig;
import com.backupinsight.core.model.AggregatedMetrics;
import com.backupinsight.core.model.EventRecord;
import com.backupinsight.core.model.Granularity;
import com.backupinsight.core.model.MonthlyPeriod;
import com.backupinsight.core.model.PeriodDetail;
import com.backupinsight.core.model.WeeklyPeriod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Groups event records into period buckets and summarizes each bucket.
 *
 * <h3>Bucketing</h3>
 * <p>
 * A bucket is identified by the period containing the record's start time
 * and by its classification key ({@value EventRecord#UNKNOWN_CLASSIFICATION}
 * when absent). Only buckets with at least one record are emitted; missing
 * periods are not zero-filled.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * Output is sorted by period start, then classification key, and is
 * identical for any permutation of the input.
 * </p>
 *
 * <p>
 * Stateless apart from the configured granularities; safe to share between
 * threads.
 * </p>
 *
 * @since 1.0.0
 */
public class AggregationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationEngine.class);

    static final Comparator<AggregatedMetrics> PERIOD_THEN_KEY = Comparator
            .comparing(AggregatedMetrics::getPeriodStart)
            .thenComparing(AggregatedMetrics::getClassificationKey);

    private final Set<Granularity> granularities;

    /**
     * Engine computing every granularity in {@link #aggregateAll(Collection)}.
     */
    public AggregationEngine() {
        this(AnalysisConfig.defaults());
    }

    /**
     * @param config validated configuration; its granularities drive
     *               {@link #aggregateAll(Collection)}
     * @throws com.backupinsight.core.config.InvalidConfigurationException if the
     *         configuration is invalid
     */
    public AggregationEngine(AnalysisConfig config) {
        Objects.requireNonNull(config, "AnalysisConfig must not be null");
        config.validate();
        this.granularities = config.getGranularitySet();
    }

    // ---------------------------------------------------------------
    // Per-granularity entry points
    // ---------------------------------------------------------------

    public List<AggregatedMetrics> aggregateDaily(Collection<EventRecord> records) {
        return aggregateDaily(records, null);
    }

    /**
     * @param records    validated records
     * @param targetDate only aggregate this day, or {@code null} for all days
     * @return one aggregate per (day, key), sorted
     */
    public List<AggregatedMetrics> aggregateDaily(Collection<EventRecord> records, LocalDate targetDate) {
        return aggregate(records, Granularity.DAY,
                period -> targetDate == null || period.getPeriodStart().equals(targetDate));
    }

    public List<AggregatedMetrics> aggregateWeekly(Collection<EventRecord> records) {
        return aggregateWeekly(records, null);
    }

    /**
     * @param records   validated records
     * @param weekStart only aggregate the ISO week containing this day, or
     *                  {@code null} for all weeks
     * @return one aggregate per (week, key), sorted
     */
    public List<AggregatedMetrics> aggregateWeekly(Collection<EventRecord> records, LocalDate weekStart) {
        LocalDate monday = weekStart == null ? null : WeeklyPeriod.containing(weekStart).getWeekStart();
        return aggregate(records, Granularity.WEEK,
                period -> monday == null || period.getPeriodStart().equals(monday));
    }

    public List<AggregatedMetrics> aggregateMonthly(Collection<EventRecord> records) {
        return aggregateMonthly(records, null, null);
    }

    /**
     * @param records validated records
     * @param year    only aggregate this year, or {@code null}
     * @param month   only aggregate this month of year (1-12), or {@code null}
     * @return one aggregate per (month, key), sorted
     */
    public List<AggregatedMetrics> aggregateMonthly(Collection<EventRecord> records, Integer year, Integer month) {
        return aggregate(records, Granularity.MONTH, period -> {
            MonthlyPeriod m = (MonthlyPeriod) period;
            return (year == null || m.getYear() == year) && (month == null || m.getMonth() == month);
        });
    }

    /**
     * Aggregate every record at the given granularity without a period filter.
     *
     * @param granularity period size
     * @param records     validated records
     * @return sorted aggregates
     */
    public List<AggregatedMetrics> aggregate(Granularity granularity, Collection<EventRecord> records) {
        Objects.requireNonNull(granularity, "Granularity must not be null");
        return aggregate(records, granularity, period -> true);
    }

    /**
     * Aggregate at each configured granularity.
     *
     * @param records validated records
     * @return unmodifiable map in day, week, month order, holding only the
     *         configured granularities
     */
    public Map<Granularity, List<AggregatedMetrics>> aggregateAll(Collection<EventRecord> records) {
        Map<Granularity, List<AggregatedMetrics>> result = new EnumMap<>(Granularity.class);
        for (Granularity granularity : granularities) {
            result.put(granularity, aggregate(granularity, records));
        }
        return Collections.unmodifiableMap(result);
    }

    public Set<Granularity> getGranularities() {
        return granularities;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<AggregatedMetrics> aggregate(Collection<EventRecord> records, Granularity granularity,
                                              Predicate<PeriodDetail> periodFilter) {
        Objects.requireNonNull(records, "Records must not be null");
        if (records.isEmpty()) {
            return List.of();
        }

        Map<BucketKey, BucketAccumulator> buckets = new HashMap<>();
        int skipped = 0;

        for (EventRecord record : records) {
            PeriodDetail period = PeriodDetail.containing(granularity, record.getStartTime().toLocalDate());
            if (!periodFilter.test(period)) {
                skipped++;
                continue;
            }
            String key = record.getEffectiveClassificationKey();
            buckets.computeIfAbsent(new BucketKey(period, key), k -> new BucketAccumulator(period, key))
                    .add(record);
        }

        List<AggregatedMetrics> metrics = new ArrayList<>(buckets.size());
        for (BucketAccumulator bucket : buckets.values()) {
            metrics.add(bucket.toMetrics());
        }
        metrics.sort(PERIOD_THEN_KEY);

        LOG.debug("Aggregated {} record(s) into {} {} bucket(s), {} outside the period filter",
                records.size() - skipped, metrics.size(), granularity.getCode(), skipped);
        return Collections.unmodifiableList(metrics);
    }

    private static final class BucketKey {
        private final PeriodDetail period;
        private final String classificationKey;

        BucketKey(PeriodDetail period, String classificationKey) {
            this.period = period;
            this.classificationKey = classificationKey;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof BucketKey that))
                return false;
            return period.equals(that.period) && classificationKey.equals(that.classificationKey);
        }

        @Override
        public int hashCode() {
            return Objects.hash(period, classificationKey);
        }
    }
}
