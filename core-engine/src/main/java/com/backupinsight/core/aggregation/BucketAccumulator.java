package com.backupinsight.core.aggregation;

import com.backupinsight.core.model.AggregatedMetrics;
import com.backupinsight.core.model.EventRecord;
import com.backupinsight.core.model.PeriodDetail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the records of one (period, classification key) bucket and turns
 * them into an {@link AggregatedMetrics}.
 *
 * <p>
 * Not thread-safe; each instance lives for a single aggregation call.
 * </p>
 */
final class BucketAccumulator {

    private final PeriodDetail period;
    private final String classificationKey;

    private final List<Double> durations = new ArrayList<>();
    private int successCount;
    private int failureCount;
    private int partialCount;

    BucketAccumulator(PeriodDetail period, String classificationKey) {
        this.period = period;
        this.classificationKey = classificationKey;
    }

    void add(EventRecord record) {
        durations.add(record.getDurationSeconds());
        switch (record.getStatus()) {
            case SUCCESS -> successCount++;
            case FAILURE -> failureCount++;
            case PARTIAL -> partialCount++;
        }
    }

    /**
     * Durations are summed in ascending order so the result does not depend
     * on the order records arrived in.
     *
     * @return summary of every added record
     */
    AggregatedMetrics toMetrics() {
        List<Double> sorted = new ArrayList<>(durations);
        Collections.sort(sorted);

        double total = 0;
        for (double d : sorted) {
            total += d;
        }
        int count = sorted.size();

        return AggregatedMetrics.builder()
                .period(period)
                .classificationKey(classificationKey)
                .averageDuration(count == 0 ? 0.0 : total / count)
                .maxDuration(count == 0 ? 0.0 : sorted.get(count - 1))
                .minDuration(count == 0 ? 0.0 : sorted.get(0))
                .totalDuration(total)
                .totalCount(count)
                .successCount(successCount)
                .failureCount(failureCount)
                .partialCount(partialCount)
                .build();
    }
}
