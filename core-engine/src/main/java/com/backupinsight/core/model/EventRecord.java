package com.backupinsight.core.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single, already normalized backup job execution.
 *
 * <p>
 * Timestamps are local to the reporting time zone; the upstream loader is
 * responsible for that conversion. Instances are immutable and can only be
 * obtained through the {@link Builder}, which refuses to produce a record
 * whose end precedes its start.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventRecord {

    /** Classification key assigned to records that carry none. */
    public static final String UNKNOWN_CLASSIFICATION = "unknown";

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final String recordId;
    private final LocalDateTime startTime;
    private final LocalDateTime endTime;
    private final RecordStatus status;
    private final String classificationKey;
    private final String sourceId;
    private final Map<String, Object> metadata;

    private EventRecord(Builder b) {
        this.recordId = b.recordId;
        this.startTime = b.startTime;
        this.endTime = b.endTime;
        this.status = b.status;
        this.classificationKey = b.classificationKey;
        this.sourceId = b.sourceId;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getRecordId() {
        return recordId;
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public LocalDateTime getEndTime() {
        return endTime;
    }

    public RecordStatus getStatus() {
        return status;
    }

    /**
     * @return the classification key, or {@code null} when unclassified
     */
    public String getClassificationKey() {
        return classificationKey;
    }

    /**
     * @return the classification key, falling back to
     *         {@link #UNKNOWN_CLASSIFICATION}
     */
    public String getEffectiveClassificationKey() {
        return classificationKey != null ? classificationKey : UNKNOWN_CLASSIFICATION;
    }

    public String getSourceId() {
        return sourceId;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * @return elapsed seconds between start and end, never negative
     */
    public double getDurationSeconds() {
        return Duration.between(startTime, endTime).toNanos() / NANOS_PER_SECOND;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EventRecord that))
            return false;
        return Objects.equals(recordId, that.recordId)
                && Objects.equals(startTime, that.startTime)
                && Objects.equals(endTime, that.endTime)
                && status == that.status
                && Objects.equals(classificationKey, that.classificationKey)
                && Objects.equals(sourceId, that.sourceId)
                && Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordId, startTime, endTime, status, classificationKey, sourceId, metadata);
    }

    @Override
    public String toString() {
        return "EventRecord{" +
                "recordId='" + recordId + '\'' +
                ", startTime=" + startTime +
                ", endTime=" + endTime +
                ", status=" + status +
                ", classificationKey='" + classificationKey + '\'' +
                ", sourceId='" + sourceId + '\'' +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EventRecord}.
     *
     * <p>
     * {@link #tryBuild()} reports every problem at once instead of stopping
     * at the first one.
     * </p>
     */
    public static class Builder {
        private String recordId;
        private LocalDateTime startTime;
        private LocalDateTime endTime;
        private RecordStatus status;
        private String classificationKey;
        private String sourceId;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder recordId(String recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder startTime(LocalDateTime startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(LocalDateTime endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder status(RecordStatus status) {
            this.status = status;
            return this;
        }

        public Builder classificationKey(String classificationKey) {
            this.classificationKey = classificationKey;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder putMetadata(String key, Object value) {
            this.metadata.put(Objects.requireNonNull(key, "metadata key must not be null"), value);
            return this;
        }

        /**
         * Validate the collected fields and build the record.
         *
         * @return a valid result holding the record, or an invalid one listing
         *         every violated constraint
         */
        public Validation<EventRecord> tryBuild() {
            List<String> errors = new ArrayList<>();

            if (recordId == null || recordId.isBlank()) {
                errors.add("'recordId' is required");
            }
            if (startTime == null) {
                errors.add("'startTime' is required");
            }
            if (endTime == null) {
                errors.add("'endTime' is required");
            }
            if (status == null) {
                errors.add("'status' is required");
            }
            if (startTime != null && endTime != null && endTime.isBefore(startTime)) {
                errors.add("'endTime' " + endTime + " is before 'startTime' " + startTime);
            }

            return errors.isEmpty()
                    ? Validation.valid(new EventRecord(this))
                    : Validation.invalid(errors);
        }

        /**
         * Build the record, failing on the first invalid input.
         *
         * @return a new {@link EventRecord}
         * @throws IllegalStateException if any field is invalid
         */
        public EventRecord build() {
            return tryBuild().orElseThrow("EventRecord");
        }
    }
}
