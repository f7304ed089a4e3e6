package com.backupinsight.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EventRecord}.
 */
class EventRecordTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 15, 2, 0, 0);

    @Test
    @DisplayName("Should compute duration in seconds")
    void shouldComputeDuration() {
        EventRecord record = validBuilder().endTime(START.plusMinutes(30).plusNanos(500_000_000)).build();

        assertThat(record.getDurationSeconds()).isEqualTo(1800.5);
    }

    @Test
    @DisplayName("Should accept a zero-length run")
    void shouldAcceptZeroDuration() {
        Validation<EventRecord> result = validBuilder().endTime(START).tryBuild();

        assertThat(result.isValid()).isTrue();
        assertThat(result.get().getDurationSeconds()).isZero();
    }

    @Test
    @DisplayName("Should reject end before start as data, not as an exception")
    void shouldRejectEndBeforeStart() {
        Validation<EventRecord> result = validBuilder().endTime(START.minusSeconds(1)).tryBuild();

        assertThat(result.isValid()).isFalse();
        assertThat(result.toOptional()).isEmpty();
        assertThat(result.getErrors()).hasSize(1);
        assertThat(result.getErrors().get(0)).contains("before 'startTime'");
    }

    @Test
    @DisplayName("Should collect every missing field")
    void shouldCollectAllErrors() {
        Validation<EventRecord> result = EventRecord.builder().recordId(" ").tryBuild();

        assertThat(result.getErrors()).hasSize(4);
    }

    @Test
    @DisplayName("build() should throw with the collected messages")
    void buildShouldThrowOnInvalidInput() {
        assertThatThrownBy(() -> validBuilder().endTime(START.minusHours(1)).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid EventRecord");
    }

    @Test
    @DisplayName("Should fall back to 'unknown' classification key")
    void shouldUseUnknownSentinel() {
        EventRecord unclassified = validBuilder().classificationKey(null).build();
        EventRecord classified = validBuilder().classificationKey("database").build();

        assertThat(unclassified.getClassificationKey()).isNull();
        assertThat(unclassified.getEffectiveClassificationKey()).isEqualTo(EventRecord.UNKNOWN_CLASSIFICATION);
        assertThat(classified.getEffectiveClassificationKey()).isEqualTo("database");
    }

    @Test
    @DisplayName("Metadata should be an immutable copy")
    void metadataShouldBeImmutable() {
        EventRecord record = validBuilder().putMetadata("host", "db-01").build();

        assertThat(record.getMetadata()).containsEntry("host", "db-01");
        assertThatThrownBy(() -> record.getMetadata().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should parse status names case-insensitively")
    void shouldParseStatus() {
        assertThat(RecordStatus.fromString("Partial")).isEqualTo(RecordStatus.PARTIAL);
        assertThatThrownBy(() -> RecordStatus.fromString("aborted"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private EventRecord.Builder validBuilder() {
        return EventRecord.builder()
                .recordId("job-1")
                .startTime(START)
                .endTime(START.plusMinutes(30))
                .status(RecordStatus.SUCCESS)
                .sourceId("db-01");
    }
}
