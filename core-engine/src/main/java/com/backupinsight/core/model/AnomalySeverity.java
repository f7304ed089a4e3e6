package com.backupinsight.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordered anomaly severities, {@link #LOW} being the mildest.
 *
 * @since 1.0.0
 */
public enum AnomalySeverity {
    LOW(1, "Low severity - minor deviation"),
    MEDIUM(2, "Medium severity - requires attention"),
    HIGH(3, "High severity - urgent attention needed"),
    CRITICAL(4, "Critical severity - immediate action required");

    private final int level;
    private final String description;

    AnomalySeverity(int level, String description) {
        this.level = level;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return lowercase name, e.g. {@code "critical"}
     */
    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isHigherThan(AnomalySeverity other) {
        return this.level > other.level;
    }
}
