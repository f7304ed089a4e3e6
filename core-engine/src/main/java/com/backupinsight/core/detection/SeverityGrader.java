package com.backupinsight.core.detection;

import com.backupinsight.core.model.AnomalySeverity;

/**
 * Maps a deviation onto an {@link AnomalySeverity}.
 *
 * <h3>Precedence</h3>
 * <ol>
 * <li>With a positive standard deviation and mean, the deviation is
 * expressed in units of the coefficient of variation:
 * {@code z = |deviation%| / (stdev / mean * 100)}. {@code z >= 3} is
 * critical, {@code z >= 2} high, {@code z >= 1} medium.</li>
 * <li>Otherwise, and whenever {@code z < 1}, fixed percentage bands apply:
 * {@code >= 200%} critical, {@code >= 100%} high, {@code >= 50%} medium,
 * anything else low.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class SeverityGrader {

    private SeverityGrader() {
        // utility class - not instantiable
    }

    /**
     * @param deviationPercentage signed deviation from the expectation, in percent
     * @param standardDeviation   spread of the historical values, 0 if unknown
     * @param mean                historical mean
     * @return the severity
     */
    public static AnomalySeverity grade(double deviationPercentage, double standardDeviation, double mean) {
        double absDeviation = Math.abs(deviationPercentage);

        if (standardDeviation > 0 && mean > 0) {
            double zScore = absDeviation / (standardDeviation / mean * 100.0);
            if (zScore >= 3) {
                return AnomalySeverity.CRITICAL;
            }
            if (zScore >= 2) {
                return AnomalySeverity.HIGH;
            }
            if (zScore >= 1) {
                return AnomalySeverity.MEDIUM;
            }
        }

        return gradeByPercentage(absDeviation);
    }

    static AnomalySeverity gradeByPercentage(double absDeviation) {
        if (absDeviation >= 200) {
            return AnomalySeverity.CRITICAL;
        }
        if (absDeviation >= 100) {
            return AnomalySeverity.HIGH;
        }
        if (absDeviation >= 50) {
            return AnomalySeverity.MEDIUM;
        }
        return AnomalySeverity.LOW;
    }
}
