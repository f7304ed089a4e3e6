package com.backupinsight.core.detection;

import com.backupinsight.core.config.AnomalyDetectionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Creates {@link AnomalyRule} instances by family name.
 *
 * <p>
 * This is the single point of extension when adding a rule family:
 * register its name here and add it to {@link #DEFAULT_FAMILIES} if it should
 * run by default.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyRuleFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyRuleFactory.class);

    /** Families evaluated by a default detector, in evaluation order. */
    public static final List<String> DEFAULT_FAMILIES = List.of(
            DurationAnomalyRule.NAME, CountAnomalyRule.NAME, RateAnomalyRule.NAME);

    private AnomalyRuleFactory() {
        // utility class - not instantiable
    }

    /**
     * @param family              {@code duration}, {@code count} or {@code rate}
     * @param thresholdMultiplier ratio bound shared by all checks of the family
     * @return the rule
     * @throws NullPointerException     if {@code family} is {@code null}
     * @throws IllegalArgumentException if the family is unknown
     */
    public static AnomalyRule create(String family, double thresholdMultiplier) {
        Objects.requireNonNull(family, "Rule family must not be null");
        return switch (family.toLowerCase(Locale.ROOT)) {
            case DurationAnomalyRule.NAME -> new DurationAnomalyRule(thresholdMultiplier);
            case CountAnomalyRule.NAME -> new CountAnomalyRule(thresholdMultiplier);
            case RateAnomalyRule.NAME -> new RateAnomalyRule(thresholdMultiplier);
            default -> throw new IllegalArgumentException(
                    "Unknown rule family: '" + family + "'. Supported families: duration, count, rate");
        };
    }

    /**
     * Create the default families for the given settings.
     *
     * @param settings validated detector settings
     * @return unmodifiable list of rules in evaluation order
     */
    public static List<AnomalyRule> createDefaults(AnomalyDetectionSettings settings) {
        Objects.requireNonNull(settings, "Settings must not be null");
        LOG.debug("Creating {} rule family(ies) with thresholdMultiplier={}",
                DEFAULT_FAMILIES.size(), settings.getThresholdMultiplier());
        return DEFAULT_FAMILIES.stream()
                .map(family -> create(family, settings.getThresholdMultiplier()))
                .toList();
    }
}
