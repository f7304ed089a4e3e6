package com.backupinsight.core.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Objects;

/**
 * JSON rendering of analysis output for external reporting.
 *
 * <p>
 * Property names are snake_case, dates are ISO-8601 strings and enums use
 * their lowercase codes. Works for an {@link AnalysisReport} or any single
 * output value or list of them.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisJson {

    private static final ObjectMapper MAPPER = createMapper();

    private AnalysisJson() {
        // utility class - not instantiable
    }

    /**
     * @param value report, aggregate, comparison, detection result or list
     *              thereof; must not be {@code null}
     * @return compact JSON
     * @throws IllegalStateException if the value cannot be serialized
     */
    public static String toJson(Object value) {
        return write(value, false);
    }

    /**
     * @param value as for {@link #toJson(Object)}
     * @return indented JSON
     * @throws IllegalStateException if the value cannot be serialized
     */
    public static String toPrettyJson(Object value) {
        return write(value, true);
    }

    private static String write(Object value, boolean pretty) {
        Objects.requireNonNull(value, "Value must not be null");
        try {
            return pretty
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value)
                    : MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                    "Failed to serialize " + value.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return mapper;
    }
}
