package com.backupinsight.core.model;

import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of constructing a value: either the value itself or every reason
 * it could not be built.
 *
 * <p>
 * Used where invalid input is an expected outcome the caller must branch on,
 * so rejection is carried as data instead of as an exception.
 * </p>
 *
 * @param <T> type of the validated value
 * @since 1.0.0
 */
public final class Validation<T> {

    private final T value;
    private final List<String> errors;

    private Validation(T value, List<String> errors) {
        this.value = value;
        this.errors = errors;
    }

    /**
     * @param value the successfully built value; must not be {@code null}
     * @return a valid result
     */
    public static <T> Validation<T> valid(T value) {
        return new Validation<>(Objects.requireNonNull(value, "value must not be null"),
                Collections.emptyList());
    }

    /**
     * @param errors at least one error message
     * @return an invalid result
     * @throws IllegalArgumentException if {@code errors} is empty
     */
    public static <T> Validation<T> invalid(List<String> errors) {
        Objects.requireNonNull(errors, "errors must not be null");
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one error");
        }
        return new Validation<>(null, List.copyOf(errors));
    }

    public boolean isValid() {
        return value != null;
    }

    /**
     * @return the value
     * @throws NoSuchElementException if this result is invalid
     */
    public T get() {
        if (value == null) {
            throw new NoSuchElementException("No value present: " + String.join("; ", errors));
        }
        return value;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * @return unmodifiable list of error messages, empty when valid
     */
    public List<String> getErrors() {
        return errors;
    }

    /**
     * Return the value or fail with all collected messages.
     *
     * @param description what was being built, used as the message prefix
     * @return the value
     * @throws IllegalStateException if this result is invalid
     */
    public T orElseThrow(String description) {
        if (value == null) {
            throw new IllegalStateException(
                    "Invalid " + description + ": " + String.join("; ", errors));
        }
        return value;
    }

    @Override
    public String toString() {
        return isValid() ? "Valid{" + value + '}' : "Invalid" + errors;
    }
}
