package com.docbridge.adapter.spi;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of validating a {@link ClientConfig} against a transport.
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(List.of());

    private final List<ValidationError> errors;

    private ValidationResult(List<ValidationError> errors) {
        this.errors = List.copyOf(errors);
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult failure(String field, String message) {
        return new ValidationResult(List.of(new ValidationError(field, message)));
    }

    public static ValidationResult failure(List<ValidationError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("failure requires at least one error");
        }
        return new ValidationResult(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean isInvalid() {
        return !errors.isEmpty();
    }

    public List<ValidationError> errors() {
        return errors;
    }

    public String firstErrorMessage() {
        return errors.isEmpty() ? "" : errors.get(0).message();
    }

    public String allErrorMessages() {
        return errors.stream()
                .map(e -> e.field() + ": " + e.message())
                .collect(Collectors.joining("; "));
    }

    /**
     * A single problem with one configuration field.
     */
    public record ValidationError(String field, String message) {
        public ValidationError {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }
    }
}
