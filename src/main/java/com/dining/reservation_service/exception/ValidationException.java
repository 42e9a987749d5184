package com.dining.reservation_service.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception thrown when a request violates field constraints.
 * Carries one message per offending field.
 */
public class ValidationException extends RuntimeException {

    private final Map<String, String> errors;

    public ValidationException(String message) {
        this(message, Collections.emptyMap());
    }

    public ValidationException(String message, Map<String, String> errors) {
        super(message);
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static ValidationException forField(String field, String message) {
        return new ValidationException(message, Map.of(field, message));
    }

    public Map<String, String> getErrors() {
        return errors;
    }
}
