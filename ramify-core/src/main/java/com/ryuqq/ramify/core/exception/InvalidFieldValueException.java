package com.ryuqq.ramify.core.exception;

/**
 * Thrown when a primary key or indexed field holds a value that cannot be used as a key
 * (a missing primary key, a nested map, a list on a non multi-entry index, ...).
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public class InvalidFieldValueException extends UsageException {

    private static final long serialVersionUID = 1L;

    private final String field;

    public InvalidFieldValueException(String field, String message) {
        super(message + " (field: " + field + ")");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
