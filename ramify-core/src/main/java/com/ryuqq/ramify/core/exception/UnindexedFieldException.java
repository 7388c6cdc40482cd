package com.ryuqq.ramify.core.exception;

/**
 * Thrown at query construction when {@code where(field)} names a field that is neither the
 * primary key nor a declared index. Raised before any scan happens.
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public class UnindexedFieldException extends UsageException {

    private static final long serialVersionUID = 1L;

    private final String field;

    public UnindexedFieldException(String collection, String field) {
        super("Field is not a primary key or an index (collection: " + collection + ", field: " + field + ")");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
