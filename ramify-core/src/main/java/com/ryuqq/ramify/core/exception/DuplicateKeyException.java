package com.ryuqq.ramify.core.exception;

/**
 * Thrown when a document is added under a primary key that already exists.
 * Use {@code put} for upserts.
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public class DuplicateKeyException extends UsageException {

    private static final long serialVersionUID = 1L;

    private final transient Object key;

    public DuplicateKeyException(String collection, Object key) {
        super("Document with primary key " + key + " already exists in collection: " + collection);
        this.key = key;
    }

    /**
     * The conflicting primary key.
     */
    public Object getKey() {
        return key;
    }
}
