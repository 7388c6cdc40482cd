package com.ryuqq.ramify.core.exception;

/**
 * Base type of caller-recoverable usage errors.
 *
 * <p>Usage errors are thrown synchronously to the immediate caller and never swallowed.
 * Missing keys are not usage errors: they are reported with {@code Optional.empty()}.</p>
 *
 * <p><strong>Subtypes:</strong></p>
 * <ul>
 *   <li>{@link DuplicateKeyException} - add of an existing primary key</li>
 *   <li>{@link UnindexedFieldException} - index-style lookup on an undeclared field</li>
 *   <li>{@link InvalidFieldValueException} - non-primitive key or index value</li>
 * </ul>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public class UsageException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public UsageException(String message) {
        super(message);
    }
}
