package com.ryuqq.ramify.core.spi;

/**
 * Handle returned by {@code subscribe}; unsubscribing is idempotent.
 *
 * @author Ramify Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Subscription {

    /**
     * Removes the observer. Later calls are no-ops.
     */
    void unsubscribe();
}
