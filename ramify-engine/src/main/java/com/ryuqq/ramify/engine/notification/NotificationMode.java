package com.ryuqq.ramify.engine.notification;

/**
 * Delivery policy for change notifications.
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public enum NotificationMode {

    /**
     * Every change is delivered synchronously on the mutating thread, with its exact keys.
     */
    IMMEDIATE,

    /**
     * Changes within the debounce window collapse into one delivery on a timer thread.
     *
     * <p>Keys are kept only while every coalesced change had the same operation.</p>
     */
    DEBOUNCED
}
