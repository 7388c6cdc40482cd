/**
 * Change notification: observer registry and delivery policies.
 *
 * <p>{@link com.ryuqq.ramify.engine.notification.NotificationManager} owns the observers of one
 * collection and hands events to a
 * {@link com.ryuqq.ramify.engine.notification.NotificationDispatcher}, either immediate
 * (synchronous, keyed) or debounced (coalesced on a per-collection timer).</p>
 *
 * @since 1.0.0
 * @author Ramify Team
 */
package com.ryuqq.ramify.engine.notification;
