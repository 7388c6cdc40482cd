/**
 * Service provider interfaces for change observation.
 *
 * <p>{@link com.ryuqq.ramify.core.spi.Observer} is implemented by embedding applications
 * (reactive bindings, persistence bridges); {@link com.ryuqq.ramify.core.spi.Subscription} is
 * returned to them by the engine.</p>
 *
 * @since 1.0.0
 * @author Ramify Team
 */
package com.ryuqq.ramify.core.spi;
