/**
 * Usage error taxonomy. All types are unchecked and extend
 * {@link com.ryuqq.ramify.core.exception.UsageException}.
 *
 * @since 1.0.0
 * @author Ramify Team
 */
package com.ryuqq.ramify.core.exception;
