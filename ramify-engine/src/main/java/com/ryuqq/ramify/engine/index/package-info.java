/**
 * Secondary index structures maintained synchronously by collections.
 *
 * @since 1.0.0
 * @author Ramify Team
 */
package com.ryuqq.ramify.engine.index;
