/**
 * Collections and their query engine.
 *
 * <p>{@link com.ryuqq.ramify.engine.DocumentCollection} stores documents and keeps its
 * indexes in sync; {@link com.ryuqq.ramify.engine.Query} plans lookups against them through
 * the staged interfaces {@link com.ryuqq.ramify.engine.WhereStage},
 * {@link com.ryuqq.ramify.engine.ExecutableStage},
 * {@link com.ryuqq.ramify.engine.OrderableStage},
 * {@link com.ryuqq.ramify.engine.LimitedStage} and
 * {@link com.ryuqq.ramify.engine.TerminalStage}.</p>
 *
 * @since 1.0.0
 * @author Ramify Team
 */
package com.ryuqq.ramify.engine;
