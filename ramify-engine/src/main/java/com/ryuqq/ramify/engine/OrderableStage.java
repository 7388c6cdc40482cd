package com.ryuqq.ramify.engine;

/**
 * Stage reached after an order field was set.
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public interface OrderableStage extends LimitedStage {

    /**
     * Sorts in descending order; calling it again keeps it descending. Documents without a
     * sortable value stay last.
     */
    OrderableStage reverse();
}
