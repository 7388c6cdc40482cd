package com.ryuqq.ramify.engine;

import java.util.Map;
import java.util.function.Predicate;

/**
 * Stage reached once the query has its conditions.
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public interface ExecutableStage extends LimitedStage {

    /**
     * Adds a predicate evaluated after the index conditions, in the order added.
     *
     * <p>The predicate receives a copy-on-write view of each candidate.</p>
     *
     * @param predicate predicate (null 불가)
     */
    ExecutableStage filter(Predicate<Map<String, Object>> predicate);

    /**
     * Orders results ascending by a field (dot paths allowed). The sort is stable.
     *
     * @param field field path
     */
    OrderableStage orderBy(String field);

    /**
     * Alias of {@link #orderBy(String)}.
     */
    OrderableStage sortBy(String field);
}
