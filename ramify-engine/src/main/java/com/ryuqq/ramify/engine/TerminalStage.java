package com.ryuqq.ramify.engine;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Operations that execute a query.
 *
 * <p>The first terminal call plans and runs the query; the result is memoized, so later
 * terminal calls on the same query see the same documents. Returned documents are
 * copy-on-write views: changing them never changes the collection.</p>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public interface TerminalStage {

    /**
     * All matching documents in result order.
     */
    List<Map<String, Object>> toArray();

    /**
     * First matching document, if any.
     */
    Optional<Map<String, Object>> first();

    /**
     * Last matching document, if any.
     */
    Optional<Map<String, Object>> last();

    /**
     * Number of matching documents (after offset and limit).
     */
    int count();

    /**
     * Calls the consumer with every matching document, in result order.
     *
     * @param consumer consumer (null 불가)
     */
    void each(Consumer<Map<String, Object>> consumer);

    /**
     * Primary keys of the matching documents, in result order.
     */
    List<Object> keys();

    /**
     * Merges the changes into every matching document through the collection's update path.
     *
     * <p>Emits a single UPDATE notification for all affected keys.</p>
     *
     * @param changes top-level field → new value
     * @return keys of the documents actually updated (new keys when the primary key changed)
     */
    List<Object> modify(Map<String, ?> changes);

    /**
     * Deletes every matching document, emitting a single DELETE notification.
     *
     * @return keys of the documents actually deleted
     */
    List<Object> delete();
}
