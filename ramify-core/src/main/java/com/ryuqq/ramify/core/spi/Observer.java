package com.ryuqq.ramify.core.spi;

import com.ryuqq.ramify.core.model.CollectionOperation;

import java.util.List;

/**
 * Change callback registered against one collection.
 *
 * <p>This is the boundary consumed by reactive bindings and persistence bridges.</p>
 *
 * <p><strong>Persistence Bridge Contract:</strong></p>
 * <ul>
 *   <li>CREATE / UPDATE: re-fetch the named keys and persist them</li>
 *   <li>DELETE: remove the named keys externally</li>
 *   <li>CLEAR: wipe the external store</li>
 *   <li>Empty key list on CREATE / UPDATE / DELETE: key precision was reduced by debounced
 *       delivery, re-synchronize everything</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Do not block: immediate delivery runs on the mutating caller's thread</li>
 *   <li>Debounced delivery runs on the collection's timer thread; reading the collection from
 *       there is safe</li>
 *   <li>Exceptions thrown from the callback are logged and do not fail the mutation</li>
 *   <li>Observers may unsubscribe themselves (or others) while being notified</li>
 * </ul>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Observer {

    /**
     * Called after a mutation (or a coalesced group of mutations) completed.
     *
     * @param operation the operation kind
     * @param keys affected primary keys, unmodifiable, in mutation order
     */
    void onChange(CollectionOperation operation, List<Object> keys);
}
