package com.ryuqq.ramify.engine.notification;

import com.ryuqq.ramify.core.model.ChangeEvent;

import java.util.function.Consumer;

/**
 * Decides when a change event reaches the observers.
 *
 * <p>A dispatcher receives every event the collection emits and forwards it (possibly merged,
 * possibly later) to a delivery sink.</p>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public sealed interface NotificationDispatcher extends AutoCloseable
    permits ImmediateDispatcher, DebouncedDispatcher {

    /**
     * Accepts one event.
     *
     * @param event change event (null 불가)
     */
    void dispatch(ChangeEvent event);

    /**
     * Delivers any pending event now.
     */
    default void flush() {
    }

    /**
     * Releases resources, delivering any pending event first.
     */
    @Override
    default void close() {
    }

    /**
     * Creates the dispatcher a configuration asks for.
     *
     * @param collectionName owning collection (thread naming, logs)
     * @param config notification config
     * @param sink delivery target
     * @return dispatcher
     */
    static NotificationDispatcher create(String collectionName, NotificationConfig config,
                                         Consumer<ChangeEvent> sink) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (config.mode() == NotificationMode.DEBOUNCED) {
            return new DebouncedDispatcher(collectionName, config.debounceMillis(), sink);
        }
        return new ImmediateDispatcher(sink);
    }
}
