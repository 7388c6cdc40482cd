package com.ryuqq.ramify.engine.notification;

import com.ryuqq.ramify.core.model.ChangeEvent;

import java.util.function.Consumer;

/**
 * Synchronous pass-through: the event reaches the sink before the mutating call returns.
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public final class ImmediateDispatcher implements NotificationDispatcher {

    private final Consumer<ChangeEvent> sink;

    public ImmediateDispatcher(Consumer<ChangeEvent> sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.sink = sink;
    }

    @Override
    public void dispatch(ChangeEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        sink.accept(event);
    }
}
