package com.ryuqq.ramify.testkit.contract;

import com.ryuqq.ramify.core.model.ChangeEvent;
import com.ryuqq.ramify.core.model.CollectionOperation;
import com.ryuqq.ramify.core.spi.Observer;

import java.util.ArrayList;
import java.util.List;

/**
 * Observer that records every delivered event, for assertions in tests.
 *
 * <p>Safe to use with debounced delivery: events arrive on the timer thread and
 * {@link #awaitEvents(int, long)} blocks until enough of them have been recorded.</p>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public class RecordingObserver implements Observer {

    private final List<ChangeEvent> events = new ArrayList<>();

    @Override
    public synchronized void onChange(CollectionOperation operation, List<Object> keys) {
        events.add(ChangeEvent.of(operation, keys));
        notifyAll();
    }

    /**
     * Snapshot of the recorded events, oldest first.
     */
    public synchronized List<ChangeEvent> events() {
        return List.copyOf(events);
    }

    public synchronized int count() {
        return events.size();
    }

    /**
     * Most recent event.
     *
     * @throws IllegalStateException 기록된 이벤트가 없는 경우
     */
    public synchronized ChangeEvent last() {
        if (events.isEmpty()) {
            throw new IllegalStateException("no events recorded");
        }
        return events.get(events.size() - 1);
    }

    public synchronized void clear() {
        events.clear();
    }

    /**
     * Waits until at least {@code expected} events were recorded.
     *
     * @param expected number of events
     * @param timeoutMillis maximum wait
     * @return true if the events arrived in time
     */
    public synchronized boolean awaitEvents(int expected, long timeoutMillis) {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (events.size() < expected) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return false;
            }
            try {
                wait(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while waiting for events", e);
            }
        }
        return true;
    }
}
