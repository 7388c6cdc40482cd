package com.ryuqq.ramify.engine.notification;

import com.ryuqq.ramify.core.model.ChangeEvent;
import com.ryuqq.ramify.core.model.CollectionOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Trailing-edge debounce over change events.
 *
 * <p>Each event restarts the timer. When the timer fires, the pending events are delivered as
 * one {@link ChangeEvent}:</p>
 * <ul>
 *   <li>operation: the latest coalesced operation</li>
 *   <li>keys: the de-duplicated union of all coalesced keys when every coalesced event had the
 *       same operation, otherwise empty</li>
 * </ul>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <ul>
 *   <li>One daemon timer thread per dispatcher (i.e. per collection)</li>
 *   <li>{@link #flush()} delivers the pending event on the calling thread</li>
 *   <li>{@link #close()} delivers the pending event, then stops the timer. Events dispatched
 *       after close are delivered immediately</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> pending state is guarded by this instance's monitor.
 * The sink is always invoked outside the lock.</p>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public final class DebouncedDispatcher implements NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DebouncedDispatcher.class);

    private final String collectionName;
    private final long delayMillis;
    private final Consumer<ChangeEvent> sink;
    private final ScheduledExecutorService scheduler;

    private ScheduledFuture<?> timer;
    private CollectionOperation latest;
    private Set<Object> keys;
    private boolean keysPrecise;
    private boolean closed;

    /**
     * Creates a dispatcher with its own timer thread.
     *
     * @param collectionName owning collection name
     * @param delayMillis debounce window (양수)
     * @param sink delivery target
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DebouncedDispatcher(String collectionName, long delayMillis, Consumer<ChangeEvent> sink) {
        if (collectionName == null) {
            throw new IllegalArgumentException("collectionName cannot be null");
        }
        if (delayMillis <= 0) {
            throw new IllegalArgumentException("delayMillis must be positive, but was: " + delayMillis);
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.collectionName = collectionName;
        this.delayMillis = delayMillis;
        this.sink = sink;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "ramify-debounce-" + collectionName);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void dispatch(ChangeEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        synchronized (this) {
            if (!closed) {
                merge(event);
                if (timer != null) {
                    timer.cancel(false);
                }
                timer = scheduler.schedule(this::fire, delayMillis, TimeUnit.MILLISECONDS);
                return;
            }
        }
        sink.accept(event);
    }

    @Override
    public void flush() {
        ChangeEvent pending;
        synchronized (this) {
            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
            pending = drain();
        }
        if (pending != null) {
            sink.accept(pending);
        }
    }

    @Override
    public void close() {
        ChangeEvent pending;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
            pending = drain();
        }
        scheduler.shutdownNow();
        log.debug("Debounce timer stopped for collection {} (pending delivered: {})",
            collectionName, pending != null);
        if (pending != null) {
            sink.accept(pending);
        }
    }

    /**
     * Whether an event is waiting for the timer.
     */
    public synchronized boolean hasPending() {
        return latest != null;
    }

    private void fire() {
        ChangeEvent pending;
        synchronized (this) {
            timer = null;
            pending = drain();
        }
        if (pending != null) {
            sink.accept(pending);
        }
    }

    private void merge(ChangeEvent event) {
        if (latest == null) {
            keys = new LinkedHashSet<>(event.keys());
            keysPrecise = true;
        } else if (keysPrecise && latest == event.operation()) {
            keys.addAll(event.keys());
        } else {
            keysPrecise = false;
            keys = null;
        }
        latest = event.operation();
    }

    private ChangeEvent drain() {
        if (latest == null) {
            return null;
        }
        ChangeEvent event = keysPrecise
            ? ChangeEvent.of(latest, new ArrayList<>(keys))
            : ChangeEvent.keyless(latest);
        latest = null;
        keys = null;
        keysPrecise = false;
        return event;
    }
}
