package com.ryuqq.ramify.engine.notification;

import com.ryuqq.ramify.core.model.ChangeEvent;
import com.ryuqq.ramify.core.model.CollectionOperation;
import com.ryuqq.ramify.core.spi.Observer;
import com.ryuqq.ramify.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Per-collection observer registry.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Observers:</strong> CopyOnWriteArraySet&lt;Observer&gt; - insertion-ordered,
 *       duplicate-free, iterated from a stable snapshot</li>
 *   <li><strong>Dispatcher:</strong> {@link NotificationDispatcher} chosen by
 *       {@link NotificationConfig#mode()}</li>
 * </ul>
 *
 * <p><strong>Delivery Semantics:</strong></p>
 * <ul>
 *   <li>Observers registered during a delivery are not called for that delivery</li>
 *   <li>Unsubscribing during a delivery is safe</li>
 *   <li>An observer throwing {@link RuntimeException} is logged at ERROR; the remaining
 *       observers are still called and the mutation does not fail</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * NotificationManager notifications = new NotificationManager("users");
 * Subscription subscription = notifications.subscribe((operation, keys) -&gt; refresh(keys));
 * notifications.notify(CollectionOperation.CREATE, List.of("1"));
 * subscription.unsubscribe();
 * </pre>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public final class NotificationManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NotificationManager.class);

    private final String collectionName;
    private final Set<Observer> observers;
    private final NotificationDispatcher dispatcher;

    /**
     * Creates a manager with immediate delivery.
     *
     * @param collectionName owning collection name
     */
    public NotificationManager(String collectionName) {
        this(collectionName, new NotificationConfig());
    }

    /**
     * Creates a manager with the configured delivery policy.
     *
     * @param collectionName owning collection name
     * @param config notification config
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public NotificationManager(String collectionName, NotificationConfig config) {
        if (collectionName == null) {
            throw new IllegalArgumentException("collectionName cannot be null");
        }
        this.collectionName = collectionName;
        this.observers = new CopyOnWriteArraySet<>();
        this.dispatcher = NotificationDispatcher.create(collectionName, config, this::deliver);
    }

    /**
     * Registers an observer. Registering the same instance twice has no effect.
     *
     * @param observer observer (null 불가)
     * @return handle removing this observer
     */
    public Subscription subscribe(Observer observer) {
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        observers.add(observer);
        return () -> observers.remove(observer);
    }

    /**
     * Removes an observer.
     *
     * @param observer observer
     * @return true if it was registered
     */
    public boolean unsubscribe(Observer observer) {
        return observers.remove(observer);
    }

    /**
     * Publishes a change through the dispatcher.
     *
     * @param operation operation kind
     * @param keys affected primary keys (may be empty)
     */
    public void notify(CollectionOperation operation, List<Object> keys) {
        ChangeEvent event = ChangeEvent.of(operation, keys);
        if (observers.isEmpty()) {
            return;
        }
        dispatcher.dispatch(event);
    }

    /**
     * Delivers a pending debounced event now (no-op for immediate delivery).
     */
    public void flush() {
        dispatcher.flush();
    }

    public int observerCount() {
        return observers.size();
    }

    @Override
    public void close() {
        dispatcher.close();
    }

    private void deliver(ChangeEvent event) {
        for (Observer observer : observers) {
            try {
                observer.onChange(event.operation(), event.keys());
            } catch (RuntimeException e) {
                log.error("Observer {} failed on {} for collection {} (keys: {})",
                    observer, event.operation(), collectionName, event.keys(), e);
            }
        }
    }
}
