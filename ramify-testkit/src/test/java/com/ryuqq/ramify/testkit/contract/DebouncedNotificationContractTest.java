package com.ryuqq.ramify.testkit.contract;

import com.ryuqq.ramify.core.document.Documents;
import com.ryuqq.ramify.core.model.ChangeEvent;
import com.ryuqq.ramify.core.model.CollectionOperation;
import com.ryuqq.ramify.engine.CollectionConfig;
import com.ryuqq.ramify.engine.DocumentCollection;
import com.ryuqq.ramify.engine.notification.NotificationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract for debounced delivery: bursts collapse into one event, keys survive only while
 * the burst has a single operation kind, and nothing pending is lost on close.
 *
 * @author Ramify Team
 * @since 1.0.0
 */
class DebouncedNotificationContractTest extends AbstractCollectionContractTest {

    private static final long DEBOUNCE_MS = 200;

    @Override
    protected CollectionConfig collectionConfig() {
        return new CollectionConfig(NotificationConfig.debounced(DEBOUNCE_MS));
    }

    @BeforeEach
    void subscribe() {
        users.subscribe(observer);
    }

    @Test
    void testBurstOfCreates_OneEventWithAllKeys() {
        // When
        users.put(Documents.of("id", "1"));
        users.put(Documents.of("id", "2"));
        users.bulkPut(List.of(Documents.of("id", "3"), Documents.of("id", "2")));

        // Then
        assertTrue(observer.awaitEvents(1, 2_000), "debounced event should arrive");
        sleep(DEBOUNCE_MS * 3);
        assertEquals(1, observer.count());
        assertEquals(ChangeEvent.of(CollectionOperation.CREATE, List.of("1", "2", "3")), observer.last());
    }

    @Test
    void testMixedBurst_LatestKindWithoutKeys() {
        // When
        users.put(Documents.of("id", "1"));
        users.update("1", Map.of("name", "A"));
        users.flushNotifications();

        // Then: flush delivers synchronously
        assertEquals(1, observer.count());
        assertEquals(ChangeEvent.keyless(CollectionOperation.UPDATE), observer.last());
    }

    @Test
    void testSeparatedWrites_TwoEvents() {
        users.put(Documents.of("id", "1"));
        assertTrue(observer.awaitEvents(1, 2_000));

        users.delete("1");
        assertTrue(observer.awaitEvents(2, 2_000));

        assertEquals(ChangeEvent.of(CollectionOperation.DELETE, List.of("1")), observer.last());
    }

    @Test
    void testClose_PendingEventDelivered() {
        // When
        users.put(Documents.of("id", "1"));
        users.close();

        // Then
        assertEquals(1, observer.count());
        assertEquals(ChangeEvent.of(CollectionOperation.CREATE, List.of("1")), observer.last());
    }

    @Test
    void testObserverReadsOnTimerThread_WhileWriterKeepsWriting() {
        // Given: 1ms window so the timer fires between short pauses of the writer
        List<Throwable> failures = new CopyOnWriteArrayList<>();
        AtomicInteger reads = new AtomicInteger();
        DocumentCollection burst = new DocumentCollection("burst", usersSchema(),
            new CollectionConfig(NotificationConfig.debounced(1)));
        burst.subscribe((operation, keys) -> {
            try {
                for (Map<String, Object> document : burst.toArray()) {
                    document.get("roles");
                }
                if (!keys.isEmpty()) {
                    burst.where("id").anyOf(keys).toArray();
                }
                burst.where("age").above(30).count();
                reads.incrementAndGet();
            } catch (RuntimeException e) {
                failures.add(e);
            }
        });

        // When
        try {
            for (int i = 0; i < 20_000; i++) {
                burst.put(user(String.valueOf(i), "U" + i, i % 60, i % 2 == 0, "r" + (i % 7)));
                if (i >= 100) {
                    burst.delete(String.valueOf(i - 100));
                }
                if (i % 1_000 == 999) {
                    sleep(5);
                }
            }
        } finally {
            burst.close();
        }
        for (int waited = 0; reads.get() == 0 && waited < 2_000; waited += 10) {
            sleep(10);
        }

        // Then
        assertTrue(failures.isEmpty(), () -> "observer failed: " + failures.get(0));
        assertTrue(reads.get() > 0, "observer should have read the collection");
        assertEquals(100, burst.count());
    }
}
