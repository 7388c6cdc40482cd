package com.ryuqq.ramify.engine;

import com.ryuqq.ramify.core.document.CopyOnWriteDocument;
import com.ryuqq.ramify.core.document.Documents;
import com.ryuqq.ramify.core.document.FieldPath;
import com.ryuqq.ramify.core.exception.DuplicateKeyException;
import com.ryuqq.ramify.core.exception.InvalidFieldValueException;
import com.ryuqq.ramify.core.exception.UnindexedFieldException;
import com.ryuqq.ramify.core.model.CollectionOperation;
import com.ryuqq.ramify.core.model.IndexValue;
import com.ryuqq.ramify.core.model.Schema;
import com.ryuqq.ramify.core.spi.Observer;
import com.ryuqq.ramify.core.spi.Subscription;
import com.ryuqq.ramify.engine.index.IndexMap;
import com.ryuqq.ramify.engine.notification.NotificationManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Schema-defined, in-memory document collection with synchronous secondary indexes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>documents:</strong> LinkedHashMap&lt;IndexValue, Document&gt; - primary map,
 *       insertion-ordered (replacing a document moves it to the end)</li>
 *   <li><strong>indexes:</strong> one {@link IndexMap} per declared secondary and
 *       multi-entry path</li>
 *   <li><strong>notifications:</strong> {@link NotificationManager} delivering
 *       {@link CollectionOperation} events to observers</li>
 * </ul>
 *
 * <p><strong>Write Path:</strong></p>
 * <ul>
 *   <li>Input documents are deep-copied, so the caller's map never aliases stored state</li>
 *   <li>The primary key and every index value are validated before any state changes</li>
 *   <li>put = delete the previous version (if any) + insert, updating every index</li>
 *   <li>One event per single-document call; bulk calls and query-driven modify/delete emit
 *       exactly one coalesced event carrying all affected keys</li>
 * </ul>
 *
 * <p><strong>Read Path:</strong> every returned document is a {@link CopyOnWriteDocument}
 * over the stored one. Reading it is free; the first write clones it privately.</p>
 *
 * <p><strong>Thread Safety:</strong> reads and writes are {@code synchronized} on the
 * collection, so observers running on the debounce timer thread can re-fetch documents while
 * the writer keeps going. A stored document is never modified after it was inserted: updates
 * store a new merged map, so views handed out earlier keep reading a stable snapshot.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No durability: state lives only as long as this object</li>
 *   <li>No transactions: bulk calls are not atomic, an error mid-batch keeps the writes
 *       already applied</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Schema schema = Schema.of("id").withIndexes("email").withMultiEntry("tags");
 * try (DocumentCollection users = new DocumentCollection("users", schema)) {
 *     users.subscribe((operation, keys) -&gt; refresh(keys));
 *     users.put(Documents.of("id", "1", "email", "a@x.com", "tags", List.of("x", "y")));
 *
 *     int tagged = users.where("tags").equalTo("y").count();
 *     List&lt;Map&lt;String, Object&gt;&gt; firstTwo = users.orderBy("age").limit(2).toArray();
 * }
 * </pre>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public final class DocumentCollection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DocumentCollection.class);

    private final String name;
    private final Schema schema;
    private final FieldPath primaryKeyPath;
    private final Map<IndexValue, Map<String, Object>> documents;
    private final Map<String, IndexMap> indexes;
    private final NotificationManager notifications;

    private int batchDepth;

    /**
     * Creates an empty collection with immediate notifications.
     *
     * @param name collection name
     * @param schema collection schema
     */
    public DocumentCollection(String name, Schema schema) {
        this(name, schema, new CollectionConfig());
    }

    /**
     * Creates an empty collection.
     *
     * @param name collection name (null/blank 불가)
     * @param schema collection schema (null 불가)
     * @param config collection config (null 불가)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DocumentCollection(String name, Schema schema, CollectionConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (schema == null) {
            throw new IllegalArgumentException("schema cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.name = name;
        this.schema = schema;
        this.primaryKeyPath = FieldPath.of(schema.primaryKey());
        this.documents = new LinkedHashMap<>();
        this.indexes = new LinkedHashMap<>();
        for (String path : schema.indexes()) {
            indexes.put(path, new IndexMap(path, false));
        }
        for (String path : schema.multiEntry()) {
            indexes.put(path, new IndexMap(path, true));
        }
        this.notifications = new NotificationManager(name, config.notification());
    }

    // ---------------------------------------------------------------- writes

    /**
     * Inserts or replaces a document.
     *
     * @param document document (null 불가)
     * @return the document's primary key
     * @throws InvalidFieldValueException primary key 또는 index 값이 primitive가 아닌 경우
     */
    public synchronized Object put(Map<String, ?> document) {
        Object key = putInternal(document);
        afterWrite(CollectionOperation.CREATE, key);
        return key;
    }

    /**
     * Inserts a document whose primary key must not exist yet.
     *
     * @param document document (null 불가)
     * @return the document's primary key
     * @throws DuplicateKeyException 같은 primary key가 이미 존재하는 경우
     */
    public synchronized Object add(Map<String, ?> document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        IndexValue key = keyOf(document);
        if (documents.containsKey(key)) {
            throw new DuplicateKeyException(name, key.raw());
        }
        return put(document);
    }

    /**
     * Merges top-level field changes into an existing document.
     *
     * <p>The merged document always replaces the stored one. When the changes touch neither
     * the primary key nor an indexed path it keeps its position everywhere. Otherwise it is
     * validated and reinserted, moving it in every index (and to the end of the primary
     * map).</p>
     *
     * @param key primary key
     * @param changes top-level field → new value (null 불가)
     * @return the document's primary key after the update (the new one if it changed),
     *         or empty when no document has this key
     * @throws DuplicateKeyException primary key가 이미 존재하는 다른 key로 변경되는 경우
     */
    public synchronized Optional<Object> update(Object key, Map<String, ?> changes) {
        if (changes == null) {
            throw new IllegalArgumentException("changes cannot be null");
        }
        Optional<Object> updated = updateInternal(key, changes);
        updated.ifPresent(k -> afterWrite(CollectionOperation.UPDATE, k));
        return updated;
    }

    /**
     * Removes a document.
     *
     * @param key primary key
     * @return the removed key, or empty when absent
     */
    public synchronized Optional<Object> delete(Object key) {
        IndexValue primaryKey = lookupKey(key);
        Map<String, Object> removed = primaryKey == null ? null : remove(primaryKey);
        if (removed == null) {
            return Optional.empty();
        }
        Object removedKey = primaryKeyOf(removed);
        afterWrite(CollectionOperation.DELETE, removedKey);
        return Optional.of(removedKey);
    }

    /**
     * Removes every document and notifies CLEAR without keys.
     */
    public synchronized void clear() {
        int removed = documents.size();
        documents.clear();
        for (IndexMap index : indexes.values()) {
            index.clear();
        }
        log.debug("Cleared collection {} ({} documents)", name, removed);
        notifications.notify(CollectionOperation.CLEAR, List.of());
    }

    /**
     * Puts every document, notifying CREATE once.
     *
     * @param batch documents
     * @return primary keys in input order
     */
    public synchronized List<Object> bulkPut(List<? extends Map<String, ?>> batch) {
        requireBatch(batch);
        return inBatch(CollectionOperation.CREATE, affected -> {
            for (Map<String, ?> document : batch) {
                affected.add(put(document));
            }
        });
    }

    /**
     * Adds every document, notifying CREATE once.
     *
     * <p>A duplicate stops the batch; documents added before it stay and are notified.</p>
     *
     * @param batch documents
     * @return primary keys in input order
     * @throws DuplicateKeyException 중복 key를 만난 경우
     */
    public synchronized List<Object> bulkAdd(List<? extends Map<String, ?>> batch) {
        requireBatch(batch);
        return inBatch(CollectionOperation.CREATE, affected -> {
            for (Map<String, ?> document : batch) {
                affected.add(add(document));
            }
        });
    }

    /**
     * Applies every update, notifying UPDATE once for the documents that existed.
     *
     * @param batch key + changes pairs
     * @return number of documents updated
     */
    public synchronized int bulkUpdate(List<KeyedChanges> batch) {
        requireBatch(batch);
        return inBatch(CollectionOperation.UPDATE, affected -> {
            for (KeyedChanges entry : batch) {
                update(entry.key(), entry.changes()).ifPresent(affected::add);
            }
        }).size();
    }

    /**
     * Deletes every key, notifying DELETE once for the documents that existed.
     *
     * @param keys primary keys
     * @return per input key, the removed key or empty
     */
    public synchronized List<Optional<Object>> bulkDelete(List<?> keys) {
        requireBatch(keys);
        List<Optional<Object>> results = new ArrayList<>(keys.size());
        inBatch(CollectionOperation.DELETE, affected -> {
            for (Object key : keys) {
                Optional<Object> removed = delete(key);
                removed.ifPresent(affected::add);
                results.add(removed);
            }
        });
        return results;
    }

    // ---------------------------------------------------------------- reads

    /**
     * Finds a document by primary key.
     *
     * @param key primary key (null 불가)
     * @return copy-on-write view, or empty when absent
     */
    public synchronized Optional<Map<String, Object>> get(Object key) {
        IndexValue primaryKey = lookupKey(key);
        Map<String, Object> document = primaryKey == null ? null : documents.get(primaryKey);
        return document == null ? Optional.empty() : Optional.of(CopyOnWriteDocument.of(document));
    }

    /**
     * Finds several documents, keeping the input order.
     *
     * @param keys primary keys
     * @return one entry per key
     */
    public synchronized List<Optional<Map<String, Object>>> bulkGet(List<?> keys) {
        requireBatch(keys);
        List<Optional<Map<String, Object>>> found = new ArrayList<>(keys.size());
        for (Object key : keys) {
            found.add(get(key));
        }
        return found;
    }

    /**
     * Every document, in primary-map order.
     */
    public synchronized List<Map<String, Object>> toArray() {
        List<Map<String, Object>> views = new ArrayList<>(documents.size());
        for (Map<String, Object> document : documents.values()) {
            views.add(CopyOnWriteDocument.of(document));
        }
        return views;
    }

    public synchronized int count() {
        return documents.size();
    }

    /**
     * Primary keys, in primary-map order.
     */
    public synchronized List<Object> keys() {
        List<Object> keys = new ArrayList<>(documents.size());
        for (IndexValue key : documents.keySet()) {
            keys.add(key.raw());
        }
        return keys;
    }

    public synchronized boolean has(Object key) {
        IndexValue primaryKey = lookupKey(key);
        return primaryKey != null && documents.containsKey(primaryKey);
    }

    /**
     * Calls the consumer with a view of every document. The consumer may mutate the collection.
     */
    public void each(Consumer<Map<String, Object>> consumer) {
        if (consumer == null) {
            throw new IllegalArgumentException("consumer cannot be null");
        }
        for (Map<String, Object> view : toArray()) {
            consumer.accept(view);
        }
    }

    // ---------------------------------------------------------------- queries

    /**
     * Starts an index query on the primary key or a declared index.
     *
     * @param field field path
     * @return where stage
     * @throws UnindexedFieldException field가 선언되지 않은 경우 (scan 전에 즉시 발생)
     */
    public WhereStage where(String field) {
        return Query.onField(this, field);
    }

    /**
     * Starts a query from criteria.
     *
     * @throws UnindexedFieldException criteria에 queryable field가 하나도 없는 경우
     */
    public ExecutableStage where(Criteria criteria) {
        return Query.matching(this, criteria);
    }

    /**
     * Starts a query from a field → value map (every entry is an equality condition).
     */
    public ExecutableStage where(Map<String, ?> criteria) {
        return Query.matching(this, Criteria.from(criteria));
    }

    /**
     * Full-scan query filtered by a predicate.
     */
    public ExecutableStage filter(Predicate<Map<String, Object>> predicate) {
        return Query.scan(this).filter(predicate);
    }

    public OrderableStage orderBy(String field) {
        return Query.scan(this).orderBy(field);
    }

    public OrderableStage sortBy(String field) {
        return Query.scan(this).sortBy(field);
    }

    public LimitedStage limit(int count) {
        return Query.scan(this).limit(count);
    }

    public LimitedStage offset(int count) {
        return Query.scan(this).offset(count);
    }

    // ---------------------------------------------------------------- observers

    /**
     * Registers an observer.
     *
     * @param observer observer (null 불가)
     * @return handle removing the observer
     */
    public Subscription subscribe(Observer observer) {
        return notifications.subscribe(observer);
    }

    /**
     * Removes an observer.
     *
     * @return true if it was registered
     */
    public boolean unsubscribe(Observer observer) {
        return notifications.unsubscribe(observer);
    }

    /**
     * Delivers a pending debounced notification now.
     */
    public void flushNotifications() {
        notifications.flush();
    }

    // ---------------------------------------------------------------- metadata

    public String name() {
        return name;
    }

    public Schema schema() {
        return schema;
    }

    /**
     * Diagnostic snapshot of one index: raw value → primary keys.
     *
     * @param path declared index path
     * @return detached, unmodifiable snapshot
     * @throws UnindexedFieldException path가 선언된 index가 아닌 경우
     */
    public synchronized Map<Object, List<Object>> indexKeys(String path) {
        return indexMap(path).snapshot();
    }

    /**
     * Stops the notification timer, delivering any pending debounced event first.
     */
    @Override
    public void close() {
        notifications.close();
        log.debug("Closed collection {}", name);
    }

    @Override
    public String toString() {
        return "DocumentCollection{name=" + name + ", count=" + documents.size() + ", schema=" + schema + '}';
    }

    // ---------------------------------------------------------------- package-private (Query)

    IndexMap indexMap(String path) {
        IndexMap index = indexes.get(path);
        if (index == null) {
            throw new UnindexedFieldException(name, path);
        }
        return index;
    }

    Map<String, Object> stored(IndexValue key) {
        return documents.get(key);
    }

    List<Map<String, Object>> storedDocuments() {
        return new ArrayList<>(documents.values());
    }

    Object primaryKeyOf(Map<String, Object> document) {
        return Documents.copyValue(primaryKeyPath.resolve(document));
    }

    /**
     * Runs a group of writes with per-call notifications suppressed, then emits one event
     * for the keys the work collected, even when the work fails half way.
     *
     * @param operation operation reported by the coalesced event
     * @param work collects affected keys into the given list
     * @return affected keys in collection order
     */
    List<Object> inBatch(CollectionOperation operation, Consumer<List<Object>> work) {
        List<Object> affected = new ArrayList<>();
        batchDepth++;
        try {
            work.accept(affected);
        } finally {
            batchDepth--;
            if (!affected.isEmpty()) {
                log.debug("Batch {} on {} affected {} documents", operation, name, affected.size());
                notifications.notify(operation, affected);
            }
        }
        return affected;
    }

    // ---------------------------------------------------------------- internals

    private Object putInternal(Map<String, ?> document) {
        Map<String, Object> stored = Documents.deepCopy(document);
        IndexValue key = keyOf(stored);
        Map<String, List<IndexValue>> entries = indexEntries(stored);
        remove(key);
        insert(key, stored, entries);
        return key.raw();
    }

    private Optional<Object> updateInternal(Object key, Map<String, ?> changes) {
        IndexValue primaryKey = lookupKey(key);
        Map<String, Object> current = primaryKey == null ? null : documents.get(primaryKey);
        if (current == null) {
            return Optional.empty();
        }
        Map<String, Object> copied = Documents.deepCopy(changes);
        Map<String, Object> merged = new LinkedHashMap<>(current);
        merged.putAll(copied);

        if (!touchesKeys(copied)) {
            replace(primaryKey, merged);
            return Optional.of(primaryKeyOf(merged));
        }

        IndexValue newKey = keyOf(merged);
        Map<String, List<IndexValue>> entries = indexEntries(merged);
        if (!newKey.equals(primaryKey) && documents.containsKey(newKey)) {
            throw new DuplicateKeyException(name, newKey.raw());
        }
        remove(primaryKey);
        insert(newKey, merged, entries);
        log.debug("Reindexed document {} in collection {}", newKey.raw(), name);
        return Optional.of(newKey.raw());
    }

    private boolean touchesKeys(Map<String, Object> changes) {
        for (String field : changes.keySet()) {
            if (primaryKeyPath.isAffectedBy(field)) {
                return true;
            }
            for (IndexMap index : indexes.values()) {
                if (index.isAffectedBy(field)) {
                    return true;
                }
            }
        }
        return false;
    }

    private Map<String, List<IndexValue>> indexEntries(Map<String, Object> document) {
        Map<String, List<IndexValue>> entries = new LinkedHashMap<>();
        for (IndexMap index : indexes.values()) {
            entries.put(index.path(), index.entriesFor(document));
        }
        return entries;
    }

    private void insert(IndexValue key, Map<String, Object> document, Map<String, List<IndexValue>> entries) {
        documents.put(key, document);
        for (Map.Entry<String, List<IndexValue>> entry : entries.entrySet()) {
            indexes.get(entry.getKey()).add(key, document, entry.getValue());
        }
    }

    // same key and index entries: existing positions are kept
    private void replace(IndexValue key, Map<String, Object> document) {
        documents.put(key, document);
        for (IndexMap index : indexes.values()) {
            index.add(key, document, index.entriesFor(document));
        }
    }

    private Map<String, Object> remove(IndexValue key) {
        Map<String, Object> removed = documents.remove(key);
        if (removed != null) {
            for (IndexMap index : indexes.values()) {
                index.remove(key, index.entriesFor(removed));
            }
        }
        return removed;
    }

    private IndexValue keyOf(Map<String, ?> document) {
        Object value = primaryKeyPath.resolve(document);
        if (!IndexValue.isPrimitive(value)) {
            throw new InvalidFieldValueException(schema.primaryKey(),
                value == null
                    ? "document has no primary key"
                    : "primary key must be a primitive value, got " + value.getClass().getName());
        }
        return IndexValue.of(value);
    }

    private IndexValue lookupKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return IndexValue.isPrimitive(key) ? IndexValue.of(key) : null;
    }

    private void afterWrite(CollectionOperation operation, Object key) {
        if (batchDepth == 0) {
            notifications.notify(operation, List.of(key));
        }
    }

    private static void requireBatch(List<?> batch) {
        if (batch == null) {
            throw new IllegalArgumentException("batch cannot be null");
        }
    }
}
