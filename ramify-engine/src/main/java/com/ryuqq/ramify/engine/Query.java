package com.ryuqq.ramify.engine;

import com.ryuqq.ramify.core.document.CopyOnWriteDocument;
import com.ryuqq.ramify.core.document.FieldPath;
import com.ryuqq.ramify.core.exception.InvalidFieldValueException;
import com.ryuqq.ramify.core.exception.UnindexedFieldException;
import com.ryuqq.ramify.core.model.CollectionOperation;
import com.ryuqq.ramify.core.model.IndexValue;
import com.ryuqq.ramify.core.model.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Fluent query over one collection, planned and executed once.
 *
 * <p><strong>Execution Plan:</strong></p>
 * <ol>
 *   <li>A condition on the primary key is answered by direct lookups (IN → several lookups)</li>
 *   <li>Otherwise every condition on a declared index yields a candidate set (union for
 *       anyOf, smallest bucket for allOf, ordered sub-range for range operators) and the
 *       smallest one wins</li>
 *   <li>Without a usable condition the whole collection is scanned</li>
 *   <li>Every condition is re-checked on every candidate, whichever one produced it</li>
 *   <li>Filters run in the order they were added</li>
 *   <li>Stable sort on the order field, ascending or reversed</li>
 *   <li>Offset, then limit</li>
 *   <li>Survivors are wrapped in copy-on-write views</li>
 * </ol>
 *
 * <p>The candidate choice only changes how much work is done, never the result.</p>
 *
 * <p><strong>Thread Safety:</strong> a query belongs to the thread that built it and becomes
 * read-only once executed; builder calls after execution throw
 * {@link IllegalStateException}. Execution and {@code modify}/{@code delete} hold the
 * collection's monitor, so they never observe a half-applied write.</p>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public final class Query implements WhereStage, ExecutableStage, OrderableStage {

    private static final Logger log = LoggerFactory.getLogger(Query.class);

    private final DocumentCollection collection;
    private final Criteria criteria;
    private final String whereField;
    private final List<Predicate<Map<String, Object>>> filters;

    private Condition whereCondition;
    private FieldPath orderPath;
    private boolean descending;
    private int offset;
    private int limit = -1;

    private List<Map<String, Object>> results;
    private int candidateCount = -1;

    private Query(DocumentCollection collection, Criteria criteria, String whereField) {
        this.collection = collection;
        this.criteria = criteria;
        this.whereField = whereField;
        this.filters = new ArrayList<>();
    }

    /**
     * Query on one field, completed by a {@link WhereStage} operator.
     *
     * @throws UnindexedFieldException field가 primary key나 선언된 index가 아닌 경우
     */
    static Query onField(DocumentCollection collection, String field) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        if (!collection.schema().isQueryable(field)) {
            throw new UnindexedFieldException(collection.name(), field);
        }
        return new Query(collection, Criteria.empty(), field);
    }

    /**
     * Query from criteria; at least one field must be the primary key or a declared index.
     *
     * @throws UnindexedFieldException no criteria field is queryable
     */
    static Query matching(DocumentCollection collection, Criteria criteria) {
        if (criteria == null) {
            throw new IllegalArgumentException("criteria cannot be null");
        }
        Schema schema = collection.schema();
        if (!criteria.isEmpty() && criteria.fields().stream().noneMatch(schema::isQueryable)) {
            throw new UnindexedFieldException(collection.name(), String.join(", ", criteria.fields()));
        }
        return new Query(collection, criteria, null);
    }

    /**
     * Query over every document (collection shortcuts such as {@code filter} or {@code orderBy}).
     */
    static Query scan(DocumentCollection collection) {
        return new Query(collection, Criteria.empty(), null);
    }

    // ---------------------------------------------------------------- where stage

    @Override
    public ExecutableStage equalTo(Object value) {
        return where(Condition.equalTo(requireWhereField(), value));
    }

    @Override
    public ExecutableStage anyOf(Collection<?> values) {
        return where(Condition.anyOf(requireWhereField(), values));
    }

    @Override
    public ExecutableStage anyOf(Object... values) {
        return anyOf(Arrays.asList(values));
    }

    @Override
    public ExecutableStage allOf(Collection<?> values) {
        String field = requireWhereField();
        if (!collection.schema().isMultiEntry(field)) {
            throw new InvalidFieldValueException(field, "allOf requires a multi-entry index");
        }
        return where(Condition.allOf(field, values));
    }

    @Override
    public ExecutableStage allOf(Object... values) {
        return allOf(Arrays.asList(values));
    }

    @Override
    public ExecutableStage notEqualTo(Object value) {
        return where(Condition.notEqualTo(requireWhereField(), value));
    }

    @Override
    public ExecutableStage above(Object bound) {
        return where(Condition.above(requireWhereField(), bound, false));
    }

    @Override
    public ExecutableStage aboveOrEqual(Object bound) {
        return where(Condition.above(requireWhereField(), bound, true));
    }

    @Override
    public ExecutableStage below(Object bound) {
        return where(Condition.below(requireWhereField(), bound, false));
    }

    @Override
    public ExecutableStage belowOrEqual(Object bound) {
        return where(Condition.below(requireWhereField(), bound, true));
    }

    @Override
    public ExecutableStage between(Object lower, Object upper) {
        return between(lower, upper, true, false);
    }

    @Override
    public ExecutableStage between(Object lower, Object upper, boolean lowerInclusive, boolean upperInclusive) {
        return where(Condition.between(requireWhereField(), lower, upper, lowerInclusive, upperInclusive));
    }

    // ---------------------------------------------------------------- builder

    @Override
    public ExecutableStage filter(Predicate<Map<String, Object>> predicate) {
        ensureNotExecuted();
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        filters.add(predicate);
        return this;
    }

    @Override
    public OrderableStage orderBy(String field) {
        ensureNotExecuted();
        this.orderPath = FieldPath.of(field);
        return this;
    }

    @Override
    public OrderableStage sortBy(String field) {
        return orderBy(field);
    }

    @Override
    public OrderableStage reverse() {
        ensureNotExecuted();
        if (orderPath == null) {
            throw new IllegalStateException("reverse requires an order field");
        }
        this.descending = true;
        return this;
    }

    @Override
    public LimitedStage limit(int count) {
        ensureNotExecuted();
        if (count < 0) {
            throw new IllegalArgumentException("limit cannot be negative, but was: " + count);
        }
        this.limit = count;
        return this;
    }

    @Override
    public LimitedStage offset(int count) {
        ensureNotExecuted();
        if (count < 0) {
            throw new IllegalArgumentException("offset cannot be negative, but was: " + count);
        }
        this.offset = count;
        return this;
    }

    // ---------------------------------------------------------------- terminals

    @Override
    public List<Map<String, Object>> toArray() {
        List<Map<String, Object>> matched = results();
        List<Map<String, Object>> views = new ArrayList<>(matched.size());
        for (Map<String, Object> document : matched) {
            views.add(CopyOnWriteDocument.of(document));
        }
        return views;
    }

    @Override
    public Optional<Map<String, Object>> first() {
        List<Map<String, Object>> matched = results();
        return matched.isEmpty() ? Optional.empty() : Optional.of(CopyOnWriteDocument.of(matched.get(0)));
    }

    @Override
    public Optional<Map<String, Object>> last() {
        List<Map<String, Object>> matched = results();
        return matched.isEmpty()
            ? Optional.empty()
            : Optional.of(CopyOnWriteDocument.of(matched.get(matched.size() - 1)));
    }

    @Override
    public int count() {
        return results().size();
    }

    @Override
    public void each(Consumer<Map<String, Object>> consumer) {
        if (consumer == null) {
            throw new IllegalArgumentException("consumer cannot be null");
        }
        for (Map<String, Object> view : toArray()) {
            consumer.accept(view);
        }
    }

    @Override
    public List<Object> keys() {
        List<Map<String, Object>> matched = results();
        List<Object> keys = new ArrayList<>(matched.size());
        for (Map<String, Object> document : matched) {
            keys.add(collection.primaryKeyOf(document));
        }
        return keys;
    }

    @Override
    public List<Object> modify(Map<String, ?> changes) {
        if (changes == null) {
            throw new IllegalArgumentException("changes cannot be null");
        }
        synchronized (collection) {
            List<Object> targets = keys();
            return collection.inBatch(CollectionOperation.UPDATE, affected -> {
                for (Object key : targets) {
                    collection.update(key, changes).ifPresent(affected::add);
                }
            });
        }
    }

    @Override
    public List<Object> delete() {
        synchronized (collection) {
            List<Object> targets = keys();
            return collection.inBatch(CollectionOperation.DELETE, affected -> {
                for (Object key : targets) {
                    collection.delete(key).ifPresent(affected::add);
                }
            });
        }
    }

    /**
     * Size of the candidate set the planner started from, or -1 before execution.
     */
    int candidateCount() {
        return candidateCount;
    }

    @Override
    public String toString() {
        return "Query{collection=" + collection.name()
            + ", criteria=" + criteria.conditions()
            + ", where=" + whereCondition
            + ", filters=" + filters.size()
            + ", orderBy=" + (orderPath == null ? null : orderPath.value())
            + ", descending=" + descending
            + ", offset=" + offset
            + ", limit=" + limit + '}';
    }

    // ---------------------------------------------------------------- execution

    private List<Map<String, Object>> results() {
        if (results == null) {
            synchronized (collection) {
                results = execute();
            }
        }
        return results;
    }

    private List<Map<String, Object>> execute() {
        if (whereField != null && whereCondition == null) {
            throw new IllegalStateException("where(" + whereField + ") needs an operator before execution");
        }
        List<Condition> conditions = new ArrayList<>(criteria.conditions());
        if (whereCondition != null) {
            conditions.add(whereCondition);
        }

        Collection<Map<String, Object>> candidates = plan(conditions);
        candidateCount = candidates.size();

        List<Map<String, Object>> matched = new ArrayList<>();
        for (Map<String, Object> document : candidates) {
            if (matchesAll(conditions, document) && passesFilters(document)) {
                matched.add(document);
            }
        }

        if (orderPath != null) {
            matched.sort(orderComparator());
        }

        int from = Math.min(offset, matched.size());
        int to = limit < 0 ? matched.size() : (int) Math.min((long) from + limit, matched.size());
        List<Map<String, Object>> page = Collections.unmodifiableList(new ArrayList<>(matched.subList(from, to)));

        log.debug("Executed query on {}: {} candidates, {} matched, {} returned",
            collection.name(), candidateCount, matched.size(), page.size());
        return page;
    }

    private Collection<Map<String, Object>> plan(List<Condition> conditions) {
        Schema schema = collection.schema();

        for (Condition condition : conditions) {
            if (schema.isPrimaryKey(condition.field())) {
                List<IndexValue> lookups = condition.primaryKeyLookups();
                if (lookups != null) {
                    List<Map<String, Object>> found = new ArrayList<>(lookups.size());
                    for (IndexValue key : lookups) {
                        Map<String, Object> document = collection.stored(key);
                        if (document != null) {
                            found.add(document);
                        }
                    }
                    return found;
                }
            }
        }

        Map<IndexValue, Map<String, Object>> smallest = null;
        for (Condition condition : conditions) {
            if (schema.isIndexed(condition.field())) {
                Map<IndexValue, Map<String, Object>> candidates =
                    condition.candidates(collection.indexMap(condition.field()));
                if (candidates != null && (smallest == null || candidates.size() < smallest.size())) {
                    smallest = candidates;
                }
            }
        }
        if (smallest != null) {
            return new ArrayList<>(smallest.values());
        }
        return collection.storedDocuments();
    }

    private boolean matchesAll(List<Condition> conditions, Map<String, Object> document) {
        for (Condition condition : conditions) {
            if (!condition.matches(document)) {
                return false;
            }
        }
        return true;
    }

    private boolean passesFilters(Map<String, Object> document) {
        if (filters.isEmpty()) {
            return true;
        }
        Map<String, Object> view = CopyOnWriteDocument.of(document);
        for (Predicate<Map<String, Object>> filter : filters) {
            if (!filter.test(view)) {
                return false;
            }
        }
        return true;
    }

    // documents without a sortable value go last in both directions
    private Comparator<Map<String, Object>> orderComparator() {
        FieldPath path = orderPath;
        boolean reversed = descending;
        return (left, right) -> {
            Object a = path.resolve(left);
            Object b = path.resolve(right);
            boolean sortableA = IndexValue.isPrimitive(a);
            boolean sortableB = IndexValue.isPrimitive(b);
            if (!sortableA || !sortableB) {
                return sortableA == sortableB ? 0 : (sortableA ? -1 : 1);
            }
            int cmp = IndexValue.of(a).compareTo(IndexValue.of(b));
            return reversed ? -cmp : cmp;
        };
    }

    private ExecutableStage where(Condition condition) {
        ensureNotExecuted();
        if (whereCondition != null) {
            throw new IllegalStateException("where operator already set: " + whereCondition);
        }
        this.whereCondition = condition;
        return this;
    }

    private String requireWhereField() {
        if (whereField == null) {
            throw new IllegalStateException("where operators require where(field)");
        }
        return whereField;
    }

    private void ensureNotExecuted() {
        if (results != null) {
            throw new IllegalStateException("query has already been executed");
        }
    }
}
