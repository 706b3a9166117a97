package com.raava.concierge.repository;

import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RecordStore} held in process memory. The default store, also used by tests.
 *
 * Documents are deep-copied on the way in and out, so callers never share state with the store.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "raava.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, Map<String, Document>> collections = new ConcurrentHashMap<>();

    @Override
    public Optional<Document> get(String collection, String key) {
        Document document = collection(collection).get(key);
        return Optional.ofNullable(document).map(InMemoryRecordStore::copy);
    }

    @Override
    public void put(String collection, String key, Document record) {
        Document document = copy(record);
        document.put(ID_FIELD, key);
        collection(collection).put(key, document);
        log.debug("In-memory write - collection: {}, key: {}", collection, key);
    }

    @Override
    public boolean insert(String collection, String key, Document record) {
        Document document = copy(record);
        document.put(ID_FIELD, key);
        boolean inserted = collection(collection).putIfAbsent(key, document) == null;
        log.debug("In-memory insert - collection: {}, key: {}, inserted: {}", collection, key, inserted);
        return inserted;
    }

    @Override
    public List<Document> find(String collection, Map<String, Object> filter, Map<String, Integer> sort, int limit) {
        List<Document> matches = new ArrayList<>();
        for (Document document : collection(collection).values()) {
            if (matches(document, filter)) {
                matches.add(copy(document));
            }
        }
        if (sort != null && !sort.isEmpty()) {
            matches.sort(comparator(sort));
        }
        if (limit > 0 && matches.size() > limit) {
            return new ArrayList<>(matches.subList(0, limit));
        }
        return matches;
    }

    @Override
    public void delete(String collection, String key) {
        collection(collection).remove(key);
    }

    public int size(String collection) {
        return collection(collection).size();
    }

    private Map<String, Document> collection(String name) {
        return collections.computeIfAbsent(name, k -> new ConcurrentHashMap<>());
    }

    private static boolean matches(Document document, Map<String, Object> filter) {
        if (filter == null) {
            return true;
        }
        for (Map.Entry<String, Object> condition : filter.entrySet()) {
            Object actual = resolve(document, condition.getKey());
            if (!satisfies(actual, condition.getValue())) {
                return false;
            }
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    private static boolean satisfies(Object actual, Object expected) {
        if (!(expected instanceof Map) || !isOperatorDocument((Map<String, Object>) expected)) {
            return valuesEqual(actual, expected);
        }
        for (Map.Entry<String, Object> operator : ((Map<String, Object>) expected).entrySet()) {
            Object operand = operator.getValue();
            boolean ok = switch (operator.getKey()) {
                case "$gt" -> actual != null && operand != null && compare(actual, operand) > 0;
                case "$gte" -> actual != null && operand != null && compare(actual, operand) >= 0;
                case "$lt" -> actual != null && operand != null && compare(actual, operand) < 0;
                case "$lte" -> actual != null && operand != null && compare(actual, operand) <= 0;
                case "$ne" -> !valuesEqual(actual, operand);
                case "$in" -> operand instanceof Collection
                        && ((Collection<Object>) operand).stream().anyMatch(candidate -> valuesEqual(actual, candidate));
                default -> throw new IllegalArgumentException("Unsupported filter operator: " + operator.getKey());
            };
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    private static boolean isOperatorDocument(Map<String, Object> value) {
        return !value.isEmpty() && value.keySet().stream().allMatch(key -> key.startsWith("$"));
    }

    private static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        return Objects.equals(a, b);
    }

    /**
     * Missing values sort first and never satisfy a range operator.
     */
    @SuppressWarnings("unchecked")
    private static int compare(Object a, Object b) {
        if (a == null || b == null) {
            return a == b ? 0 : (a == null ? -1 : 1);
        }
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof Comparable && a.getClass().isInstance(b)) {
            return ((Comparable<Object>) a).compareTo(b);
        }
        return a.toString().compareTo(b.toString());
    }

    private static Comparator<Document> comparator(Map<String, Integer> sort) {
        Comparator<Document> comparator = (x, y) -> 0;
        for (Map.Entry<String, Integer> order : sort.entrySet()) {
            String path = order.getKey();
            boolean descending = order.getValue() != null && order.getValue() < 0;
            Comparator<Document> byField = (x, y) -> compare(resolve(x, path), resolve(y, path));
            comparator = comparator.thenComparing(descending ? byField.reversed() : byField);
        }
        return comparator;
    }

    @SuppressWarnings("unchecked")
    private static Object resolve(Map<String, Object> document, String path) {
        Object current = document;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(part);
        }
        return current;
    }

    private static Document copy(Document source) {
        Document target = new Document();
        source.forEach((key, value) -> target.put(key, copyValue(value)));
        return target;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Document) {
            return copy((Document) value);
        }
        if (value instanceof Map) {
            Document nested = new Document();
            ((Map<String, Object>) value).forEach((key, inner) -> nested.put(key, copyValue(inner)));
            return nested;
        }
        if (value instanceof List) {
            List<Object> list = new ArrayList<>();
            for (Object element : (List<Object>) value) {
                list.add(copyValue(element));
            }
            return list;
        }
        if (value instanceof Date) {
            return new Date(((Date) value).getTime());
        }
        return value;
    }
}
