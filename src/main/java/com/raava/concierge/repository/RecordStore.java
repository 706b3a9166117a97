package com.raava.concierge.repository;

import com.raava.concierge.exception.PersistenceException;
import org.bson.Document;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document storage for sessions and business records.
 *
 * Keys are held in {@code _id}. Implementations throw {@link PersistenceException} when the
 * backing store cannot be reached; a missing key is an empty result, not an error.
 */
public interface RecordStore {

    String ID_FIELD = "_id";

    Optional<Document> get(String collection, String key);

    /**
     * Inserts or replaces the document stored under {@code key}.
     */
    void put(String collection, String key, Document record);

    /**
     * Stores the document under {@code key} only if no document holds that key yet.
     *
     * @return false if the key is already taken; the stored document is left as it was
     */
    boolean insert(String collection, String key, Document record);

    /**
     * Finds documents matching {@code filter}.
     *
     * @param filter equality on (dotted) field paths, or an operator document using
     *               {@code $gt}, {@code $gte}, {@code $lt}, {@code $lte}, {@code $ne}, {@code $in}
     * @param sort   field to direction (1 ascending, -1 descending), applied in order; may be null
     * @param limit  maximum results, 0 for no limit
     */
    List<Document> find(String collection, Map<String, Object> filter, Map<String, Integer> sort, int limit);

    void delete(String collection, String key);
}
