package com.raava.concierge.repository;

import com.raava.concierge.exception.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.BasicQuery;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link RecordStore} backed by MongoDB. Enabled with {@code raava.store.type=mongo}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "raava.store.type", havingValue = "mongo")
public class MongoRecordStore implements RecordStore {

    private final MongoTemplate mongo;

    @Override
    public Optional<Document> get(String collection, String key) {
        try {
            Query query = Query.query(Criteria.where(ID_FIELD).is(key));
            return Optional.ofNullable(mongo.findOne(query, Document.class, collection));
        } catch (DataAccessException e) {
            log.error("Mongo read failed - collection: {}, key: {}", collection, key, e);
            throw new PersistenceException("Failed to read " + collection + "/" + key, e);
        }
    }

    @Override
    public void put(String collection, String key, Document record) {
        Document document = new Document(record);
        document.put(ID_FIELD, key);
        try {
            mongo.save(document, collection);
            log.debug("Mongo write - collection: {}, key: {}", collection, key);
        } catch (DataAccessException e) {
            log.error("Mongo write failed - collection: {}, key: {}", collection, key, e);
            throw new PersistenceException("Failed to write " + collection + "/" + key, e);
        }
    }

    @Override
    public boolean insert(String collection, String key, Document record) {
        Document document = new Document(record);
        document.put(ID_FIELD, key);
        try {
            mongo.insert(document, collection);
            log.debug("Mongo insert - collection: {}, key: {}", collection, key);
            return true;
        } catch (DuplicateKeyException e) {
            log.warn("Mongo insert rejected, key taken - collection: {}, key: {}", collection, key);
            return false;
        } catch (DataAccessException e) {
            log.error("Mongo insert failed - collection: {}, key: {}", collection, key, e);
            throw new PersistenceException("Failed to insert " + collection + "/" + key, e);
        }
    }

    @Override
    public List<Document> find(String collection, Map<String, Object> filter, Map<String, Integer> sort, int limit) {
        Query query = new BasicQuery(new Document(filter == null ? Map.of() : filter));
        if (sort != null && !sort.isEmpty()) {
            List<Sort.Order> orders = sort.entrySet().stream()
                    .map(e -> new Sort.Order(e.getValue() != null && e.getValue() < 0 ? Sort.Direction.DESC : Sort.Direction.ASC, e.getKey()))
                    .collect(Collectors.toList());
            query.with(Sort.by(orders));
        }
        if (limit > 0) {
            query.limit(limit);
        }
        try {
            return mongo.find(query, Document.class, collection);
        } catch (DataAccessException e) {
            log.error("Mongo query failed - collection: {}", collection, e);
            throw new PersistenceException("Failed to query " + collection, e);
        }
    }

    @Override
    public void delete(String collection, String key) {
        try {
            mongo.remove(Query.query(Criteria.where(ID_FIELD).is(key)), collection);
        } catch (DataAccessException e) {
            log.error("Mongo delete failed - collection: {}, key: {}", collection, key, e);
            throw new PersistenceException("Failed to delete " + collection + "/" + key, e);
        }
    }
}
