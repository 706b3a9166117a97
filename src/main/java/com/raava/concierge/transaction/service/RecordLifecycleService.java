package com.raava.concierge.transaction.service;

import com.raava.concierge.exception.InvalidStatusTransitionException;
import com.raava.concierge.exception.RecordNotFoundException;
import com.raava.concierge.repository.RecordStore;
import com.raava.concierge.transaction.model.RecordStatus;
import com.raava.concierge.transaction.model.RecordType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and updates business records after they were created.
 *
 * Responsibilities:
 * - Look up a record by type and ID
 * - Move a record through its status lifecycle, appending a timestamped note per change
 * - List a customer's records, newest first
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecordLifecycleService {

    private static final int MAX_LIMIT = 50;

    private final RecordStore recordStore;
    private final Clock clock;

    public Document get(RecordType type, String recordId) {
        return recordStore.get(type.getCollection(), recordId)
                .orElseThrow(() -> new RecordNotFoundException(
                        type.name().toLowerCase(Locale.ROOT) + " " + recordId + " not found"));
    }

    /**
     * Changes the status of a record.
     *
     * @param note optional free-text note stored with the change
     * @return the updated record
     * @throws RecordNotFoundException          if the record does not exist
     * @throws InvalidStatusTransitionException if the lifecycle does not allow the change
     */
    @SuppressWarnings("unchecked")
    public Document updateStatus(RecordType type, String recordId, RecordStatus newStatus, String note) {
        Document record = get(type, recordId);
        RecordStatus current = RecordStatus.fromValue(record.getString("status"));
        if (!current.canTransitionTo(newStatus)) {
            throw new InvalidStatusTransitionException(String.format(
                    "Cannot change %s %s from %s to %s", type.name().toLowerCase(Locale.ROOT), recordId,
                    current.value(), newStatus.value()));
        }

        Instant now = clock.instant();
        List<Object> notes = record.get("notes") instanceof List
                ? new ArrayList<>((List<Object>) record.get("notes"))
                : new ArrayList<>();
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("at", Date.from(now));
        entry.put("status", newStatus.value());
        entry.put("note", note == null || note.isBlank() ? "Status changed to " + newStatus.value() : note.trim());
        notes.add(new Document(entry));

        record.put("status", newStatus.value());
        record.put("updatedAt", Date.from(now));
        record.put("notes", notes);
        recordStore.put(type.getCollection(), recordId, record);

        log.info("Record status updated - type: {}, recordId: {}, from: {}, to: {}",
                type, recordId, current.value(), newStatus.value());
        return record;
    }

    /**
     * Records belonging to the given email address, newest first.
     */
    public List<Document> findByCustomerEmail(RecordType type, String email, int limit) {
        if (email == null || email.isBlank()) {
            return List.of();
        }
        int boundedLimit = limit <= 0 ? MAX_LIMIT : Math.min(limit, MAX_LIMIT);
        Map<String, Integer> sort = new LinkedHashMap<>();
        sort.put("createdAt", -1);
        return recordStore.find(type.getCollection(),
                Map.of(type.getPartyField() + ".email", email.trim()), sort, boundedLimit);
    }
}
