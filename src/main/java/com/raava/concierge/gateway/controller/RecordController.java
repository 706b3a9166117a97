package com.raava.concierge.gateway.controller;

import com.raava.concierge.gateway.dto.StatusUpdateRequest;
import com.raava.concierge.transaction.model.RecordStatus;
import com.raava.concierge.transaction.model.RecordType;
import com.raava.concierge.transaction.service.RecordLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

/**
 * Back-office REST controller for business records (orders, appointments, listings).
 *
 * Paths use the record collection name, e.g. {@code /api/v1/records/orders/ORD-RA-2026-AB12C}.
 */
@RestController
@RequestMapping("/api/v1/records")
@RequiredArgsConstructor
public class RecordController {

    private final RecordLifecycleService recordLifecycleService;

    @GetMapping("/{collection}/{recordId}")
    public ResponseEntity<Document> get(@PathVariable String collection, @PathVariable String recordId) {
        return ResponseEntity.ok(recordLifecycleService.get(recordType(collection), recordId));
    }

    @GetMapping("/{collection}")
    public ResponseEntity<List<Document>> findByEmail(
            @PathVariable String collection,
            @RequestParam String email,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(recordLifecycleService.findByCustomerEmail(recordType(collection), email, limit));
    }

    @PatchMapping("/{collection}/{recordId}/status")
    public ResponseEntity<Document> updateStatus(
            @PathVariable String collection,
            @PathVariable String recordId,
            @Valid @RequestBody StatusUpdateRequest request) {
        RecordStatus status = RecordStatus.fromValue(request.getStatus());
        return ResponseEntity.ok(recordLifecycleService.updateStatus(recordType(collection), recordId, status, request.getNote()));
    }

    static RecordType recordType(String collection) {
        String name = collection == null ? "" : collection.toLowerCase(Locale.ROOT);
        for (RecordType type : RecordType.values()) {
            if (type.getCollection().equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown record collection: " + collection);
    }
}
