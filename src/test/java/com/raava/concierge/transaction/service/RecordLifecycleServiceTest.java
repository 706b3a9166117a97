package com.raava.concierge.transaction.service;

import com.raava.concierge.exception.InvalidStatusTransitionException;
import com.raava.concierge.exception.RecordNotFoundException;
import com.raava.concierge.repository.InMemoryRecordStore;
import com.raava.concierge.transaction.model.RecordStatus;
import com.raava.concierge.transaction.model.RecordType;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordLifecycleServiceTest {

    private static final String ORDER_ID = "ORD-RA-2026-AB12C";

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-16T09:30:00Z"), ZoneOffset.UTC);
    private InMemoryRecordStore recordStore;
    private RecordLifecycleService recordLifecycleService;

    @BeforeEach
    void setUp() {
        recordStore = new InMemoryRecordStore();
        recordLifecycleService = new RecordLifecycleService(recordStore, clock);
        recordStore.put("orders", ORDER_ID, order(ORDER_ID, "john@x.com", "pending", "2026-01-15T10:00:00Z"));
    }

    @Test
    void testGet_ExistingRecord() {
        // When
        Document record = recordLifecycleService.get(RecordType.ORDER, ORDER_ID);

        // Then
        assertEquals(ORDER_ID, record.getString("orderId"));
    }

    @Test
    void testGet_MissingRecord() {
        // When
        RecordNotFoundException exception = assertThrows(RecordNotFoundException.class,
                () -> recordLifecycleService.get(RecordType.ORDER, "ORD-RA-2026-ZZZZZ"));

        // Then
        assertEquals("order ORD-RA-2026-ZZZZZ not found", exception.getMessage());
    }

    @Test
    void testUpdateStatus_AppendsNoteAndStores() {
        // When
        Document updated = recordLifecycleService.updateStatus(RecordType.ORDER, ORDER_ID, RecordStatus.CONFIRMED, null);

        // Then
        assertEquals("confirmed", updated.getString("status"));
        assertEquals(Date.from(clock.instant()), updated.getDate("updatedAt"));
        Document stored = recordStore.get("orders", ORDER_ID).orElseThrow();
        assertEquals("confirmed", stored.getString("status"));
        List<Document> notes = stored.getList("notes", Document.class);
        assertEquals(1, notes.size());
        assertEquals("Status changed to confirmed", notes.get(0).getString("note"));
        assertEquals("confirmed", notes.get(0).getString("status"));
    }

    @Test
    void testUpdateStatus_ThroughToCompletedKeepsHistory() {
        // When
        recordLifecycleService.updateStatus(RecordType.ORDER, ORDER_ID, RecordStatus.CONFIRMED, "Deposit received");
        recordLifecycleService.updateStatus(RecordType.ORDER, ORDER_ID, RecordStatus.COMPLETED, "  Handed over  ");

        // Then
        List<Document> notes = recordStore.get("orders", ORDER_ID).orElseThrow().getList("notes", Document.class);
        assertEquals(List.of("Deposit received", "Handed over"), List.of(notes.get(0).getString("note"), notes.get(1).getString("note")));
    }

    @Test
    void testUpdateStatus_InvalidTransitionIsRejected() {
        // When
        InvalidStatusTransitionException exception = assertThrows(InvalidStatusTransitionException.class,
                () -> recordLifecycleService.updateStatus(RecordType.ORDER, ORDER_ID, RecordStatus.COMPLETED, null));

        // Then
        assertEquals("Cannot change order " + ORDER_ID + " from pending to completed", exception.getMessage());
        assertEquals("pending", recordStore.get("orders", ORDER_ID).orElseThrow().getString("status"));
    }

    @Test
    void testUpdateStatus_CancelledIsTerminal() {
        // Given
        recordLifecycleService.updateStatus(RecordType.ORDER, ORDER_ID, RecordStatus.CANCELLED, "Customer changed mind");

        // When / Then
        assertThrows(InvalidStatusTransitionException.class,
                () -> recordLifecycleService.updateStatus(RecordType.ORDER, ORDER_ID, RecordStatus.CONFIRMED, null));
    }

    @Test
    void testFindByCustomerEmail_NewestFirst() {
        // Given
        recordStore.put("orders", "ORD-RA-2026-NEW01", order("ORD-RA-2026-NEW01", "john@x.com", "pending", "2026-01-16T08:00:00Z"));
        recordStore.put("orders", "ORD-RA-2026-OTHER", order("ORD-RA-2026-OTHER", "someone@x.com", "pending", "2026-01-16T08:30:00Z"));

        // When
        List<Document> records = recordLifecycleService.findByCustomerEmail(RecordType.ORDER, " john@x.com ", 10);

        // Then
        assertEquals(List.of("ORD-RA-2026-NEW01", ORDER_ID),
                List.of(records.get(0).getString("orderId"), records.get(1).getString("orderId")));
        assertEquals(2, records.size());
    }

    @Test
    void testFindByCustomerEmail_BlankEmailFindsNothing() {
        assertTrue(recordLifecycleService.findByCustomerEmail(RecordType.ORDER, "  ", 10).isEmpty());
    }

    @Test
    void testFindByCustomerEmail_LimitIsApplied() {
        // Given
        recordStore.put("orders", "ORD-RA-2026-NEW01", order("ORD-RA-2026-NEW01", "john@x.com", "pending", "2026-01-16T08:00:00Z"));

        // When
        List<Document> records = recordLifecycleService.findByCustomerEmail(RecordType.ORDER, "john@x.com", 1);

        // Then
        assertEquals(1, records.size());
        assertEquals("ORD-RA-2026-NEW01", records.get(0).getString("orderId"));
    }

    private static Document order(String orderId, String email, String status, String createdAt) {
        return new Document("orderId", orderId)
                .append("status", status)
                .append("customer", new Document("name", "John Smith").append("email", email))
                .append("createdAt", Date.from(Instant.parse(createdAt)))
                .append("notes", new ArrayList<>());
    }
}
