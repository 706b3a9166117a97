package com.raava.concierge.repository;

import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRecordStoreTest {

    private InMemoryRecordStore recordStore;

    @BeforeEach
    void setUp() {
        recordStore = new InMemoryRecordStore();
        recordStore.put("orders", "A", order("A", "john@x.com", 189_500, "pending"));
        recordStore.put("orders", "B", order("B", "john@x.com", 239_000, "confirmed"));
        recordStore.put("orders", "C", order("C", "jane@x.com", 425_000, "pending"));
    }

    @Test
    void testPut_SetsIdAndCopies() {
        // Given
        Document original = order("D", "d@x.com", 100, "pending");
        recordStore.put("orders", "D", original);

        // When
        original.put("status", "cancelled");
        Document stored = recordStore.get("orders", "D").orElseThrow();
        stored.get("customer", Document.class).put("email", "changed@x.com");

        // Then
        assertEquals("D", stored.getString(RecordStore.ID_FIELD));
        assertEquals("pending", stored.getString("status"));
        assertEquals("d@x.com", recordStore.get("orders", "D").orElseThrow()
                .get("customer", Document.class).getString("email"));
    }

    @Test
    void testGet_Missing() {
        assertTrue(recordStore.get("orders", "Z").isEmpty());
        assertTrue(recordStore.get("unknown", "A").isEmpty());
    }

    @Test
    void testFind_DottedPathEquality() {
        // When
        List<Document> found = recordStore.find("orders", Map.of("customer.email", "john@x.com"), null, 0);

        // Then
        assertEquals(List.of("A", "B"), ids(found).stream().sorted().collect(Collectors.toList()));
    }

    @Test
    void testFind_RangeOperators() {
        // When
        List<Document> found = recordStore.find("orders",
                Map.of("total", Map.of("$gte", 200_000, "$lt", 425_000.0)), null, 0);

        // Then
        assertEquals(List.of("B"), ids(found));
    }

    @Test
    void testFind_InAndNotEqual() {
        // When
        List<Document> in = recordStore.find("orders", Map.of("status", Map.of("$in", List.of("confirmed", "cancelled"))), null, 0);
        List<Document> ne = recordStore.find("orders", Map.of("status", Map.of("$ne", "confirmed")), null, 0);

        // Then
        assertEquals(List.of("B"), ids(in));
        assertEquals(2, ne.size());
    }

    @Test
    void testFind_SortAndLimit() {
        // Given
        Map<String, Integer> sort = new LinkedHashMap<>();
        sort.put("total", -1);

        // When
        List<Document> found = recordStore.find("orders", Map.of(), sort, 2);

        // Then
        assertEquals(List.of("C", "B"), ids(found));
    }

    @Test
    void testFind_SortsStringsThenNumbers() {
        // Given
        Map<String, Integer> sort = new LinkedHashMap<>();
        sort.put("status", 1);
        sort.put("total", -1);

        // When
        List<Document> found = recordStore.find("orders", Map.of(), sort, 0);

        // Then
        assertEquals(List.of("B", "C", "A"), ids(found));
    }

    @Test
    void testFind_UnsupportedOperator() {
        assertThrows(IllegalArgumentException.class,
                () -> recordStore.find("orders", Map.of("total", Map.of("$regex", "1")), null, 0));
    }

    @Test
    void testInsert_NewKeyIsStored() {
        // When
        boolean inserted = recordStore.insert("orders", "D", order("D", "d@x.com", 100, "pending"));

        // Then
        assertTrue(inserted);
        assertEquals("D", recordStore.get("orders", "D").orElseThrow().getString(RecordStore.ID_FIELD));
        assertEquals(4, recordStore.size("orders"));
    }

    @Test
    void testInsert_TakenKeyKeepsExistingDocument() {
        // When
        boolean inserted = recordStore.insert("orders", "A", order("A", "intruder@x.com", 1, "pending"));

        // Then
        assertFalse(inserted);
        assertEquals("john@x.com", recordStore.get("orders", "A").orElseThrow()
                .get("customer", Document.class).getString("email"));
        assertEquals(3, recordStore.size("orders"));
    }

    @Test
    void testDelete() {
        // When
        recordStore.delete("orders", "A");

        // Then
        assertTrue(recordStore.get("orders", "A").isEmpty());
        assertEquals(2, recordStore.size("orders"));
    }

    private static Document order(String id, String email, double total, String status) {
        return new Document("orderId", id)
                .append("status", status)
                .append("total", total)
                .append("customer", new Document("email", email))
                .append("notes", new ArrayList<>(List.of(new Document("note", "created"))));
    }

    private static List<String> ids(List<Document> documents) {
        return documents.stream().map(document -> document.getString("orderId")).collect(Collectors.toList());
    }
}
