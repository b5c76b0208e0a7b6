package com.example.kvdriver.model;

import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KvDocumentTest {

    @Test
    void testFromBson_ReadsAllFields() {
        // Given
        Instant created = Instant.parse("2024-01-01T00:00:00Z");
        Instant expires = Instant.parse("2024-01-02T00:00:00Z");
        Document bson = new Document("ID", "session:42")
                .append("data", new Document("uid", 7).append("roles", List.of(new Document("name", "admin"))))
                .append("createdAt", Date.from(created))
                .append("updatedAt", Date.from(created))
                .append("expireAt", Date.from(expires));

        // When
        KvDocument doc = KvDocument.fromBson(bson);

        // Then
        assertEquals("session:42", doc.getId());
        assertEquals(Map.of("uid", 7, "roles", List.of(Map.of("name", "admin"))), doc.getData());
        assertEquals(LinkedHashMap.class, doc.getData().getClass());
        assertEquals(created, doc.getCreatedAt());
        assertEquals(expires, doc.getExpireAt());
    }

    @Test
    void testFromBson_MissingExpiry() {
        KvDocument doc = KvDocument.fromBson(new Document("ID", "k").append("data", "v").append("expireAt", null));

        assertNull(doc.getExpireAt());
        assertFalse(doc.isExpired(Instant.now()));
    }

    @Test
    void testIsExpired_AtAndAfterExpireAt() {
        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        KvDocument doc = KvDocument.builder().id("k").expireAt(at).build();

        assertFalse(doc.isExpired(at.minusMillis(1)));
        assertTrue(doc.isExpired(at));
        assertTrue(doc.isExpired(at.plusSeconds(1)));
    }

    @Test
    void testPlainValue_CopiesCollections() {
        Object copy = KvDocument.plainValue(Set.of("only"));

        assertEquals(List.of("only"), copy);
        assertEquals("scalar", KvDocument.plainValue("scalar"));
        assertNull(KvDocument.plainValue(null));
    }
}
