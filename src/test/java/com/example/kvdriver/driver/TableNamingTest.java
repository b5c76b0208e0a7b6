package com.example.kvdriver.driver;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class TableNamingTest {

    @Test
    void testVerbatimKeepsName() {
        assertEquals("UserSessions", TableNaming.verbatim().collectionName("UserSessions"));
        assertFalse(TableNaming.of(false).isPluralized());
    }

    @ParameterizedTest
    @CsvSource({
            "user, users",
            "User, users",
            "box, boxes",
            "match, matches",
            "category, categories",
            "key, keys",
            "status, status",
            "json, json",
            "news, news",
            "sheep, sheep"
    })
    void testPluralized(String table, String collection) {
        assertEquals(collection, TableNaming.pluralized().collectionName(table));
    }

    @Test
    void testBlankNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> TableNaming.verbatim().collectionName(""));
        assertThrows(IllegalArgumentException.class, () -> TableNaming.pluralized().collectionName("  "));
        assertThrows(IllegalArgumentException.class, () -> TableNaming.verbatim().collectionName(null));
    }
}
