package com.example.kvdriver.mongo;

import com.example.kvdriver.driver.Row;
import com.example.kvdriver.driver.RowLookup;
import com.example.kvdriver.driver.exceptions.BackendQueryException;
import com.example.kvdriver.driver.exceptions.DriverConnectionException;
import com.example.kvdriver.driver.exceptions.NotConnectedException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.result.DeleteResult;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoDriverTest {

    private static final String URL = "mongodb://localhost/quickdb";

    @Mock
    private MongoClient mongoClient;

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private IndexOperations indexOps;

    private final AtomicInteger connects = new AtomicInteger();

    private MongoDriver driver;

    @BeforeEach
    void setUp() {
        lenient().when(mongoTemplate.indexOps(anyString())).thenReturn(indexOps);
        driver = newDriver(MongoDriverOptions.defaults());
    }

    private MongoDriver newDriver(MongoDriverOptions options) {
        MongoConnector connector = (url, opts) -> {
            connects.incrementAndGet();
            return new MongoConnection(mongoClient, mongoTemplate, "quickdb");
        };
        return new MongoDriver(URL, options, connector, Runnable::run);
    }

    @Test
    void testOperationsBeforeConnect_ThrowWithoutTouchingStore() {
        assertThrows(NotConnectedException.class, () -> driver.prepare("cache"));
        assertThrows(NotConnectedException.class, () -> driver.getRowByKey("cache", "k"));
        assertThrows(NotConnectedException.class, () -> driver.setRowByKey("cache", "k", 1, false));
        assertThrows(NotConnectedException.class, () -> driver.deleteAllRows("cache"));

        assertEquals(0, connects.get());
        verifyNoInteractions(mongoTemplate, mongoClient);
    }

    @Test
    void testPrepare_CreatesUniqueAndTtlIndexesOnce() {
        // Given
        driver.connect();

        // When
        driver.prepare("cache");
        driver.prepare("cache");

        // Then
        ArgumentCaptor<Index> indexes = ArgumentCaptor.forClass(Index.class);
        verify(mongoTemplate, times(1)).indexOps("cache");
        verify(indexOps, times(2)).ensureIndex(indexes.capture());

        Index unique = indexes.getAllValues().get(0);
        assertEquals(new Document("ID", 1), unique.getIndexKeys());
        assertEquals(true, unique.getIndexOptions().get("unique"));

        Index ttl = indexes.getAllValues().get(1);
        assertEquals(new Document("expireAt", 1), ttl.getIndexKeys());
        assertEquals(0L, ((Number) ttl.getIndexOptions().get("expireAfterSeconds")).longValue());
        assertEquals(Set.of("cache"), driver.getPreparedTables());
    }

    @Test
    void testPrepare_IndexFailureIsSwallowed() {
        // Given
        driver.connect();
        when(indexOps.ensureIndex(any(Index.class))).thenThrow(new DataAccessResourceFailureException("not authorized"));

        // When
        driver.prepare("cache");

        // Then
        MongoTable table = driver.getModel("cache");
        assertTrue(table.getIndexSetup().isDone());
        assertFalse(table.getIndexSetup().isCompletedExceptionally());
    }

    @Test
    void testSetRowByKey_UpsertsOnId() {
        // Given
        driver.connect();
        Instant expireAt = Instant.parse("2030-01-01T00:00:00Z");

        // When
        Object stored = driver.setRowByKey("cache", "session:42", Map.of("uid", 7), false, expireAt);

        // Then
        assertEquals(Map.of("uid", 7), stored);
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).upsert(query.capture(), update.capture(), eq("cache"));
        verify(mongoTemplate, never()).insert(any(Object.class), anyString());

        assertEquals(new Document("ID", "session:42"), query.getValue().getQueryObject());
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertEquals(Map.of("uid", 7), set.get("data"));
        assertEquals(Date.from(expireAt), set.get("expireAt"));
        assertNotNull(set.get("updatedAt"));
        Document setOnInsert = (Document) update.getValue().getUpdateObject().get("$setOnInsert");
        assertNotNull(setOnInsert.get("createdAt"));
    }

    @Test
    void testSetRowByKey_WithoutExpiryClearsExpireAt() {
        // Given
        driver.connect();

        // When
        driver.setRowByKey("cache", "k", "v", false);

        // Then
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).upsert(any(Query.class), update.capture(), eq("cache"));
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertTrue(set.containsKey("expireAt"));
        assertNull(set.get("expireAt"));
    }

    @Test
    void testGetRowByKey_FoundAndMissing() {
        // Given
        driver.connect();
        when(mongoTemplate.findOne(any(Query.class), eq(Document.class), eq("cache")))
                .thenReturn(new Document("ID", "session:42").append("data", new Document("uid", 7)))
                .thenReturn(null);

        // When
        RowLookup found = driver.getRowByKey("cache", "session:42");
        RowLookup missing = driver.getRowByKey("cache", "session:43");

        // Then
        assertTrue(found.isFound());
        assertEquals(Map.of("uid", 7), found.getValue());
        assertFalse(missing.isFound());
        assertNull(missing.getValue());
    }

    @Test
    void testGetAllRows_MapsDocumentsToRows() {
        // Given
        driver.connect();
        when(mongoTemplate.find(any(Query.class), eq(Document.class), eq("cache"))).thenReturn(List.of(
                new Document("ID", "a").append("data", 1),
                new Document("ID", "b").append("data", List.of(new Document("x", "y")))));

        // When
        List<Row> rows = driver.getAllRows("cache");

        // Then
        assertEquals(2, rows.size());
        assertEquals(new Row("a", 1), rows.get(0));
        assertEquals(new Row("b", List.of(Map.of("x", "y"))), rows.get(1));
    }

    @Test
    void testStartsWith_QuotesRegexMetacharacters() {
        Pattern pattern = Pattern.compile(MongoDriver.startsWith("user.(1)*"));

        assertTrue(pattern.matcher("user.(1)*42").find());
        assertFalse(pattern.matcher("userX(1)42").find());
        assertFalse(pattern.matcher("xuser.(1)*").find());
    }

    @Test
    void testDeleteRowByKey_ReturnsStoreCount() {
        // Given
        driver.connect();
        when(mongoTemplate.remove(any(Query.class), eq("cache")))
                .thenReturn(DeleteResult.acknowledged(1))
                .thenReturn(DeleteResult.acknowledged(0));

        // Then
        assertEquals(1, driver.deleteRowByKey("cache", "k"));
        assertEquals(0, driver.deleteRowByKey("cache", "k"));
    }

    @Test
    void testDeleteAllRows_ReturnsStoreCount() {
        // Given
        driver.connect();
        when(mongoTemplate.remove(any(Query.class), eq("cache"))).thenReturn(DeleteResult.acknowledged(3));

        // Then
        assertEquals(3, driver.deleteAllRows("cache"));
    }

    @Test
    void testStoreFailureIsReportedAsBackendQueryException() {
        // Given
        driver.connect();
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("socket closed");
        when(mongoTemplate.find(any(Query.class), eq(Document.class), eq("cache"))).thenThrow(failure);

        // When
        BackendQueryException e = assertThrows(BackendQueryException.class, () -> driver.getAllRows("cache"));

        // Then
        assertSame(failure, e.getCause());
    }

    @Test
    void testConnectFailure_IsDriverConnectionException() {
        // Given
        MongoDriver unreachable = new MongoDriver(URL, MongoDriverOptions.defaults(), (url, opts) -> {
            throw new MongoTimeoutException("Timed out while waiting for a server");
        }, Runnable::run);

        // Then
        assertThrows(DriverConnectionException.class, unreachable::connect);
        assertFalse(unreachable.isConnected());
    }

    @Test
    void testMalformedUrl_IsDriverConnectionException() {
        MongoDriver malformed = new MongoDriver("not-a-mongo-url", MongoDriverOptions.defaults());

        assertThrows(DriverConnectionException.class, malformed::connect);
    }

    @Test
    void testConnectTwice_KeepsFirstConnection() {
        driver.connect();
        driver.connect();

        assertEquals(1, connects.get());
        assertTrue(driver.isConnected());
    }

    @Test
    void testDisconnect_ClosesClientAndDropsTableHandles() {
        // Given
        driver.connect();
        driver.prepare("cache");

        // When
        driver.disconnect();
        driver.disconnect();

        // Then
        verify(mongoClient, times(1)).close();
        assertFalse(driver.isConnected());
        assertTrue(driver.getPreparedTables().isEmpty());
        assertThrows(NotConnectedException.class, () -> driver.getAllRows("cache"));
    }

    @Test
    void testPluralizedCollectionNames() {
        // Given
        MongoDriver plural = newDriver(MongoDriverOptions.builder().pluralizeNames(true).build()).connect();
        when(mongoTemplate.remove(any(Query.class), eq("boxes"))).thenReturn(DeleteResult.acknowledged(0));

        // Then
        assertEquals(0, plural.deleteAllRows("Box"));
    }
}
