package com.example.kvdriver.memory;

import com.example.kvdriver.driver.ConnectionManager;
import com.example.kvdriver.driver.RemoteDriver;
import com.example.kvdriver.driver.Row;
import com.example.kvdriver.driver.RowLookup;
import com.example.kvdriver.driver.TableNaming;
import com.example.kvdriver.driver.TableRegistry;
import com.example.kvdriver.model.KvDocument;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * {@link RemoteDriver} over a {@link MemoryStore}. Needs no infrastructure, which makes it
 * the backend for local runs and tests.
 */
public class MemoryDriver implements RemoteDriver {

    private final MemoryStore store;
    private final TableNaming naming;
    private final ConnectionManager<MemoryStore> connection = new ConnectionManager<>("MemoryDriver");
    private final TableRegistry<ConcurrentMap<String, KvDocument>> tables = new TableRegistry<>();

    public MemoryDriver() {
        this(new MemoryStore(), false);
    }

    public MemoryDriver(MemoryStore store, boolean pluralizeNames) {
        this.store = Objects.requireNonNull(store, "store");
        this.naming = TableNaming.of(pluralizeNames);
    }

    @Override
    public MemoryDriver connect() {
        connection.open(() -> {
            if (store.isClosed()) {
                throw new IllegalStateException("memory store has been closed");
            }
            return store;
        });
        return this;
    }

    @Override
    public void disconnect() {
        tables.invalidate();
        // the store is shared; only this driver's hold on it is released
        connection.close(s -> { });
    }

    @Override
    public boolean isConnected() {
        return connection.isConnected();
    }

    @Override
    public void prepare(String table) {
        collection(table);
    }

    private ConcurrentMap<String, KvDocument> collection(String table) {
        MemoryStore current = connection.require();
        String name = naming.collectionName(table);
        return tables.resolve(table, t -> current.collection(name));
    }

    @Override
    public List<Row> getAllRows(String table) {
        return select(collection(table), id -> true);
    }

    @Override
    public RowLookup getRowByKey(String table, String key) {
        Objects.requireNonNull(key, "key");
        KvDocument doc = collection(table).get(key);
        if (doc == null || doc.isExpired(store.now())) {
            return RowLookup.absent();
        }
        return RowLookup.of(KvDocument.plainValue(doc.getData()));
    }

    @Override
    public List<Row> getStartsWith(String table, String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        return select(collection(table), id -> id.startsWith(prefix));
    }

    @Override
    public Object setRowByKey(String table, String key, Object value, boolean update, Instant expireAt) {
        Objects.requireNonNull(key, "key");
        ConcurrentMap<String, KvDocument> docs = collection(table);
        Instant now = store.now();
        Object stored = KvDocument.plainValue(value);
        docs.compute(key, (k, existing) -> KvDocument.builder()
                .id(k)
                .data(stored)
                .createdAt(existing == null || existing.isExpired(now) ? now : existing.getCreatedAt())
                .updatedAt(now)
                .expireAt(expireAt)
                .build());
        return value;
    }

    @Override
    public long deleteAllRows(String table) {
        ConcurrentMap<String, KvDocument> docs = collection(table);
        long removed = 0;
        for (String key : new ArrayList<>(docs.keySet())) {
            if (docs.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public long deleteRowByKey(String table, String key) {
        Objects.requireNonNull(key, "key");
        return collection(table).remove(key) != null ? 1 : 0;
    }

    private List<Row> select(ConcurrentMap<String, KvDocument> docs, Predicate<String> idFilter) {
        Instant now = store.now();
        List<Row> rows = new ArrayList<>();
        for (KvDocument doc : docs.values()) {
            if (idFilter.test(doc.getId()) && !doc.isExpired(now)) {
                rows.add(new Row(doc.getId(), KvDocument.plainValue(doc.getData())));
            }
        }
        return rows;
    }
}
