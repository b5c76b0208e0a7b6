package com.example.kvdriver.mongo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static com.example.kvdriver.model.KvDocument.EXPIRE_AT;
import static com.example.kvdriver.model.KvDocument.ID;

/**
 * Handle for the collection backing one KV table.
 * <p>
 * Creating the handle starts index setup in the background: a unique index on {@code ID}
 * and a TTL index on {@code expireAt} that lets the server's own reaper remove entries
 * once their expiry passes. Index setup never fails the caller. A failure is logged and
 * the table keeps working without the index.
 */
public class MongoTable {

    private static final Logger logger = LoggerFactory.getLogger(MongoTable.class);

    private final String table;
    private final String collection;
    private final CompletableFuture<Void> indexSetup;

    MongoTable(String table, String collection, MongoTemplate template, Executor indexExecutor) {
        this.table = table;
        this.collection = collection;
        this.indexSetup = CompletableFuture
                .runAsync(() -> ensureIndexes(template), indexExecutor)
                .exceptionally(e -> {
                    logger.warn("Index setup failed for collection {}; entries will not expire automatically", collection, e);
                    return null;
                });
        logger.info("Registered table {} on collection {}", table, collection);
    }

    private void ensureIndexes(MongoTemplate template) {
        IndexOperations indexOps = template.indexOps(collection);
        indexOps.ensureIndex(new Index().on(ID, Sort.Direction.ASC).unique());
        indexOps.ensureIndex(new Index().on(EXPIRE_AT, Sort.Direction.ASC).expire(Duration.ZERO));
        logger.debug("Indexes ready on collection {}", collection);
    }

    public String getTable() {
        return table;
    }

    public String getCollection() {
        return collection;
    }

    /** Completes once index setup has finished, whether or not it succeeded. */
    public CompletableFuture<Void> getIndexSetup() {
        return indexSetup;
    }
}
