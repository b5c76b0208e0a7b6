package com.example.kvdriver.memory;

import com.example.kvdriver.model.KvDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Process-local stand-in for a document store server. Collections outlive the drivers
 * connected to it, and a background sweeper removes entries whose {@code expireAt} has
 * passed, the way a store's TTL monitor would.
 */
public class MemoryStore implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MemoryStore.class);

    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(1);

    private final ConcurrentMap<String, ConcurrentMap<String, KvDocument>> collections = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService sweeper;
    private volatile boolean closed;

    public MemoryStore() {
        this(DEFAULT_SWEEP_INTERVAL, Clock.systemUTC());
    }

    /**
     * @param sweepInterval how often expired entries are removed; zero or negative disables
     *                      the sweeper, leaving removal to {@link #sweepExpired()}
     */
    public MemoryStore(Duration sweepInterval, Clock clock) {
        this.clock = clock;
        if (sweepInterval.isZero() || sweepInterval.isNegative()) {
            this.sweeper = null;
        } else {
            this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "memory-store-sweeper");
                t.setDaemon(true);
                return t;
            });
            long millis = sweepInterval.toMillis();
            sweeper.scheduleWithFixedDelay(this::sweepQuietly, millis, millis, TimeUnit.MILLISECONDS);
        }
    }

    public Instant now() {
        return clock.instant();
    }

    public boolean isClosed() {
        return closed;
    }

    ConcurrentMap<String, KvDocument> collection(String name) {
        return collections.computeIfAbsent(name, n -> new ConcurrentHashMap<>());
    }

    public Set<String> collectionNames() {
        return new TreeSet<>(collections.keySet());
    }

    /** Documents physically present in a collection, expired or not. */
    public int documentCount(String collection) {
        ConcurrentMap<String, KvDocument> docs = collections.get(collection);
        return docs == null ? 0 : docs.size();
    }

    /** Removes every expired document and returns how many were removed. */
    public int sweepExpired() {
        Instant now = now();
        int removed = 0;
        for (ConcurrentMap<String, KvDocument> docs : collections.values()) {
            for (KvDocument doc : docs.values()) {
                if (doc.isExpired(now) && docs.remove(doc.getId(), doc)) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            logger.debug("Swept {} expired documents", removed);
        }
        return removed;
    }

    private void sweepQuietly() {
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            // an exception would cancel the scheduled sweep
            logger.warn("Expiry sweep failed", e);
        }
    }

    @Override
    public void close() {
        closed = true;
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }
}
