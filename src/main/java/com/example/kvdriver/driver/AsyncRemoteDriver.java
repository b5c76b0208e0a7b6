package com.example.kvdriver.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs the operations of a {@link RemoteDriver} on a worker pool so callers can issue
 * them without blocking. A failed operation completes its future exceptionally, with the
 * driver's own exception as the cause.
 */
public class AsyncRemoteDriver implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AsyncRemoteDriver.class);

    private final RemoteDriver driver;
    private final ExecutorService executor;

    public AsyncRemoteDriver(RemoteDriver driver, int threads) {
        this.driver = driver;
        this.executor = createExecutorService(threads);
    }

    private static ExecutorService createExecutorService(int threads) {
        int threadCount = threads > 0 ? threads : 4;
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threadCount, r -> {
            Thread t = new Thread(r, "kv-driver-async-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public RemoteDriver getDriver() {
        return driver;
    }

    public CompletableFuture<RemoteDriver> connect() {
        return submit(driver::connect);
    }

    public CompletableFuture<Void> disconnect() {
        return submit(driver::disconnect);
    }

    public CompletableFuture<Void> prepare(String table) {
        return submit(() -> driver.prepare(table));
    }

    public CompletableFuture<List<Row>> getAllRows(String table) {
        return submit(() -> driver.getAllRows(table));
    }

    public CompletableFuture<RowLookup> getRowByKey(String table, String key) {
        return submit(() -> driver.getRowByKey(table, key));
    }

    public CompletableFuture<List<Row>> getStartsWith(String table, String prefix) {
        return submit(() -> driver.getStartsWith(table, prefix));
    }

    public CompletableFuture<Object> setRowByKey(String table, String key, Object value, boolean update) {
        return submit(() -> driver.setRowByKey(table, key, value, update));
    }

    public CompletableFuture<Object> setRowByKey(String table, String key, Object value, boolean update, Instant expireAt) {
        return submit(() -> driver.setRowByKey(table, key, value, update, expireAt));
    }

    public CompletableFuture<Long> deleteAllRows(String table) {
        return submit(() -> driver.deleteAllRows(table));
    }

    public CompletableFuture<Long> deleteRowByKey(String table, String key) {
        return submit(() -> driver.deleteRowByKey(table, key));
    }

    private <T> CompletableFuture<T> submit(Supplier<T> operation) {
        return CompletableFuture.supplyAsync(operation, executor);
    }

    private CompletableFuture<Void> submit(Runnable operation) {
        return CompletableFuture.runAsync(operation, executor);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Async driver workers did not finish within 5s, interrupting them");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
