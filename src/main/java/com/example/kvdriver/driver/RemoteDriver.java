package com.example.kvdriver.driver;

import com.example.kvdriver.driver.exceptions.DriverConnectionException;
import com.example.kvdriver.driver.exceptions.NotConnectedException;

import java.time.Instant;
import java.util.List;

/**
 * Storage contract consumed by the KV façade. Every backend exposes the same
 * table-scoped operations with the same semantics, so application code does not
 * change when the backing store does.
 * <p>
 * All operations except {@link #connect()}, {@link #disconnect()} and {@link #isConnected()}
 * throw {@link NotConnectedException} before touching the store when the driver is not connected.
 * Absence is never an error: missing keys, empty prefixes and empty tables are reported as
 * {@link RowLookup#absent()}, empty lists and zero counts.
 */
public interface RemoteDriver {

    /** Table used by the façade when the caller does not name one. */
    String DEFAULT_TABLE = "json";

    /**
     * Opens the connection to the backing store.
     *
     * @throws DriverConnectionException when the store is unreachable, rejects the credentials
     *                                   or the connection target is malformed
     */
    RemoteDriver connect();

    /** Releases the connection. Calling it while disconnected is a no-op. */
    void disconnect();

    boolean isConnected();

    /** Ensures a handle for {@code table} exists, creating the table on first use. */
    void prepare(String table);

    /** Every live entry of the table, in no particular order. */
    List<Row> getAllRows(String table);

    RowLookup getRowByKey(String table, String key);

    /** Entries whose key begins with {@code prefix}, compared literally. */
    List<Row> getStartsWith(String table, String prefix);

    /**
     * Inserts or replaces the entry for {@code key} without an expiry.
     *
     * @param update reserved for merge-style writes; bundled backends always replace
     * @return the value as stored
     */
    default Object setRowByKey(String table, String key, Object value, boolean update) {
        return setRowByKey(table, key, value, update, null);
    }

    /**
     * Inserts or replaces the entry for {@code key}. A non-null {@code expireAt} makes the
     * entry eligible for removal by the store once that instant is reached; a null one
     * clears any earlier expiry.
     */
    Object setRowByKey(String table, String key, Object value, boolean update, Instant expireAt);

    /** @return number of entries removed */
    long deleteAllRows(String table);

    /** @return 1 if an entry was removed, otherwise 0 */
    long deleteRowByKey(String table, String key);
}
