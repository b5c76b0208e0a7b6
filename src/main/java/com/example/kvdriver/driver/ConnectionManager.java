package com.example.kvdriver.driver;

import com.example.kvdriver.driver.exceptions.DriverConnectionException;
import com.example.kvdriver.driver.exceptions.NotConnectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * Owns the single store handle of one driver instance and gates every other operation
 * behind the connected state.
 *
 * @param <H> the backend's connection handle
 */
public class ConnectionManager<H> {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    private final String driverName;
    private volatile H handle;

    public ConnectionManager(String driverName) {
        this.driverName = driverName;
    }

    /**
     * Opens the handle unless one is already held. Whatever the opener throws is reported
     * as a {@link DriverConnectionException}.
     */
    public synchronized H open(Callable<H> opener) {
        if (handle != null) {
            logger.warn("{} is already connected; keeping the existing connection", driverName);
            return handle;
        }
        H opened;
        try {
            opened = opener.call();
        } catch (DriverConnectionException e) {
            throw e;
        } catch (Exception e) {
            throw new DriverConnectionException(driverName + " failed to connect: " + e.getMessage(), e);
        }
        if (opened == null) {
            throw new DriverConnectionException(driverName + " failed to connect: no connection was returned", null);
        }
        handle = opened;
        logger.info("{} connected", driverName);
        return opened;
    }

    public H require() {
        H current = handle;
        if (current == null) {
            throw new NotConnectedException(driverName);
        }
        return current;
    }

    public boolean isConnected() {
        return handle != null;
    }

    /**
     * Releases the handle. The manager is disconnected afterwards even if the closer fails.
     */
    public synchronized void close(Consumer<H> closer) {
        H current = handle;
        if (current == null) {
            return;
        }
        handle = null;
        try {
            closer.accept(current);
            logger.info("{} disconnected", driverName);
        } catch (RuntimeException e) {
            logger.warn("{} failed to release its connection cleanly", driverName, e);
        }
    }

    public String getDriverName() {
        return driverName;
    }
}
