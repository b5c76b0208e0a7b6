package com.example.kvdriver.driver.exceptions;

/**
 * A table or row operation was attempted on a driver that has not been connected,
 * or has been disconnected since.
 */
public class NotConnectedException extends KvDriverException {
    public NotConnectedException(String driverName) {
        super(driverName + " is not connected to the database");
    }
}
