package com.example.kvdriver.driver.exceptions;

/**
 * The backing store failed a read, write or delete. The store's own exception is the cause.
 */
public class BackendQueryException extends KvDriverException {
    public BackendQueryException(String operation, String table, Throwable cause) {
        super(operation + " failed on table '" + table + "': " + cause.getMessage(), cause);
    }
}
