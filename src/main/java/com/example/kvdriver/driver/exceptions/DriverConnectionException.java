package com.example.kvdriver.driver.exceptions;

/**
 * {@code connect()} failed: the target was malformed, unreachable, or refused the credentials.
 */
public class DriverConnectionException extends KvDriverException {
    public DriverConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
