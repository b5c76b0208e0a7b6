package com.example.kvdriver.driver.exceptions;

public class KvDriverException extends RuntimeException {
    public KvDriverException(String message) {
        super(message);
    }

    public KvDriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
