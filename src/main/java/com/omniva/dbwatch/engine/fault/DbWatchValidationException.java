package com.omniva.dbwatch.engine.fault;

/**
 * Exception thrown when watch parameters are rejected before any session exists
 */
public class DbWatchValidationException extends DbWatchRuntimeException {
    public DbWatchValidationException(String message) {
        super(message);
    }

    public DbWatchValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
