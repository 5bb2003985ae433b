package com.omniva.dbwatch.engine.fault;

/**
 * Base runtime exception for all DB Watch related errors
 */
public class DbWatchRuntimeException extends RuntimeException {
    public DbWatchRuntimeException(String message) {
        super(message);
    }

    public DbWatchRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
