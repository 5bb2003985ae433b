package com.omniva.dbwatch.engine.fault;

/**
 * Exception thrown when a lifecycle call is not valid in the provider's current state
 */
public class DbWatchStateException extends DbWatchRuntimeException {
    public DbWatchStateException(String message) {
        super(message);
    }

    public DbWatchStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
