package com.omniva.dbwatch.engine.fault;

/**
 * Exception thrown when a database connection cannot be opened
 */
public class DbWatchConnectionException extends DbWatchRuntimeException {
    public DbWatchConnectionException(String message) {
        super(message);
    }

    public DbWatchConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
