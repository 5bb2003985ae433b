package com.omniva.dbwatch.engine.fault;

/**
 * Exception thrown by a change detector while reading or arming notifications
 */
public class DbWatchDetectionException extends DbWatchRuntimeException {
    public DbWatchDetectionException(String message) {
        super(message);
    }

    public DbWatchDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
