package com.omniva.dbwatch.engine.fault;

/**
 * Exception thrown when the change ledger or its triggers cannot be created or dropped
 */
public class DbWatchProvisioningException extends DbWatchRuntimeException {
    public DbWatchProvisioningException(String message) {
        super(message);
    }

    public DbWatchProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
