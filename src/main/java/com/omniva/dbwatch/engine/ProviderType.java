package com.omniva.dbwatch.engine;

/**
 * Provider requested from {@link DbWatchProviderFactory}
 */
public enum ProviderType {
    /**
     * Push when a notification listener is running for the queue, polling otherwise
     */
    AUTO,
    POLLING,
    SERVICE_BROKER
}
