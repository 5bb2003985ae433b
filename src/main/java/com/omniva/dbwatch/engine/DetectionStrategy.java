package com.omniva.dbwatch.engine;

/**
 * How a provider detects changes once the ledger is in place
 */
public enum DetectionStrategy {
    /**
     * Periodic re-read of the change ledger
     */
    POLLING,

    /**
     * Single-fire Service Broker notifications on each ledger row, re-armed after every notification
     */
    PUSH
}
