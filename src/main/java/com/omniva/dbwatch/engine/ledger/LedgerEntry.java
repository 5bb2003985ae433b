package com.omniva.dbwatch.engine.ledger;

/**
 * One row of the change ledger
 */
public record LedgerEntry(int objectId, String objectName, LedgerSnapshot snapshot) {
}
