package com.omniva.dbwatch.messaging.model;

import lombok.Value;

import java.time.Instant;

/**
 * Raised when one or more monitored kinds of change were detected on a table
 */
@Value
public class TableChangedEvent {
    Object source;
    QualifiedTableName table;
    MonitoredChanges changes;
    Instant detectedAt;

    public TableChangedEvent(Object source, QualifiedTableName table, MonitoredChanges changes) {
        this.source = source;
        this.table = table;
        this.changes = changes;
        this.detectedAt = Instant.now();
    }

    public boolean hasChange(ChangeType type) {
        return changes.contains(type);
    }
}
