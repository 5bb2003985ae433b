package com.omniva.dbwatch.messaging.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Naming options for the objects a watch session generates in the database:
 * the change ledger table and one trigger per monitored table.
 */
@Getter
public final class WatchOptions {

    public static final String DEFAULT_OBJECT_SCHEMA = "dbo";
    public static final String DEFAULT_LEDGER_BASE_NAME = "SqlDependencyChanges";
    public static final String DEFAULT_TRIGGER_BASE_NAME = "SqlDependencyChangeTrigger";

    private final String objectSchema;
    private final String objectPrefix;
    private final String ledgerBaseName;
    private final String triggerBaseName;

    @Builder(toBuilder = true)
    private WatchOptions(String objectSchema, String objectPrefix, String ledgerBaseName, String triggerBaseName) {
        this.objectSchema = isBlank(objectSchema) ? DEFAULT_OBJECT_SCHEMA : objectSchema.trim();
        this.objectPrefix = isBlank(objectPrefix) ? "" : objectPrefix.trim();
        this.ledgerBaseName = isBlank(ledgerBaseName) ? DEFAULT_LEDGER_BASE_NAME : ledgerBaseName.trim();
        this.triggerBaseName = isBlank(triggerBaseName) ? DEFAULT_TRIGGER_BASE_NAME : triggerBaseName.trim();
    }

    public static WatchOptions defaults() {
        return builder().build();
    }

    public QualifiedTableName getLedgerTable() {
        return new QualifiedTableName(objectPrefix + ledgerBaseName, objectSchema);
    }

    /**
     * Trigger installed on {@code table}; it lives in the table's own schema
     */
    public QualifiedTableName getTableTrigger(QualifiedTableName table) {
        if (table == null || !table.isValid()) {
            throw new IllegalArgumentException("Table name is required to derive its trigger name");
        }
        return new QualifiedTableName(objectPrefix + triggerBaseName + "_" + table.getName(), table.getSchema());
    }

    @Override
    public String toString() {
        return String.format("WatchOptions[ledger=%s, triggerBaseName=%s, prefix=%s]",
                getLedgerTable(), triggerBaseName, objectPrefix);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
