package com.omniva.dbwatch.engine.ledger;

import com.omniva.dbwatch.messaging.model.QualifiedTableName;

import java.util.Collections;

/**
 * T-SQL for the change ledger and the per-table triggers that feed it.
 * <p>
 * Object names come from validated {@link QualifiedTableName}s and are
 * embedded as bracketed identifiers. Where a name appears inside a string
 * literal instead, its quotes are doubled.
 */
public final class LedgerStatements {

    private static final String ENSURE_LEDGER_TABLE_TEMPLATE =
            "IF NOT EXISTS (SELECT 1 FROM [sys].[tables] WHERE [object_id] = OBJECT_ID('%1$s')) " +
                    "BEGIN " +
                    "CREATE TABLE %3$s (" +
                    "[ObjectId] [int] NOT NULL, " +
                    "[ObjectName] [nvarchar](128) NOT NULL, " +
                    "[LastInsertDate] [datetimeoffset](7) NULL, " +
                    "[LastUpdateDate] [datetimeoffset](7) NULL, " +
                    "[LastDeleteDate] [datetimeoffset](7) NULL, " +
                    "CONSTRAINT [PK_%2$s] PRIMARY KEY CLUSTERED ([ObjectId] ASC)); " +
                    "CREATE UNIQUE NONCLUSTERED INDEX [IX_%2$s] ON %3$s ([ObjectName] ASC); " +
                    "END";

    private static final String DROP_LEDGER_TABLE_TEMPLATE =
            "IF EXISTS (SELECT 1 FROM [sys].[tables] WHERE [object_id] = OBJECT_ID('%1$s')) " +
                    "DROP TABLE %2$s;";

    private static final String CREATE_TRIGGER_TEMPLATE =
            "CREATE TRIGGER %1$s ON %2$s AFTER INSERT, UPDATE, DELETE AS " +
                    "BEGIN " +
                    "SET NOCOUNT ON; " +
                    "IF NOT EXISTS (SELECT 1 FROM %3$s WHERE [ObjectId] = OBJECT_ID('%4$s')) " +
                    "INSERT INTO %3$s VALUES (OBJECT_ID('%4$s'), '%4$s', NULL, NULL, NULL); " +
                    "IF EXISTS (SELECT 1 FROM INSERTED) " +
                    "IF EXISTS (SELECT 1 FROM DELETED) " +
                    "UPDATE %3$s SET [LastUpdateDate] = SYSDATETIMEOFFSET() WHERE ([ObjectId] = OBJECT_ID('%4$s')); " +
                    "ELSE " +
                    "UPDATE %3$s SET [LastInsertDate] = SYSDATETIMEOFFSET() WHERE ([ObjectId] = OBJECT_ID('%4$s')); " +
                    "ELSE " +
                    "IF EXISTS (SELECT 1 FROM DELETED) " +
                    "UPDATE %3$s SET [LastDeleteDate] = SYSDATETIMEOFFSET() WHERE ([ObjectId] = OBJECT_ID('%4$s')); " +
                    "END";

    private static final String DROP_TRIGGER_TEMPLATE =
            "IF EXISTS (SELECT 1 FROM [sys].[triggers] WHERE [object_id] = OBJECT_ID('%1$s')) " +
                    "DROP TRIGGER %2$s;";

    public static final String TABLE_EXISTS_QUERY =
            "SELECT COUNT(*) FROM [sys].[tables] WHERE [object_id] = OBJECT_ID(?)";

    public static final String TRIGGER_EXISTS_QUERY =
            "SELECT COUNT(*) FROM [sys].[triggers] WHERE [object_id] = OBJECT_ID(?)";

    private static final String SELECT_LEDGER_ENTRIES_TEMPLATE =
            "SELECT [ObjectId], [ObjectName], [LastInsertDate], [LastUpdateDate], [LastDeleteDate] " +
                    "FROM %s WHERE [ObjectId] IN (%s)";

    private static final String WATCHED_LEDGER_ROW_TEMPLATE =
            "SELECT [ObjectId], [ObjectName], [LastInsertDate], [LastUpdateDate], [LastDeleteDate] " +
                    "FROM %s WHERE [ObjectName] = ?";

    private LedgerStatements() {
    }

    public static String ensureLedgerTable(QualifiedTableName ledger) {
        return String.format(ENSURE_LEDGER_TABLE_TEMPLATE, literal(ledger.getFullName()),
                QualifiedTableName.escapeIdentifier(ledger.getName()), ledger.getFullName());
    }

    public static String dropLedgerTable(QualifiedTableName ledger) {
        return String.format(DROP_LEDGER_TABLE_TEMPLATE, literal(ledger.getFullName()), ledger.getFullName());
    }

    public static String createTrigger(QualifiedTableName trigger, QualifiedTableName table, QualifiedTableName ledger) {
        return String.format(CREATE_TRIGGER_TEMPLATE,
                trigger.getFullName(), table.getFullName(), ledger.getFullName(), literal(table.getFullName()));
    }

    public static String dropTrigger(QualifiedTableName trigger) {
        return String.format(DROP_TRIGGER_TEMPLATE, literal(trigger.getFullName()), trigger.getFullName());
    }

    /**
     * Ledger rows of {@code tableCount} tables, one {@code OBJECT_ID(?)} parameter per table
     */
    public static String selectLedgerEntries(QualifiedTableName ledger, int tableCount) {
        if (tableCount <= 0) {
            throw new IllegalArgumentException("At least one table is required");
        }
        String placeholders = String.join(", ", Collections.nCopies(tableCount, "OBJECT_ID(?)"));
        return String.format(SELECT_LEDGER_ENTRIES_TEMPLATE, ledger.getFullName(), placeholders);
    }

    /**
     * Query over a single ledger row, parameterized by the table's full name.
     * Uses the two part name form notification subscriptions require.
     */
    public static String watchedLedgerRow(QualifiedTableName ledger) {
        return String.format(WATCHED_LEDGER_ROW_TEMPLATE, ledger.getAlternateFullName());
    }

    static String literal(String value) {
        return value.replace("'", "''");
    }
}
