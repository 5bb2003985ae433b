package com.omniva.dbwatch.engine.ledger;

import com.omniva.dbwatch.engine.fault.DbWatchProvisioningException;
import com.omniva.dbwatch.engine.fuelsystem.DbWatchConnectionManager;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import com.omniva.dbwatch.messaging.model.WatchParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

/**
 * Creates and drops the change ledger table and the per-table triggers.
 * <p>
 * Both directions run on one connection inside one serializable transaction
 * while holding the registry's provisioning lock. Reference counts are
 * snapshotted first and restored together with the database rollback, so a
 * failed call leaves neither half-created objects nor drifted counts.
 * <p>
 * Provision: ledger table, then triggers. Deprovision: triggers first (they
 * write into the ledger), then the ledger table. An object is only dropped
 * once its count reaches zero.
 */
public class LedgerLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(LedgerLifecycleManager.class);

    private final DbWatchConnectionManager connectionManager;
    private final ReferenceCountRegistry referenceCounts;

    public LedgerLifecycleManager(DbWatchConnectionManager connectionManager,
                                  ReferenceCountRegistry referenceCounts) {
        this.connectionManager = connectionManager;
        this.referenceCounts = referenceCounts;
    }

    /**
     * Ensures the ledger table and all table triggers exist and takes a
     * reference on each of them.
     */
    public void provision(WatchParameters params) {
        referenceCounts.runWithLock(() -> inTransaction(params, "provision", connection -> {
            ensureLedgerTable(connection, params);
            ensureTableTriggers(connection, params);
        }));
        log.info("Provisioned change ledger {} for tables {}", params.getLedgerTable(), params.getTables());
    }

    /**
     * Releases this session's references, dropping objects nobody else uses.
     */
    public void deprovision(WatchParameters params) {
        referenceCounts.runWithLock(() -> inTransaction(params, "deprovision", connection -> {
            deleteTableTriggers(connection, params);
            deleteLedgerTable(connection, params);
        }));
        log.info("Deprovisioned change ledger {} for tables {}", params.getLedgerTable(), params.getTables());
    }

    public ReferenceCountRegistry getReferenceCounts() {
        return referenceCounts;
    }

    // ===== TRANSACTION HANDLING =====

    private void inTransaction(WatchParameters params, String operation, LedgerWork work) {
        Map<String, Integer> backupRefCounts = referenceCounts.snapshot();
        Connection connection = null;
        boolean committed = false;

        try {
            connection = connectionManager.openConnection(params.getDataSource());
            connection.setAutoCommit(false);
            connection.setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);

            work.execute(connection);

            connection.commit();
            committed = true;
        } catch (SQLException e) {
            log.error("Failed to {} change ledger {} (SQLState: {}, ErrorCode: {}): {}",
                    operation, params.getLedgerTable(), e.getSQLState(), e.getErrorCode(), e.getMessage());
            throw new DbWatchProvisioningException(
                    "Failed to " + operation + " change ledger " + params.getLedgerTable(), e);
        } catch (RuntimeException e) {
            log.error("Failed to {} change ledger {}: {}", operation, params.getLedgerTable(), e.getMessage());
            if (e instanceof DbWatchProvisioningException) {
                throw e;
            }
            throw new DbWatchProvisioningException(
                    "Failed to " + operation + " change ledger " + params.getLedgerTable(), e);
        } finally {
            if (!committed) {
                connectionManager.safeRollback(connection, operation);
                referenceCounts.restore(backupRefCounts);
            }
            connectionManager.safeClose(connection, operation);
        }
    }

    @FunctionalInterface
    private interface LedgerWork {
        void execute(Connection connection) throws SQLException;
    }

    // ===== LEDGER TABLE =====

    private void ensureLedgerTable(Connection connection, WatchParameters params) throws SQLException {
        QualifiedTableName ledger = params.getLedgerTable();
        execute(connection, LedgerStatements.ensureLedgerTable(ledger));
        int refCount = referenceCounts.increment(ledger.getFullName());
        log.debug("Ledger table {} ensured (references: {})", ledger, refCount);
    }

    private void deleteLedgerTable(Connection connection, WatchParameters params) throws SQLException {
        QualifiedTableName ledger = params.getLedgerTable();
        int refCount = referenceCounts.decrement(ledger.getFullName());
        if (refCount <= 0) {
            execute(connection, LedgerStatements.dropLedgerTable(ledger));
            log.debug("Ledger table {} dropped", ledger);
        } else {
            log.debug("Ledger table {} kept (references: {})", ledger, refCount);
        }
    }

    // ===== TABLE TRIGGERS =====

    private void ensureTableTriggers(Connection connection, WatchParameters params) throws SQLException {
        List<QualifiedTableName> tables = params.getTables();
        for (QualifiedTableName table : tables) {
            QualifiedTableName trigger = params.getTableTrigger(table);
            if (!triggerExists(connection, trigger)) {
                execute(connection, LedgerStatements.createTrigger(trigger, table, params.getLedgerTable()));
                log.debug("Created trigger {} on {}", trigger, table);
            }
        }

        for (QualifiedTableName table : tables) {
            referenceCounts.increment(params.getTableTrigger(table).getFullName());
        }
    }

    private void deleteTableTriggers(Connection connection, WatchParameters params) throws SQLException {
        for (QualifiedTableName table : params.getTables()) {
            QualifiedTableName trigger = params.getTableTrigger(table);
            int refCount = referenceCounts.decrement(trigger.getFullName());
            if (refCount <= 0) {
                execute(connection, LedgerStatements.dropTrigger(trigger));
                log.debug("Dropped trigger {} on {}", trigger, table);
            }
        }
    }

    private boolean triggerExists(Connection connection, QualifiedTableName trigger) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(LedgerStatements.TRIGGER_EXISTS_QUERY)) {
            ps.setString(1, trigger.getFullName());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt(1) > 0;
            }
        }
    }

    private void execute(Connection connection, String sql) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }
}
