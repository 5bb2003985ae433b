package com.omniva.dbwatch.engine.ignition;

import com.omniva.dbwatch.engine.fault.DbWatchValidationException;
import com.omniva.dbwatch.engine.fuelsystem.DbWatchConnectionManager;
import com.omniva.dbwatch.engine.ledger.LedgerStatements;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import com.omniva.dbwatch.messaging.model.WatchParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validates watch parameters before a provider is built.
 * <p>
 * Checks run cheapest first; the live table check is the only one that
 * touches the database.
 */
public class WatchParametersValidator {
    private static final Logger log = LoggerFactory.getLogger(WatchParametersValidator.class);

    private final DbWatchConnectionManager connectionManager;

    public WatchParametersValidator(DbWatchConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    /**
     * Returns a validated copy: tables deduplicated and sorted by schema then name.
     *
     * @throws DbWatchValidationException when a parameter is missing or a table does not exist
     */
    public WatchParameters validateAndAdjust(WatchParameters params) {
        if (params == null) {
            throw new DbWatchValidationException("Watch parameters cannot be null");
        }

        if (params.getDataSource() == null) {
            throw new DbWatchValidationException("Watch parameters require a data source");
        }

        List<QualifiedTableName> tables = normalizeTables(params.getTables());
        if (tables.isEmpty()) {
            throw new DbWatchValidationException("Watch parameters require at least one valid table");
        }

        if (params.getMonitoredChanges() == null || params.getMonitoredChanges().isEmpty()) {
            throw new DbWatchValidationException("Watch parameters require at least one monitored change type");
        }

        WatchParameters adjusted = params.toBuilder()
                .clearTables()
                .tables(tables)
                .build();

        verifyTablesExist(adjusted);
        return adjusted;
    }

    private List<QualifiedTableName> normalizeTables(List<QualifiedTableName> tables) {
        Set<QualifiedTableName> unique = new LinkedHashSet<>();
        if (tables != null) {
            tables.stream()
                    .filter(Objects::nonNull)
                    .filter(QualifiedTableName::isValid)
                    .forEach(unique::add);
        }
        List<QualifiedTableName> sorted = new ArrayList<>(unique);
        sorted.sort(null);
        return sorted;
    }

    private void verifyTablesExist(WatchParameters params) {
        List<String> missingTables = new ArrayList<>();

        Connection connection = connectionManager.openConnection(params.getDataSource());
        try (PreparedStatement ps = connection.prepareStatement(LedgerStatements.TABLE_EXISTS_QUERY)) {
            for (QualifiedTableName table : params.getTables()) {
                ps.setString(1, table.getFullName());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next() || rs.getInt(1) <= 0) {
                        missingTables.add(table.getFullName());
                    }
                }
            }
        } catch (SQLException e) {
            throw new DbWatchValidationException("Could not verify monitored tables: " + e.getMessage(), e);
        } finally {
            connectionManager.safeClose(connection, "parameter validation");
        }

        if (!missingTables.isEmpty()) {
            log.error("Monitored tables do not exist: {}", missingTables);
            throw new DbWatchValidationException(
                    "One or more monitored tables do not exist: " + String.join(", ", missingTables));
        }
    }
}
