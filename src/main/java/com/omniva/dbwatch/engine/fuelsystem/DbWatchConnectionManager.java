package com.omniva.dbwatch.engine.fuelsystem;

import com.omniva.dbwatch.engine.fault.ConnectionFailureClassifier;
import com.omniva.dbwatch.engine.fault.DbWatchConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Opens connections for provisioning, validation and detection.
 * <p>
 * Opening is retried with a fixed backoff for transient failures; failures
 * that {@link ConnectionFailureClassifier} reports as non-retryable are
 * rethrown at once without spending the remaining attempts.
 */
public class DbWatchConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(DbWatchConnectionManager.class);

    public static final int DEFAULT_MAX_OPEN_ATTEMPTS = 5;
    public static final long DEFAULT_OPEN_RETRY_DELAY_MS = 1000;

    private final int maxOpenAttempts;
    private final long openRetryDelayMs;

    public DbWatchConnectionManager() {
        this(DEFAULT_MAX_OPEN_ATTEMPTS, DEFAULT_OPEN_RETRY_DELAY_MS);
    }

    public DbWatchConnectionManager(int maxOpenAttempts, long openRetryDelayMs) {
        this.maxOpenAttempts = maxOpenAttempts > 0 ? maxOpenAttempts : DEFAULT_MAX_OPEN_ATTEMPTS;
        this.openRetryDelayMs = Math.max(0, openRetryDelayMs);
    }

    /**
     * Opens a connection, retrying transient failures.
     *
     * @throws DbWatchConnectionException when all attempts failed, a non-retryable
     *                                    SQL failure occurred or the thread was interrupted while backing off
     */
    public Connection openConnection(DataSource dataSource) {
        if (dataSource == null) {
            throw new IllegalArgumentException("DataSource cannot be null");
        }

        Exception previousFailure = null;
        for (int attempt = 1; attempt <= maxOpenAttempts; attempt++) {
            if (attempt > 1) {
                backOff(attempt, previousFailure);
            }

            try {
                Connection connection = dataSource.getConnection();
                if (connection == null) {
                    throw new SQLException("DataSource returned null connection");
                }
                if (attempt > 1) {
                    log.info("Database connection opened on attempt {}/{}", attempt, maxOpenAttempts);
                }
                return connection;
            } catch (SQLException e) {
                if (ConnectionFailureClassifier.isNonRetryable(e)) {
                    log.error("Non-retryable connection failure (SQLState: {}, ErrorCode: {}): {}",
                            e.getSQLState(), e.getErrorCode(), e.getMessage());
                    throw new DbWatchConnectionException("Database connection could not be opened: " + e.getMessage(), e);
                }
                log.warn("Connection attempt {}/{} failed (SQLState: {}, ErrorCode: {}): {}",
                        attempt, maxOpenAttempts, e.getSQLState(), e.getErrorCode(), e.getMessage());
                previousFailure = e;
            } catch (RuntimeException e) {
                if (ConnectionFailureClassifier.isNonRetryable(e)) {
                    log.error("Non-retryable connection failure: {}", e.getMessage());
                    throw e;
                }
                log.warn("Connection attempt {}/{} failed: {}", attempt, maxOpenAttempts, e.getMessage());
                previousFailure = e;
            }
        }

        throw new DbWatchConnectionException(
                "Database connection could not be opened after " + maxOpenAttempts + " attempts", previousFailure);
    }

    private void backOff(int attempt, Exception previousFailure) {
        if (openRetryDelayMs == 0) {
            return;
        }
        try {
            log.debug("Waiting {}ms before connection attempt {}", openRetryDelayMs, attempt);
            Thread.sleep(openRetryDelayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new DbWatchConnectionException("Interrupted while waiting to retry connection", previousFailure);
        }
    }

    /**
     * Checks if Service Broker is enabled for the connected database.
     */
    public boolean isServiceBrokerEnabled(DataSource dataSource) {
        String checkSql = "SELECT is_broker_enabled FROM sys.databases WHERE name = DB_NAME()";

        try (Connection conn = openConnection(dataSource);
             PreparedStatement ps = conn.prepareStatement(checkSql);
             ResultSet rs = ps.executeQuery()) {

            if (rs.next()) {
                boolean enabled = rs.getInt("is_broker_enabled") != 0;
                if (enabled) {
                    log.info("Service Broker is enabled for database.");
                } else {
                    log.warn("Service Broker is DISABLED for database.");
                }
                return enabled;
            }
            log.warn("Could not determine Service Broker status.");
            return false;
        } catch (SQLException e) {
            throw new DbWatchConnectionException("Database error checking Service Broker status", e);
        }
    }

    /**
     * Safely closes a statement
     */
    public void safeCloseStatement(Statement statement, String owner) {
        if (statement != null) {
            try {
                statement.close();
            } catch (SQLException e) {
                log.warn("Error closing statement for {}: {}", owner, e.getMessage());
            }
        }
    }

    /**
     * Safely cancels a statement (interrupts a WAITFOR)
     */
    public void safeCancelStatement(Statement statement, String owner) {
        if (statement != null) {
            try {
                statement.cancel();
            } catch (SQLException e) {
                log.warn("Error cancelling statement for {}: {}", owner, e.getMessage());
            }
        }
    }

    /**
     * Safely rolls back a transaction.
     */
    public void safeRollback(Connection connection, String owner) {
        if (connection != null) {
            try {
                if (!connection.isClosed() && !connection.getAutoCommit()) {
                    connection.rollback();
                }
            } catch (SQLException rollbackError) {
                log.warn("Error rolling back transaction for {}: {}", owner, rollbackError.getMessage());
            }
        }
    }

    /**
     * Safely closes a connection.
     */
    public void safeClose(Connection connection, String owner) {
        if (connection != null) {
            try {
                if (!connection.isClosed()) {
                    connection.close();
                }
            } catch (SQLException closeError) {
                log.warn("Error closing connection for {}: {}", owner, closeError.getMessage());
            }
        }
    }

    public int getMaxOpenAttempts() {
        return maxOpenAttempts;
    }

    public long getOpenRetryDelayMs() {
        return openRetryDelayMs;
    }
}
