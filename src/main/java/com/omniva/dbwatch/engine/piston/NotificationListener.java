package com.omniva.dbwatch.engine.piston;

import com.omniva.dbwatch.engine.fault.DbWatchConnectionException;
import com.omniva.dbwatch.engine.fault.ErrorTracker;
import com.omniva.dbwatch.engine.fuelsystem.DbWatchConnectionManager;
import com.omniva.dbwatch.engine.transmission.NotificationDispatcher;
import com.omniva.dbwatch.engine.transmission.ServiceBrokerStatements;
import com.omniva.dbwatch.messaging.model.BrokerMessage;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Receive loop on one notification queue.
 * <p>
 * Runs a {@code WAITFOR (RECEIVE ...)} with a timeout on its own connection.
 * Each message ends its conversation and is committed before it is handed
 * to the dispatcher, so a notification is delivered at most once. SQL and
 * connection failures drop the connection and retry after a delay until
 * shutdown is requested.
 */
public class NotificationListener implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(NotificationListener.class);

    private final DataSource dataSource;
    @Getter private final QualifiedTableName queue;
    private final int waitTimeoutMs;
    private final long retryDelayMs;
    private final DbWatchConnectionManager connectionManager;
    private final NotificationDispatcher dispatcher;
    private final ErrorTracker errorTracker;

    private final AtomicReference<Connection> currentConnection = new AtomicReference<>();
    private final AtomicReference<PreparedStatement> currentStatement = new AtomicReference<>();

    @Getter private volatile boolean running = false;
    private volatile boolean shutdownRequested = false;
    @Getter private volatile long messagesReceived = 0;
    private String listenerName = "Not Started";

    public NotificationListener(DataSource dataSource,
                                QualifiedTableName queue,
                                int waitTimeoutMs,
                                long retryDelayMs,
                                DbWatchConnectionManager connectionManager,
                                NotificationDispatcher dispatcher,
                                ErrorTracker errorTracker) {
        this.dataSource = dataSource;
        this.queue = queue;
        this.waitTimeoutMs = waitTimeoutMs;
        this.retryDelayMs = retryDelayMs;
        this.connectionManager = connectionManager;
        this.dispatcher = dispatcher;
        this.errorTracker = errorTracker;
    }

    @Override
    public void run() {
        running = true;
        listenerName = Thread.currentThread().getName();
        log.info("Notification listener {} started on queue {}", listenerName, queue);

        try {
            while (shouldContinueRunning()) {
                try {
                    receiveCycle();
                } catch (SQLException | DbWatchConnectionException e) {
                    if (shutdownRequested) {
                        break;
                    }
                    log.warn("Listener {} lost its connection: {}", listenerName, e.getMessage());
                    errorTracker.addError("Notification listener error on queue " + queue, e);
                    resetConnection();
                    if (!waitBeforeRetry()) {
                        break;
                    }
                } catch (RuntimeException e) {
                    log.error("Listener {} failed dispatching notification: {}", listenerName, e.getMessage(), e);
                    errorTracker.addError("Notification dispatch failed on queue " + queue, e);
                }
            }
        } catch (Error t) {
            log.error("CRITICAL failure in listener {}: {}", listenerName, t.getMessage(), t);
            errorTracker.addError("Critical notification listener failure on queue " + queue, t);
            throw t;
        } finally {
            running = false;
            resetConnection();
            log.info("Notification listener {} stopped (messages received: {})", listenerName, messagesReceived);
        }
    }

    private void receiveCycle() throws SQLException {
        Connection connection = ensureConnection();

        BrokerMessage message;
        try (PreparedStatement statement = connection.prepareStatement(
                ServiceBrokerStatements.waitForQuery(queue, waitTimeoutMs))) {
            currentStatement.set(statement);
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    log.trace("No messages in queue {} (timeout)", queue);
                    connection.commit();
                    return;
                }
                message = BrokerMessage.fromResultSet(rs);
            }
        } finally {
            currentStatement.set(null);
        }

        acknowledge(connection, message);
        messagesReceived++;

        if (message.isSystemMessage()) {
            log.debug("System message {} on conversation {} ended", message.getMessageTypeName(),
                    message.getConversationHandle());
            return;
        }
        dispatcher.dispatch(message);
    }

    private void acknowledge(Connection connection, BrokerMessage message) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(ServiceBrokerStatements.END_CONVERSATION)) {
            ps.setString(1, message.getConversationHandle());
            ps.execute();
        }
        connection.commit();
    }

    private Connection ensureConnection() throws SQLException {
        Connection connection = currentConnection.get();
        if (connection == null || connection.isClosed()) {
            connection = connectionManager.openConnection(dataSource);
            connection.setAutoCommit(false);
            currentConnection.set(connection);
        }
        return connection;
    }

    private void resetConnection() {
        Connection connection = currentConnection.getAndSet(null);
        connectionManager.safeRollback(connection, listenerName);
        connectionManager.safeClose(connection, listenerName);
    }

    private boolean waitBeforeRetry() {
        try {
            Thread.sleep(retryDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Cancels the pending WAITFOR and closes the connection, ending the loop
     */
    public void requestShutdown() {
        log.info("Shutdown requested for listener {} (queue: {})", listenerName, queue);
        shutdownRequested = true;
        connectionManager.safeCancelStatement(currentStatement.get(), listenerName);
        connectionManager.safeClose(currentConnection.get(), listenerName);
    }

    private boolean shouldContinueRunning() {
        return !shutdownRequested && !Thread.currentThread().isInterrupted();
    }

    @Override
    public String toString() {
        return String.format("NotificationListener[queue=%s, running=%s, messages=%d]", queue, running, messagesReceived);
    }
}
