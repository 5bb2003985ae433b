package com.omniva.dbwatch.engine.transmission;

import com.omniva.dbwatch.engine.fault.DbWatchDetectionException;
import com.omniva.dbwatch.engine.fault.ErrorTracker;
import com.omniva.dbwatch.engine.fuelsystem.DbWatchConnectionManager;
import com.omniva.dbwatch.engine.piston.NotificationListener;
import com.omniva.dbwatch.messaging.model.BrokerMessage;
import com.omniva.dbwatch.messaging.model.NotificationMessageParser;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Query notifications built on SQL Server Service Broker.
 * <p>
 * Each subscription is a row in the queue's subscription table plus a dialog
 * on the queue's service. A trigger on the ledger table sends one message
 * per subscription whose ledger row changed and deletes the row, which
 * makes every subscription single-fire. One {@link NotificationListener}
 * thread per data source and queue receives those messages and hands them
 * to the waiting callbacks.
 */
public class ServiceBrokerNotificationService implements QueryNotificationService {

    private static final Logger log = LoggerFactory.getLogger(ServiceBrokerNotificationService.class);

    public static final int DEFAULT_WAIT_TIMEOUT_MS = 5000;

    private final DbWatchConnectionManager connectionManager;
    private final NotificationMessageParser messageParser;
    private final ErrorTracker errorTracker;
    private final ThreadFactory threadFactory;
    private final int waitTimeoutMs;

    private final Map<ListenerKey, ListenerContext> listeners = new ConcurrentHashMap<>();
    private final Map<String, BrokerSubscription> pendingSubscriptions = new ConcurrentHashMap<>();
    private final Object triggerLock = new Object();

    public ServiceBrokerNotificationService(DbWatchConnectionManager connectionManager,
                                            NotificationMessageParser messageParser,
                                            ErrorTracker errorTracker,
                                            ThreadFactory threadFactory,
                                            int waitTimeoutMs) {
        this.connectionManager = connectionManager;
        this.messageParser = messageParser;
        this.errorTracker = errorTracker;
        this.threadFactory = threadFactory;
        this.waitTimeoutMs = waitTimeoutMs > 0 ? waitTimeoutMs : DEFAULT_WAIT_TIMEOUT_MS;
    }

    // ===== LISTENERS =====

    @Override
    public boolean startListener(DataSource dataSource, String queueName) {
        ListenerKey key = ListenerKey.of(dataSource, queueName);

        synchronized (listeners) {
            ListenerContext existing = listeners.get(key);
            if (existing != null && existing.thread().isAlive()) {
                log.debug("Notification listener already running on {}", key.queue());
                return false;
            }

            if (!connectionManager.isServiceBrokerEnabled(dataSource)) {
                throw new DbWatchDetectionException("Service Broker is not enabled for the database");
            }
            ensureQueue(dataSource, key.queue());

            NotificationListener listener = new NotificationListener(
                    dataSource, key.queue(), waitTimeoutMs, connectionManager.getOpenRetryDelayMs(),
                    connectionManager, this::dispatch, errorTracker);
            Thread thread = threadFactory.newThread(listener);
            listeners.put(key, new ListenerContext(listener, thread));
            thread.start();

            log.info("Notification listener started on queue {}", key.queue());
            return true;
        }
    }

    @Override
    public boolean stopListener(DataSource dataSource, String queueName) {
        ListenerKey key = ListenerKey.of(dataSource, queueName);

        ListenerContext context;
        synchronized (listeners) {
            context = listeners.remove(key);
        }
        if (context == null) {
            return false;
        }

        context.listener().requestShutdown();
        try {
            context.thread().join(waitTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (context.thread().isAlive()) {
            log.warn("Notification listener on {} did not stop within {}ms, interrupting", key.queue(), waitTimeoutMs);
            context.thread().interrupt();
        }

        pendingSubscriptions.values().removeIf(subscription -> subscription.key().equals(key) && subscription.deactivate());
        log.info("Notification listener stopped on queue {}", key.queue());
        return true;
    }

    @Override
    public boolean isListenerStarted(DataSource dataSource, String queueName) {
        if (dataSource == null || queueName == null || queueName.isBlank()) {
            return false;
        }
        ListenerContext context = listeners.get(ListenerKey.of(dataSource, queueName));
        return context != null && context.thread().isAlive();
    }

    /**
     * Stops every running listener
     */
    public void shutdown() {
        for (ListenerKey key : listeners.keySet()) {
            stopListener(key.dataSource(), key.queue().getFullName());
        }
    }

    private void ensureQueue(DataSource dataSource, QualifiedTableName queue) {
        Connection connection = connectionManager.openConnection(dataSource);
        try (Statement statement = connection.createStatement()) {
            statement.execute(ServiceBrokerStatements.ensureQueue(queue));
        } catch (SQLException e) {
            throw new DbWatchDetectionException("Failed to create notification queue " + queue, e);
        } finally {
            connectionManager.safeClose(connection, "queue setup");
        }
    }

    // ===== SUBSCRIPTIONS =====

    @Override
    public NotificationSubscription subscribe(WatchedQuery query, QueryNotificationCallback callback) {
        if (!isListenerStarted(query.dataSource(), query.queueName())) {
            throw new DbWatchDetectionException("No notification listener started for queue " + query.queueName());
        }

        ListenerKey key = ListenerKey.of(query.dataSource(), query.queueName());
        String id = UUID.randomUUID().toString().toUpperCase(Locale.ROOT);
        BrokerSubscription subscription = new BrokerSubscription(id, key, query, callback);
        pendingSubscriptions.put(id, subscription);

        Connection connection = null;
        try {
            connection = connectionManager.openConnection(query.dataSource());
            ensureNotifyTrigger(connection, query.ledgerTable(), key.queue());

            connection.setAutoCommit(false);
            registerSubscription(connection, key.queue(), id, query.objectName());
            runWatchedQuery(connection, query);
            connection.commit();

            log.debug("Subscription {} registered on {} for {}", id, key.queue(), query.objectName());
        } catch (SQLException | RuntimeException e) {
            connectionManager.safeRollback(connection, "subscribe");
            pendingSubscriptions.remove(id);
            subscription.deactivate();

            log.warn("Subscription for {} could not be registered: {}", query.objectName(), e.getMessage());
            errorTracker.addError("Subscription failed for " + query.objectName(), e);
            callback.onNotification(subscription, QueryNotification.subscriptionFailed(id));
        } finally {
            connectionManager.safeClose(connection, "subscribe");
        }
        return subscription;
    }

    private void ensureNotifyTrigger(Connection connection, QualifiedTableName ledger, QualifiedTableName queue)
            throws SQLException {
        QualifiedTableName trigger = ServiceBrokerStatements.notifyTrigger(ledger, queue);
        synchronized (triggerLock) {
            if (triggerExists(connection, trigger)) {
                return;
            }
            try (Statement statement = connection.createStatement()) {
                statement.execute(ServiceBrokerStatements.createNotifyTrigger(ledger, queue));
                log.debug("Created notification trigger {} on {}", trigger, ledger);
            } catch (SQLException e) {
                // created concurrently by another process
                if (!triggerExists(connection, trigger)) {
                    throw e;
                }
            }
        }
    }

    private boolean triggerExists(Connection connection, QualifiedTableName trigger) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(ServiceBrokerStatements.TRIGGER_EXISTS_QUERY)) {
            ps.setString(1, trigger.getFullName());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt(1) > 0;
            }
        }
    }

    private void registerSubscription(Connection connection, QualifiedTableName queue,
                                      String id, String objectName) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(ServiceBrokerStatements.registerSubscription(queue))) {
            ps.setString(1, id);
            ps.setString(2, objectName);
            ps.execute();
        }
    }

    private void runWatchedQuery(Connection connection, WatchedQuery query) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(query.sql())) {
            ps.setString(1, query.objectName());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    log.trace("Watched row {} present", query.objectName());
                }
            }
        }
    }

    private void unregister(BrokerSubscription subscription) {
        if (!subscription.deactivate()) {
            return;
        }
        pendingSubscriptions.remove(subscription.getId());

        DataSource dataSource = subscription.getQuery().dataSource();
        Connection connection = null;
        try {
            connection = connectionManager.openConnection(dataSource);
            try (PreparedStatement ps = connection.prepareStatement(
                    ServiceBrokerStatements.unregisterSubscription(subscription.key().queue()))) {
                ps.setString(1, subscription.getId());
                ps.setString(2, subscription.getId());
                ps.execute();
            }
            log.debug("Subscription {} unregistered", subscription.getId());
        } catch (SQLException | RuntimeException e) {
            log.warn("Failed to remove subscription {}: {}", subscription.getId(), e.getMessage());
            errorTracker.addError("Failed to remove subscription " + subscription.getId(), e);
        } finally {
            connectionManager.safeClose(connection, "unsubscribe");
        }
    }

    // ===== DISPATCH =====

    void dispatch(BrokerMessage message) {
        QueryNotification notification = messageParser.parse(message);

        BrokerSubscription subscription = pendingSubscriptions.remove(notification.subscriptionId());
        if (subscription == null || !subscription.deactivate()) {
            log.debug("Notification for inactive subscription {} dropped", notification.subscriptionId());
            return;
        }

        log.debug("Delivering {} to subscription {}", notification, subscription.getId());
        subscription.callback().onNotification(subscription, notification);
    }

    int pendingSubscriptionCount() {
        return pendingSubscriptions.size();
    }

    // ===== TYPES =====

    private record ListenerKey(DataSource dataSource, QualifiedTableName queue) {

        static ListenerKey of(DataSource dataSource, String queueName) {
            if (dataSource == null) {
                throw new IllegalArgumentException("DataSource cannot be null");
            }
            QualifiedTableName queue = queueName != null ? QualifiedTableName.parse(queueName.trim()) : null;
            if (queue == null || !queue.isValid()) {
                throw new IllegalArgumentException("Queue name cannot be empty");
            }
            return new ListenerKey(dataSource, queue);
        }
    }

    private record ListenerContext(NotificationListener listener, Thread thread) {
    }

    private final class BrokerSubscription implements NotificationSubscription {
        private final String id;
        private final ListenerKey key;
        private final WatchedQuery query;
        private final QueryNotificationCallback callback;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private BrokerSubscription(String id, ListenerKey key, WatchedQuery query, QueryNotificationCallback callback) {
            this.id = id;
            this.key = key;
            this.query = query;
            this.callback = callback;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public WatchedQuery getQuery() {
            return query;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void unregister() {
            ServiceBrokerNotificationService.this.unregister(this);
        }

        ListenerKey key() {
            return key;
        }

        QueryNotificationCallback callback() {
            return callback;
        }

        boolean deactivate() {
            return active.compareAndSet(true, false);
        }

        @Override
        public String toString() {
            return "BrokerSubscription[" + id + ", " + query.objectName() + "]";
        }
    }
}
