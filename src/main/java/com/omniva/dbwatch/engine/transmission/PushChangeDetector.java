package com.omniva.dbwatch.engine.transmission;

import com.omniva.dbwatch.engine.ChangeDetector;
import com.omniva.dbwatch.engine.ledger.LedgerStatements;
import com.omniva.dbwatch.messaging.model.ChangeType;
import com.omniva.dbwatch.messaging.model.MonitoredChanges;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import com.omniva.dbwatch.messaging.model.WatchParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Detects changes through single-fire notifications on each table's ledger row.
 * <p>
 * Every monitored table holds one active subscription. When it fires the
 * subscription is dropped, an event is raised for each monitored kind the
 * notification reports, and a new subscription is armed unless the session
 * is shutting down. A subscription that could not be registered is dropped
 * without re-arming.
 */
public class PushChangeDetector implements ChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(PushChangeDetector.class);

    private final WatchParameters parameters;
    private final String queueName;
    private final QueryNotificationService notificationService;

    private final Object subscriptionsLock = new Object();
    private final Map<QualifiedTableName, NotificationSubscription> subscriptions = new HashMap<>();
    private final AtomicBoolean exiting = new AtomicBoolean(false);

    private volatile ChangeTransmitter transmitter;

    public PushChangeDetector(WatchParameters parameters,
                              String queueName,
                              QueryNotificationService notificationService) {
        this.parameters = parameters;
        this.queueName = queueName;
        this.notificationService = notificationService;
    }

    @Override
    public void start(ChangeTransmitter transmitter) {
        this.transmitter = transmitter;
        exiting.set(false);

        for (QualifiedTableName table : parameters.getTables()) {
            arm(table);
        }
        log.info("Subscribed to changes of {} on queue {}", parameters.getTables(), queueName);
    }

    /**
     * Nothing to stop; notifications arrive on the listener's thread.
     */
    @Override
    public void stop() {
        exiting.set(true);
    }

    @Override
    public void cleanup() {
        exiting.set(true);

        List<NotificationSubscription> active;
        synchronized (subscriptionsLock) {
            active = List.copyOf(subscriptions.values());
            subscriptions.clear();
        }

        for (NotificationSubscription subscription : active) {
            try {
                subscription.unregister();
            } catch (RuntimeException e) {
                log.warn("Failed to unregister subscription {}: {}", subscription.getId(), e.getMessage());
            }
        }
        log.debug("Released {} subscriptions", active.size());
    }

    @Override
    public boolean isRunning() {
        return !exiting.get() && subscriptionCount() > 0;
    }

    public int subscriptionCount() {
        synchronized (subscriptionsLock) {
            return subscriptions.size();
        }
    }

    // ===== SUBSCRIPTIONS =====

    private void arm(QualifiedTableName table) {
        WatchedQuery query = new WatchedQuery(
                parameters.getDataSource(),
                queueName,
                parameters.getLedgerTable(),
                table.getFullName(),
                LedgerStatements.watchedLedgerRow(parameters.getLedgerTable()));

        synchronized (subscriptionsLock) {
            if (exiting.get()) {
                return;
            }
            NotificationSubscription subscription = notificationService.subscribe(query, this::onNotification);
            if (subscription.isActive()) {
                subscriptions.put(table, subscription);
                log.debug("Armed subscription {} for {}", subscription.getId(), table);
            }
        }
    }

    private QualifiedTableName release(NotificationSubscription subscription) {
        subscription.unregister();
        synchronized (subscriptionsLock) {
            Iterator<Map.Entry<QualifiedTableName, NotificationSubscription>> it = subscriptions.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<QualifiedTableName, NotificationSubscription> entry = it.next();
                if (entry.getValue().getId().equals(subscription.getId())) {
                    it.remove();
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    void onNotification(NotificationSubscription subscription, QueryNotification notification) {
        ChangeTransmitter currentTransmitter = transmitter;
        try {
            QualifiedTableName table = release(subscription);

            if (notification.isSubscriptionFailure()) {
                log.warn("Subscription {} could not be registered, not re-arming", subscription.getId());
                return;
            }

            if (table == null) {
                log.debug("Notification for unknown subscription {}", subscription.getId());
                return;
            }

            log.debug("Notification {} for {}", notification, table);
            if (notification.type() == QueryNotification.NotificationType.CHANGE) {
                ChangeType changeType = notification.info().toChangeType();
                if (changeType != null && parameters.getMonitoredChanges().contains(changeType)) {
                    currentTransmitter.transmitTableChanged(table, MonitoredChanges.of(changeType));
                }
            }

            if (!exiting.get()) {
                arm(table);
            }
        } catch (RuntimeException e) {
            log.warn("Failed handling notification {}: {}", notification, e.getMessage());
            if (currentTransmitter != null) {
                currentTransmitter.transmitException(e);
            }
        }
    }

    public String getQueueName() {
        return queueName;
    }
}
