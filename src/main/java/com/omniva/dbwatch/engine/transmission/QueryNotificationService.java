package com.omniva.dbwatch.engine.transmission;

import javax.sql.DataSource;

/**
 * Database push notifications on query results.
 * <p>
 * A listener must be running for a data source and queue before
 * subscriptions on that queue can be made.
 */
public interface QueryNotificationService {

    /**
     * Starts the notification listener for the queue.
     *
     * @return true if started by this call, false if it was already running
     */
    boolean startListener(DataSource dataSource, String queueName);

    /**
     * @return true if a running listener was stopped
     */
    boolean stopListener(DataSource dataSource, String queueName);

    boolean isListenerStarted(DataSource dataSource, String queueName);

    /**
     * Registers a single-fire subscription. A subscription that cannot be
     * registered is reported to the callback as a SUBSCRIBE/INVALID
     * notification rather than thrown.
     *
     * @throws com.omniva.dbwatch.engine.fault.DbWatchDetectionException if no listener is running for the queue
     */
    NotificationSubscription subscribe(WatchedQuery query, QueryNotificationCallback callback);
}
