package com.omniva.dbwatch.engine.transmission;

/**
 * Handle of a single-fire query subscription.
 * <p>
 * A subscription delivers at most one notification. {@link #unregister()}
 * detaches the callback; calling it after the notification fired, or more
 * than once, has no effect.
 */
public interface NotificationSubscription {

    String getId();

    WatchedQuery getQuery();

    boolean isActive();

    void unregister();
}
