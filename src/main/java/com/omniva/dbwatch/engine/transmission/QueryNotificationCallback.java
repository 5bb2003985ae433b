package com.omniva.dbwatch.engine.transmission;

@FunctionalInterface
public interface QueryNotificationCallback {

    void onNotification(NotificationSubscription subscription, QueryNotification notification);
}
