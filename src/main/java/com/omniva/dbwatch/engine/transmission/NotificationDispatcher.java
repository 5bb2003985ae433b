package com.omniva.dbwatch.engine.transmission;

import com.omniva.dbwatch.messaging.model.BrokerMessage;

/**
 * Receives messages taken off a notification queue, after they were acknowledged
 */
@FunctionalInterface
public interface NotificationDispatcher {

    void dispatch(BrokerMessage message);
}
