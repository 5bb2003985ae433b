package com.omniva.dbwatch.engine.transmission;

import com.omniva.dbwatch.messaging.model.ChangeType;

/**
 * A single notification delivered for a subscription
 *
 * @param subscriptionId id of the subscription that fired
 * @param type           why the notification was sent
 * @param info           what happened
 */
public record QueryNotification(String subscriptionId, NotificationType type, NotificationInfo info) {

    public enum NotificationType {
        /**
         * The subscription could not be registered
         */
        SUBSCRIBE,

        /**
         * The watched data changed
         */
        CHANGE,
        UNKNOWN
    }

    public enum NotificationInfo {
        INSERT,
        UPDATE,
        DELETE,
        INVALID,
        UNKNOWN;

        /**
         * @return the matching change type, or null for INVALID and UNKNOWN
         */
        public ChangeType toChangeType() {
            return switch (this) {
                case INSERT -> ChangeType.INSERT;
                case UPDATE -> ChangeType.UPDATE;
                case DELETE -> ChangeType.DELETE;
                default -> null;
            };
        }
    }

    public boolean isSubscriptionFailure() {
        return type == NotificationType.SUBSCRIBE && info == NotificationInfo.INVALID;
    }

    public static QueryNotification subscriptionFailed(String subscriptionId) {
        return new QueryNotification(subscriptionId, NotificationType.SUBSCRIBE, NotificationInfo.INVALID);
    }
}
