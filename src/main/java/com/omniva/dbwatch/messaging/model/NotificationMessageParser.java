package com.omniva.dbwatch.messaging.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.omniva.dbwatch.engine.fault.DbWatchDetectionException;
import com.omniva.dbwatch.engine.fault.ErrorTracker;
import com.omniva.dbwatch.engine.transmission.QueryNotification;
import com.omniva.dbwatch.engine.transmission.QueryNotification.NotificationInfo;
import com.omniva.dbwatch.engine.transmission.QueryNotification.NotificationType;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Parse BrokerMessage to QueryNotification
 * <p>
 * Message JSON:
 * {
 * "subscriptionId": "8F0C2B7E-5A43-4C1F-9B0D-3E6A1C2D4F59",
 * "type": "change",
 * "info": "update"
 * }
 */
@RequiredArgsConstructor
public class NotificationMessageParser {
    private static final Logger log = LoggerFactory.getLogger(NotificationMessageParser.class);

    private final ErrorTracker errorTracker;
    private final ObjectMapper objectMapper;

    /**
     * @throws DbWatchDetectionException if the body is empty, malformed or has no subscription id
     */
    public QueryNotification parse(BrokerMessage message) {
        try {
            if (!message.hasDataContent()) {
                throw new IllegalArgumentException("Message body is empty");
            }

            JsonNode jsonNode = objectMapper.readTree(message.getMessageBody());

            String subscriptionId = getRequiredString(jsonNode, "subscriptionId");
            NotificationType type = parseEnum(NotificationType.class, jsonNode.path("type").asText(), NotificationType.UNKNOWN);
            NotificationInfo info = parseEnum(NotificationInfo.class, jsonNode.path("info").asText(), NotificationInfo.UNKNOWN);

            return new QueryNotification(subscriptionId.toUpperCase(Locale.ROOT), type, info);

        } catch (JsonProcessingException e) {
            String errorMsg = String.format("Malformed JSON in notification on conversation %s: %s",
                    message.getConversationHandle(), e.getOriginalMessage());
            errorTracker.addError(errorMsg, e);
            log.error("Notification JSON parsing failed: {}", e.getMessage());
            throw new DbWatchDetectionException(errorMsg, e);

        } catch (IllegalArgumentException e) {
            String errorMsg = String.format("Invalid notification on conversation %s: %s",
                    message.getConversationHandle(), e.getMessage());
            errorTracker.addError(errorMsg, e);
            log.error("Notification validation failed: {}", e.getMessage());
            throw new DbWatchDetectionException(errorMsg, e);
        }
    }

    private String getRequiredString(JsonNode jsonNode, String fieldName) {
        JsonNode fieldNode = jsonNode.path(fieldName);
        if (fieldNode.isMissingNode() || fieldNode.asText().trim().isEmpty()) {
            throw new IllegalArgumentException(fieldName + " is required but missing or empty");
        }
        return fieldNode.asText().trim();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, E fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown {} '{}', using {}", type.getSimpleName(), value, fallback);
            return fallback;
        }
    }
}
