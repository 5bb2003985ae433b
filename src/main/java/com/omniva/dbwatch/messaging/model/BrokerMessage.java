package com.omniva.dbwatch.messaging.model;

import lombok.Builder;
import lombok.Data;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Message received from a notification queue
 */
@Data
@Builder
public class BrokerMessage {

    public static final String END_DIALOG = "http://schemas.microsoft.com/SQL/ServiceBroker/EndDialog";
    public static final String ERROR = "http://schemas.microsoft.com/SQL/ServiceBroker/Error";
    public static final String DIALOG_TIMER = "http://schemas.microsoft.com/SQL/ServiceBroker/DialogTimer";

    private String conversationHandle;
    private String messageTypeName;
    private String messageBody;

    public static BrokerMessage fromResultSet(ResultSet rs) throws SQLException {
        return BrokerMessage.builder()
                .conversationHandle(rs.getString("conversation_handle"))
                .messageTypeName(rs.getString("message_type_name"))
                .messageBody(rs.getString("message_body"))
                .build();
    }

    public boolean isSystemMessage() {
        return messageTypeName != null && (
                messageTypeName.equals(END_DIALOG) ||
                        messageTypeName.equals(ERROR) ||
                        messageTypeName.equals(DIALOG_TIMER)
        );
    }

    public boolean hasDataContent() {
        return messageBody != null && !messageBody.trim().isEmpty();
    }
}
