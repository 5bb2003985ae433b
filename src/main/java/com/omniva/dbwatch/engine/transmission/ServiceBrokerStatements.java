package com.omniva.dbwatch.engine.transmission;

import com.omniva.dbwatch.messaging.model.QualifiedTableName;

/**
 * T-SQL for the Service Broker notification objects.
 * <p>
 * For a queue {@code [s].[Q]} these are the queue itself, the service
 * {@code [QService]}, the subscription table {@code [s].[Q_Subscriptions]}
 * and, per ledger table, a trigger {@code [ledger_Q_Notify]} that sends one
 * message for each subscription on a changed ledger row and then deletes
 * that subscription.
 */
public final class ServiceBrokerStatements {

    private static final String ENSURE_QUEUE_TEMPLATE =
            "IF OBJECT_ID('%1$s', 'SQ') IS NULL CREATE QUEUE %2$s; " +
                    "IF NOT EXISTS (SELECT 1 FROM [sys].[services] WHERE [name] = '%3$s') " +
                    "CREATE SERVICE [%4$s] ON QUEUE %2$s ([DEFAULT]); " +
                    "IF OBJECT_ID('%5$s', 'U') IS NULL " +
                    "CREATE TABLE %6$s (" +
                    "[SubscriptionId] [uniqueidentifier] NOT NULL PRIMARY KEY, " +
                    "[ObjectName] [nvarchar](128) NOT NULL, " +
                    "[ConversationHandle] [uniqueidentifier] NOT NULL, " +
                    "[CreatedAt] [datetimeoffset](7) NOT NULL DEFAULT SYSDATETIMEOFFSET());";

    private static final String CREATE_NOTIFY_TRIGGER_TEMPLATE =
            "CREATE TRIGGER %1$s ON %2$s AFTER UPDATE AS " +
                    "BEGIN " +
                    "SET NOCOUNT ON; " +
                    "DECLARE @id uniqueidentifier, @handle uniqueidentifier, @info nvarchar(16), @body nvarchar(max); " +
                    "DECLARE @never datetimeoffset(7) = CAST('0001-01-01' AS datetimeoffset(7)); " +
                    "DECLARE pending CURSOR LOCAL FAST_FORWARD FOR " +
                    "SELECT s.[SubscriptionId], s.[ConversationHandle], " +
                    "CASE " +
                    "WHEN ISNULL(i.[LastInsertDate], @never) <> ISNULL(d.[LastInsertDate], @never) THEN N'insert' " +
                    "WHEN ISNULL(i.[LastUpdateDate], @never) <> ISNULL(d.[LastUpdateDate], @never) THEN N'update' " +
                    "WHEN ISNULL(i.[LastDeleteDate], @never) <> ISNULL(d.[LastDeleteDate], @never) THEN N'delete' " +
                    "END " +
                    "FROM INSERTED i " +
                    "JOIN DELETED d ON d.[ObjectId] = i.[ObjectId] " +
                    "JOIN %3$s s ON s.[ObjectName] = i.[ObjectName]; " +
                    "OPEN pending; " +
                    "FETCH NEXT FROM pending INTO @id, @handle, @info; " +
                    "WHILE @@FETCH_STATUS = 0 " +
                    "BEGIN " +
                    "IF @info IS NOT NULL " +
                    "BEGIN " +
                    "SET @body = N'{\"subscriptionId\":\"' + CONVERT(nvarchar(36), @id) + N'\",\"type\":\"change\",\"info\":\"' + @info + N'\"}'; " +
                    "SEND ON CONVERSATION @handle (@body); " +
                    "DELETE FROM %3$s WHERE [SubscriptionId] = @id; " +
                    "END " +
                    "FETCH NEXT FROM pending INTO @id, @handle, @info; " +
                    "END " +
                    "CLOSE pending; " +
                    "DEALLOCATE pending; " +
                    "END";

    private static final String REGISTER_SUBSCRIPTION_TEMPLATE =
            "DECLARE @handle uniqueidentifier; " +
                    "BEGIN DIALOG CONVERSATION @handle FROM SERVICE [%1$s] TO SERVICE '%2$s' " +
                    "ON CONTRACT [DEFAULT] WITH ENCRYPTION = OFF; " +
                    "INSERT INTO %3$s ([SubscriptionId], [ObjectName], [ConversationHandle]) VALUES (?, ?, @handle);";

    private static final String UNREGISTER_SUBSCRIPTION_TEMPLATE =
            "DECLARE @handle uniqueidentifier = " +
                    "(SELECT [ConversationHandle] FROM %1$s WHERE [SubscriptionId] = ?); " +
                    "DELETE FROM %1$s WHERE [SubscriptionId] = ?; " +
                    "IF @handle IS NOT NULL END CONVERSATION @handle;";

    private static final String WAITFOR_QUERY_TEMPLATE =
            "WAITFOR (RECEIVE TOP(1) " +
                    "conversation_handle, " +
                    "message_type_name, " +
                    "CAST(message_body AS NVARCHAR(MAX)) AS message_body " +
                    "FROM %s), TIMEOUT %d";

    public static final String END_CONVERSATION = "END CONVERSATION ?";

    public static final String TRIGGER_EXISTS_QUERY =
            "SELECT COUNT(*) FROM [sys].[triggers] WHERE [object_id] = OBJECT_ID(?)";

    private ServiceBrokerStatements() {
    }

    public static String serviceName(QualifiedTableName queue) {
        return queue.getName() + "Service";
    }

    public static QualifiedTableName subscriptionTable(QualifiedTableName queue) {
        return new QualifiedTableName(queue.getName() + "_Subscriptions", queue.getSchema());
    }

    public static QualifiedTableName notifyTrigger(QualifiedTableName ledger, QualifiedTableName queue) {
        return new QualifiedTableName(ledger.getName() + "_" + queue.getName() + "_Notify", ledger.getSchema());
    }

    public static String ensureQueue(QualifiedTableName queue) {
        QualifiedTableName subscriptions = subscriptionTable(queue);
        String service = serviceName(queue);
        return String.format(ENSURE_QUEUE_TEMPLATE,
                literal(queue.getFullName()), queue.getFullName(),
                literal(service), QualifiedTableName.escapeIdentifier(service),
                literal(subscriptions.getFullName()), subscriptions.getFullName());
    }

    public static String createNotifyTrigger(QualifiedTableName ledger, QualifiedTableName queue) {
        return String.format(CREATE_NOTIFY_TRIGGER_TEMPLATE,
                notifyTrigger(ledger, queue).getFullName(), ledger.getFullName(),
                subscriptionTable(queue).getFullName());
    }

    public static String registerSubscription(QualifiedTableName queue) {
        String service = serviceName(queue);
        return String.format(REGISTER_SUBSCRIPTION_TEMPLATE, QualifiedTableName.escapeIdentifier(service), literal(service),
                subscriptionTable(queue).getFullName());
    }

    public static String unregisterSubscription(QualifiedTableName queue) {
        return String.format(UNREGISTER_SUBSCRIPTION_TEMPLATE, subscriptionTable(queue).getFullName());
    }

    public static String waitForQuery(QualifiedTableName queue, int timeoutMs) {
        return String.format(WAITFOR_QUERY_TEMPLATE, queue.getFullName(), timeoutMs);
    }

    static String literal(String value) {
        return value.replace("'", "''");
    }
}
