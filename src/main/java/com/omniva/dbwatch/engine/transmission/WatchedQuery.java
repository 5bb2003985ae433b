package com.omniva.dbwatch.engine.transmission;

import com.omniva.dbwatch.messaging.model.QualifiedTableName;

import javax.sql.DataSource;

/**
 * Query over one ledger row whose result a subscription watches
 *
 * @param dataSource  database the query runs against
 * @param queueName   notification queue the subscription reports to
 * @param ledgerTable ledger table holding the watched row
 * @param objectName  key ({@code ObjectName}) of the watched row
 * @param sql         query text, taking {@code objectName} as its only parameter
 */
public record WatchedQuery(DataSource dataSource,
                           String queueName,
                           QualifiedTableName ledgerTable,
                           String objectName,
                           String sql) {
}
