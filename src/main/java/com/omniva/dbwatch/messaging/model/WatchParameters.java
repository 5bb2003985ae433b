package com.omniva.dbwatch.messaging.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import javax.sql.DataSource;
import java.util.List;

/**
 * What a watch session monitors and where.
 * <p>
 * The table list is copied into an unmodifiable list on build, so changing
 * the collection handed to the builder afterwards has no effect. The
 * validated form (deduplicated, sorted) is produced by
 * {@code WatchParametersValidator}.
 */
@Value
@Builder(toBuilder = true)
public class WatchParameters {

    DataSource dataSource;

    @Singular
    List<QualifiedTableName> tables;

    @Builder.Default
    MonitoredChanges monitoredChanges = MonitoredChanges.ALL;

    @Builder.Default
    WatchOptions options = WatchOptions.defaults();

    /**
     * Independent copy sharing only the data source
     */
    public WatchParameters copy() {
        return toBuilder()
                .clearTables()
                .tables(List.copyOf(tables))
                .options(options.toBuilder().build())
                .build();
    }

    public QualifiedTableName getLedgerTable() {
        return options.getLedgerTable();
    }

    public QualifiedTableName getTableTrigger(QualifiedTableName table) {
        return options.getTableTrigger(table);
    }
}
