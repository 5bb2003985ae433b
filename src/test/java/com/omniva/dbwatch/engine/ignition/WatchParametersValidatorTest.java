package com.omniva.dbwatch.engine.ignition;

import com.omniva.dbwatch.JdbcMocks;
import com.omniva.dbwatch.engine.fault.DbWatchValidationException;
import com.omniva.dbwatch.engine.fuelsystem.DbWatchConnectionManager;
import com.omniva.dbwatch.messaging.model.MonitoredChanges;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import com.omniva.dbwatch.messaging.model.WatchParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WatchParametersValidatorTest {

    private JdbcMocks db;
    private WatchParametersValidator validator;

    @BeforeEach
    void setUp() {
        db = new JdbcMocks();
        db.existsCount = 1;
        validator = new WatchParametersValidator(new DbWatchConnectionManager(1, 0));
    }

    @Test
    void tablesAreDeduplicatedAndSorted() {
        WatchParameters params = WatchParameters.builder()
                .dataSource(db.dataSource)
                .table(new QualifiedTableName("Orders"))
                .table(new QualifiedTableName("customers"))
                .table(new QualifiedTableName("ORDERS"))
                .table(new QualifiedTableName(" "))
                .build();

        WatchParameters adjusted = validator.validateAndAdjust(params);

        assertThat(adjusted.getTables()).containsExactly(
                new QualifiedTableName("Customers"), new QualifiedTableName("Orders"));
    }

    @Test
    void missingDataSourceIsRejected() {
        WatchParameters params = WatchParameters.builder().table(new QualifiedTableName("Orders")).build();

        assertThatThrownBy(() -> validator.validateAndAdjust(params))
                .isInstanceOf(DbWatchValidationException.class)
                .hasMessageContaining("data source");
    }

    @Test
    void emptyTableListIsRejected() {
        WatchParameters params = WatchParameters.builder().dataSource(db.dataSource).build();

        assertThatThrownBy(() -> validator.validateAndAdjust(params))
                .isInstanceOf(DbWatchValidationException.class)
                .hasMessageContaining("table");
    }

    @Test
    void emptyMonitoredChangesIsRejected() {
        WatchParameters params = WatchParameters.builder()
                .dataSource(db.dataSource)
                .table(new QualifiedTableName("Orders"))
                .monitoredChanges(MonitoredChanges.NONE)
                .build();

        assertThatThrownBy(() -> validator.validateAndAdjust(params))
                .isInstanceOf(DbWatchValidationException.class)
                .hasMessageContaining("change type");
    }

    @Test
    void missingTableIsReportedByName() throws SQLException {
        db.existsCount = 0;
        WatchParameters params = WatchParameters.builder()
                .dataSource(db.dataSource)
                .table(new QualifiedTableName("Ghost"))
                .build();

        assertThatThrownBy(() -> validator.validateAndAdjust(params))
                .isInstanceOf(DbWatchValidationException.class)
                .hasMessageContaining("[dbo].[Ghost]");

        verify(db.preparedStatement).setString(1, "[dbo].[Ghost]");
        verify(db.connection).close();
    }

    @Test
    void databaseErrorDuringCheckIsAValidationFailure() throws SQLException {
        when(db.preparedStatement.executeQuery()).thenThrow(new SQLException("timeout"));
        WatchParameters params = WatchParameters.builder()
                .dataSource(db.dataSource)
                .table(new QualifiedTableName("Orders"))
                .build();

        assertThatThrownBy(() -> validator.validateAndAdjust(params))
                .isInstanceOf(DbWatchValidationException.class)
                .hasCauseInstanceOf(SQLException.class);
    }

    @Test
    void nullParametersAreRejected() {
        assertThatThrownBy(() -> validator.validateAndAdjust(null)).isInstanceOf(DbWatchValidationException.class);
    }
}
