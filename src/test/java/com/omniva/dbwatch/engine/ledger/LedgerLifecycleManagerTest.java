package com.omniva.dbwatch.engine.ledger;

import com.omniva.dbwatch.JdbcMocks;
import com.omniva.dbwatch.engine.fault.DbWatchProvisioningException;
import com.omniva.dbwatch.engine.fuelsystem.DbWatchConnectionManager;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import com.omniva.dbwatch.messaging.model.WatchParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LedgerLifecycleManagerTest {

    private static final QualifiedTableName ORDERS = new QualifiedTableName("Orders");
    private static final QualifiedTableName CUSTOMERS = new QualifiedTableName("Customers");

    private JdbcMocks db;
    private ReferenceCountRegistry registry;
    private LedgerLifecycleManager manager;

    @BeforeEach
    void setUp() {
        db = new JdbcMocks();
        registry = new ReferenceCountRegistry();
        manager = new LedgerLifecycleManager(new DbWatchConnectionManager(1, 0), registry);
    }

    private WatchParameters params(QualifiedTableName... tables) {
        WatchParameters.WatchParametersBuilder builder = WatchParameters.builder().dataSource(db.dataSource);
        for (QualifiedTableName table : tables) {
            builder.table(table);
        }
        return builder.build();
    }

    @Test
    void provisionCreatesLedgerAndTriggersInOneSerializableTransaction() throws SQLException {
        WatchParameters params = params(CUSTOMERS, ORDERS);

        manager.provision(params);

        assertThat(db.executedContaining("CREATE TABLE [dbo].[SqlDependencyChanges]")).isEqualTo(1);
        assertThat(db.executedContaining("CREATE TRIGGER [dbo].[SqlDependencyChangeTrigger_Orders]")).isEqualTo(1);
        assertThat(db.executedContaining("CREATE TRIGGER [dbo].[SqlDependencyChangeTrigger_Customers]")).isEqualTo(1);
        assertThat(registry.count("[dbo].[SqlDependencyChanges]")).isEqualTo(1);
        assertThat(registry.count("[dbo].[SqlDependencyChangeTrigger_Orders]")).isEqualTo(1);

        verify(db.connection).setAutoCommit(false);
        verify(db.connection).setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
        verify(db.connection).commit();
        verify(db.connection).close();
    }

    @Test
    void existingTriggerIsNotRecreatedButStillCounted() {
        db.existsCount = 1;

        manager.provision(params(ORDERS));

        assertThat(db.executedContaining("CREATE TRIGGER")).isZero();
        assertThat(registry.count("[dbo].[SqlDependencyChangeTrigger_Orders]")).isEqualTo(1);
    }

    @Test
    void provisionThenDeprovisionRestoresCounts() {
        WatchParameters params = params(ORDERS);

        manager.provision(params);
        manager.deprovision(params);

        assertThat(registry.snapshot().values()).allMatch(count -> count == 0);
        assertThat(db.executedContaining("DROP TRIGGER [dbo].[SqlDependencyChangeTrigger_Orders]")).isEqualTo(1);
        assertThat(db.executedContaining("DROP TABLE [dbo].[SqlDependencyChanges]")).isEqualTo(1);
    }

    @Test
    void sharedObjectsSurviveUntilLastSessionReleasesThem() {
        WatchParameters first = params(ORDERS);
        WatchParameters second = params(ORDERS, CUSTOMERS);

        manager.provision(first);
        db.existsCount = 1;
        manager.provision(second);

        manager.deprovision(first);
        assertThat(db.executedContaining("DROP TRIGGER [dbo].[SqlDependencyChangeTrigger_Orders]")).isZero();
        assertThat(db.executedContaining("DROP TABLE")).isZero();

        manager.deprovision(second);
        assertThat(db.executedContaining("DROP TRIGGER [dbo].[SqlDependencyChangeTrigger_Orders]")).isEqualTo(1);
        assertThat(db.executedContaining("DROP TRIGGER [dbo].[SqlDependencyChangeTrigger_Customers]")).isEqualTo(1);
        assertThat(db.executedContaining("DROP TABLE")).isEqualTo(1);
    }

    @Test
    void triggersAreDroppedBeforeTheLedger() {
        WatchParameters params = params(ORDERS);
        manager.provision(params);
        db.executed.clear();

        manager.deprovision(params);

        assertThat(db.executed).hasSize(2);
        assertThat(db.executed.get(0)).contains("DROP TRIGGER");
        assertThat(db.executed.get(1)).contains("DROP TABLE");
    }

    @Test
    void failedProvisionRollsBackAndRestoresCounts() throws SQLException {
        when(db.statement.execute(contains("CREATE TRIGGER"))).thenThrow(new SQLException("permission denied"));

        assertThatThrownBy(() -> manager.provision(params(ORDERS)))
                .isInstanceOf(DbWatchProvisioningException.class)
                .hasCauseInstanceOf(SQLException.class);

        verify(db.connection).rollback();
        verify(db.connection, never()).commit();
        assertThat(registry.count("[dbo].[SqlDependencyChanges]")).isZero();
        assertThat(registry.isLockedByCurrentThread()).isFalse();
    }

    @Test
    void failedDeprovisionKeepsCounts() throws SQLException {
        WatchParameters params = params(ORDERS);
        manager.provision(params);
        when(db.statement.execute(anyString())).thenThrow(new SQLException("deadlock"));

        assertThatThrownBy(() -> manager.deprovision(params)).isInstanceOf(DbWatchProvisioningException.class);

        assertThat(registry.count("[dbo].[SqlDependencyChanges]")).isEqualTo(1);
        assertThat(registry.count("[dbo].[SqlDependencyChangeTrigger_Orders]")).isEqualTo(1);
    }
}
