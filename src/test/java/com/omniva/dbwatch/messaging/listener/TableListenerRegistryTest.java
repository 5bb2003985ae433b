package com.omniva.dbwatch.messaging.listener;

import com.omniva.dbwatch.messaging.model.ChangeType;
import com.omniva.dbwatch.messaging.model.MonitoredChanges;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import com.omniva.dbwatch.messaging.model.TableChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TableListenerRegistryTest {

    private ApplicationContext applicationContext;
    private TableListenerRegistry registry;

    @BeforeEach
    void setUp() {
        applicationContext = mock(ApplicationContext.class);
        registry = new TableListenerRegistry(applicationContext);
    }

    @Test
    void routesEachKindToItsHandler() {
        OrdersListener listener = new OrdersListener();
        registry.register("ordersListener", listener);

        registry.onTableChanged(new TableChangedEvent(this, new QualifiedTableName("Orders"),
                MonitoredChanges.of(ChangeType.INSERT, ChangeType.DELETE)));

        assertThat(listener.calls).containsExactlyInAnyOrder("insert", "delete");
        assertThat(listener.registeredAs).isEqualTo("[dbo].[Orders]");
    }

    @Test
    void unsupportedKindsAreSkipped() {
        InsertOnlyListener listener = new InsertOnlyListener();
        registry.register("insertOnly", listener);

        registry.onTableChanged(new TableChangedEvent(this, new QualifiedTableName("Customers", "sales"),
                MonitoredChanges.ALL));

        assertThat(listener.calls).containsExactly("insert");
    }

    @Test
    void tableNamesMatchCaseInsensitively() {
        OrdersListener listener = new OrdersListener();
        registry.register("ordersListener", listener);

        registry.onTableChanged(new TableChangedEvent(this, QualifiedTableName.parse("[DBO].[orders]"),
                MonitoredChanges.of(ChangeType.UPDATE)));

        assertThat(listener.calls).containsExactly("update");
        assertThat(registry.get("dbo.ORDERS")).isNotNull();
    }

    @Test
    void eventsForUnknownTablesAreIgnored() {
        OrdersListener listener = new OrdersListener();
        registry.register("ordersListener", listener);

        registry.onTableChanged(new TableChangedEvent(this, new QualifiedTableName("Invoices"), MonitoredChanges.ALL));

        assertThat(listener.calls).isEmpty();
    }

    @Test
    void duplicateTableIsRejected() {
        assertThat(registry.register("first", new OrdersListener())).isTrue();
        assertThat(registry.register("second", new OrdersListener())).isFalse();

        assertThat(registry.getListenerCount()).isEqualTo(1);
        assertThat(registry.get(new QualifiedTableName("Orders")).beanName()).isEqualTo("first");
    }

    @Test
    void disabledAndUnannotatedListenersAreNotRegistered() {
        assertThat(registry.register("disabled", new DisabledListener())).isFalse();
        assertThat(registry.register("plain", new TableListener() {
        })).isFalse();

        assertThat(registry.getListenerCount()).isZero();
    }

    @Test
    void failingRegistrationCallbackIsRolledBack() {
        assertThatThrownBy(() -> registry.register("failing", new FailingListener()))
                .isInstanceOf(IllegalStateException.class);

        assertThat(registry.getListenerCount()).isZero();
    }

    @Test
    void discoveryRegistersAnnotatedBeansAndListsTablesSorted() {
        Map<String, Object> beans = new LinkedHashMap<>();
        beans.put("ordersListener", new OrdersListener());
        beans.put("insertOnly", new InsertOnlyListener());
        beans.put("notAListener", new Object());
        beans.put("failing", new FailingListener());
        when(applicationContext.getBeansWithAnnotation(TableChangeListener.class)).thenReturn(beans);

        registry.discoverAndRegisterListeners();

        assertThat(registry.getTables()).containsExactly(
                new QualifiedTableName("Orders"),
                new QualifiedTableName("Customers", "sales"));
        assertThat(registry.getAllListeners()).hasSize(2);
    }

    @TableChangeListener(table = "Orders")
    static class OrdersListener implements TableListener {
        final List<String> calls = new ArrayList<>();
        String registeredAs;

        @Override
        public void onInsert(TableChangedEvent event) {
            calls.add("insert");
        }

        @Override
        public void onUpdate(TableChangedEvent event) {
            calls.add("update");
        }

        @Override
        public void onDelete(TableChangedEvent event) {
            calls.add("delete");
        }

        @Override
        public void onRegistered(String tableName) {
            registeredAs = tableName;
        }
    }

    @TableChangeListener(table = "sales.Customers", events = ChangeType.INSERT)
    static class InsertOnlyListener implements TableListener {
        final List<String> calls = new ArrayList<>();

        @Override
        public void onInsert(TableChangedEvent event) {
            calls.add("insert");
        }

        @Override
        public void onUpdate(TableChangedEvent event) {
            calls.add("update");
        }
    }

    @TableChangeListener(table = "Archive", enabled = false)
    static class DisabledListener implements TableListener {
    }

    @TableChangeListener(table = "Audit")
    static class FailingListener implements TableListener {
        @Override
        public void onRegistered(String tableName) {
            throw new IllegalStateException("cannot register " + tableName);
        }
    }
}
