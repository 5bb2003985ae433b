package com.omniva.dbwatch.engine.transmission;

import com.omniva.dbwatch.engine.transmission.QueryNotification.NotificationInfo;
import com.omniva.dbwatch.engine.transmission.QueryNotification.NotificationType;
import com.omniva.dbwatch.messaging.model.ChangeType;
import com.omniva.dbwatch.messaging.model.MonitoredChanges;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import com.omniva.dbwatch.messaging.model.WatchParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PushChangeDetectorTest {

    private static final QualifiedTableName ORDERS = new QualifiedTableName("Orders");
    private static final QualifiedTableName CUSTOMERS = new QualifiedTableName("Customers");

    private FakeNotificationService service;
    private ChangeTransmitter transmitter;

    @BeforeEach
    void setUp() {
        service = new FakeNotificationService();
        transmitter = mock(ChangeTransmitter.class);
    }

    private PushChangeDetector detector(MonitoredChanges monitored, QualifiedTableName... tables) {
        WatchParameters.WatchParametersBuilder builder = WatchParameters.builder()
                .dataSource(mock(DataSource.class))
                .monitoredChanges(monitored);
        for (QualifiedTableName table : tables) {
            builder.table(table);
        }
        return new PushChangeDetector(builder.build(), "ChangesQueue", service);
    }

    @Test
    void startArmsOneSubscriptionPerTable() {
        PushChangeDetector detector = detector(MonitoredChanges.ALL, CUSTOMERS, ORDERS);

        detector.start(transmitter);

        assertThat(service.subscriptions).hasSize(2);
        assertThat(service.subscriptions).extracting(s -> s.getQuery().objectName())
                .containsExactly("[dbo].[Customers]", "[dbo].[Orders]");
        assertThat(service.subscriptions.get(0).getQuery().sql())
                .contains("FROM dbo.SqlDependencyChanges WHERE [ObjectName] = ?");
        assertThat(detector.subscriptionCount()).isEqualTo(2);
    }

    @Test
    void changeRaisesOneEventAndRearms() {
        PushChangeDetector detector = detector(MonitoredChanges.ALL, ORDERS);
        detector.start(transmitter);
        FakeSubscription first = service.subscriptions.get(0);

        first.fire(NotificationType.CHANGE, NotificationInfo.UPDATE);

        verify(transmitter).transmitTableChanged(ORDERS, MonitoredChanges.of(ChangeType.UPDATE));
        assertThat(first.unregistered).isTrue();
        assertThat(service.subscriptions).hasSize(2);
        assertThat(detector.subscriptionCount()).isEqualTo(1);
    }

    @Test
    void unmonitoredChangeRearmsWithoutEvent() {
        PushChangeDetector detector = detector(MonitoredChanges.of(ChangeType.INSERT), ORDERS);
        detector.start(transmitter);

        service.subscriptions.get(0).fire(NotificationType.CHANGE, NotificationInfo.DELETE);

        verify(transmitter, never()).transmitTableChanged(any(), any());
        assertThat(service.subscriptions).hasSize(2);
    }

    @Test
    void failedSubscriptionIsNotRearmed() {
        PushChangeDetector detector = detector(MonitoredChanges.ALL, ORDERS);
        detector.start(transmitter);

        service.subscriptions.get(0).fire(NotificationType.SUBSCRIBE, NotificationInfo.INVALID);

        verify(transmitter, never()).transmitTableChanged(any(), any());
        assertThat(service.subscriptions).hasSize(1);
        assertThat(detector.subscriptionCount()).isZero();
    }

    @Test
    void invalidChangeRearmsWithoutEvent() {
        PushChangeDetector detector = detector(MonitoredChanges.ALL, ORDERS);
        detector.start(transmitter);

        service.subscriptions.get(0).fire(NotificationType.CHANGE, NotificationInfo.INVALID);

        verify(transmitter, never()).transmitTableChanged(any(), any());
        assertThat(service.subscriptions).hasSize(2);
    }

    @Test
    void noRearmOnceExiting() {
        PushChangeDetector detector = detector(MonitoredChanges.ALL, ORDERS);
        detector.start(transmitter);
        FakeSubscription first = service.subscriptions.get(0);

        detector.stop();
        first.fire(NotificationType.CHANGE, NotificationInfo.INSERT);

        verify(transmitter).transmitTableChanged(ORDERS, MonitoredChanges.of(ChangeType.INSERT));
        assertThat(service.subscriptions).hasSize(1);
    }

    @Test
    void cleanupUnregistersEverySubscription() {
        PushChangeDetector detector = detector(MonitoredChanges.ALL, CUSTOMERS, ORDERS);
        detector.start(transmitter);

        detector.cleanup();

        assertThat(service.subscriptions).allMatch(s -> s.unregistered);
        assertThat(detector.subscriptionCount()).isZero();
        assertThat(detector.isRunning()).isFalse();
    }

    @Test
    void rearmFailureIsReportedAsRecoverable() {
        PushChangeDetector detector = detector(MonitoredChanges.ALL, ORDERS);
        detector.start(transmitter);
        IllegalStateException failure = new IllegalStateException("listener stopped");
        service.failure = failure;

        service.subscriptions.get(0).fire(NotificationType.CHANGE, NotificationInfo.UPDATE);

        verify(transmitter).transmitException(failure);
    }

    @Test
    void subscriptionFailingDuringSubscribeIsDropped() {
        service.failSynchronously = true;
        PushChangeDetector detector = detector(MonitoredChanges.ALL, ORDERS);
        when(transmitter.transmitException(any())).thenReturn(true);

        detector.start(transmitter);

        assertThat(detector.subscriptionCount()).isZero();
        assertThat(service.subscriptions).hasSize(1);
    }

    private static class FakeNotificationService implements QueryNotificationService {
        final List<FakeSubscription> subscriptions = new ArrayList<>();
        RuntimeException failure;
        boolean failSynchronously;

        @Override
        public boolean startListener(DataSource dataSource, String queueName) {
            return true;
        }

        @Override
        public boolean stopListener(DataSource dataSource, String queueName) {
            return true;
        }

        @Override
        public boolean isListenerStarted(DataSource dataSource, String queueName) {
            return true;
        }

        @Override
        public NotificationSubscription subscribe(WatchedQuery query, QueryNotificationCallback callback) {
            if (failure != null) {
                throw failure;
            }
            FakeSubscription subscription = new FakeSubscription("S" + subscriptions.size(), query, callback);
            subscriptions.add(subscription);
            if (failSynchronously) {
                subscription.fire(NotificationType.SUBSCRIBE, NotificationInfo.INVALID);
            }
            return subscription;
        }
    }

    private static class FakeSubscription implements NotificationSubscription {
        final String id;
        final WatchedQuery query;
        final QueryNotificationCallback callback;
        boolean unregistered;
        boolean fired;

        FakeSubscription(String id, WatchedQuery query, QueryNotificationCallback callback) {
            this.id = id;
            this.query = query;
            this.callback = callback;
        }

        void fire(NotificationType type, NotificationInfo info) {
            fired = true;
            callback.onNotification(this, new QueryNotification(id, type, info));
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public WatchedQuery getQuery() {
            return query;
        }

        @Override
        public boolean isActive() {
            return !fired && !unregistered;
        }

        @Override
        public void unregister() {
            unregistered = true;
        }
    }
}
