package com.omniva.dbwatch.engine;

import com.omniva.dbwatch.engine.fault.DbWatchProvisioningException;
import com.omniva.dbwatch.engine.fault.DbWatchStateException;
import com.omniva.dbwatch.engine.fault.ErrorTracker;
import com.omniva.dbwatch.engine.ledger.LedgerLifecycleManager;
import com.omniva.dbwatch.engine.transmission.ChangeTransmitter;
import com.omniva.dbwatch.messaging.listener.DbWatchListener;
import com.omniva.dbwatch.messaging.model.ChangeType;
import com.omniva.dbwatch.messaging.model.ExceptionEvent;
import com.omniva.dbwatch.messaging.model.FatalExceptionEvent;
import com.omniva.dbwatch.messaging.model.MonitoredChanges;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import com.omniva.dbwatch.messaging.model.TableChangedEvent;
import com.omniva.dbwatch.messaging.model.WatchParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class DbWatchProviderTest {

    private WatchParameters params;
    private ChangeDetector detector;
    private LedgerLifecycleManager ledger;
    private DbWatchProvider provider;
    private RecordingListener events;

    @BeforeEach
    void setUp() {
        params = WatchParameters.builder()
                .dataSource(mock(DataSource.class))
                .table(new QualifiedTableName("Orders"))
                .build();
        detector = mock(ChangeDetector.class);
        ledger = mock(LedgerLifecycleManager.class);
        provider = new DbWatchProvider(params, DetectionStrategy.POLLING, detector, ledger, new ErrorTracker());
        events = new RecordingListener();
        provider.addListener(events);
    }

    @Test
    void startProvisionsBeforeStartingDetection() {
        provider.start();

        InOrder order = inOrder(ledger, detector);
        order.verify(ledger).provision(params);
        order.verify(detector).start(provider);
        assertThat(provider.isStarted()).isTrue();
        assertThat(provider.isProvisioned()).isTrue();
    }

    @Test
    void secondStartIsRejected() {
        provider.start();

        assertThatThrownBy(() -> provider.start())
                .isInstanceOf(DbWatchStateException.class)
                .hasMessageContaining("already started");
        verify(ledger, times(1)).provision(params);
    }

    @Test
    void detectorStartFailureIsFatalAndReleasesTheLedger() {
        IllegalStateException failure = new IllegalStateException("listener gone");
        doThrow(failure).when(detector).start(any());

        assertThatThrownBy(() -> provider.start()).isSameAs(failure);

        assertThat(events.fatal).extracting(FatalExceptionEvent::getException).containsExactly(failure);
        verify(detector).cleanup();
        verify(ledger).deprovision(params);
        assertThat(provider.isStarted()).isFalse();
    }

    @Test
    void provisionFailureDoesNotDeprovision() {
        doThrow(new DbWatchProvisioningException("no permission")).when(ledger).provision(params);

        assertThatThrownBy(() -> provider.start()).isInstanceOf(DbWatchProvisioningException.class);

        assertThat(events.fatal).hasSize(1);
        verify(ledger, never()).deprovision(any());
    }

    @Test
    void stopWithoutStartDoesNothing() {
        provider.stop();

        verify(detector, never()).stop();
        verify(ledger, never()).deprovision(any());
    }

    @Test
    void repeatedStopReleasesOnlyOnce() {
        provider.start();

        provider.stop();
        provider.stop();

        verify(detector, times(1)).stop();
        verify(ledger, times(1)).deprovision(params);
        assertThat(provider.isStarted()).isFalse();
    }

    @Test
    void providerIsRestartableAfterStop() {
        provider.start();
        provider.stop();
        provider.start();

        verify(ledger, times(2)).provision(params);
        assertThat(provider.isStarted()).isTrue();
    }

    @Test
    void detectorStopFailureIsFatalButStillCleansUp() {
        provider.start();
        IllegalStateException failure = new IllegalStateException("stuck");
        doThrow(failure).when(detector).stop();

        assertThatThrownBy(() -> provider.stop()).isSameAs(failure);

        assertThat(events.fatal).hasSize(1);
        assertThat(provider.isStarted()).isFalse();
        verify(ledger).deprovision(params);
    }

    @Test
    void deprovisionFailureIsReportedAsRecoverable() {
        provider.start();
        DbWatchProvisioningException failure = new DbWatchProvisioningException("deadlock");
        doThrow(failure).when(ledger).deprovision(params);

        provider.stop();

        assertThat(events.exceptions).extracting(ExceptionEvent::getException).containsExactly(failure);
        assertThat(events.fatal).isEmpty();
    }

    @Test
    void disposeIsIdempotentAndFinal() {
        provider.start();

        provider.dispose();
        provider.close();

        verify(ledger, times(1)).deprovision(params);
        assertThat(provider.isDisposed()).isTrue();
        assertThatThrownBy(() -> provider.start()).isInstanceOf(DbWatchStateException.class);
    }

    @Test
    void exceptionsAreIgnoredByDefault() {
        boolean keepGoing = provider.transmitException(new RuntimeException("blip"));

        assertThat(keepGoing).isTrue();
        assertThat(events.exceptions).hasSize(1);
        assertThat(events.fatal).isEmpty();
    }

    @Test
    void declinedExceptionBecomesFatal() {
        provider.addListener(new DbWatchListener() {
            @Override
            public void onTableChanged(TableChangedEvent event) {
            }

            @Override
            public void onException(ExceptionEvent event) {
                event.setIgnore(false);
            }
        });
        RuntimeException failure = new RuntimeException("bad");

        boolean keepGoing = provider.transmitException(failure);

        assertThat(keepGoing).isFalse();
        assertThat(events.fatal).extracting(FatalExceptionEvent::getException).containsExactly(failure);
    }

    @Test
    void throwingExceptionHandlerBecomesFatal() {
        provider.addListener(new DbWatchListener() {
            @Override
            public void onTableChanged(TableChangedEvent event) {
            }

            @Override
            public void onException(ExceptionEvent event) {
                throw new IllegalStateException("handler broke");
            }
        });

        assertThat(provider.transmitException(new RuntimeException("bad"))).isFalse();
        assertThat(events.fatal).hasSize(1);
    }

    @Test
    void failingSubscriberDoesNotHideEventsFromOthers() {
        List<TableChangedEvent> received = new ArrayList<>();
        provider.removeListener(events);
        provider.addListener(event -> {
            throw new IllegalStateException("boom");
        });
        provider.addListener(received::add);

        provider.transmitTableChanged(new QualifiedTableName("Orders"), MonitoredChanges.of(ChangeType.UPDATE));

        assertThat(received).hasSize(1);
        assertThat(received.get(0).getSource()).isSameAs(provider);
        assertThat(received.get(0).hasChange(ChangeType.UPDATE)).isTrue();
        assertThat(provider.getErrorTracker().hasRecentErrors()).isTrue();
    }

    @Test
    void terminatedDetectionReleasesOnceAndMarksStopped() {
        provider.start();

        provider.detectionTerminated(new RuntimeException("declined"));
        provider.stop();

        verify(ledger, times(1)).deprovision(params);
        verify(detector, never()).stop();
        assertThat(provider.isStarted()).isFalse();
    }

    @Test
    void detectionEndingDuringStartLeavesSessionStopped() {
        doAnswer(invocation -> {
            ChangeTransmitter transmitter = invocation.getArgument(0);
            Thread pollingThread = new Thread(() -> transmitter.detectionTerminated(new RuntimeException("first tick failed")));
            pollingThread.start();
            pollingThread.join();
            return null;
        }).doNothing().when(detector).start(any());

        provider.start();

        assertThat(provider.isStarted()).isFalse();
        assertThat(provider.isProvisioned()).isFalse();
        verify(ledger, times(1)).deprovision(params);

        provider.start();

        assertThat(provider.isStarted()).isTrue();
        verify(ledger, times(2)).provision(params);
    }

    private static class RecordingListener implements DbWatchListener {
        final List<TableChangedEvent> changes = new ArrayList<>();
        final List<ExceptionEvent> exceptions = new ArrayList<>();
        final List<FatalExceptionEvent> fatal = new ArrayList<>();

        @Override
        public void onTableChanged(TableChangedEvent event) {
            changes.add(event);
        }

        @Override
        public void onException(ExceptionEvent event) {
            exceptions.add(event);
        }

        @Override
        public void onFatalException(FatalExceptionEvent event) {
            fatal.add(event);
        }
    }
}
