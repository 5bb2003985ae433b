package com.omniva.dbwatch.engine.piston;

import com.omniva.dbwatch.engine.ChangeDetector;
import com.omniva.dbwatch.engine.fault.DbWatchStateException;
import com.omniva.dbwatch.engine.fuelsystem.DbWatchConnectionManager;
import com.omniva.dbwatch.engine.ledger.LedgerEntry;
import com.omniva.dbwatch.engine.ledger.LedgerReader;
import com.omniva.dbwatch.engine.ledger.LedgerSnapshot;
import com.omniva.dbwatch.engine.transmission.ChangeTransmitter;
import com.omniva.dbwatch.messaging.model.MonitoredChanges;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import com.omniva.dbwatch.messaging.model.WatchParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Detects changes by re-reading the change ledger on a fixed period.
 * <p>
 * Runs a single loop on a dedicated thread. Each tick reads the ledger rows
 * of all monitored tables, compares them with the previous tick and raises
 * one event per changed table, in table order. After a failure the loop
 * keeps going if the failure was ignored and ends otherwise.
 * <p>
 * There is no baseline read at start: a ledger row that already carries a
 * timestamp counts as changed on the first tick.
 * <p>
 * Stopping signals the loop and waits up to the grace period; a loop that
 * does not exit in time is interrupted.
 */
public class PollingChangeDetector implements ChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(PollingChangeDetector.class);

    public static final Duration DEFAULT_POLLING_PERIOD = Duration.ofSeconds(5);
    public static final long DEFAULT_STOP_GRACE_PERIOD_MS = 2000;

    private final WatchParameters parameters;
    private final Duration pollingPeriod;
    private final long stopGracePeriodMs;
    private final DbWatchConnectionManager connectionManager;
    private final LedgerReader ledgerReader;
    private final ThreadFactory threadFactory;

    // only touched by the polling thread
    private final Map<QualifiedTableName, LedgerSnapshot> previousSnapshots = new HashMap<>();
    private final Map<String, QualifiedTableName> tablesByName = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    private final AtomicReference<ExecutorService> executor = new AtomicReference<>();
    private volatile Future<?> pollingTask;
    private volatile CountDownLatch exitSignal;

    public PollingChangeDetector(WatchParameters parameters,
                                 Duration pollingPeriod,
                                 long stopGracePeriodMs,
                                 DbWatchConnectionManager connectionManager,
                                 LedgerReader ledgerReader,
                                 ThreadFactory threadFactory) {
        this.parameters = parameters;
        this.pollingPeriod = pollingPeriod != null && !pollingPeriod.isNegative() && !pollingPeriod.isZero()
                ? pollingPeriod : DEFAULT_POLLING_PERIOD;
        this.stopGracePeriodMs = stopGracePeriodMs >= 0 ? stopGracePeriodMs : DEFAULT_STOP_GRACE_PERIOD_MS;
        this.connectionManager = connectionManager;
        this.ledgerReader = ledgerReader;
        this.threadFactory = threadFactory;

        for (QualifiedTableName table : parameters.getTables()) {
            tablesByName.put(table.getFullName(), table);
        }
    }

    @Override
    public void start(ChangeTransmitter transmitter) {
        if (isRunning()) {
            throw new DbWatchStateException("Polling already running");
        }

        ExecutorService newExecutor = Executors.newSingleThreadExecutor(threadFactory);
        CountDownLatch signal = new CountDownLatch(1);
        previousSnapshots.clear();

        executor.set(newExecutor);
        exitSignal = signal;
        pollingTask = newExecutor.submit(() -> pollUntilStopped(transmitter, signal));
        log.info("Polling {} every {}ms", parameters.getTables(), pollingPeriod.toMillis());
    }

    @Override
    public void stop() {
        CountDownLatch signal = exitSignal;
        Future<?> task = pollingTask;
        if (signal == null || task == null) {
            return;
        }

        signal.countDown();
        try {
            task.get(stopGracePeriodMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Polling thread did not stop within {}ms, interrupting", stopGracePeriodMs);
            task.cancel(true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
        } catch (ExecutionException e) {
            log.warn("Polling thread ended with failure: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (CancellationException e) {
            log.debug("Polling task already cancelled");
        }
    }

    /**
     * Releases the polling thread without waiting for it. Safe to call from
     * the polling thread itself.
     */
    @Override
    public void cleanup() {
        CountDownLatch signal = exitSignal;
        if (signal != null) {
            signal.countDown();
        }

        ExecutorService current = executor.getAndSet(null);
        if (current != null) {
            current.shutdown();
            log.debug("Polling executor released");
        }
    }

    @Override
    public boolean isRunning() {
        Future<?> task = pollingTask;
        return executor.get() != null && task != null && !task.isDone();
    }

    // ===== POLLING LOOP =====

    private void pollUntilStopped(ChangeTransmitter transmitter, CountDownLatch signal) {
        log.info("Polling loop started on {}", Thread.currentThread().getName());
        try {
            while (true) {
                try {
                    poll(transmitter);
                } catch (Exception e) {
                    log.warn("Polling failed: {}", e.getMessage());
                    if (!transmitter.transmitException(e)) {
                        log.error("Polling error not ignored, ending detection");
                        transmitter.detectionTerminated(e);
                        return;
                    }
                }

                if (signal.await(pollingPeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.info("Polling loop stopped");
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Polling loop interrupted");
        } catch (Error t) {
            log.error("CRITICAL failure in polling loop: {}", t.getMessage(), t);
            transmitter.transmitFatalException(t);
            transmitter.detectionTerminated(t);
            throw t;
        }
    }

    /**
     * One tick: read the ledger, diff against the previous tick, raise events.
     */
    void poll(ChangeTransmitter transmitter) throws SQLException {
        List<LedgerEntry> entries;
        Connection connection = connectionManager.openConnection(parameters.getDataSource());
        try {
            entries = ledgerReader.readEntries(connection, parameters);
        } finally {
            connectionManager.safeClose(connection, "ledger poll");
        }

        Map<QualifiedTableName, LedgerSnapshot> current = new HashMap<>();
        for (LedgerEntry entry : entries) {
            QualifiedTableName table = tablesByName.get(entry.objectName());
            if (table != null) {
                current.put(table, entry.snapshot());
            } else {
                log.trace("Ignoring ledger row of unmonitored object {}", entry.objectName());
            }
        }

        Map<QualifiedTableName, MonitoredChanges> detected = new LinkedHashMap<>();
        for (QualifiedTableName table : parameters.getTables()) {
            LedgerSnapshot snapshot = current.get(table);
            if (snapshot == null) {
                continue;
            }
            MonitoredChanges changes = snapshot.changesSince(previousSnapshots.get(table), parameters.getMonitoredChanges());
            previousSnapshots.put(table, snapshot);
            if (!changes.isEmpty()) {
                detected.put(table, changes);
            }
        }

        detected.forEach(transmitter::transmitTableChanged);
    }

    public Duration getPollingPeriod() {
        return pollingPeriod;
    }

    public long getStopGracePeriodMs() {
        return stopGracePeriodMs;
    }
}
