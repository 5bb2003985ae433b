package com.omniva.dbwatch.engine;

import com.omniva.dbwatch.engine.fault.DbWatchStateException;
import com.omniva.dbwatch.engine.fault.ErrorTracker;
import com.omniva.dbwatch.engine.ledger.LedgerLifecycleManager;
import com.omniva.dbwatch.engine.transmission.ChangeTransmitter;
import com.omniva.dbwatch.messaging.listener.DbWatchListener;
import com.omniva.dbwatch.messaging.model.ExceptionEvent;
import com.omniva.dbwatch.messaging.model.FatalExceptionEvent;
import com.omniva.dbwatch.messaging.model.MonitoredChanges;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import com.omniva.dbwatch.messaging.model.TableChangedEvent;
import com.omniva.dbwatch.messaging.model.WatchParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One watch session over a set of tables.
 * <p>
 * Lifecycle: Created -> Started -> Stopped (restartable) and finally Disposed.
 * {@link #start()} provisions the change ledger and starts the detector,
 * {@link #stop()} stops the detector and releases the ledger again. State
 * transitions are serialized by a per-session lock; ledger provisioning is
 * additionally serialized across sessions by the ledger lifecycle manager.
 * <p>
 * Events are delivered on the detector's thread to every registered
 * {@link DbWatchListener}.
 */
public class DbWatchProvider implements ChangeTransmitter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DbWatchProvider.class);

    private final WatchParameters parameters;
    private final DetectionStrategy strategy;
    private final ChangeDetector detector;
    private final LedgerLifecycleManager ledgerLifecycleManager;
    private final ErrorTracker errorTracker;

    private final List<DbWatchListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock stateLock = new ReentrantLock();
    private final AtomicBoolean provisioned = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    // guarded by stateLock
    private volatile boolean started = false;
    private volatile boolean disposed = false;

    public DbWatchProvider(WatchParameters parameters,
                           DetectionStrategy strategy,
                           ChangeDetector detector,
                           LedgerLifecycleManager ledgerLifecycleManager,
                           ErrorTracker errorTracker) {
        this.parameters = parameters;
        this.strategy = strategy;
        this.detector = detector;
        this.ledgerLifecycleManager = ledgerLifecycleManager;
        this.errorTracker = errorTracker;
    }

    // ===== LIFECYCLE =====

    /**
     * Provisions the ledger and starts detection.
     * <p>
     * On failure a fatal event is raised, everything acquired so far is
     * released and the exception is rethrown.
     *
     * @throws DbWatchStateException if already started or disposed
     */
    public void start() {
        stateLock.lock();
        try {
            if (disposed) {
                throw new DbWatchStateException("Watch session has been disposed");
            }
            if (started) {
                throw new DbWatchStateException("Watch session already started");
            }

            log.info("Starting {} watch session on {}", strategy, parameters.getTables());
            try {
                ledgerLifecycleManager.provision(parameters);
                provisioned.set(true);
                terminated.set(false);

                detector.start(this);
                if (terminated.get()) {
                    log.warn("{} detection terminated while starting, session not started", strategy);
                    return;
                }
                started = true;
                log.info("{} watch session started on {}", strategy, parameters.getTables());
            } catch (RuntimeException e) {
                log.error("Failed to start {} watch session: {}", strategy, e.getMessage());
                transmitFatalException(e);
                releaseResources();
                throw e;
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Stops detection and releases the ledger. Does nothing when not started.
     * <p>
     * If the detector fails to stop a fatal event is raised and the exception
     * is rethrown, after the session has been marked stopped and its
     * resources released.
     */
    public void stop() {
        stateLock.lock();
        try {
            if (!started) {
                log.debug("Watch session not started, nothing to stop");
                return;
            }

            log.info("Stopping {} watch session on {}", strategy, parameters.getTables());
            try {
                detector.stop();
            } catch (RuntimeException e) {
                log.error("Failed to stop {} detection: {}", strategy, e.getMessage());
                transmitFatalException(e);
                throw e;
            } finally {
                started = false;
                releaseResources();
            }
            log.info("{} watch session stopped", strategy);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Stops the session if needed and makes it unusable. Idempotent.
     */
    public void dispose() {
        stateLock.lock();
        try {
            if (disposed) {
                return;
            }
            disposed = true;
            stop();
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public void close() {
        dispose();
    }

    /**
     * Detector cleanup, then ledger release. The ledger is released at most
     * once per successful provision, whichever path gets here first.
     */
    private void releaseResources() {
        try {
            detector.cleanup();
        } catch (RuntimeException e) {
            log.warn("Detector cleanup failed: {}", e.getMessage());
            transmitException(e);
        }

        if (provisioned.compareAndSet(true, false)) {
            try {
                ledgerLifecycleManager.deprovision(parameters);
            } catch (RuntimeException e) {
                log.warn("Failed to release change ledger: {}", e.getMessage());
                transmitException(e);
            }
        }
    }

    // ===== SUBSCRIBERS =====

    public void addListener(DbWatchListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        listeners.add(listener);
    }

    public void removeListener(DbWatchListener listener) {
        listeners.remove(listener);
    }

    // ===== TRANSMITTER =====

    @Override
    public void transmitTableChanged(QualifiedTableName table, MonitoredChanges changes) {
        TableChangedEvent event = new TableChangedEvent(this, table, changes);
        log.debug("Table {} changed: {}", table, changes);

        for (DbWatchListener listener : listeners) {
            try {
                listener.onTableChanged(event);
            } catch (RuntimeException e) {
                log.error("Listener {} failed handling change of {}: {}",
                        listener.getClass().getSimpleName(), table, e.getMessage(), e);
                errorTracker.addError("Listener failed handling change of " + table, e);
            }
        }
    }

    /**
     * Raises an exception event. A subscriber that throws, or that clears
     * {@code ignore}, turns the exception into a fatal one.
     */
    @Override
    public boolean transmitException(Throwable exception) {
        errorTracker.addError("Watch session error", exception);
        log.warn("{} watch session error: {}", strategy, exception.getMessage());

        ExceptionEvent event = new ExceptionEvent(this, exception, true);
        for (DbWatchListener listener : listeners) {
            try {
                listener.onException(event);
            } catch (RuntimeException e) {
                log.error("Exception handler {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
                event.setIgnore(false);
            }
        }

        if (!event.isIgnore()) {
            transmitFatalException(exception);
            return false;
        }
        return true;
    }

    @Override
    public void transmitFatalException(Throwable exception) {
        errorTracker.addError("Fatal watch session error", exception);
        log.error("{} watch session fatal error: {}", strategy, exception.getMessage(), exception);

        FatalExceptionEvent event = new FatalExceptionEvent(this, exception);
        for (DbWatchListener listener : listeners) {
            try {
                listener.onFatalException(event);
            } catch (RuntimeException e) {
                log.error("Fatal exception handler {} failed: {}",
                        listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    /**
     * Called from the detector's own thread. Never waits for the state lock,
     * since {@link #stop()} may hold it while waiting for that thread. When
     * {@link #start()} holds the lock instead, it sees the termination flag
     * and leaves the session stopped.
     */
    @Override
    public void detectionTerminated(Throwable cause) {
        log.warn("{} detection terminated: {}", strategy, cause != null ? cause.getMessage() : "unknown cause");
        terminated.set(true);
        releaseResources();

        if (stateLock.tryLock()) {
            try {
                started = false;
            } finally {
                stateLock.unlock();
            }
        }
    }

    // ===== STATE =====

    public boolean isStarted() {
        return started;
    }

    public boolean isDisposed() {
        return disposed;
    }

    public boolean isProvisioned() {
        return provisioned.get();
    }

    public DetectionStrategy getStrategy() {
        return strategy;
    }

    public WatchParameters getParameters() {
        return parameters;
    }

    public ErrorTracker getErrorTracker() {
        return errorTracker;
    }

    ChangeDetector getDetector() {
        return detector;
    }

    @Override
    public String toString() {
        return String.format("DbWatchProvider[strategy=%s, tables=%s, started=%s, disposed=%s]",
                strategy, parameters.getTables(), started, disposed);
    }
}
