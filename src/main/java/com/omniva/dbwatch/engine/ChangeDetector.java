package com.omniva.dbwatch.engine;

import com.omniva.dbwatch.engine.transmission.ChangeTransmitter;

/**
 * Strategy specific part of a watch session.
 * <p>
 * {@link DbWatchProvider} calls {@link #start} after the ledger is provisioned
 * and {@link #stop} before it is released. {@link #cleanup} may be called
 * more than once and from the detector's own thread, so it must be
 * idempotent and must not block on that thread.
 */
public interface ChangeDetector {

    void start(ChangeTransmitter transmitter);

    void stop();

    void cleanup();

    boolean isRunning();
}
