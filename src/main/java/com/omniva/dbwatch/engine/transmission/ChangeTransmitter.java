package com.omniva.dbwatch.engine.transmission;

import com.omniva.dbwatch.messaging.model.MonitoredChanges;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;

/**
 * Path from a change detector back to its provider and the provider's subscribers
 */
public interface ChangeTransmitter {

    void transmitTableChanged(QualifiedTableName table, MonitoredChanges changes);

    /**
     * Report a recoverable failure.
     *
     * @return true to continue, false if a subscriber declined and the detector should stop
     */
    boolean transmitException(Throwable exception);

    void transmitFatalException(Throwable exception);

    /**
     * The detector stopped on its own (not through {@code stop()}) and its
     * session resources should be released.
     */
    void detectionTerminated(Throwable cause);
}
