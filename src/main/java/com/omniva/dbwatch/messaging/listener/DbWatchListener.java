package com.omniva.dbwatch.messaging.listener;

import com.omniva.dbwatch.messaging.model.ExceptionEvent;
import com.omniva.dbwatch.messaging.model.FatalExceptionEvent;
import com.omniva.dbwatch.messaging.model.TableChangedEvent;

/**
 * Subscriber of a watch session's events.
 * <p>
 * Callbacks run on the detector's thread (the polling thread or the
 * notification listener thread), never on the caller of {@code start()}.
 */
public interface DbWatchListener {

    void onTableChanged(TableChangedEvent event);

    /**
     * Recoverable failure. Leave {@code ignore} set to keep the session running.
     */
    default void onException(ExceptionEvent event) {
        // Default: keep running
    }

    default void onFatalException(FatalExceptionEvent event) {
        // Default: do nothing
    }
}
