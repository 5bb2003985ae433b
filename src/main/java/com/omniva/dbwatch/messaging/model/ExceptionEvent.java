package com.omniva.dbwatch.messaging.model;

import lombok.Getter;
import lombok.Setter;

/**
 * Recoverable failure inside a watch session.
 * <p>
 * Subscribers may clear {@link #isIgnore() ignore} to end the session; the
 * provider then escalates the same exception as a {@link FatalExceptionEvent}.
 */
@Getter
public class ExceptionEvent {
    private final Object source;
    private final Throwable exception;

    @Setter
    private volatile boolean ignore;

    public ExceptionEvent(Object source, Throwable exception, boolean ignore) {
        if (exception == null) {
            throw new IllegalArgumentException("Exception cannot be null");
        }
        this.source = source;
        this.exception = exception;
        this.ignore = ignore;
    }
}
