package com.omniva.dbwatch.messaging.model;

import lombok.Value;

/**
 * Failure that ended (or prevented) a watch session
 */
@Value
public class FatalExceptionEvent {
    Object source;
    Throwable exception;
}
