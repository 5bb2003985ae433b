package com.omniva.dbwatch.engine.fault;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Decides whether a failed connection attempt is worth retrying.
 * <p>
 * Most failures while opening a connection are transient (network blips,
 * failover, throttled logins) and are retried with a fixed backoff. A few
 * can never succeed on a later attempt and are surfaced immediately.
 */
public final class ConnectionFailureClassifier {

    private ConnectionFailureClassifier() {
    }

    public static boolean isRetryable(Throwable failure) {
        return !isNonRetryable(failure);
    }

    public static boolean isNonRetryable(Throwable failure) {
        // Pool or driver rejected the configuration itself (bad url, missing driver class)
        if (failure instanceof IllegalArgumentException || failure instanceof IllegalStateException) {
            return true;
        }

        if (failure instanceof SQLException sqlException) {
            int errorCode = sqlException.getErrorCode();
            if (errorCode == 18487 ||   // Login failed, password expired
                    errorCode == 18488) {  // Login failed, password must be changed
                return true;
            }

            // No suitable driver for the url
            String sqlState = sqlException.getSQLState();
            return "08001".equals(sqlState) && errorCode == 0
                    && sqlException.getMessage() != null
                    && sqlException.getMessage().toLowerCase(Locale.ROOT).contains("no suitable driver");
        }

        return false;
    }
}
