package com.omniva.dbwatch.engine.fault;

import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps a bounded history of recent watch session errors for diagnostics.
 * Thread-safe: detectors report from their own threads.
 */
public class ErrorTracker {

    private static final int DEFAULT_MAX_RECENT_ERRORS = 100;
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final List<String> recentErrors = new CopyOnWriteArrayList<>();
    private final int maxRecentErrors;

    public ErrorTracker() {
        this(DEFAULT_MAX_RECENT_ERRORS);
    }

    public ErrorTracker(int maxRecentErrors) {
        this.maxRecentErrors = maxRecentErrors > 0 ? maxRecentErrors : DEFAULT_MAX_RECENT_ERRORS;
    }

    /**
     * Add an error with exception details; SQL errors also carry state and code
     */
    public void addError(String errorMessage, Throwable throwable) {
        String timestamp = LocalDateTime.now().format(TIMESTAMP_FORMAT);
        String formattedError;

        if (throwable instanceof SQLException sqlException) {
            formattedError = String.format("[%s] %s - %s (SQLState: %s, ErrorCode: %d): %s",
                    timestamp, errorMessage, throwable.getClass().getSimpleName(),
                    sqlException.getSQLState(), sqlException.getErrorCode(), throwable.getMessage());
        } else if (throwable != null) {
            formattedError = String.format("[%s] %s - %s: %s",
                    timestamp, errorMessage, throwable.getClass().getSimpleName(), throwable.getMessage());
        } else {
            formattedError = String.format("[%s] %s", timestamp, errorMessage);
        }

        recentErrors.add(formattedError);

        while (recentErrors.size() > maxRecentErrors) {
            recentErrors.remove(0);
        }
    }

    public List<String> getRecentErrors() {
        return new ArrayList<>(recentErrors);
    }

    public String getLastError() {
        List<String> errors = getRecentErrors();
        return errors.isEmpty() ? null : errors.get(errors.size() - 1);
    }

    public boolean hasRecentErrors() {
        return !recentErrors.isEmpty();
    }
}
