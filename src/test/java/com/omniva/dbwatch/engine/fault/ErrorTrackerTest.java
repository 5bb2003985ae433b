package com.omniva.dbwatch.engine.fault;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorTrackerTest {

    @Test
    void keepsOnlyTheMostRecentErrors() {
        ErrorTracker tracker = new ErrorTracker(2);

        tracker.addError("first", null);
        tracker.addError("second", null);
        tracker.addError("third", null);

        assertThat(tracker.getRecentErrors()).hasSize(2);
        assertThat(tracker.getRecentErrors().get(0)).endsWith("second");
        assertThat(tracker.getLastError()).endsWith("third");
    }

    @Test
    void sqlErrorsCarryStateAndCode() {
        ErrorTracker tracker = new ErrorTracker();

        tracker.addError("Failed to read ledger", new SQLException("deadlock victim", "40001", 1205));

        assertThat(tracker.getLastError())
                .contains("Failed to read ledger - SQLException")
                .contains("SQLState: 40001")
                .contains("ErrorCode: 1205")
                .endsWith("deadlock victim");
    }

    @Test
    void emptyUntilSomethingFails() {
        ErrorTracker tracker = new ErrorTracker(0);

        assertThat(tracker.hasRecentErrors()).isFalse();
        assertThat(tracker.getLastError()).isNull();

        tracker.addError("Subscription failed", new IllegalStateException("listener stopped"));

        assertThat(tracker.hasRecentErrors()).isTrue();
        assertThat(tracker.getLastError()).contains("IllegalStateException: listener stopped");
    }
}
