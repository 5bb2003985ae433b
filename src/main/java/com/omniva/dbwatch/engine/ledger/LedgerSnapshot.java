package com.omniva.dbwatch.engine.ledger;

import com.omniva.dbwatch.messaging.model.ChangeType;
import com.omniva.dbwatch.messaging.model.MonitoredChanges;

import java.time.OffsetDateTime;

/**
 * Last insert/update/delete timestamps of one ledger row. Any of them may be null.
 */
public record LedgerSnapshot(OffsetDateTime lastInsertDate,
                             OffsetDateTime lastUpdateDate,
                             OffsetDateTime lastDeleteDate) {

    public static final LedgerSnapshot EMPTY = new LedgerSnapshot(null, null, null);

    /**
     * Kinds of change this snapshot shows relative to {@code previous}.
     * <p>
     * A kind counts when it is monitored, its current timestamp is set, and
     * either no previous timestamp exists or the current one is strictly later.
     * A table seen for the first time therefore reports every kind that was
     * ever stamped, including writes made before the session started.
     *
     * @param previous  snapshot of the previous poll, or null if none
     * @param monitored kinds the session is interested in
     */
    public MonitoredChanges changesSince(LedgerSnapshot previous, MonitoredChanges monitored) {
        LedgerSnapshot before = previous != null ? previous : EMPTY;
        MonitoredChanges changes = MonitoredChanges.NONE;

        if (isNewer(monitored, ChangeType.INSERT, lastInsertDate, before.lastInsertDate)) {
            changes = changes.with(ChangeType.INSERT);
        }
        if (isNewer(monitored, ChangeType.UPDATE, lastUpdateDate, before.lastUpdateDate)) {
            changes = changes.with(ChangeType.UPDATE);
        }
        if (isNewer(monitored, ChangeType.DELETE, lastDeleteDate, before.lastDeleteDate)) {
            changes = changes.with(ChangeType.DELETE);
        }
        return changes;
    }

    private static boolean isNewer(MonitoredChanges monitored, ChangeType type,
                                   OffsetDateTime current, OffsetDateTime previous) {
        if (!monitored.contains(type) || current == null) {
            return false;
        }
        return previous == null || current.isAfter(previous);
    }
}
