package com.omniva.dbwatch.messaging.listener;

import com.omniva.dbwatch.messaging.model.TableChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interface for handling table change events
 * Implementations should be annotated with @TableChangeListener
 * <p>
 * TableChangeListener(
 * table = "dbo.Orders",
 * events = {ChangeType.INSERT, ChangeType.UPDATE}
 * enabled = true/false
 * )
 * <p>
 * An event carrying several kinds of change is delivered once per kind.
 */
public interface TableListener {

    Logger log = LoggerFactory.getLogger(TableListener.class);

    default void onInsert(TableChangedEvent event) {
        log.error("INSERT on {} not handled by {}", event.getTable(), getListenerName());
    }

    default void onUpdate(TableChangedEvent event) {
        log.error("UPDATE on {} not handled by {}", event.getTable(), getListenerName());
    }

    default void onDelete(TableChangedEvent event) {
        log.error("DELETE on {} not handled by {}", event.getTable(), getListenerName());
    }

    /**
     * Called when listener is registered (optional override)
     */
    default void onRegistered(String tableName) {
        // Default: do nothing
    }

    default String getListenerName() {
        return this.getClass().getSimpleName();
    }
}
