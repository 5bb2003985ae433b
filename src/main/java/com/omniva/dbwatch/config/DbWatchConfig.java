package com.omniva.dbwatch.config;

import com.omniva.dbwatch.engine.ProviderType;
import com.omniva.dbwatch.messaging.model.MonitoredChanges;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import com.omniva.dbwatch.messaging.model.WatchOptions;

import java.time.Duration;
import java.util.List;

/**
 * Configuration interface for DB Watch.
 * This interface abstracts the configuration details from the engine implementation
 */
public interface DbWatchConfig {

    // What to watch
    List<QualifiedTableName> getTables();
    MonitoredChanges getMonitoredChanges();
    WatchOptions getWatchOptions();

    // Detection
    ProviderType getProviderType();
    Duration getPollingPeriod();
    String getQueueName();
    boolean isStartNotificationListener();
    int getNotificationWaitTimeoutMs();

    // Connection retry
    int getMaxOpenAttempts();
    long getOpenRetryDelayMs();

    // Shutdown
    long getStopGracePeriodMs();
}
