package com.omniva.dbwatch.engine;

import com.omniva.dbwatch.config.DbWatchConfig;
import com.omniva.dbwatch.engine.fault.DbWatchRuntimeException;
import com.omniva.dbwatch.engine.fault.ErrorTracker;
import com.omniva.dbwatch.engine.transmission.QueryNotificationService;
import com.omniva.dbwatch.messaging.listener.TableListenerRegistry;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import com.omniva.dbwatch.messaging.model.WatchParameters;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import javax.sql.DataSource;
import java.util.List;

/**
 * Runs one watch session for the lifetime of the application context.
 * <p>
 * Tables come from {@code db-watch.tables}, or from the registered
 * {@code @TableChangeListener} beans when none are configured. Table-changed
 * events are routed to those listeners through the {@link TableListenerRegistry}.
 */
@RequiredArgsConstructor
public class DbWatchEngine implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(DbWatchEngine.class);

    private final DbWatchConfig config;
    private final DataSource dataSource;
    private final DbWatchProviderFactory providerFactory;
    private final QueryNotificationService notificationService;
    private final TableListenerRegistry listenerRegistry;
    private final ErrorTracker errorTracker;

    private volatile DbWatchProvider provider;
    private volatile boolean listenerStartedHere = false;
    private volatile boolean running = false;

    // ===== SPRING LIFECYCLE METHODS =====

    @Override
    public synchronized void start() {
        if (running) {
            log.warn("DbWatchEngine is already running");
            return;
        }

        List<QualifiedTableName> tables = resolveTables();
        if (tables.isEmpty()) {
            log.warn("No tables configured and no table listeners registered - not starting change detection");
            return;
        }

        try {
            startNotificationListenerIfRequested();

            WatchParameters params = WatchParameters.builder()
                    .dataSource(dataSource)
                    .tables(tables)
                    .monitoredChanges(config.getMonitoredChanges())
                    .options(config.getWatchOptions())
                    .build();

            DbWatchProvider newProvider = providerFactory.create(
                    params, config.getProviderType(), config.getQueueName(), config.getPollingPeriod());
            newProvider.addListener(listenerRegistry);
            newProvider.start();

            provider = newProvider;
            running = true;
            log.info("DbWatchEngine started {} detection on {}", newProvider.getStrategy(), tables);

        } catch (RuntimeException e) {
            log.error("Failed to start DbWatchEngine: {}", e.getMessage(), e);
            errorTracker.addError("STARTUP: Failed to start change detection", e);
            stopNotificationListener();
            throw new DbWatchRuntimeException("Failed to start change detection", e);
        }
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            log.info("DbWatchEngine is not running");
            return;
        }

        log.info("Stopping DbWatchEngine...");
        try {
            DbWatchProvider current = provider;
            if (current != null) {
                current.dispose();
            }
        } catch (RuntimeException e) {
            errorTracker.addError("Error stopping DbWatchEngine: " + e.getMessage(), e);
            log.error("Error stopping DbWatchEngine: {}", e.getMessage(), e);
            throw new DbWatchRuntimeException("Failed to stop change detection", e);
        } finally {
            provider = null;
            running = false;
            stopNotificationListener();
        }
        log.info("DbWatchEngine stopped");
    }

    @Override
    public boolean isRunning() {
        DbWatchProvider current = provider;
        return running && current != null && current.isStarted();
    }

    @Override
    public int getPhase() {
        return 1000;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down DbWatchEngine");
        try {
            if (running) {
                stop();
            }
        } catch (RuntimeException e) {
            errorTracker.addError("Error during DbWatchEngine shutdown: " + e.getMessage(), e);
            log.error("Error during DbWatchEngine shutdown: {}", e.getMessage(), e);
        }
    }

    // ===== HELPERS =====

    private List<QualifiedTableName> resolveTables() {
        List<QualifiedTableName> configured = config.getTables();
        if (configured != null && !configured.isEmpty()) {
            return configured;
        }
        return listenerRegistry.getTables();
    }

    private void startNotificationListenerIfRequested() {
        if (notificationService == null) {
            return;
        }
        if (config.getProviderType() == ProviderType.SERVICE_BROKER) {
            listenerStartedHere = notificationService.startListener(dataSource, config.getQueueName());
        } else if (config.getProviderType() == ProviderType.AUTO && config.isStartNotificationListener()) {
            try {
                listenerStartedHere = notificationService.startListener(dataSource, config.getQueueName());
            } catch (RuntimeException e) {
                log.warn("Notification listener unavailable, falling back to polling: {}", e.getMessage());
                errorTracker.addError("Notification listener unavailable", e);
            }
        }
    }

    private void stopNotificationListener() {
        if (listenerStartedHere) {
            listenerStartedHere = false;
            try {
                notificationService.stopListener(dataSource, config.getQueueName());
            } catch (RuntimeException e) {
                log.warn("Failed to stop notification listener: {}", e.getMessage());
                errorTracker.addError("Failed to stop notification listener", e);
            }
        }
    }

    public DbWatchProvider getProvider() {
        return provider;
    }
}
