package com.omniva.dbwatch.engine;

import com.omniva.dbwatch.engine.crankshaft.DbWatchThreadFactory;
import com.omniva.dbwatch.engine.fault.DbWatchValidationException;
import com.omniva.dbwatch.engine.fault.ErrorTracker;
import com.omniva.dbwatch.engine.fuelsystem.DbWatchConnectionManager;
import com.omniva.dbwatch.engine.ignition.WatchParametersValidator;
import com.omniva.dbwatch.engine.ledger.LedgerLifecycleManager;
import com.omniva.dbwatch.engine.ledger.LedgerReader;
import com.omniva.dbwatch.engine.piston.PollingChangeDetector;
import com.omniva.dbwatch.engine.transmission.PushChangeDetector;
import com.omniva.dbwatch.engine.transmission.QueryNotificationService;
import com.omniva.dbwatch.messaging.model.WatchParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Builds watch sessions.
 * <p>
 * Parameters are copied and validated first. {@link ProviderType#AUTO}
 * picks push detection when a notification listener is already running for
 * the queue and polling otherwise.
 */
public class DbWatchProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(DbWatchProviderFactory.class);

    public static final String DEFAULT_QUEUE_NAME = "DbWatchNotifications";

    private final DbWatchConnectionManager connectionManager;
    private final WatchParametersValidator validator;
    private final LedgerLifecycleManager ledgerLifecycleManager;
    private final QueryNotificationService notificationService;
    private final ErrorTracker errorTracker;
    private final String defaultQueueName;
    private final Duration defaultPollingPeriod;
    private final long stopGracePeriodMs;
    private final DbWatchThreadFactory pollingThreadFactory = new DbWatchThreadFactory("DbWatch-poll");
    private final LedgerReader ledgerReader = new LedgerReader();

    public DbWatchProviderFactory(DbWatchConnectionManager connectionManager,
                                  WatchParametersValidator validator,
                                  LedgerLifecycleManager ledgerLifecycleManager,
                                  QueryNotificationService notificationService,
                                  ErrorTracker errorTracker,
                                  String defaultQueueName,
                                  Duration defaultPollingPeriod,
                                  long stopGracePeriodMs) {
        this.connectionManager = connectionManager;
        this.validator = validator;
        this.ledgerLifecycleManager = ledgerLifecycleManager;
        this.notificationService = notificationService;
        this.errorTracker = errorTracker;
        this.defaultQueueName = defaultQueueName == null || defaultQueueName.isBlank()
                ? DEFAULT_QUEUE_NAME : defaultQueueName.trim();
        this.defaultPollingPeriod = defaultPollingPeriod != null ? defaultPollingPeriod : PollingChangeDetector.DEFAULT_POLLING_PERIOD;
        this.stopGracePeriodMs = stopGracePeriodMs;
    }

    public DbWatchProvider create(WatchParameters params) {
        return create(params, ProviderType.AUTO, null, null);
    }

    public DbWatchProvider create(WatchParameters params, ProviderType type) {
        return create(params, type, null, null);
    }

    /**
     * @param queueName     notification queue, the configured default when null or blank
     * @param pollingPeriod polling period, the configured default when null
     * @throws DbWatchValidationException if the parameters are invalid or the period is negative
     */
    public DbWatchProvider create(WatchParameters params, ProviderType type, String queueName, Duration pollingPeriod) {
        if (params == null) {
            throw new DbWatchValidationException("Watch parameters cannot be null");
        }
        if (pollingPeriod != null && pollingPeriod.isNegative()) {
            throw new DbWatchValidationException("Polling period cannot be negative: " + pollingPeriod);
        }

        String queue = queueName == null || queueName.isBlank() ? defaultQueueName : queueName.trim();
        Duration period = pollingPeriod == null || pollingPeriod.isZero() ? defaultPollingPeriod : pollingPeriod;
        ProviderType requested = type != null ? type : ProviderType.AUTO;

        WatchParameters validated = validator.validateAndAdjust(params.copy());

        DetectionStrategy strategy = selectStrategy(requested, validated, queue);
        ChangeDetector detector = switch (strategy) {
            case POLLING -> new PollingChangeDetector(validated, period, stopGracePeriodMs,
                    connectionManager, ledgerReader, pollingThreadFactory);
            case PUSH -> new PushChangeDetector(validated, queue, notificationService);
        };

        log.info("Created {} watch session for {} (requested: {})", strategy, validated.getTables(), requested);
        return new DbWatchProvider(validated, strategy, detector, ledgerLifecycleManager, errorTracker);
    }

    private DetectionStrategy selectStrategy(ProviderType type, WatchParameters params, String queue) {
        return switch (type) {
            case POLLING -> DetectionStrategy.POLLING;
            case SERVICE_BROKER -> DetectionStrategy.PUSH;
            case AUTO -> notificationService != null && notificationService.isListenerStarted(params.getDataSource(), queue)
                    ? DetectionStrategy.PUSH
                    : DetectionStrategy.POLLING;
        };
    }

    public String getDefaultQueueName() {
        return defaultQueueName;
    }

    public Duration getDefaultPollingPeriod() {
        return defaultPollingPeriod;
    }
}
