package com.omniva.dbwatch.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.omniva.dbwatch.config.DbWatchConfig;
import com.omniva.dbwatch.engine.DbWatchEngine;
import com.omniva.dbwatch.engine.DbWatchProviderFactory;
import com.omniva.dbwatch.engine.ProviderType;
import com.omniva.dbwatch.engine.crankshaft.DbWatchThreadFactory;
import com.omniva.dbwatch.engine.fault.ErrorTracker;
import com.omniva.dbwatch.engine.fuelsystem.DbWatchConnectionManager;
import com.omniva.dbwatch.engine.ignition.WatchParametersValidator;
import com.omniva.dbwatch.engine.ledger.LedgerLifecycleManager;
import com.omniva.dbwatch.engine.ledger.ReferenceCountRegistry;
import com.omniva.dbwatch.engine.transmission.QueryNotificationService;
import com.omniva.dbwatch.engine.transmission.ServiceBrokerNotificationService;
import com.omniva.dbwatch.messaging.listener.TableChangeListener;
import com.omniva.dbwatch.messaging.listener.TableListenerRegistry;
import com.omniva.dbwatch.messaging.model.MonitoredChanges;
import com.omniva.dbwatch.messaging.model.NotificationMessageParser;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import com.omniva.dbwatch.messaging.model.WatchOptions;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;

/**
 * Auto-configuration for DB Watch
 * Enabled by default, can be disabled with: db-watch.enabled=false
 */
@AutoConfiguration
@ConditionalOnClass(DbWatchEngine.class)
@ConditionalOnProperty(prefix = "db-watch", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(DbWatchProperties.class)
@ComponentScan(
        includeFilters = {
                // Find @TableChangeListener implementations anywhere
                @ComponentScan.Filter(
                        type = FilterType.ANNOTATION,
                        classes = TableChangeListener.class
                )
        },
        basePackageClasses = TableListenerRegistry.class
)
public class DbWatchAutoConfiguration {

    // 1. Data layer

    @Bean("dbWatchHikariConfig")
    @ConditionalOnMissingBean(name = "dbWatchHikariConfig")
    public HikariConfig dbWatchHikariConfig(DbWatchProperties properties) {
        HikariConfig hikariConfig = new HikariConfig();
        DbWatchProperties.DataSourceConfig datasource = properties.getDatasource();
        DbWatchProperties.DataSourceConfig.HikariProperties hikariProps = datasource.getHikari();

        hikariConfig.setJdbcUrl(datasource.getUrl());
        hikariConfig.setUsername(datasource.getUsername());
        hikariConfig.setPassword(datasource.getPassword());
        hikariConfig.setDriverClassName(datasource.getDriverClassName());

        // Pool settings
        hikariConfig.setMaximumPoolSize(hikariProps.getMaximumPoolSize());
        hikariConfig.setMinimumIdle(hikariProps.getMinimumIdle());
        hikariConfig.setConnectionTimeout(hikariProps.getConnectionTimeout());
        hikariConfig.setIdleTimeout(hikariProps.getIdleTimeout());
        hikariConfig.setMaxLifetime(hikariProps.getMaxLifetime());
        hikariConfig.setPoolName(hikariProps.getPoolName());
        hikariConfig.setLeakDetectionThreshold(hikariProps.getLeakDetectionThreshold());

        // Provisioning and polling manage their own transactions
        hikariConfig.setAutoCommit(true);
        hikariConfig.setConnectionTestQuery("SELECT 1");
        hikariConfig.setValidationTimeout(5000);

        if (hikariProps.getDataSourceProperties() != null) {
            hikariProps.getDataSourceProperties().forEach(hikariConfig::addDataSourceProperty);
        }
        return hikariConfig;
    }

    @Bean("dbWatchDataSource")
    @ConditionalOnMissingBean(name = "dbWatchDataSource")
    public DataSource dbWatchDataSource(@Qualifier("dbWatchHikariConfig") HikariConfig config) {
        return new HikariDataSource(config);
    }

    // 2. Configuration

    @Bean
    @ConditionalOnMissingBean
    public DbWatchConfig dbWatchConfig(DbWatchProperties properties) {
        return new DbWatchConfigAdapter(properties);
    }

    // 3. Core infrastructure (depends on config/data)

    @Bean
    @ConditionalOnMissingBean
    public ErrorTracker errorTracker() {
        return new ErrorTracker();
    }

    @Bean
    @ConditionalOnMissingBean
    public DbWatchConnectionManager dbWatchConnectionManager(DbWatchConfig config) {
        return new DbWatchConnectionManager(config.getMaxOpenAttempts(), config.getOpenRetryDelayMs());
    }

    @Bean
    @ConditionalOnMissingBean
    public LedgerLifecycleManager ledgerLifecycleManager(DbWatchConnectionManager connectionManager) {
        return new LedgerLifecycleManager(connectionManager, ReferenceCountRegistry.shared());
    }

    @Bean
    @ConditionalOnMissingBean
    public WatchParametersValidator watchParametersValidator(DbWatchConnectionManager connectionManager) {
        return new WatchParametersValidator(connectionManager);
    }

    // 4. Detection components (depends on core infrastructure)

    @Bean
    @ConditionalOnMissingBean
    public NotificationMessageParser notificationMessageParser(ErrorTracker errorTracker,
                                                               ObjectProvider<ObjectMapper> objectMapper) {
        return new NotificationMessageParser(errorTracker, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(QueryNotificationService.class)
    public ServiceBrokerNotificationService serviceBrokerNotificationService(DbWatchConfig config,
                                                                             DbWatchConnectionManager connectionManager,
                                                                             NotificationMessageParser messageParser,
                                                                             ErrorTracker errorTracker) {
        return new ServiceBrokerNotificationService(connectionManager, messageParser, errorTracker,
                new DbWatchThreadFactory("DbWatch-notify"), config.getNotificationWaitTimeoutMs());
    }

    @Bean
    @ConditionalOnMissingBean
    public DbWatchProviderFactory dbWatchProviderFactory(DbWatchConfig config,
                                                         DbWatchConnectionManager connectionManager,
                                                         WatchParametersValidator validator,
                                                         LedgerLifecycleManager ledgerLifecycleManager,
                                                         QueryNotificationService notificationService,
                                                         ErrorTracker errorTracker) {
        return new DbWatchProviderFactory(connectionManager, validator, ledgerLifecycleManager,
                notificationService, errorTracker, config.getQueueName(), config.getPollingPeriod(),
                config.getStopGracePeriodMs());
    }

    // 5. Engine (depends on everything)

    @Bean
    @ConditionalOnMissingBean
    public DbWatchEngine dbWatchEngine(DbWatchConfig config,
                                       @Qualifier("dbWatchDataSource") DataSource dataSource,
                                       DbWatchProviderFactory providerFactory,
                                       QueryNotificationService notificationService,
                                       TableListenerRegistry listenerRegistry,
                                       ErrorTracker errorTracker) {
        return new DbWatchEngine(config, dataSource, providerFactory, notificationService,
                listenerRegistry, errorTracker);
    }

    /**
     * Adapter to convert properties to config interface
     */
    private record DbWatchConfigAdapter(DbWatchProperties properties) implements DbWatchConfig {

        @Override
        public List<QualifiedTableName> getTables() {
            return properties.getTables().stream()
                    .map(QualifiedTableName::parse)
                    .filter(QualifiedTableName::isValid)
                    .toList();
        }

        @Override
        public MonitoredChanges getMonitoredChanges() {
            return MonitoredChanges.of(properties.getMonitoredChanges());
        }

        @Override
        public WatchOptions getWatchOptions() {
            DbWatchProperties.ObjectsConfig objects = properties.getObjects();
            return WatchOptions.builder()
                    .objectSchema(objects.getSchema())
                    .objectPrefix(objects.getPrefix())
                    .ledgerBaseName(objects.getLedgerBaseName())
                    .triggerBaseName(objects.getTriggerBaseName())
                    .build();
        }

        @Override
        public ProviderType getProviderType() {
            return properties.getProviderType();
        }

        @Override
        public Duration getPollingPeriod() {
            return properties.getPollingPeriod();
        }

        @Override
        public String getQueueName() {
            return properties.getQueueName();
        }

        @Override
        public boolean isStartNotificationListener() {
            return properties.isStartNotificationListener();
        }

        @Override
        public int getNotificationWaitTimeoutMs() {
            return properties.getNotification().getWaitTimeoutMs();
        }

        @Override
        public int getMaxOpenAttempts() {
            return properties.getConnection().getMaxOpenAttempts();
        }

        @Override
        public long getOpenRetryDelayMs() {
            return properties.getConnection().getOpenRetryDelayMs();
        }

        @Override
        public long getStopGracePeriodMs() {
            return properties.getShutdown().getGracePeriodMs();
        }
    }
}
