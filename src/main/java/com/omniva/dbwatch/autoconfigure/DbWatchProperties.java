package com.omniva.dbwatch.autoconfigure;

import com.omniva.dbwatch.engine.ProviderType;
import com.omniva.dbwatch.messaging.model.ChangeType;
import com.omniva.dbwatch.messaging.model.WatchOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@ConfigurationProperties(prefix = "db-watch")
public class DbWatchProperties {

    private boolean enabled = true;
    private ProviderType providerType = ProviderType.AUTO;
    private String queueName = "DbWatchNotifications";
    private Duration pollingPeriod = Duration.ofSeconds(5);

    /**
     * Start the Service Broker listener with provider type AUTO, so push detection is used where available
     */
    private boolean startNotificationListener = false;

    /**
     * Tables to watch; when empty, the tables of the registered @TableChangeListener beans
     */
    private List<String> tables = new ArrayList<>();
    private Set<ChangeType> monitoredChanges = EnumSet.allOf(ChangeType.class);

    @NestedConfigurationProperty
    private ObjectsConfig objects = new ObjectsConfig();

    @NestedConfigurationProperty
    private DataSourceConfig datasource = new DataSourceConfig();

    @NestedConfigurationProperty
    private ConnectionConfig connection = new ConnectionConfig();

    @NestedConfigurationProperty
    private NotificationConfig notification = new NotificationConfig();

    @NestedConfigurationProperty
    private ShutdownConfig shutdown = new ShutdownConfig();

    @Data
    public static class ObjectsConfig {
        private String schema = WatchOptions.DEFAULT_OBJECT_SCHEMA;
        private String prefix = "";
        private String ledgerBaseName = WatchOptions.DEFAULT_LEDGER_BASE_NAME;
        private String triggerBaseName = WatchOptions.DEFAULT_TRIGGER_BASE_NAME;
    }

    @Data
    public static class DataSourceConfig {
        private String url;
        private String username;
        private String password;
        private String driverClassName = "com.microsoft.sqlserver.jdbc.SQLServerDriver";

        @NestedConfigurationProperty
        private HikariProperties hikari = new HikariProperties();

        @Data
        public static class HikariProperties {
            private int maximumPoolSize = 5;
            private int minimumIdle = 1;
            private long connectionTimeout = 30000;
            private long idleTimeout = 0; // No timeout for WAITFOR
            private long maxLifetime = 0;
            private String poolName = "DbWatchPool";
            private long leakDetectionThreshold = 0; // Disabled for WAITFOR
            private Map<String, String> dataSourceProperties = getDefaultDataSourceProperties();

            private static Map<String, String> getDefaultDataSourceProperties() {
                Map<String, String> defaults = new HashMap<>();
                defaults.put("sendStringParametersAsUnicode", "true");
                defaults.put("responseBuffering", "adaptive");
                defaults.put("lockTimeout", "-1");
                defaults.put("queryTimeout", "0");
                defaults.put("socketTimeout", "0");
                defaults.put("applicationName", "DbWatch");
                return defaults;
            }
        }
    }

    @Data
    public static class ConnectionConfig {
        private int maxOpenAttempts = 5;
        private long openRetryDelayMs = 1000;
    }

    @Data
    public static class NotificationConfig {
        private int waitTimeoutMs = 5000;
    }

    @Data
    public static class ShutdownConfig {
        private long gracePeriodMs = 2000;
    }
}
