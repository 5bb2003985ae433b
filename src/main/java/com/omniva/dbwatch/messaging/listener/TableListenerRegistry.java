package com.omniva.dbwatch.messaging.listener;

import com.omniva.dbwatch.messaging.model.ChangeType;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;
import com.omniva.dbwatch.messaging.model.TableChangedEvent;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Discovers {@link TableChangeListener} beans and routes table-changed
 * events to them, one call per change type.
 */
@Component
public class TableListenerRegistry implements DbWatchListener {

    private static final Logger log = LoggerFactory.getLogger(TableListenerRegistry.class);
    private final ApplicationContext applicationContext;
    private final Map<QualifiedTableName, TableListenerRegistryRecord> listeners = new ConcurrentHashMap<>();

    public TableListenerRegistry(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @PostConstruct
    public void discoverAndRegisterListeners() {
        log.info("Starting table listener discovery...");

        Map<String, Object> annotatedBeans = applicationContext.getBeansWithAnnotation(TableChangeListener.class);

        int registeredCount = 0;
        for (Map.Entry<String, Object> entry : annotatedBeans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (bean instanceof TableListener tableListener) {
                try {
                    if (register(beanName, tableListener)) {
                        registeredCount++;
                    }
                } catch (RuntimeException e) {
                    log.error("Failed to register table listener {}: {}", beanName, e.getMessage(), e);
                }
            } else {
                log.warn("Bean {} is annotated with @TableChangeListener but doesn't implement TableListener", beanName);
            }
        }

        log.info("Successfully registered {} table listeners", registeredCount);
        listeners.forEach((table, registration) ->
                log.info("  {} -> {} (events: {}, enabled: {})",
                        table,
                        registration.beanName(),
                        Arrays.toString(registration.config().events()),
                        registration.isEnabled()));
    }

    /**
     * @return true if the listener was registered
     */
    public boolean register(String beanName, TableListener listener) {
        TableChangeListener annotation = listener.getClass().getAnnotation(TableChangeListener.class);
        if (annotation == null) {
            log.warn("TableListener {} missing @TableChangeListener annotation", beanName);
            return false;
        }

        QualifiedTableName table = QualifiedTableName.parse(annotation.table());
        if (!table.isValid()) {
            log.error("TableListener {} has empty table name", beanName);
            return false;
        }

        if (listeners.containsKey(table)) {
            log.error("Duplicate table listener registration for table {}: {} conflicts with {}",
                    table, beanName, listeners.get(table).beanName());
            return false;
        }

        TableListenerRegistryRecord registration = new TableListenerRegistryRecord(table, listener, annotation, beanName);
        if (!registration.isEnabled()) {
            log.warn("TableListener {} for {} is disabled", beanName, table);
            return false;
        }

        listeners.put(table, registration);
        try {
            listener.onRegistered(table.getFullName());
        } catch (RuntimeException e) {
            log.error("Error during listener registration for table {}: {}", table, e.getMessage(), e);
            listeners.remove(table);
            throw e;
        }
        return true;
    }

    // ===== ROUTING =====

    @Override
    public void onTableChanged(TableChangedEvent event) {
        TableListenerRegistryRecord registration = listeners.get(event.getTable());
        if (registration == null) {
            log.warn("No listener registered for table: {}", event.getTable());
            return;
        }

        for (ChangeType changeType : event.getChanges().toSet()) {
            if (!registration.supportsEvent(changeType)) {
                log.debug("Listener for table {} doesn't support {} events", event.getTable(), changeType);
                continue;
            }
            switch (changeType) {
                case INSERT -> registration.listener().onInsert(event);
                case UPDATE -> registration.listener().onUpdate(event);
                case DELETE -> registration.listener().onDelete(event);
            }
        }
    }

    // ===== PUBLIC API METHODS =====

    public TableListenerRegistryRecord get(QualifiedTableName table) {
        return listeners.get(table);
    }

    public TableListenerRegistryRecord get(String tableName) {
        return listeners.get(QualifiedTableName.parse(tableName));
    }

    /**
     * Tables with a registered listener, sorted by schema then name
     */
    public List<QualifiedTableName> getTables() {
        return listeners.keySet().stream().sorted().toList();
    }

    public Map<QualifiedTableName, TableListenerRegistryRecord> getAllListeners() {
        return new TreeMap<>(listeners);
    }

    public int getListenerCount() {
        return listeners.size();
    }
}
