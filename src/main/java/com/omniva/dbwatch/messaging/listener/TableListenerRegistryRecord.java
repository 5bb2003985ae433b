package com.omniva.dbwatch.messaging.listener;

import com.omniva.dbwatch.messaging.model.ChangeType;
import com.omniva.dbwatch.messaging.model.QualifiedTableName;

import java.util.Arrays;

public record TableListenerRegistryRecord(
        QualifiedTableName table,
        TableListener listener,
        TableChangeListener config,
        String beanName
) {

    public boolean isEnabled() {
        return config.enabled();
    }

    public boolean supportsEvent(ChangeType changeType) {
        return Arrays.asList(config.events()).contains(changeType);
    }
}
