package com.omniva.dbwatch.messaging.model;

import lombok.Getter;

/**
 * Kind of DML a trigger stamps into the change ledger
 */
@Getter
public enum ChangeType {
    INSERT(0x1),
    UPDATE(0x2),
    DELETE(0x4);

    private final int flag;

    ChangeType(int flag) {
        this.flag = flag;
    }
}
