package com.dbkeeper.server.enums;

public enum BackupTypeEnum {

    FULL,

    DIFF,

    LOG,
    ;

    public static BackupTypeEnum fromName(String name) {
        for (BackupTypeEnum value : values()) {
            if (value.name().equalsIgnoreCase(name)) {
                return value;
            }
        }
        return null;
    }
}
