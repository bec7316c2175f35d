package com.dbkeeper.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum MaintenanceTypeEnum {

    INDEX("Index optimization completed"),

    INTEGRITY("Integrity check completed"),

    STATS("Statistics update completed"),
    ;

    private final String completedMessage;

    public static MaintenanceTypeEnum fromName(String name) {
        for (MaintenanceTypeEnum value : values()) {
            if (value.name().equalsIgnoreCase(name)) {
                return value;
            }
        }
        return null;
    }
}
