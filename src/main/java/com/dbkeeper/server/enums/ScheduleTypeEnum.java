package com.dbkeeper.server.enums;

public enum ScheduleTypeEnum {

    DAILY,

    WEEKLY,
    ;

    public static ScheduleTypeEnum fromName(String name) {
        for (ScheduleTypeEnum value : values()) {
            if (value.name().equalsIgnoreCase(name)) {
                return value;
            }
        }
        return null;
    }
}
