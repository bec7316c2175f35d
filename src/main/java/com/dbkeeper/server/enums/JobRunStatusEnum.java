package com.dbkeeper.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum JobRunStatusEnum {

    RUNNING("RUNNING"),

    SUCCESS("SUCCESS"),

    FAILED("FAILED"),

    PARTIAL("PARTIAL"),

    UNKNOWN("UNKNOWN")
    ;

    private final String name;

    public static JobRunStatusEnum fromName(String name) {
        for (JobRunStatusEnum value : values()) {
            if (value.name.equals(name)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
