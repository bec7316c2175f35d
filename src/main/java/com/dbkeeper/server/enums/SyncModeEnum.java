package com.dbkeeper.server.enums;

import lombok.Getter;

@Getter
public enum SyncModeEnum {

    SCHEDULED("scheduled"),

    AFTER_BACKUPS("after_backups"),

    MANUAL("manual"),
    ;

    // value stored in the setting table
    private final String settingValue;

    SyncModeEnum(String settingValue) {
        this.settingValue = settingValue;
    }

    public static SyncModeEnum fromSettingValue(String settingValue) {
        for (SyncModeEnum e : SyncModeEnum.values()) {
            if (e.settingValue.equalsIgnoreCase(settingValue) || e.name().equalsIgnoreCase(settingValue)) {
                return e;
            }
        }
        return null;
    }
}
