package com.dbkeeper.server.enums;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;

/**
 * Scalar settings kept as key/value rows in the setting table, with the value
 * used when the row is absent. A null default means "no value".
 */
@Getter
public enum SettingKeyEnum {

    // falls back to dbkeeper.server.backup.root-path when absent
    DEFAULT_BACKUP_PATH("default_backup_path", null),

    CLEANUP_ENABLED("cleanup_enabled", "false"),

    CLEANUP_SCHEDULE("cleanup_schedule", "0 6 * * 0"),

    CLEANUP_KEEP_FULL_COUNT("cleanup_keep_full_count", "2"),

    CLEANUP_KEEP_DIFF_PER_FULL("cleanup_keep_diff_per_full", "1"),

    CLEANUP_KEEP_ORPHAN_DIFF("cleanup_keep_orphan_diff", "0"),

    CLEANUP_LAST_RUN_AT("cleanup_last_run_at", null),

    CLEANUP_LAST_RUN_STATUS("cleanup_last_run_status", null),

    CLEANUP_LAST_RUN_MESSAGE("cleanup_last_run_message", null),

    BORG_SYNC_ENABLED("borg_sync_enabled", "true"),

    BORG_SYNC_MODE("borg_sync_mode", "after_backups"),

    BORG_SYNC_TIME("borg_sync_time", "06:00"),

    BORG_SYNC_BUFFER_MINUTES("borg_sync_buffer_minutes", "30"),

    BANDWIDTH_LIMIT_ENABLED("borg_bandwidth_limit_enabled", "true"),

    BANDWIDTH_PEAK_LIMIT("borg_bandwidth_peak_limit", "5000"),

    BANDWIDTH_OFFPEAK_LIMIT("borg_bandwidth_offpeak_limit", null),

    BANDWIDTH_PEAK_START("borg_bandwidth_peak_start", "08:00"),

    BANDWIDTH_PEAK_END("borg_bandwidth_peak_end", "20:00"),

    BANDWIDTH_WEEKEND_UNLIMITED("borg_bandwidth_weekend_unlimited", "true"),

    DAILY_SUMMARY_ENABLED("daily_summary_enabled", "true"),

    SUMMARY_TIME("summary_time", "08:00"),

    FAILURE_ALERTS_ENABLED("failure_alerts_enabled", "true"),
    ;

    private final String key;

    private final String defaultValue;

    SettingKeyEnum(String key, String defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public static List<SettingKeyEnum> getAllSettingKeyEnum() {
        return Arrays.stream(SettingKeyEnum.values()).toList();
    }
}
