package com.dbkeeper.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum JobKindEnum {

    BACKUP(false),

    MAINTENANCE(false),

    SYNC(true),

    CLEANUP(true),

    SUMMARY(true),
    ;

    // system jobs are synthesized from settings and never stored in scheduled_job
    private final boolean systemJob;

    public String getSystemJobId() {
        return "system-" + this.name().toLowerCase();
    }

    public static JobKindEnum fromName(String name) {
        for (JobKindEnum value : values()) {
            if (value.name().equalsIgnoreCase(name)) {
                return value;
            }
        }
        return null;
    }

    public static JobKindEnum fromSystemJobId(String jobId) {
        for (JobKindEnum value : values()) {
            if (value.systemJob && value.getSystemJobId().equals(jobId)) {
                return value;
            }
        }
        return null;
    }
}
