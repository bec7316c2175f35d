package com.dbkeeper.server.model.internal;

import com.dbkeeper.server.enums.JobKindEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledJob {

    // row id for stored jobs, "system-<kind>" for system jobs
    private String jobId;

    private JobKindEnum kind;

    private String cronExpression;

    // database name, null for global jobs
    private String resourceKey;

    private boolean enabled;

    // null while not armed
    private Instant nextFireAt;

    private String subType;

    private String options;
}
