package com.dbkeeper.server.model.api.job;

import com.dbkeeper.server.model.internal.ScheduledJob;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.ObjectUtils;

@Data
@NoArgsConstructor
public class ScheduledJobInfo {

    private String jobId;

    private String jobKind;

    private String jobSubType;

    private String cronExpression;

    private String databaseName;

    private boolean enabled;

    private String nextFireAt;

    // set when the job could not be armed
    private String unscheduledReason;

    public ScheduledJobInfo(ScheduledJob job) {
        this.jobId = job.getJobId();
        this.jobKind = ObjectUtils.isEmpty(job.getKind()) ? null : job.getKind().name();
        this.jobSubType = job.getSubType();
        this.cronExpression = job.getCronExpression();
        this.databaseName = job.getResourceKey();
        this.enabled = job.isEnabled();
        this.nextFireAt = ObjectUtils.isEmpty(job.getNextFireAt()) ? null : job.getNextFireAt().toString();
    }

    public ScheduledJobInfo(ScheduledJob job, String unscheduledReason) {
        this(job);
        this.unscheduledReason = unscheduledReason;
    }
}
