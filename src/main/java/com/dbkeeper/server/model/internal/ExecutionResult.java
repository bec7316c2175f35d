package com.dbkeeper.server.model.internal;

import com.dbkeeper.server.enums.JobRunStatusEnum;
import com.dbkeeper.server.model.entity.JobRunEntity;
import lombok.Data;
import org.apache.commons.lang3.ObjectUtils;

@Data
public class ExecutionResult {

    private String jobId;

    // true when the job was already running and no run was created
    private boolean skipped;

    private JobRunEntity jobRun;

    private ExecutionResult() {}

    public static ExecutionResult skipped(String jobId) {
        ExecutionResult result = new ExecutionResult();
        result.jobId = jobId;
        result.skipped = true;
        return result;
    }

    public static ExecutionResult of(String jobId, JobRunEntity jobRun) {
        ExecutionResult result = new ExecutionResult();
        result.jobId = jobId;
        result.jobRun = jobRun;
        return result;
    }

    public JobRunStatusEnum getStatus() {
        if (this.skipped || ObjectUtils.isEmpty(this.jobRun)) {
            return null;
        }
        return JobRunStatusEnum.fromName(this.jobRun.getRunStatus());
    }
}
