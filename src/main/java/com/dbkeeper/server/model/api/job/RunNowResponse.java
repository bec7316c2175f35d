package com.dbkeeper.server.model.api.job;

import com.dbkeeper.server.model.internal.ExecutionResult;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.ObjectUtils;

@Data
@NoArgsConstructor
public class RunNowResponse {

    private String jobId;

    private boolean skipped;

    private Long jobRunId;

    private String runStatus;

    private String errorMessage;

    public RunNowResponse(ExecutionResult executionResult) {
        this.jobId = executionResult.getJobId();
        this.skipped = executionResult.isSkipped();
        if (ObjectUtils.isNotEmpty(executionResult.getJobRun())) {
            this.jobRunId = executionResult.getJobRun().getJobRunId();
            this.runStatus = executionResult.getJobRun().getRunStatus();
            this.errorMessage = executionResult.getJobRun().getErrorMessage();
        }
    }
}
