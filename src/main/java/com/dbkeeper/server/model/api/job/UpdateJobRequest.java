package com.dbkeeper.server.model.api.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

@Data
public class UpdateJobRequest {

    private String jobId;

    // null keeps the stored value
    private String cronExpression;

    private Boolean enabled;

    private String jobSubType;

    private String jobOptions;

    @JsonIgnore
    private Long jobIdInner;
}
