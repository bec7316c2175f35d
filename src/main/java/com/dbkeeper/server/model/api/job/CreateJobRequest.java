package com.dbkeeper.server.model.api.job;

import com.dbkeeper.server.enums.JobKindEnum;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

@Data
public class CreateJobRequest {

    // BACKUP or MAINTENANCE
    private String jobKind;

    private String jobSubType;

    private String cronExpression;

    private String databaseName;

    private Boolean enabled;

    // json object
    private String jobOptions;

    @JsonIgnore
    private JobKindEnum jobKindEnum;
}
