package com.dbkeeper.server.model.api.job;

import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.enums.ScheduleTypeEnum;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.List;

@Data
public class BulkCreateJobRequest {

    private String jobKind;

    private String jobSubType;

    private List<String> databaseNames;

    // DAILY or WEEKLY
    private String scheduleType;

    private Integer startHour;

    private Integer windowHours;

    private Integer weekDay;

    private String jobOptions;

    // skip databases that already have a job of this kind and sub type, true when absent
    private Boolean skipExisting;

    @JsonIgnore
    private JobKindEnum jobKindEnum;

    @JsonIgnore
    private ScheduleTypeEnum scheduleTypeEnum;
}
