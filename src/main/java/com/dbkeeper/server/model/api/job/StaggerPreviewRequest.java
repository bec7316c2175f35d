package com.dbkeeper.server.model.api.job;

import com.dbkeeper.server.enums.ScheduleTypeEnum;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

@Data
public class StaggerPreviewRequest {

    private Integer count;

    private String scheduleType;

    private Integer startHour;

    private Integer windowHours;

    private Integer weekDay;

    @JsonIgnore
    private ScheduleTypeEnum scheduleTypeEnum;
}
