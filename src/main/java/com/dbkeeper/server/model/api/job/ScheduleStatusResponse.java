package com.dbkeeper.server.model.api.job;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleStatusResponse {

    private List<ScheduledJobInfo> scheduled;

    private List<ScheduledJobInfo> unscheduled;
}
