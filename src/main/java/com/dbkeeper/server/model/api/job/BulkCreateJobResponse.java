package com.dbkeeper.server.model.api.job;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkCreateJobResponse {

    private List<ScheduledJobInfo> created = new ArrayList<>();

    private List<String> skippedDatabases = new ArrayList<>();
}
