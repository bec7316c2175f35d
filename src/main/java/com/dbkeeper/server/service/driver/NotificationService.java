package com.dbkeeper.server.service.driver;

import com.dbkeeper.server.model.entity.JobRunEntity;
import com.dbkeeper.server.model.internal.DailySummary;

// fire and forget, implementations must not block the caller
public interface NotificationService {

    void notifyFailure(JobRunEntity jobRun);

    void notifyDailySummary(DailySummary dailySummary);
}
