package com.dbkeeper.server.service.executor;

import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.enums.MaintenanceTypeEnum;
import com.dbkeeper.server.exception.DbKeeperException;
import com.dbkeeper.server.exception.JobExecutionException;
import com.dbkeeper.server.model.internal.BackupCompletedEvent;
import com.dbkeeper.server.model.internal.MaintenanceResult;
import com.dbkeeper.server.model.internal.RunMetrics;
import com.dbkeeper.server.model.internal.ScheduledJob;
import com.dbkeeper.server.service.driver.DatabaseDriver;
import com.dbkeeper.server.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
@Slf4j
public class MaintenanceJobExecutor implements JobExecutor {

    private final DatabaseDriver databaseDriver;

    private final ApplicationEventPublisher applicationEventPublisher;

    private final Clock clock;

    @Autowired
    public MaintenanceJobExecutor(
            DatabaseDriver databaseDriver,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.databaseDriver = databaseDriver;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    @Override
    public JobKindEnum kind() {
        return JobKindEnum.MAINTENANCE;
    }

    @Override
    public RunMetrics run(ScheduledJob job) throws JobExecutionException {
        MaintenanceTypeEnum maintenanceType = MaintenanceTypeEnum.fromName(job.getSubType());
        if (ObjectUtils.isEmpty(maintenanceType)) {
            throw new JobExecutionException("maintenance failed. unknown maintenance type. " +
                    "jobId is %s, subType is %s".formatted(job.getJobId(), job.getSubType()));
        }
        MaintenanceResult maintenanceResult;
        try {
            maintenanceResult = this.databaseDriver.runMaintenance(
                    job.getResourceKey(),
                    maintenanceType,
                    JsonUtil.deserializeStringToMap(job.getOptions()));
        } catch (DbKeeperException e) {
            throw new JobExecutionException("maintenance failed. jobId is %s, database is %s"
                    .formatted(job.getJobId(), job.getResourceKey()), e);
        }
        log.info("maintenance success. jobId is {}, database is {}, type is {}",
                job.getJobId(), job.getResourceKey(), maintenanceType);
        this.applicationEventPublisher.publishEvent(
                new BackupCompletedEvent(job.getJobId(), job.getResourceKey(), this.clock.instant()));
        RunMetrics runMetrics = new RunMetrics();
        runMetrics.setDurationMillis(maintenanceResult.getDuration().toMillis());
        runMetrics.setMessage(maintenanceResult.getMessage());
        return runMetrics;
    }
}
