package com.dbkeeper.server.service.executor;

import com.dbkeeper.server.enums.BackupTypeEnum;
import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.exception.DbKeeperException;
import com.dbkeeper.server.exception.JobExecutionException;
import com.dbkeeper.server.model.internal.BackupCompletedEvent;
import com.dbkeeper.server.model.internal.BackupResult;
import com.dbkeeper.server.model.internal.RunMetrics;
import com.dbkeeper.server.model.internal.ScheduledJob;
import com.dbkeeper.server.service.driver.DatabaseDriver;
import com.dbkeeper.server.service.store.JobStore;
import com.dbkeeper.server.util.BackupFileUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;

@Service
@Slf4j
public class BackupJobExecutor implements JobExecutor {

    private final DatabaseDriver databaseDriver;

    private final JobStore jobStore;

    private final ApplicationEventPublisher applicationEventPublisher;

    private final Clock clock;

    @Autowired
    public BackupJobExecutor(
            DatabaseDriver databaseDriver,
            JobStore jobStore,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.databaseDriver = databaseDriver;
        this.jobStore = jobStore;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    @Override
    public JobKindEnum kind() {
        return JobKindEnum.BACKUP;
    }

    @Override
    public RunMetrics run(ScheduledJob job) throws JobExecutionException {
        BackupTypeEnum backupType = BackupTypeEnum.fromName(job.getSubType());
        if (ObjectUtils.isEmpty(backupType)) {
            throw new JobExecutionException("backup failed. unknown backup type. jobId is %s, subType is %s"
                    .formatted(job.getJobId(), job.getSubType()));
        }
        BackupResult backupResult;
        try {
            Path targetFile = BackupFileUtil.buildBackupFilePath(
                    this.jobStore.getBackupRoot(),
                    job.getResourceKey(),
                    backupType,
                    LocalDateTime.now(this.clock));
            backupResult = this.databaseDriver.runBackup(job.getResourceKey(), backupType, targetFile);
        } catch (DbKeeperException e) {
            throw new JobExecutionException("backup failed. jobId is %s, database is %s"
                    .formatted(job.getJobId(), job.getResourceKey()), e);
        }
        log.info("backup success. jobId is {}, database is {}, file is {}",
                job.getJobId(), job.getResourceKey(), backupResult.getFilePath());
        this.applicationEventPublisher.publishEvent(
                new BackupCompletedEvent(job.getJobId(), job.getResourceKey(), this.clock.instant()));
        RunMetrics runMetrics = new RunMetrics();
        runMetrics.setDurationMillis(backupResult.getDuration().toMillis());
        runMetrics.setSizeBytes(backupResult.getSizeBytes());
        runMetrics.setFilesAffected(1);
        runMetrics.setFilePath(backupResult.getFilePath());
        runMetrics.setMessage("%s backup completed".formatted(backupType));
        return runMetrics;
    }
}
