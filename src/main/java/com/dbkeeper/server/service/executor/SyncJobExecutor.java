package com.dbkeeper.server.service.executor;

import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.exception.DbKeeperException;
import com.dbkeeper.server.exception.JobExecutionException;
import com.dbkeeper.server.model.internal.BandwidthLimit;
import com.dbkeeper.server.model.internal.RunMetrics;
import com.dbkeeper.server.model.internal.ScheduledJob;
import com.dbkeeper.server.model.internal.SyncResult;
import com.dbkeeper.server.model.internal.SyncSettings;
import com.dbkeeper.server.service.driver.SyncDriver;
import com.dbkeeper.server.service.store.JobStore;
import com.dbkeeper.server.util.BandwidthPolicyResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;

@Service
@Slf4j
public class SyncJobExecutor implements JobExecutor {

    private final SyncDriver syncDriver;

    private final JobStore jobStore;

    private final Clock clock;

    @Autowired
    public SyncJobExecutor(SyncDriver syncDriver, JobStore jobStore, Clock clock) {
        this.syncDriver = syncDriver;
        this.jobStore = jobStore;
        this.clock = clock;
    }

    @Override
    public JobKindEnum kind() {
        return JobKindEnum.SYNC;
    }

    @Override
    public RunMetrics run(ScheduledJob job) throws JobExecutionException {
        SyncSettings syncSettings = this.jobStore.getSyncSettings();
        // resolved per run, never cached
        BandwidthLimit limit = BandwidthPolicyResolver.effectiveLimit(
                ZonedDateTime.now(this.clock),
                this.jobStore.getBandwidthPolicy());
        if (limit.isPaused()) {
            throw new JobExecutionException("sync failed. bandwidth limit is 0 KB/s at this time of day");
        }
        SyncResult syncResult;
        try {
            syncResult = this.syncDriver.sync(syncSettings.getBackupPath(), limit);
        } catch (DbKeeperException e) {
            throw new JobExecutionException("sync failed. backupPath is %s".formatted(syncSettings.getBackupPath()), e);
        }
        log.info("sync success. archive is {}, limit is {}, files {}, original {} bytes, deduplicated {} bytes",
                syncResult.getArchiveName(),
                limit,
                syncResult.getFilesTotal(),
                syncResult.getBytesOriginal(),
                syncResult.getBytesDeduplicated());
        RunMetrics runMetrics = new RunMetrics();
        runMetrics.setDurationMillis(syncResult.getDuration() == null ? 0 : syncResult.getDuration().toMillis());
        runMetrics.setSizeBytes(syncResult.getBytesOriginal());
        runMetrics.setBytesDeduplicated(syncResult.getBytesDeduplicated());
        runMetrics.setFilesAffected((int) syncResult.getFilesTotal());
        runMetrics.setMessage("archive %s created at %s".formatted(syncResult.getArchiveName(), limit));
        runMetrics.getErrors().addAll(syncResult.getWarnings());
        return runMetrics;
    }
}
