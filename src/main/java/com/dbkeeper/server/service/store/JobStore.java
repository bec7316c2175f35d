package com.dbkeeper.server.service.store;

import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.enums.JobRunStatusEnum;
import com.dbkeeper.server.model.entity.JobRunEntity;
import com.dbkeeper.server.model.internal.BackupFile;
import com.dbkeeper.server.model.internal.BandwidthPolicy;
import com.dbkeeper.server.model.internal.RetentionPolicy;
import com.dbkeeper.server.model.internal.ScheduledJob;
import com.dbkeeper.server.model.internal.SummarySettings;
import com.dbkeeper.server.model.internal.SyncSettings;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Persistent state consumed by the scheduler: stored jobs, run history, policy
 * settings and the backup file listing. System jobs (sync, cleanup, summary)
 * are synthesized from settings under the ids {@code system-<kind>}.
 */
public interface JobStore {

    // enabled stored jobs followed by enabled system jobs
    List<ScheduledJob> listEnabledJobs();

    List<ScheduledJob> listStoredJobs(JobKindEnum kind, String subType);

    // null when unknown
    ScheduledJob getJob(String jobId);

    ScheduledJob getSystemJob(JobKindEnum kind);

    ScheduledJob createJob(ScheduledJob job);

    ScheduledJob updateJob(ScheduledJob job);

    void deleteJob(String jobId);

    JobRunEntity createRun(ScheduledJob job, Instant startedAt);

    void finalizeRun(JobRunEntity jobRun);

    List<JobRunEntity> listRuns(String jobId, int limit);

    // runs started in [from, to)
    List<JobRunEntity> listRunsBetween(Instant from, Instant to);

    RetentionPolicy getRetentionPolicy();

    void saveRetentionPolicy(RetentionPolicy retentionPolicy);

    BandwidthPolicy getBandwidthPolicy();

    void saveBandwidthPolicy(BandwidthPolicy bandwidthPolicy);

    SyncSettings getSyncSettings();

    void saveSyncSettings(SyncSettings syncSettings);

    SummarySettings getSummarySettings();

    void saveSummarySettings(SummarySettings summarySettings);

    boolean isFailureAlertsEnabled();

    Path getBackupRoot();

    List<String> listBackupDatabases();

    // every database when databaseName is null
    List<BackupFile> listBackupFiles(String databaseName);

    void recordCleanupRun(Instant completedAt, JobRunStatusEnum status, String message);
}
