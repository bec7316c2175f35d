package com.dbkeeper.server;

import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.enums.JobRunStatusEnum;
import com.dbkeeper.server.enums.SyncModeEnum;
import com.dbkeeper.server.exception.DbException;
import com.dbkeeper.server.model.entity.JobRunEntity;
import com.dbkeeper.server.model.internal.BackupFile;
import com.dbkeeper.server.model.internal.BandwidthPolicy;
import com.dbkeeper.server.model.internal.RetentionPolicy;
import com.dbkeeper.server.model.internal.ScheduledJob;
import com.dbkeeper.server.model.internal.SummarySettings;
import com.dbkeeper.server.model.internal.SyncSettings;
import com.dbkeeper.server.service.store.JobStore;
import com.dbkeeper.server.util.BackupFileUtil;
import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JobStore kept in memory for service tests. Backup files come from
 * {@link #setBackupFiles(List)} when set, otherwise from the backup root on disk.
 */
@Getter
@Setter
public class InMemoryJobStore implements JobStore {

    private final Map<String, ScheduledJob> storedJobs = new LinkedHashMap<>();

    private final List<JobRunEntity> runs = new ArrayList<>();

    private final AtomicLong idSequence = new AtomicLong();

    private RetentionPolicy retentionPolicy = RetentionPolicy.builder()
            .enabled(false)
            .schedule("0 6 * * 0")
            .keepFullCount(2)
            .keepDiffPerFull(1)
            .keepOrphanDiff(0)
            .build();

    private BandwidthPolicy bandwidthPolicy = BandwidthPolicy.builder()
            .enabled(false)
            .peakStart(LocalTime.of(8, 0))
            .peakEnd(LocalTime.of(20, 0))
            .build();

    private SyncSettings syncSettings = SyncSettings.builder()
            .enabled(false)
            .mode(SyncModeEnum.MANUAL)
            .syncTime(LocalTime.of(6, 0))
            .bufferMinutes(30)
            .backupPath("/backup")
            .build();

    private SummarySettings summarySettings = new SummarySettings(false, LocalTime.of(8, 0));

    private boolean failureAlertsEnabled = true;

    private Path backupRoot = Path.of("/backup");

    private ZoneId zoneId = ZoneId.of("Europe/Istanbul");

    private List<BackupFile> backupFiles;

    private boolean failCreateRun;

    // thrown as is, for failures outside the DbKeeperException hierarchy
    private RuntimeException createRunError;

    private RuntimeException finalizeRunError;

    // runs once, right after the next updateJob wrote the row
    private Runnable afterUpdateJob;

    private final AtomicInteger backupListings = new AtomicInteger();

    private JobRunStatusEnum lastCleanupStatus;

    private String lastCleanupMessage;

    @Override
    public synchronized List<ScheduledJob> listEnabledJobs() {
        List<ScheduledJob> result = new ArrayList<>(this.storedJobs.values()
                .stream()
                .filter(ScheduledJob::isEnabled)
                .toList());
        for (JobKindEnum kind : JobKindEnum.values()) {
            if (kind.isSystemJob() && this.getSystemJob(kind).isEnabled()) {
                result.add(this.getSystemJob(kind));
            }
        }
        return result;
    }

    @Override
    public synchronized List<ScheduledJob> listStoredJobs(JobKindEnum kind, String subType) {
        return this.storedJobs.values()
                .stream()
                .filter(job -> job.getKind() == kind && Objects.equals(job.getSubType(), subType))
                .toList();
    }

    @Override
    public synchronized ScheduledJob getJob(String jobId) {
        JobKindEnum systemKind = JobKindEnum.fromSystemJobId(jobId);
        if (systemKind != null) {
            return this.getSystemJob(systemKind);
        }
        return this.storedJobs.get(jobId);
    }

    @Override
    public synchronized ScheduledJob getSystemJob(JobKindEnum kind) {
        ScheduledJob.ScheduledJobBuilder builder = ScheduledJob.builder().jobId(kind.getSystemJobId()).kind(kind);
        switch (kind) {
            case SYNC -> builder
                    .enabled(this.syncSettings.isEnabled() && this.syncSettings.getMode() == SyncModeEnum.SCHEDULED)
                    .cronExpression("%d %d * * *".formatted(
                            this.syncSettings.getSyncTime().getMinute(), this.syncSettings.getSyncTime().getHour()));
            case CLEANUP -> builder
                    .enabled(this.retentionPolicy.isEnabled())
                    .cronExpression(this.retentionPolicy.getSchedule());
            case SUMMARY -> builder
                    .enabled(this.summarySettings.isEnabled())
                    .cronExpression("%d %d * * *".formatted(
                            this.summarySettings.getSummaryTime().getMinute(),
                            this.summarySettings.getSummaryTime().getHour()));
            default -> throw new IllegalArgumentException(kind.name());
        }
        return builder.build();
    }

    @Override
    public synchronized ScheduledJob createJob(ScheduledJob job) {
        ScheduledJob created = job.toBuilder().jobId(String.valueOf(this.idSequence.incrementAndGet())).build();
        this.storedJobs.put(created.getJobId(), created);
        return created;
    }

    // bypasses validation, used to seed rows that no longer parse
    public synchronized ScheduledJob seedJob(ScheduledJob job) {
        return this.createJob(job);
    }

    @Override
    public synchronized ScheduledJob updateJob(ScheduledJob job) {
        if (!this.storedJobs.containsKey(job.getJobId())) {
            throw new DbException("updateJob failed. jobId is %s".formatted(job.getJobId()));
        }
        ScheduledJob updated = job.toBuilder().nextFireAt(null).build();
        this.storedJobs.put(job.getJobId(), updated);
        Runnable hook = this.afterUpdateJob;
        this.afterUpdateJob = null;
        if (hook != null) {
            hook.run();
        }
        return updated;
    }

    @Override
    public synchronized void deleteJob(String jobId) {
        this.storedJobs.remove(jobId);
    }

    @Override
    public synchronized JobRunEntity createRun(ScheduledJob job, Instant startedAt) {
        if (this.failCreateRun) {
            throw new DbException("createRun failed. database is down");
        }
        if (this.createRunError != null) {
            throw this.createRunError;
        }
        JobRunEntity jobRun = new JobRunEntity();
        jobRun.setJobRunId(this.idSequence.incrementAndGet());
        jobRun.setJobId(job.getJobId());
        jobRun.setJobKind(job.getKind().name());
        jobRun.setResourceKey(job.getResourceKey());
        jobRun.setStartedAt(Timestamp.from(startedAt));
        jobRun.setRunStatus(JobRunStatusEnum.RUNNING.getName());
        this.runs.add(jobRun);
        return jobRun;
    }

    @Override
    public synchronized void finalizeRun(JobRunEntity jobRun) {
        if (this.finalizeRunError != null) {
            throw this.finalizeRunError;
        }
        // runs are held by reference
    }

    @Override
    public synchronized List<JobRunEntity> listRuns(String jobId, int limit) {
        return this.runs.stream()
                .filter(jobRun -> jobRun.getJobId().equals(jobId))
                .sorted(Comparator.comparing(JobRunEntity::getJobRunId).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized List<JobRunEntity> listRunsBetween(Instant from, Instant to) {
        return this.runs.stream()
                .filter(jobRun -> !jobRun.getStartedAt().toInstant().isBefore(from) &&
                        jobRun.getStartedAt().toInstant().isBefore(to))
                .toList();
    }

    @Override
    public void saveRetentionPolicy(RetentionPolicy retentionPolicy) {
        this.retentionPolicy = retentionPolicy;
    }

    @Override
    public void saveBandwidthPolicy(BandwidthPolicy bandwidthPolicy) {
        this.bandwidthPolicy = bandwidthPolicy;
    }

    @Override
    public void saveSyncSettings(SyncSettings syncSettings) {
        this.syncSettings = syncSettings;
    }

    @Override
    public void saveSummarySettings(SummarySettings summarySettings) {
        this.summarySettings = summarySettings;
    }

    @Override
    public List<String> listBackupDatabases() {
        if (this.backupFiles == null) {
            return BackupFileUtil.listDatabaseNames(this.backupRoot, this.zoneId);
        }
        TreeSet<String> names = new TreeSet<>();
        this.backupFiles.forEach(backupFile -> names.add(backupFile.getDatabaseName()));
        return new ArrayList<>(names);
    }

    @Override
    public List<BackupFile> listBackupFiles(String databaseName) {
        this.backupListings.incrementAndGet();
        if (this.backupFiles == null) {
            return BackupFileUtil.listBackupFiles(this.backupRoot, databaseName, this.zoneId);
        }
        return this.backupFiles.stream()
                .filter(backupFile -> databaseName == null || backupFile.getDatabaseName().equals(databaseName))
                .toList();
    }

    @Override
    public void recordCleanupRun(Instant completedAt, JobRunStatusEnum status, String message) {
        this.lastCleanupStatus = status;
        this.lastCleanupMessage = message;
    }

    public synchronized List<JobRunEntity> runsOf(String jobId) {
        return this.runs.stream().filter(jobRun -> jobRun.getJobId().equals(jobId)).toList();
    }
}
