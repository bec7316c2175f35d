package com.dbkeeper.server.service.store;

import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.enums.JobRunStatusEnum;
import com.dbkeeper.server.enums.SettingKeyEnum;
import com.dbkeeper.server.enums.SyncModeEnum;
import com.dbkeeper.server.exception.DbException;
import com.dbkeeper.server.exception.ValidationException;
import com.dbkeeper.server.model.entity.JobRunEntity;
import com.dbkeeper.server.model.entity.ScheduledJobEntity;
import com.dbkeeper.server.model.internal.BackupFile;
import com.dbkeeper.server.model.internal.BandwidthPolicy;
import com.dbkeeper.server.model.internal.RetentionPolicy;
import com.dbkeeper.server.model.internal.ScheduledJob;
import com.dbkeeper.server.model.internal.SummarySettings;
import com.dbkeeper.server.model.internal.SyncSettings;
import com.dbkeeper.server.service.db.impl.JobRunService;
import com.dbkeeper.server.service.db.impl.ScheduledJobService;
import com.dbkeeper.server.service.db.impl.SettingService;
import com.dbkeeper.server.util.BackupFileUtil;
import com.dbkeeper.server.util.EntityValidationUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
@Slf4j
public class DbJobStore implements JobStore {

    private static final DateTimeFormatter SETTING_TIME = DateTimeFormatter.ofPattern("HH:mm");

    // legacy boolean values of cleanup_keep_orphan_diff
    private static final int KEEP_ALL_ORPHANS = Integer.MAX_VALUE;

    private final ScheduledJobService scheduledJobService;

    private final JobRunService jobRunService;

    private final SettingService settingService;

    private final ZoneId zoneId;

    @Value("${dbkeeper.server.backup.root-path:/var/opt/mssql/backup}")
    private String defaultBackupRoot;

    @Autowired
    public DbJobStore(
            ScheduledJobService scheduledJobService,
            JobRunService jobRunService,
            SettingService settingService,
            ZoneId zoneId) {
        this.scheduledJobService = scheduledJobService;
        this.jobRunService = jobRunService;
        this.settingService = settingService;
        this.zoneId = zoneId;
    }

    @Override
    public List<ScheduledJob> listEnabledJobs() {
        List<ScheduledJob> result = new ArrayList<>();
        for (ScheduledJobEntity scheduledJobEntity : this.scheduledJobService.getEnabledScheduledJob()) {
            ScheduledJob job = toScheduledJob(scheduledJobEntity);
            if (ObjectUtils.isNotEmpty(job)) {
                result.add(job);
            }
        }
        for (JobKindEnum kind : JobKindEnum.values()) {
            if (!kind.isSystemJob()) {
                continue;
            }
            ScheduledJob systemJob = this.getSystemJob(kind);
            if (systemJob.isEnabled()) {
                result.add(systemJob);
            }
        }
        return result;
    }

    @Override
    public List<ScheduledJob> listStoredJobs(JobKindEnum kind, String subType) {
        return this.scheduledJobService.getByKindAndSubType(kind.name(), subType)
                .stream()
                .map(DbJobStore::toScheduledJob)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public ScheduledJob getJob(String jobId) {
        if (StringUtils.isBlank(jobId)) {
            return null;
        }
        JobKindEnum systemKind = JobKindEnum.fromSystemJobId(jobId);
        if (ObjectUtils.isNotEmpty(systemKind)) {
            return this.getSystemJob(systemKind);
        }
        if (!StringUtils.isNumeric(jobId)) {
            return null;
        }
        ScheduledJobEntity scheduledJobEntity = this.scheduledJobService.getByScheduledJobId(Long.parseLong(jobId));
        return ObjectUtils.isEmpty(scheduledJobEntity) ? null : toScheduledJob(scheduledJobEntity);
    }

    @Override
    public ScheduledJob getSystemJob(JobKindEnum kind) {
        ScheduledJob.ScheduledJobBuilder builder = ScheduledJob.builder()
                .jobId(kind.getSystemJobId())
                .kind(kind);
        switch (kind) {
            case SYNC -> {
                SyncSettings syncSettings = this.getSyncSettings();
                builder.enabled(syncSettings.isEnabled() && syncSettings.getMode() == SyncModeEnum.SCHEDULED)
                        .cronExpression(dailyCron(syncSettings.getSyncTime()))
                        .subType(syncSettings.getMode().name());
            }
            case CLEANUP -> {
                RetentionPolicy retentionPolicy = this.getRetentionPolicy();
                builder.enabled(retentionPolicy.isEnabled())
                        .cronExpression(retentionPolicy.getSchedule());
            }
            case SUMMARY -> {
                SummarySettings summarySettings = this.getSummarySettings();
                builder.enabled(summarySettings.isEnabled())
                        .cronExpression(dailyCron(summarySettings.getSummaryTime()));
            }
            default -> throw new ValidationException("getSystemJob failed. %s is not a system job".formatted(kind));
        }
        return builder.build();
    }

    @Override
    public ScheduledJob createJob(ScheduledJob job) {
        if (ObjectUtils.isEmpty(job) || ObjectUtils.isEmpty(job.getKind()) || job.getKind().isSystemJob()) {
            throw new ValidationException("createJob failed. only backup and maintenance jobs are stored. " +
                    "job is %s".formatted(job));
        }
        ScheduledJobEntity scheduledJobEntity = new ScheduledJobEntity();
        fillEntity(scheduledJobEntity, job);
        this.scheduledJobService.createScheduledJob(scheduledJobEntity);
        return toScheduledJob(scheduledJobEntity);
    }

    @Override
    public ScheduledJob updateJob(ScheduledJob job) {
        Long scheduledJobId = EntityValidationUtil.isStoredJobIdValid(job.getJobId());
        ScheduledJobEntity scheduledJobEntity = this.scheduledJobService.getByScheduledJobId(scheduledJobId);
        if (ObjectUtils.isEmpty(scheduledJobEntity)) {
            throw new DbException("updateJob failed. job not found. jobId is %s".formatted(job.getJobId()));
        }
        fillEntity(scheduledJobEntity, job);
        this.scheduledJobService.updateScheduledJob(scheduledJobEntity);
        return toScheduledJob(scheduledJobEntity);
    }

    @Override
    public void deleteJob(String jobId) {
        Long scheduledJobId = EntityValidationUtil.isStoredJobIdValid(jobId);
        ScheduledJobEntity scheduledJobEntity = this.scheduledJobService.getByScheduledJobId(scheduledJobId);
        if (ObjectUtils.isEmpty(scheduledJobEntity)) {
            log.warn("deleteJob skipped. job not found. jobId is {}", jobId);
            return;
        }
        this.scheduledJobService.deleteScheduledJob(scheduledJobEntity);
    }

    @Override
    public JobRunEntity createRun(ScheduledJob job, Instant startedAt) {
        JobRunEntity jobRunEntity = new JobRunEntity();
        jobRunEntity.setJobId(job.getJobId());
        jobRunEntity.setJobKind(job.getKind().name());
        jobRunEntity.setResourceKey(job.getResourceKey());
        jobRunEntity.setStartedAt(Timestamp.from(startedAt));
        return this.jobRunService.addJobRun(jobRunEntity);
    }

    @Override
    public void finalizeRun(JobRunEntity jobRun) {
        this.jobRunService.updateJobRun(jobRun);
    }

    @Override
    public List<JobRunEntity> listRuns(String jobId, int limit) {
        return this.jobRunService.getByJobId(jobId, limit);
    }

    @Override
    public List<JobRunEntity> listRunsBetween(Instant from, Instant to) {
        return this.jobRunService.getStartedBetween(from, to);
    }

    @Override
    public RetentionPolicy getRetentionPolicy() {
        Map<SettingKeyEnum, String> values = this.settingService.getValues(List.of(
                SettingKeyEnum.CLEANUP_ENABLED,
                SettingKeyEnum.CLEANUP_SCHEDULE,
                SettingKeyEnum.CLEANUP_KEEP_FULL_COUNT,
                SettingKeyEnum.CLEANUP_KEEP_DIFF_PER_FULL,
                SettingKeyEnum.CLEANUP_KEEP_ORPHAN_DIFF));
        String schedule = values.get(SettingKeyEnum.CLEANUP_SCHEDULE);
        return RetentionPolicy.builder()
                .enabled(SettingService.parseBoolean(
                        SettingKeyEnum.CLEANUP_ENABLED, values.get(SettingKeyEnum.CLEANUP_ENABLED)))
                .schedule(StringUtils.isBlank(schedule) ? SettingKeyEnum.CLEANUP_SCHEDULE.getDefaultValue() : schedule)
                .keepFullCount(SettingService.parseInt(
                        SettingKeyEnum.CLEANUP_KEEP_FULL_COUNT, values.get(SettingKeyEnum.CLEANUP_KEEP_FULL_COUNT)))
                .keepDiffPerFull(SettingService.parseInt(
                        SettingKeyEnum.CLEANUP_KEEP_DIFF_PER_FULL,
                        values.get(SettingKeyEnum.CLEANUP_KEEP_DIFF_PER_FULL)))
                .keepOrphanDiff(parseKeepOrphanDiff(values.get(SettingKeyEnum.CLEANUP_KEEP_ORPHAN_DIFF)))
                .build();
    }

    @Override
    @Transactional
    public void saveRetentionPolicy(RetentionPolicy retentionPolicy) {
        Map<SettingKeyEnum, String> values = new EnumMap<>(SettingKeyEnum.class);
        values.put(SettingKeyEnum.CLEANUP_ENABLED, String.valueOf(retentionPolicy.isEnabled()));
        values.put(SettingKeyEnum.CLEANUP_KEEP_FULL_COUNT, String.valueOf(retentionPolicy.getKeepFullCount()));
        values.put(SettingKeyEnum.CLEANUP_KEEP_DIFF_PER_FULL, String.valueOf(retentionPolicy.getKeepDiffPerFull()));
        values.put(SettingKeyEnum.CLEANUP_KEEP_ORPHAN_DIFF, String.valueOf(retentionPolicy.getKeepOrphanDiff()));
        if (StringUtils.isNotBlank(retentionPolicy.getSchedule())) {
            values.put(SettingKeyEnum.CLEANUP_SCHEDULE, retentionPolicy.getSchedule().trim());
        }
        this.settingService.saveValues(values);
    }

    @Override
    public BandwidthPolicy getBandwidthPolicy() {
        Map<SettingKeyEnum, String> values = this.settingService.getValues(List.of(
                SettingKeyEnum.BANDWIDTH_LIMIT_ENABLED,
                SettingKeyEnum.BANDWIDTH_PEAK_LIMIT,
                SettingKeyEnum.BANDWIDTH_OFFPEAK_LIMIT,
                SettingKeyEnum.BANDWIDTH_PEAK_START,
                SettingKeyEnum.BANDWIDTH_PEAK_END,
                SettingKeyEnum.BANDWIDTH_WEEKEND_UNLIMITED));
        return BandwidthPolicy.builder()
                .enabled(SettingService.parseBoolean(
                        SettingKeyEnum.BANDWIDTH_LIMIT_ENABLED, values.get(SettingKeyEnum.BANDWIDTH_LIMIT_ENABLED)))
                .peakLimitKBs(SettingService.parseLong(
                        SettingKeyEnum.BANDWIDTH_PEAK_LIMIT, values.get(SettingKeyEnum.BANDWIDTH_PEAK_LIMIT)))
                .offpeakLimitKBs(SettingService.parseLong(
                        SettingKeyEnum.BANDWIDTH_OFFPEAK_LIMIT, values.get(SettingKeyEnum.BANDWIDTH_OFFPEAK_LIMIT)))
                .peakStart(SettingService.parseTime(
                        SettingKeyEnum.BANDWIDTH_PEAK_START, values.get(SettingKeyEnum.BANDWIDTH_PEAK_START)))
                .peakEnd(SettingService.parseTime(
                        SettingKeyEnum.BANDWIDTH_PEAK_END, values.get(SettingKeyEnum.BANDWIDTH_PEAK_END)))
                .weekendUnlimited(SettingService.parseBoolean(
                        SettingKeyEnum.BANDWIDTH_WEEKEND_UNLIMITED,
                        values.get(SettingKeyEnum.BANDWIDTH_WEEKEND_UNLIMITED)))
                .build();
    }

    @Override
    @Transactional
    public void saveBandwidthPolicy(BandwidthPolicy bandwidthPolicy) {
        Map<SettingKeyEnum, String> values = new EnumMap<>(SettingKeyEnum.class);
        values.put(SettingKeyEnum.BANDWIDTH_LIMIT_ENABLED, String.valueOf(bandwidthPolicy.isEnabled()));
        values.put(SettingKeyEnum.BANDWIDTH_PEAK_LIMIT, ObjectUtils.isEmpty(bandwidthPolicy.getPeakLimitKBs()) ?
                null : String.valueOf(bandwidthPolicy.getPeakLimitKBs()));
        values.put(SettingKeyEnum.BANDWIDTH_OFFPEAK_LIMIT, ObjectUtils.isEmpty(bandwidthPolicy.getOffpeakLimitKBs()) ?
                null : String.valueOf(bandwidthPolicy.getOffpeakLimitKBs()));
        values.put(SettingKeyEnum.BANDWIDTH_PEAK_START, bandwidthPolicy.getPeakStart().format(SETTING_TIME));
        values.put(SettingKeyEnum.BANDWIDTH_PEAK_END, bandwidthPolicy.getPeakEnd().format(SETTING_TIME));
        values.put(SettingKeyEnum.BANDWIDTH_WEEKEND_UNLIMITED, String.valueOf(bandwidthPolicy.isWeekendUnlimited()));
        this.settingService.saveValues(values);
    }

    @Override
    public SyncSettings getSyncSettings() {
        Map<SettingKeyEnum, String> values = this.settingService.getValues(List.of(
                SettingKeyEnum.BORG_SYNC_ENABLED,
                SettingKeyEnum.BORG_SYNC_MODE,
                SettingKeyEnum.BORG_SYNC_TIME,
                SettingKeyEnum.BORG_SYNC_BUFFER_MINUTES));
        SyncModeEnum mode = SyncModeEnum.fromSettingValue(values.get(SettingKeyEnum.BORG_SYNC_MODE));
        if (ObjectUtils.isEmpty(mode)) {
            log.warn("getSyncSettings found an unknown sync mode. fall back to default. mode is {}",
                    values.get(SettingKeyEnum.BORG_SYNC_MODE));
            mode = SyncModeEnum.fromSettingValue(SettingKeyEnum.BORG_SYNC_MODE.getDefaultValue());
        }
        return SyncSettings.builder()
                .enabled(SettingService.parseBoolean(
                        SettingKeyEnum.BORG_SYNC_ENABLED, values.get(SettingKeyEnum.BORG_SYNC_ENABLED)))
                .mode(mode)
                .syncTime(SettingService.parseTime(
                        SettingKeyEnum.BORG_SYNC_TIME, values.get(SettingKeyEnum.BORG_SYNC_TIME)))
                .bufferMinutes(SettingService.parseInt(
                        SettingKeyEnum.BORG_SYNC_BUFFER_MINUTES, values.get(SettingKeyEnum.BORG_SYNC_BUFFER_MINUTES)))
                .backupPath(this.getBackupRoot().toString())
                .build();
    }

    @Override
    @Transactional
    public void saveSyncSettings(SyncSettings syncSettings) {
        Map<SettingKeyEnum, String> values = new EnumMap<>(SettingKeyEnum.class);
        values.put(SettingKeyEnum.BORG_SYNC_ENABLED, String.valueOf(syncSettings.isEnabled()));
        values.put(SettingKeyEnum.BORG_SYNC_MODE, syncSettings.getMode().getSettingValue());
        values.put(SettingKeyEnum.BORG_SYNC_TIME, syncSettings.getSyncTime().format(SETTING_TIME));
        values.put(SettingKeyEnum.BORG_SYNC_BUFFER_MINUTES, String.valueOf(syncSettings.getBufferMinutes()));
        if (StringUtils.isNotBlank(syncSettings.getBackupPath())) {
            values.put(SettingKeyEnum.DEFAULT_BACKUP_PATH, syncSettings.getBackupPath().trim());
        }
        this.settingService.saveValues(values);
    }

    @Override
    public SummarySettings getSummarySettings() {
        Map<SettingKeyEnum, String> values = this.settingService.getValues(List.of(
                SettingKeyEnum.DAILY_SUMMARY_ENABLED,
                SettingKeyEnum.SUMMARY_TIME));
        return new SummarySettings(
                SettingService.parseBoolean(
                        SettingKeyEnum.DAILY_SUMMARY_ENABLED, values.get(SettingKeyEnum.DAILY_SUMMARY_ENABLED)),
                SettingService.parseTime(SettingKeyEnum.SUMMARY_TIME, values.get(SettingKeyEnum.SUMMARY_TIME)));
    }

    @Override
    @Transactional
    public void saveSummarySettings(SummarySettings summarySettings) {
        Map<SettingKeyEnum, String> values = new EnumMap<>(SettingKeyEnum.class);
        values.put(SettingKeyEnum.DAILY_SUMMARY_ENABLED, String.valueOf(summarySettings.isEnabled()));
        values.put(SettingKeyEnum.SUMMARY_TIME, summarySettings.getSummaryTime().format(SETTING_TIME));
        this.settingService.saveValues(values);
    }

    @Override
    public boolean isFailureAlertsEnabled() {
        return this.settingService.getBoolean(SettingKeyEnum.FAILURE_ALERTS_ENABLED);
    }

    @Override
    public Path getBackupRoot() {
        String stored = this.settingService.getValue(SettingKeyEnum.DEFAULT_BACKUP_PATH);
        return Path.of(StringUtils.isBlank(stored) ? this.defaultBackupRoot : stored.trim());
    }

    @Override
    public List<String> listBackupDatabases() {
        return BackupFileUtil.listDatabaseNames(this.getBackupRoot(), this.zoneId);
    }

    @Override
    public List<BackupFile> listBackupFiles(String databaseName) {
        return BackupFileUtil.listBackupFiles(this.getBackupRoot(), databaseName, this.zoneId);
    }

    @Override
    @Transactional
    public void recordCleanupRun(Instant completedAt, JobRunStatusEnum status, String message) {
        Map<SettingKeyEnum, String> values = new EnumMap<>(SettingKeyEnum.class);
        values.put(SettingKeyEnum.CLEANUP_LAST_RUN_AT, completedAt.toString());
        values.put(SettingKeyEnum.CLEANUP_LAST_RUN_STATUS, status.name());
        values.put(SettingKeyEnum.CLEANUP_LAST_RUN_MESSAGE, message);
        this.settingService.saveValues(values);
    }

    static int parseKeepOrphanDiff(String value) {
        if ("true".equalsIgnoreCase(StringUtils.trim(value))) {
            return KEEP_ALL_ORPHANS;
        }
        if ("false".equalsIgnoreCase(StringUtils.trim(value))) {
            return 0;
        }
        return SettingService.parseInt(SettingKeyEnum.CLEANUP_KEEP_ORPHAN_DIFF, value);
    }

    static String dailyCron(LocalTime time) {
        return "%d %d * * *".formatted(time.getMinute(), time.getHour());
    }

    private static void fillEntity(ScheduledJobEntity scheduledJobEntity, ScheduledJob job) {
        scheduledJobEntity.setJobKind(job.getKind().name());
        scheduledJobEntity.setJobSubType(StringUtils.upperCase(job.getSubType()));
        scheduledJobEntity.setCronExpression(StringUtils.trim(job.getCronExpression()));
        scheduledJobEntity.setResourceKey(job.getResourceKey());
        scheduledJobEntity.setEnabled(job.isEnabled());
        scheduledJobEntity.setJobOptions(job.getOptions());
    }

    private static ScheduledJob toScheduledJob(ScheduledJobEntity scheduledJobEntity) {
        JobKindEnum kind = JobKindEnum.fromName(scheduledJobEntity.getJobKind());
        if (ObjectUtils.isEmpty(kind)) {
            log.warn("toScheduledJob skipped. unknown job kind. scheduledJobId is {}, jobKind is {}",
                    scheduledJobEntity.getScheduledJobId(), scheduledJobEntity.getJobKind());
            return null;
        }
        return ScheduledJob.builder()
                .jobId(String.valueOf(scheduledJobEntity.getScheduledJobId()))
                .kind(kind)
                .subType(scheduledJobEntity.getJobSubType())
                .cronExpression(scheduledJobEntity.getCronExpression())
                .resourceKey(scheduledJobEntity.getResourceKey())
                .enabled(Boolean.TRUE.equals(scheduledJobEntity.getEnabled()))
                .options(scheduledJobEntity.getJobOptions())
                .build();
    }
}
