package com.dbkeeper.server.service.bussiness;

import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.exception.ValidationException;
import com.dbkeeper.server.model.api.cleanup.RetentionPreviewResponse;
import com.dbkeeper.server.model.api.job.StaggerPreviewRequest;
import com.dbkeeper.server.model.internal.BandwidthLimit;
import com.dbkeeper.server.model.internal.BandwidthPolicy;
import com.dbkeeper.server.model.internal.ExecutionResult;
import com.dbkeeper.server.model.internal.RetentionPlan;
import com.dbkeeper.server.model.internal.RetentionPolicy;
import com.dbkeeper.server.model.internal.SummarySettings;
import com.dbkeeper.server.model.internal.SyncSettings;
import com.dbkeeper.server.service.executor.CleanupJobExecutor;
import com.dbkeeper.server.service.store.JobStore;
import com.dbkeeper.server.util.BandwidthPolicyResolver;
import com.dbkeeper.server.util.CronEvaluator;
import com.dbkeeper.server.util.EntityValidationUtil;
import com.dbkeeper.server.util.RetentionPlanner;
import com.dbkeeper.server.util.StaggerGenerator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

// operator policies: retention, bandwidth, sync and summary settings
@Service
@Slf4j
public class PolicyService {

    private final JobStore jobStore;

    private final SchedulerService schedulerService;

    private final SyncTriggerService syncTriggerService;

    private final ExecutionCoordinator executionCoordinator;

    private final CleanupJobExecutor cleanupJobExecutor;

    private final Clock clock;

    @Autowired
    public PolicyService(
            JobStore jobStore,
            SchedulerService schedulerService,
            SyncTriggerService syncTriggerService,
            ExecutionCoordinator executionCoordinator,
            CleanupJobExecutor cleanupJobExecutor,
            Clock clock) {
        this.jobStore = jobStore;
        this.schedulerService = schedulerService;
        this.syncTriggerService = syncTriggerService;
        this.executionCoordinator = executionCoordinator;
        this.cleanupJobExecutor = cleanupJobExecutor;
        this.clock = clock;
    }

    public List<String> previewStagger(StaggerPreviewRequest staggerPreviewRequest) {
        EntityValidationUtil.isStaggerPreviewRequestValid(staggerPreviewRequest);
        return StaggerGenerator.generateAll(
                staggerPreviewRequest.getCount(),
                staggerPreviewRequest.getScheduleTypeEnum(),
                staggerPreviewRequest.getStartHour(),
                staggerPreviewRequest.getWindowHours(),
                staggerPreviewRequest.getWeekDay());
    }

    // dry run of the cleanup job, databaseName null means every database on disk
    public RetentionPreviewResponse previewRetention(String databaseName) {
        if (StringUtils.isNotBlank(databaseName)) {
            EntityValidationUtil.isDatabaseNameValid(databaseName);
        }
        Map<String, RetentionPlan> plans = this.cleanupJobExecutor.preview(StringUtils.trimToNull(databaseName));
        long totalDeleteSizeBytes = plans.values()
                .stream()
                .mapToLong(RetentionPlan::getDeleteSizeBytes)
                .sum();
        return new RetentionPreviewResponse(this.jobStore.getRetentionPolicy(), plans, totalDeleteSizeBytes);
    }

    public RetentionPolicy getRetentionPolicy() {
        return this.jobStore.getRetentionPolicy();
    }

    public RetentionPolicy setRetentionPolicy(RetentionPolicy retentionPolicy) {
        RetentionPlanner.isPolicyValid(retentionPolicy);
        if (StringUtils.isNotBlank(retentionPolicy.getSchedule())) {
            CronEvaluator.validate(retentionPolicy.getSchedule(), this.clock.getZone());
        }
        this.jobStore.saveRetentionPolicy(retentionPolicy);
        this.schedulerService.refreshSystemJob(JobKindEnum.CLEANUP);
        log.info("setRetentionPolicy success. retentionPolicy is {}", retentionPolicy);
        return this.jobStore.getRetentionPolicy();
    }

    public CompletableFuture<ExecutionResult> runCleanupNow() {
        return this.executionCoordinator.execute(this.jobStore.getSystemJob(JobKindEnum.CLEANUP));
    }

    public BandwidthPolicy getBandwidthPolicy() {
        return this.jobStore.getBandwidthPolicy();
    }

    public BandwidthPolicy setBandwidthPolicy(BandwidthPolicy bandwidthPolicy) {
        EntityValidationUtil.isBandwidthPolicyValid(bandwidthPolicy);
        this.jobStore.saveBandwidthPolicy(bandwidthPolicy);
        log.info("setBandwidthPolicy success. bandwidthPolicy is {}", bandwidthPolicy);
        return this.jobStore.getBandwidthPolicy();
    }

    public BandwidthLimit getCurrentLimit() {
        return BandwidthPolicyResolver.effectiveLimit(ZonedDateTime.now(this.clock), this.jobStore.getBandwidthPolicy());
    }

    public SyncSettings getSyncSettings() {
        return this.jobStore.getSyncSettings();
    }

    public SyncSettings setSyncSettings(SyncSettings syncSettings) {
        EntityValidationUtil.isSyncSettingsValid(syncSettings);
        this.jobStore.saveSyncSettings(syncSettings);
        this.syncTriggerService.resetPending();
        this.schedulerService.refreshSystemJob(JobKindEnum.SYNC);
        log.info("setSyncSettings success. syncSettings is {}", syncSettings);
        return this.jobStore.getSyncSettings();
    }

    public CompletableFuture<ExecutionResult> runSyncNow() {
        return this.executionCoordinator.execute(this.jobStore.getSystemJob(JobKindEnum.SYNC));
    }

    public SummarySettings getSummarySettings() {
        return this.jobStore.getSummarySettings();
    }

    public SummarySettings setSummarySettings(SummarySettings summarySettings) {
        if (ObjectUtils.isEmpty(summarySettings) || ObjectUtils.isEmpty(summarySettings.getSummaryTime())) {
            throw new ValidationException("setSummarySettings failed. summarySettings or summaryTime is null");
        }
        this.jobStore.saveSummarySettings(summarySettings);
        this.schedulerService.refreshSystemJob(JobKindEnum.SUMMARY);
        log.info("setSummarySettings success. summarySettings is {}", summarySettings);
        return this.jobStore.getSummarySettings();
    }
}
