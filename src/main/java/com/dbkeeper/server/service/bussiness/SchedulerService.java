package com.dbkeeper.server.service.bussiness;

import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.exception.ResourceNotFoundException;
import com.dbkeeper.server.exception.ValidationException;
import com.dbkeeper.server.model.api.job.BulkCreateJobRequest;
import com.dbkeeper.server.model.api.job.BulkCreateJobResponse;
import com.dbkeeper.server.model.api.job.CreateJobRequest;
import com.dbkeeper.server.model.api.job.ScheduleStatusResponse;
import com.dbkeeper.server.model.api.job.ScheduledJobInfo;
import com.dbkeeper.server.model.api.job.UpdateJobRequest;
import com.dbkeeper.server.model.entity.JobRunEntity;
import com.dbkeeper.server.model.internal.ExecutionResult;
import com.dbkeeper.server.model.internal.ScheduledJob;
import com.dbkeeper.server.service.store.JobStore;
import com.dbkeeper.server.util.CronEvaluator;
import com.dbkeeper.server.util.EntityValidationUtil;
import com.dbkeeper.server.util.StaggerGenerator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Registry of armed jobs. Each registered job holds exactly one single shot
 * timer on the trigger scheduler; a fire re-arms the next occurrence before
 * handing the job to the {@link ExecutionCoordinator}, so a long run never
 * delays the schedule.
 */
@Service
@Slf4j
public class SchedulerService {

    private final Object registryLock = new Object();

    // guarded by registryLock
    private final Map<String, RegistryEntry> registry = new HashMap<>();

    // guarded by registryLock, jobs whose cron no longer parses
    private final Map<String, UnscheduledEntry> unscheduled = new HashMap<>();

    private final TaskScheduler triggerTaskScheduler;

    private final ExecutionCoordinator executionCoordinator;

    private final JobStore jobStore;

    private final Clock clock;

    @Autowired
    public SchedulerService(
            @Qualifier("triggerTaskScheduler") TaskScheduler triggerTaskScheduler,
            ExecutionCoordinator executionCoordinator,
            JobStore jobStore,
            Clock clock) {
        this.triggerTaskScheduler = triggerTaskScheduler;
        this.executionCoordinator = executionCoordinator;
        this.jobStore = jobStore;
        this.clock = clock;
    }

    /**
     * Arms the job, replacing any timer already held under its id. A disabled
     * job is unregistered instead.
     *
     * @return the job with its next fire time, or null when it was unregistered
     * @throws ValidationException the cron expression is malformed or never fires
     */
    public ScheduledJob register(ScheduledJob job) throws ValidationException {
        if (ObjectUtils.isEmpty(job) || StringUtils.isBlank(job.getJobId())) {
            throw new ValidationException("register failed. job or jobId is null");
        }
        if (!job.isEnabled()) {
            this.unregister(job.getJobId());
            return null;
        }
        ZonedDateTime nextFireTime = CronEvaluator.nextFireTime(job.getCronExpression(), this.now());
        synchronized (this.registryLock) {
            this.unscheduled.remove(job.getJobId());
            return this.arm(job, nextFireTime.toInstant());
        }
    }

    public void unregister(String jobId) {
        synchronized (this.registryLock) {
            this.unscheduled.remove(jobId);
            RegistryEntry registryEntry = this.registry.remove(jobId);
            if (ObjectUtils.isNotEmpty(registryEntry)) {
                registryEntry.cancel();
                log.info("unregister job. jobId is {}", jobId);
            }
        }
    }

    public ScheduledJobInfo addJob(CreateJobRequest createJobRequest) {
        EntityValidationUtil.isCreateJobRequestValid(createJobRequest);
        CronEvaluator.validate(createJobRequest.getCronExpression(), this.clock.getZone());
        ScheduledJob created = this.jobStore.createJob(ScheduledJob.builder()
                .kind(createJobRequest.getJobKindEnum())
                .subType(createJobRequest.getJobSubType())
                .cronExpression(createJobRequest.getCronExpression())
                .resourceKey(createJobRequest.getDatabaseName())
                .enabled(createJobRequest.getEnabled())
                .options(createJobRequest.getJobOptions())
                .build());
        ScheduledJob registered = this.registerStored(created.getJobId());
        log.info("addJob success. jobId is {}, kind is {}, database is {}",
                created.getJobId(), created.getKind(), created.getResourceKey());
        return new ScheduledJobInfo(ObjectUtils.isEmpty(registered) ? created : registered);
    }

    /**
     * Creates one job per database with staggered cron expressions. Databases
     * that already have a job of the same kind and sub type are skipped unless
     * {@code skipExisting} is false.
     */
    public BulkCreateJobResponse bulkAddJob(BulkCreateJobRequest bulkCreateJobRequest) {
        EntityValidationUtil.isBulkCreateJobRequestValid(bulkCreateJobRequest);
        Set<String> existing = new HashSet<>();
        if (bulkCreateJobRequest.getSkipExisting()) {
            for (ScheduledJob job : this.jobStore.listStoredJobs(
                    bulkCreateJobRequest.getJobKindEnum(),
                    bulkCreateJobRequest.getJobSubType())) {
                existing.add(job.getResourceKey());
            }
        }
        BulkCreateJobResponse response = new BulkCreateJobResponse();
        List<String> targets = new ArrayList<>();
        for (String databaseName : new LinkedHashSet<>(bulkCreateJobRequest.getDatabaseNames())) {
            if (existing.contains(databaseName)) {
                response.getSkippedDatabases().add(databaseName);
            } else {
                targets.add(databaseName);
            }
        }
        if (targets.isEmpty()) {
            return response;
        }
        // staggered over the databases actually created, skipped ones leave no gap
        List<String> cronExpressions = StaggerGenerator.generateAll(
                targets.size(),
                bulkCreateJobRequest.getScheduleTypeEnum(),
                bulkCreateJobRequest.getStartHour(),
                bulkCreateJobRequest.getWindowHours(),
                bulkCreateJobRequest.getWeekDay());
        for (int i = 0; i < targets.size(); i++) {
            ScheduledJob created = this.jobStore.createJob(ScheduledJob.builder()
                    .kind(bulkCreateJobRequest.getJobKindEnum())
                    .subType(bulkCreateJobRequest.getJobSubType())
                    .cronExpression(cronExpressions.get(i))
                    .resourceKey(targets.get(i))
                    .enabled(true)
                    .options(bulkCreateJobRequest.getJobOptions())
                    .build());
            ScheduledJob registered = this.registerStored(created.getJobId());
            response.getCreated().add(new ScheduledJobInfo(ObjectUtils.isEmpty(registered) ? created : registered));
        }
        log.info("bulkAddJob success. created {} jobs, skipped {}",
                response.getCreated().size(), response.getSkippedDatabases());
        return response;
    }

    public ScheduledJobInfo updateJob(UpdateJobRequest updateJobRequest) {
        EntityValidationUtil.isUpdateJobRequestValid(updateJobRequest);
        ScheduledJob existing = this.getJobOrThrow(updateJobRequest.getJobId());
        ScheduledJob.ScheduledJobBuilder builder = existing.toBuilder();
        if (StringUtils.isNotBlank(updateJobRequest.getCronExpression())) {
            CronEvaluator.validate(updateJobRequest.getCronExpression(), this.clock.getZone());
            builder.cronExpression(updateJobRequest.getCronExpression());
        }
        if (ObjectUtils.isNotEmpty(updateJobRequest.getEnabled())) {
            builder.enabled(updateJobRequest.getEnabled());
        }
        if (StringUtils.isNotBlank(updateJobRequest.getJobSubType())) {
            EntityValidationUtil.isJobSubTypeValid(existing.getKind(), updateJobRequest.getJobSubType());
            builder.subType(updateJobRequest.getJobSubType());
        }
        if (ObjectUtils.isNotEmpty(updateJobRequest.getJobOptions())) {
            builder.options(updateJobRequest.getJobOptions());
        }
        ScheduledJob updated = this.jobStore.updateJob(builder.build());
        ScheduledJob registered = this.registerStored(updated.getJobId());
        log.info("updateJob success. jobId is {}, enabled is {}, cron is {}",
                updated.getJobId(), updated.isEnabled(), updated.getCronExpression());
        return new ScheduledJobInfo(ObjectUtils.isEmpty(registered) ? updated : registered);
    }

    public void removeJob(String jobId) {
        if (ObjectUtils.isNotEmpty(JobKindEnum.fromSystemJobId(jobId))) {
            throw new ValidationException("removeJob failed. system jobs are driven by settings. jobId is %s"
                    .formatted(jobId));
        }
        this.getJobOrThrow(jobId);
        synchronized (this.registryLock) {
            this.jobStore.deleteJob(jobId);
            this.unregister(jobId);
        }
        log.info("removeJob success. jobId is {}", jobId);
    }

    // runs regardless of the job being enabled, skipped when already running
    public CompletableFuture<ExecutionResult> runNow(String jobId) {
        return this.executionCoordinator.execute(this.getJobOrThrow(jobId));
    }

    public List<JobRunEntity> listRuns(String jobId, int limit) {
        if (StringUtils.isBlank(jobId)) {
            throw new ValidationException("listRuns failed. jobId is null");
        }
        return this.jobStore.listRuns(jobId, limit);
    }

    public List<ScheduledJobInfo> listScheduled() {
        synchronized (this.registryLock) {
            return this.registry.values()
                    .stream()
                    .sorted(Comparator.comparing(RegistryEntry::fireAt)
                            .thenComparing(registryEntry -> registryEntry.job().getJobId()))
                    .map(registryEntry -> new ScheduledJobInfo(registryEntry.job()))
                    .toList();
        }
    }

    public List<ScheduledJobInfo> listUnscheduled() {
        synchronized (this.registryLock) {
            return this.unscheduled.values()
                    .stream()
                    .sorted(Comparator.comparing(unscheduledEntry -> unscheduledEntry.job().getJobId()))
                    .map(unscheduledEntry -> new ScheduledJobInfo(unscheduledEntry.job(), unscheduledEntry.reason()))
                    .toList();
        }
    }

    public ScheduleStatusResponse getScheduleStatus() {
        return new ScheduleStatusResponse(this.listScheduled(), this.listUnscheduled());
    }

    /**
     * Drops every timer and registers all enabled jobs from the store. Jobs
     * whose cron can not be evaluated are left unarmed and listed as
     * unscheduled.
     */
    public void reloadAll() {
        List<ScheduledJob> jobs = this.jobStore.listEnabledJobs();
        synchronized (this.registryLock) {
            this.cancelAll();
            for (ScheduledJob job : jobs) {
                this.registerOrRecord(job);
            }
            log.info("reloadAll finished. {} jobs scheduled, {} not scheduled",
                    this.registry.size(), this.unscheduled.size());
        }
    }

    // re-reads the settings behind a system job and re-arms it
    public void refreshSystemJob(JobKindEnum kind) {
        ScheduledJob systemJob = this.jobStore.getSystemJob(kind);
        synchronized (this.registryLock) {
            if (systemJob.isEnabled()) {
                this.registerOrRecord(systemJob);
            } else {
                this.unregister(systemJob.getJobId());
            }
        }
    }

    public void shutdown() {
        synchronized (this.registryLock) {
            this.cancelAll();
        }
        log.info("scheduler shut down");
    }

    /**
     * Arms the job as it is stored now. A job deleted or disabled by a
     * concurrent call is left unarmed.
     */
    private ScheduledJob registerStored(String jobId) {
        synchronized (this.registryLock) {
            ScheduledJob stored = this.jobStore.getJob(jobId);
            if (ObjectUtils.isEmpty(stored)) {
                log.info("register skipped. job was removed. jobId is {}", jobId);
                this.unregister(jobId);
                return null;
            }
            return this.register(stored);
        }
    }

    private void registerOrRecord(ScheduledJob job) {
        try {
            this.register(job);
        } catch (ValidationException e) {
            log.error("job can't be scheduled, left unarmed. jobId is {}, cron is {}",
                    job.getJobId(), job.getCronExpression(), e);
            this.unregister(job.getJobId());
            this.unscheduled.put(job.getJobId(), new UnscheduledEntry(job, e.getMessage()));
        }
    }

    // caller holds registryLock
    private ScheduledJob arm(ScheduledJob job, Instant fireAt) {
        RegistryEntry previous = this.registry.get(job.getJobId());
        if (ObjectUtils.isNotEmpty(previous)) {
            previous.cancel();
        }
        ScheduledJob armed = job.toBuilder().nextFireAt(fireAt).build();
        RegistryEntry registryEntry = new RegistryEntry(armed, fireAt);
        this.registry.put(job.getJobId(), registryEntry);
        registryEntry.future = this.triggerTaskScheduler.schedule(() -> this.onFire(registryEntry), fireAt);
        log.debug("job armed. jobId is {}, fireAt is {}", job.getJobId(), fireAt);
        return armed;
    }

    void onFire(RegistryEntry registryEntry) {
        ScheduledJob job = registryEntry.job();
        synchronized (this.registryLock) {
            // replaced or removed after this timer was armed
            if (this.registry.get(job.getJobId()) != registryEntry) {
                log.debug("stale fire dropped. jobId is {}", job.getJobId());
                return;
            }
            Instant now = this.clock.instant();
            Instant base = now.isAfter(registryEntry.fireAt()) ? now : registryEntry.fireAt();
            try {
                ZonedDateTime next = CronEvaluator.nextFireTime(
                        job.getCronExpression(), base.atZone(this.clock.getZone()));
                this.arm(job, next.toInstant());
            } catch (ValidationException e) {
                log.error("job can't be re-armed. jobId is {}", job.getJobId(), e);
                this.registry.remove(job.getJobId());
                this.unscheduled.put(job.getJobId(), new UnscheduledEntry(job, e.getMessage()));
            }
        }
        try {
            this.executionCoordinator.execute(job);
        } catch (RuntimeException e) {
            log.error("onFire failed. can't dispatch job. jobId is {}", job.getJobId(), e);
        }
    }

    private ScheduledJob getJobOrThrow(String jobId) {
        ScheduledJob job = this.jobStore.getJob(jobId);
        if (ObjectUtils.isEmpty(job)) {
            throw new ResourceNotFoundException("job not found. jobId is %s".formatted(jobId));
        }
        return job;
    }

    // caller holds registryLock
    private void cancelAll() {
        this.registry.values().forEach(RegistryEntry::cancel);
        this.registry.clear();
        this.unscheduled.clear();
    }

    private ZonedDateTime now() {
        return ZonedDateTime.now(this.clock);
    }

    static final class RegistryEntry {

        private final ScheduledJob job;

        private final Instant fireAt;

        private ScheduledFuture<?> future;

        RegistryEntry(ScheduledJob job, Instant fireAt) {
            this.job = job;
            this.fireAt = fireAt;
        }

        ScheduledJob job() {
            return this.job;
        }

        Instant fireAt() {
            return this.fireAt;
        }

        void cancel() {
            if (ObjectUtils.isNotEmpty(this.future)) {
                this.future.cancel(false);
            }
        }
    }

    private record UnscheduledEntry(ScheduledJob job, String reason) {
    }
}
