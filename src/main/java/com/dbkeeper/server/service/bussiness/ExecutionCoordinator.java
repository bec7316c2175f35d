package com.dbkeeper.server.service.bussiness;

import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.enums.JobRunStatusEnum;
import com.dbkeeper.server.exception.DbKeeperException;
import com.dbkeeper.server.exception.JobExecutionException;
import com.dbkeeper.server.model.entity.JobRunEntity;
import com.dbkeeper.server.model.internal.ExecutionResult;
import com.dbkeeper.server.model.internal.RunMetrics;
import com.dbkeeper.server.model.internal.ScheduledJob;
import com.dbkeeper.server.service.driver.NotificationService;
import com.dbkeeper.server.service.executor.JobExecutor;
import com.dbkeeper.server.service.store.JobStore;
import com.dbkeeper.server.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a job at most once at a time per job id. Different ids, including jobs
 * of different kinds against the same database, run in parallel.
 * <p>
 * The returned future always completes normally; failures are recorded on the
 * job run instead.
 */
@Service
@Slf4j
public class ExecutionCoordinator {

    private static final int MAX_ERROR_MESSAGE_LENGTH = 2000;

    private static final int MAX_METRICS_LENGTH = 4000;

    private final Set<String> runningJobIds = ConcurrentHashMap.newKeySet();

    private final Map<JobKindEnum, JobExecutor> executors = new EnumMap<>(JobKindEnum.class);

    private final Executor jobExecutionPool;

    private final JobStore jobStore;

    private final NotificationService notificationService;

    private final Clock clock;

    @Autowired
    public ExecutionCoordinator(
            List<JobExecutor> jobExecutors,
            @Qualifier("jobExecutionPool") Executor jobExecutionPool,
            JobStore jobStore,
            NotificationService notificationService,
            Clock clock) {
        for (JobExecutor jobExecutor : jobExecutors) {
            this.executors.put(jobExecutor.kind(), jobExecutor);
        }
        this.jobExecutionPool = jobExecutionPool;
        this.jobStore = jobStore;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    public CompletableFuture<ExecutionResult> execute(ScheduledJob job) {
        String jobId = job.getJobId();
        if (!this.runningJobIds.add(jobId)) {
            log.info("execute skipped. job is already running. jobId is {}", jobId);
            return CompletableFuture.completedFuture(ExecutionResult.skipped(jobId));
        }
        // once handed to the pool, the completion stage owns the release of jobId
        boolean dispatched = false;
        try {
            JobRunEntity jobRun;
            try {
                jobRun = this.jobStore.createRun(job, this.clock.instant());
            } catch (RuntimeException e) {
                log.error("execute failed. can't create job run. jobId is {}", jobId, e);
                // not persisted, the caller still gets a FAILED result
                JobRunEntity failedRun = this.newDetachedRun(job);
                this.finishQuietly(failedRun, null, e);
                return CompletableFuture.completedFuture(ExecutionResult.of(jobId, failedRun));
            }
            CompletableFuture<RunMetrics> runFuture;
            try {
                runFuture = CompletableFuture.supplyAsync(() -> this.runExecutor(job), this.jobExecutionPool);
            } catch (RejectedExecutionException e) {
                runFuture = CompletableFuture.failedFuture(new JobExecutionException(
                        "execute failed. job execution pool rejected the job. jobId is %s".formatted(jobId), e));
            } catch (RuntimeException e) {
                runFuture = CompletableFuture.failedFuture(new JobExecutionException(
                        "execute failed. can't hand the job to the execution pool. jobId is %s".formatted(jobId), e));
            }
            CompletableFuture<ExecutionResult> resultFuture = runFuture.handle((runMetrics, throwable) -> {
                try {
                    this.finalizeRun(jobRun, runMetrics, throwable);
                    return ExecutionResult.of(jobId, jobRun);
                } finally {
                    this.runningJobIds.remove(jobId);
                }
            });
            dispatched = true;
            return resultFuture;
        } finally {
            if (!dispatched) {
                this.runningJobIds.remove(jobId);
            }
        }
    }

    public boolean isRunning(String jobId) {
        return this.runningJobIds.contains(jobId);
    }

    public Set<String> getRunningJobIds() {
        return new TreeSet<>(this.runningJobIds);
    }

    private RunMetrics runExecutor(ScheduledJob job) {
        JobExecutor jobExecutor = this.executors.get(job.getKind());
        if (ObjectUtils.isEmpty(jobExecutor)) {
            throw new JobExecutionException("execute failed. no executor for job kind. jobId is %s, kind is %s"
                    .formatted(job.getJobId(), job.getKind()));
        }
        log.info("execute start. jobId is {}, kind is {}, resource is {}",
                job.getJobId(), job.getKind(), job.getResourceKey());
        return jobExecutor.run(job);
    }

    private void finalizeRun(JobRunEntity jobRun, RunMetrics runMetrics, Throwable throwable) {
        this.finishQuietly(jobRun, runMetrics, throwable);
        try {
            this.jobStore.finalizeRun(jobRun);
        } catch (RuntimeException e) {
            log.error("finalizeRun failed. jobRunId is {}, status is {}",
                    jobRun.getJobRunId(), jobRun.getRunStatus(), e);
        }
    }

    private void finishQuietly(JobRunEntity jobRun, RunMetrics runMetrics, Throwable throwable) {
        try {
            this.finish(jobRun, runMetrics, throwable);
        } catch (RuntimeException e) {
            log.error("finish failed. jobId is {}", jobRun.getJobId(), e);
            jobRun.setRunStatus(JobRunStatusEnum.FAILED.getName());
            jobRun.setErrorMessage(StringUtils.abbreviate(e.toString(), MAX_ERROR_MESSAGE_LENGTH));
            if (ObjectUtils.isEmpty(jobRun.getCompletedAt())) {
                jobRun.setCompletedAt(Timestamp.from(this.clock.instant()));
            }
        }
    }

    private void finish(JobRunEntity jobRun, RunMetrics runMetrics, Throwable throwable) {
        Instant completedAt = this.clock.instant();
        jobRun.setCompletedAt(Timestamp.from(completedAt));
        if (ObjectUtils.isNotEmpty(jobRun.getStartedAt())) {
            jobRun.setDurationMillis(completedAt.toEpochMilli() - jobRun.getStartedAt().getTime());
        }
        if (ObjectUtils.isNotEmpty(throwable)) {
            Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null ?
                    throwable.getCause() : throwable;
            String errorMessage = cause instanceof DbKeeperException dbKeeperException ?
                    dbKeeperException.getDbKeeperMessage() : cause.toString();
            jobRun.setRunStatus(JobRunStatusEnum.FAILED.getName());
            jobRun.setErrorMessage(StringUtils.abbreviate(errorMessage, MAX_ERROR_MESSAGE_LENGTH));
            log.error("execute failed. jobId is {}, kind is {}", jobRun.getJobId(), jobRun.getJobKind(), cause);
        } else {
            if (ObjectUtils.isNotEmpty(runMetrics)) {
                if (runMetrics.getDurationMillis() > 0) {
                    jobRun.setDurationMillis(runMetrics.getDurationMillis());
                }
                jobRun.setSizeBytes(runMetrics.getSizeBytes());
                jobRun.setFilesAffected(runMetrics.getFilesAffected());
                try {
                    jobRun.setMetrics(StringUtils.abbreviate(
                            JsonUtil.serializeToString(runMetrics), MAX_METRICS_LENGTH));
                } catch (RuntimeException e) {
                    log.warn("execute can't serialize run metrics. jobId is {}", jobRun.getJobId(), e);
                }
            }
            if (ObjectUtils.isNotEmpty(runMetrics) && runMetrics.hasErrors()) {
                jobRun.setRunStatus(JobRunStatusEnum.PARTIAL.getName());
                jobRun.setErrorMessage(StringUtils.abbreviate(
                        String.join("; ", runMetrics.getErrors()), MAX_ERROR_MESSAGE_LENGTH));
                log.warn("execute partially failed. jobId is {}, errors are {}",
                        jobRun.getJobId(), runMetrics.getErrors());
            } else {
                jobRun.setRunStatus(JobRunStatusEnum.SUCCESS.getName());
                log.info("execute success. jobId is {}, kind is {}", jobRun.getJobId(), jobRun.getJobKind());
            }
        }
        if (JobRunStatusEnum.FAILED.getName().equals(jobRun.getRunStatus())) {
            this.notifyFailure(jobRun);
        }
    }

    private void notifyFailure(JobRunEntity jobRun) {
        try {
            if (this.jobStore.isFailureAlertsEnabled()) {
                this.notificationService.notifyFailure(jobRun);
            }
        } catch (RuntimeException e) {
            log.error("notifyFailure failed. jobId is {}", jobRun.getJobId(), e);
        }
    }

    private JobRunEntity newDetachedRun(ScheduledJob job) {
        JobRunEntity jobRun = new JobRunEntity();
        jobRun.setJobId(job.getJobId());
        jobRun.setJobKind(job.getKind().name());
        jobRun.setResourceKey(job.getResourceKey());
        jobRun.setStartedAt(Timestamp.from(this.clock.instant()));
        return jobRun;
    }
}
