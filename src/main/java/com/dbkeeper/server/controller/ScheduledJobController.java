package com.dbkeeper.server.controller;

import com.dbkeeper.server.enums.JobRunStatusEnum;
import com.dbkeeper.server.model.api.global.DbKeeperHttpResponse;
import com.dbkeeper.server.model.api.job.BulkCreateJobRequest;
import com.dbkeeper.server.model.api.job.BulkCreateJobResponse;
import com.dbkeeper.server.model.api.job.CreateJobRequest;
import com.dbkeeper.server.model.api.job.RunNowResponse;
import com.dbkeeper.server.model.api.job.ScheduleStatusResponse;
import com.dbkeeper.server.model.api.job.ScheduledJobInfo;
import com.dbkeeper.server.model.api.job.StaggerPreviewRequest;
import com.dbkeeper.server.model.api.job.UpdateJobRequest;
import com.dbkeeper.server.model.entity.JobRunEntity;
import com.dbkeeper.server.model.internal.ExecutionResult;
import com.dbkeeper.server.service.bussiness.PolicyService;
import com.dbkeeper.server.service.bussiness.SchedulerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;


@RestController
@RequestMapping("/jobs")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class ScheduledJobController {

    private static final int MAX_RUN_HISTORY = 500;

    private final SchedulerService schedulerService;

    private final PolicyService policyService;

    @Autowired
    public ScheduledJobController(SchedulerService schedulerService, PolicyService policyService) {
        this.schedulerService = schedulerService;
        this.policyService = policyService;
    }

    @PostMapping("/add-job")
    public DbKeeperHttpResponse<ScheduledJobInfo> addJob(@RequestBody CreateJobRequest createJobRequest) {
        return DbKeeperHttpResponse.success(this.schedulerService.addJob(createJobRequest));
    }

    @PostMapping("/bulk-add-job")
    public DbKeeperHttpResponse<BulkCreateJobResponse> bulkAddJob(
            @RequestBody BulkCreateJobRequest bulkCreateJobRequest) {
        BulkCreateJobResponse response = this.schedulerService.bulkAddJob(bulkCreateJobRequest);
        return DbKeeperHttpResponse.success(
                response,
                "created %d jobs, skipped %d databases".formatted(
                        response.getCreated().size(), response.getSkippedDatabases().size()));
    }

    @PostMapping("/update-job")
    public DbKeeperHttpResponse<ScheduledJobInfo> updateJob(@RequestBody UpdateJobRequest updateJobRequest) {
        return DbKeeperHttpResponse.success(this.schedulerService.updateJob(updateJobRequest));
    }

    @DeleteMapping("/remove-job")
    public DbKeeperHttpResponse<Void> removeJob(@RequestParam("jobId") String jobId) {
        this.schedulerService.removeJob(jobId);
        return DbKeeperHttpResponse.success();
    }

    // wait=false returns as soon as the run is dispatched
    @PostMapping("/run-now")
    public DbKeeperHttpResponse<RunNowResponse> runNow(
            @RequestParam("jobId") String jobId,
            @RequestParam(value = "wait", defaultValue = "false") boolean wait) {
        CompletableFuture<ExecutionResult> future = this.schedulerService.runNow(jobId);
        if (wait || future.isDone()) {
            RunNowResponse response = new RunNowResponse(future.join());
            return DbKeeperHttpResponse.success(response, response.isSkipped() ? "job is already running" : "success");
        }
        RunNowResponse response = new RunNowResponse();
        response.setJobId(jobId);
        response.setRunStatus(JobRunStatusEnum.RUNNING.getName());
        return DbKeeperHttpResponse.success(response, "job triggered");
    }

    @GetMapping("/list-scheduled")
    public DbKeeperHttpResponse<ScheduleStatusResponse> listScheduled() {
        return DbKeeperHttpResponse.success(this.schedulerService.getScheduleStatus());
    }

    @PostMapping("/preview-stagger")
    public DbKeeperHttpResponse<List<String>> previewStagger(@RequestBody StaggerPreviewRequest staggerPreviewRequest) {
        return DbKeeperHttpResponse.success(this.policyService.previewStagger(staggerPreviewRequest));
    }

    @GetMapping("/list-runs")
    public DbKeeperHttpResponse<List<JobRunEntity>> listRuns(
            @RequestParam("jobId") String jobId,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return DbKeeperHttpResponse.success(
                this.schedulerService.listRuns(jobId, Math.min(Math.max(limit, 1), MAX_RUN_HISTORY)));
    }
}
