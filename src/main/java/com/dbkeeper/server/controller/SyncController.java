package com.dbkeeper.server.controller;

import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.enums.JobRunStatusEnum;
import com.dbkeeper.server.model.api.global.DbKeeperHttpResponse;
import com.dbkeeper.server.model.api.job.RunNowResponse;
import com.dbkeeper.server.model.internal.BandwidthLimit;
import com.dbkeeper.server.model.internal.BandwidthPolicy;
import com.dbkeeper.server.model.internal.ExecutionResult;
import com.dbkeeper.server.model.internal.SummarySettings;
import com.dbkeeper.server.model.internal.SyncSettings;
import com.dbkeeper.server.service.bussiness.PolicyService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;


@RestController
@RequestMapping("/sync")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class SyncController {

    private final PolicyService policyService;

    @Autowired
    public SyncController(PolicyService policyService) {
        this.policyService = policyService;
    }

    @GetMapping("/bandwidth-policy")
    public DbKeeperHttpResponse<BandwidthPolicy> getBandwidthPolicy() {
        return DbKeeperHttpResponse.success(this.policyService.getBandwidthPolicy());
    }

    @PostMapping("/bandwidth-policy")
    public DbKeeperHttpResponse<BandwidthPolicy> setBandwidthPolicy(@RequestBody BandwidthPolicy bandwidthPolicy) {
        return DbKeeperHttpResponse.success(this.policyService.setBandwidthPolicy(bandwidthPolicy));
    }

    @GetMapping("/current-limit")
    public DbKeeperHttpResponse<BandwidthLimit> getCurrentLimit() {
        BandwidthLimit limit = this.policyService.getCurrentLimit();
        return DbKeeperHttpResponse.success(limit, limit.toString());
    }

    @GetMapping("/sync-settings")
    public DbKeeperHttpResponse<SyncSettings> getSyncSettings() {
        return DbKeeperHttpResponse.success(this.policyService.getSyncSettings());
    }

    @PostMapping("/sync-settings")
    public DbKeeperHttpResponse<SyncSettings> setSyncSettings(@RequestBody SyncSettings syncSettings) {
        return DbKeeperHttpResponse.success(this.policyService.setSyncSettings(syncSettings));
    }

    @PostMapping("/run")
    public DbKeeperHttpResponse<RunNowResponse> runSync() {
        CompletableFuture<ExecutionResult> future = this.policyService.runSyncNow();
        if (future.isDone()) {
            RunNowResponse response = new RunNowResponse(future.join());
            return DbKeeperHttpResponse.success(response, response.isSkipped() ? "sync is already running" : "success");
        }
        RunNowResponse response = new RunNowResponse();
        response.setJobId(JobKindEnum.SYNC.getSystemJobId());
        response.setRunStatus(JobRunStatusEnum.RUNNING.getName());
        return DbKeeperHttpResponse.success(response, "sync triggered");
    }

    @GetMapping("/summary-settings")
    public DbKeeperHttpResponse<SummarySettings> getSummarySettings() {
        return DbKeeperHttpResponse.success(this.policyService.getSummarySettings());
    }

    @PostMapping("/summary-settings")
    public DbKeeperHttpResponse<SummarySettings> setSummarySettings(@RequestBody SummarySettings summarySettings) {
        return DbKeeperHttpResponse.success(this.policyService.setSummarySettings(summarySettings));
    }
}
