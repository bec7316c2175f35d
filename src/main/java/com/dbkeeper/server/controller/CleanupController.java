package com.dbkeeper.server.controller;

import com.dbkeeper.server.model.api.cleanup.RetentionPreviewResponse;
import com.dbkeeper.server.model.api.global.DbKeeperHttpResponse;
import com.dbkeeper.server.model.api.job.RunNowResponse;
import com.dbkeeper.server.model.internal.RetentionPolicy;
import com.dbkeeper.server.service.bussiness.PolicyService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;


@RestController
@RequestMapping("/cleanup")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class CleanupController {

    private final PolicyService policyService;

    @Autowired
    public CleanupController(PolicyService policyService) {
        this.policyService = policyService;
    }

    @GetMapping("/preview-retention")
    public DbKeeperHttpResponse<RetentionPreviewResponse> previewRetention(
            @RequestParam(value = "databaseName", required = false) String databaseName) {
        return DbKeeperHttpResponse.success(this.policyService.previewRetention(databaseName));
    }

    @GetMapping("/retention-policy")
    public DbKeeperHttpResponse<RetentionPolicy> getRetentionPolicy() {
        return DbKeeperHttpResponse.success(this.policyService.getRetentionPolicy());
    }

    @PostMapping("/retention-policy")
    public DbKeeperHttpResponse<RetentionPolicy> setRetentionPolicy(@RequestBody RetentionPolicy retentionPolicy) {
        return DbKeeperHttpResponse.success(this.policyService.setRetentionPolicy(retentionPolicy));
    }

    // runs the cleanup job and waits for it
    @PostMapping("/run")
    public DbKeeperHttpResponse<RunNowResponse> runCleanup() {
        RunNowResponse response = new RunNowResponse(this.policyService.runCleanupNow().join());
        return DbKeeperHttpResponse.success(response, response.isSkipped() ? "cleanup is already running" : "success");
    }
}
