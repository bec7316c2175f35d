package com.dbkeeper.server.service.driver;

import com.dbkeeper.server.model.entity.JobRunEntity;
import com.dbkeeper.server.model.internal.DailySummary;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class LogNotificationService implements NotificationService {

    @Value("${dbkeeper.server.notification.recipients:}")
    private List<String> recipients;

    @Override
    @Async("generalTaskScheduler")
    public void notifyFailure(JobRunEntity jobRun) {
        log.error("job failed. recipients are {}. jobId is {}, jobKind is {}, database is {}, status is {}, " +
                        "error is {}",
                this.getRecipients(),
                jobRun.getJobId(),
                jobRun.getJobKind(),
                jobRun.getResourceKey(),
                jobRun.getRunStatus(),
                jobRun.getErrorMessage());
    }

    @Override
    @Async("generalTaskScheduler")
    public void notifyDailySummary(DailySummary dailySummary) {
        log.info("daily summary for {}. recipients are {}. total {}, success {}, partial {}, failed {}, " +
                        "running {}, backup size {} MB, average duration {} s",
                dailySummary.getDate(),
                this.getRecipients(),
                dailySummary.getTotalJobs(),
                dailySummary.getSuccessCount(),
                dailySummary.getPartialCount(),
                dailySummary.getFailedCount(),
                dailySummary.getRunningCount(),
                "%.2f".formatted(dailySummary.getTotalBackupSizeMb()),
                "%.1f".formatted(dailySummary.getAverageDurationSeconds()));
        for (DailySummary.FailedJob failedJob : dailySummary.getFailedJobs()) {
            log.info("daily summary failed job. jobId is {}, jobKind is {}, database is {}, error is {}",
                    failedJob.getJobId(),
                    failedJob.getJobKind(),
                    failedJob.getResourceKey(),
                    failedJob.getErrorMessage());
        }
    }

    private String getRecipients() {
        return CollectionUtils.isEmpty(this.recipients) ? "[log only]" : String.join(",", this.recipients);
    }
}
