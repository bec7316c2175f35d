package com.dbkeeper.server.model.internal;

import com.dbkeeper.server.enums.JobRunStatusEnum;
import com.dbkeeper.server.model.entity.JobRunEntity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.collections4.CollectionUtils;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class DailySummary {

    private LocalDate date;

    private int totalJobs;

    private int successCount;

    private int failedCount;

    private int partialCount;

    private int runningCount;

    private List<FailedJob> failedJobs = new ArrayList<>();

    private double totalBackupSizeMb;

    private double averageDurationSeconds;

    public static DailySummary from(LocalDate date, List<JobRunEntity> runs) {
        DailySummary summary = new DailySummary();
        summary.date = date;
        if (CollectionUtils.isEmpty(runs)) {
            return summary;
        }
        long totalSizeBytes = 0;
        long totalDurationMillis = 0;
        int finishedCount = 0;
        for (JobRunEntity run : runs) {
            summary.totalJobs++;
            switch (JobRunStatusEnum.fromName(run.getRunStatus())) {
                case SUCCESS -> summary.successCount++;
                case PARTIAL -> summary.partialCount++;
                case RUNNING -> summary.runningCount++;
                default -> {
                    summary.failedCount++;
                    summary.failedJobs.add(new FailedJob(
                            run.getJobId(),
                            run.getJobKind(),
                            run.getResourceKey(),
                            run.getErrorMessage()));
                }
            }
            if (run.getSizeBytes() != null) {
                totalSizeBytes += run.getSizeBytes();
            }
            if (run.getDurationMillis() != null && run.getCompletedAt() != null) {
                totalDurationMillis += run.getDurationMillis();
                finishedCount++;
            }
        }
        summary.totalBackupSizeMb = totalSizeBytes / (1024.0 * 1024.0);
        summary.averageDurationSeconds = finishedCount == 0 ? 0 : totalDurationMillis / 1000.0 / finishedCount;
        return summary;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FailedJob {

        private String jobId;

        private String jobKind;

        private String resourceKey;

        private String errorMessage;
    }
}
