package com.dbkeeper.server.service.executor;

import com.dbkeeper.server.InMemoryJobStore;
import com.dbkeeper.server.MutableClock;
import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.enums.JobRunStatusEnum;
import com.dbkeeper.server.model.entity.JobRunEntity;
import com.dbkeeper.server.model.internal.DailySummary;
import com.dbkeeper.server.model.internal.RunMetrics;
import com.dbkeeper.server.model.internal.ScheduledJob;
import com.dbkeeper.server.service.driver.NotificationService;
import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SummaryJobExecutorTest {

    @Test
    void shouldSummarizePreviousDayInSchedulerZone() {
        InMemoryJobStore jobStore = new InMemoryJobStore();
        // 23:30 on March 3rd in Istanbul, outside the summarized day
        this.addRun(jobStore, "1", Instant.parse("2024-03-03T20:30:00Z"), JobRunStatusEnum.SUCCESS, 100L);
        this.addRun(jobStore, "1", Instant.parse("2024-03-03T22:10:00Z"), JobRunStatusEnum.SUCCESS, 1024L * 1024L);
        this.addRun(jobStore, "2", Instant.parse("2024-03-04T10:00:00Z"), JobRunStatusEnum.FAILED, null);
        this.addRun(jobStore, "3", Instant.parse("2024-03-04T12:00:00Z"), JobRunStatusEnum.PARTIAL, null);
        // 00:30 on March 5th in Istanbul
        this.addRun(jobStore, "1", Instant.parse("2024-03-04T21:30:00Z"), JobRunStatusEnum.SUCCESS, 100L);
        List<DailySummary> sent = new ArrayList<>();
        NotificationService notificationService = new NotificationService() {
            @Override
            public void notifyFailure(JobRunEntity jobRun) {
                fail("no failure alert expected");
            }

            @Override
            public void notifyDailySummary(DailySummary dailySummary) {
                sent.add(dailySummary);
            }
        };
        SummaryJobExecutor summaryJobExecutor = new SummaryJobExecutor(
                jobStore,
                notificationService,
                new MutableClock(Instant.parse("2024-03-05T05:00:00Z"), ZoneId.of("Europe/Istanbul")));

        RunMetrics runMetrics = summaryJobExecutor.run(jobStore.getSystemJob(JobKindEnum.SUMMARY));

        assertEquals(1, sent.size());
        DailySummary dailySummary = sent.get(0);
        assertEquals(LocalDate.of(2024, 3, 4), dailySummary.getDate());
        assertEquals(3, dailySummary.getTotalJobs());
        assertEquals(1, dailySummary.getSuccessCount());
        assertEquals(1, dailySummary.getFailedCount());
        assertEquals(1, dailySummary.getPartialCount());
        assertEquals("2", dailySummary.getFailedJobs().get(0).getJobId());
        assertEquals(1.0, dailySummary.getTotalBackupSizeMb(), 0.001);
        assertEquals(3, runMetrics.getFilesAffected());
    }

    private void addRun(InMemoryJobStore jobStore, String jobId, Instant startedAt, JobRunStatusEnum status, Long size) {
        JobRunEntity jobRun = jobStore.createRun(ScheduledJob.builder()
                .jobId(jobId)
                .kind(JobKindEnum.BACKUP)
                .resourceKey("Sales")
                .build(), startedAt);
        jobRun.setRunStatus(status.getName());
        jobRun.setSizeBytes(size);
        jobRun.setCompletedAt(Timestamp.from(startedAt.plusSeconds(60)));
        jobRun.setDurationMillis(60_000L);
    }
}
