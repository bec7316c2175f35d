package com.dbkeeper.server.service.executor;

import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.exception.DbKeeperException;
import com.dbkeeper.server.exception.JobExecutionException;
import com.dbkeeper.server.model.entity.JobRunEntity;
import com.dbkeeper.server.model.internal.DailySummary;
import com.dbkeeper.server.model.internal.RunMetrics;
import com.dbkeeper.server.model.internal.ScheduledJob;
import com.dbkeeper.server.service.driver.NotificationService;
import com.dbkeeper.server.service.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

// summarizes the previous calendar day
@Service
@Slf4j
public class SummaryJobExecutor implements JobExecutor {

    private final JobStore jobStore;

    private final NotificationService notificationService;

    private final Clock clock;

    @Autowired
    public SummaryJobExecutor(JobStore jobStore, NotificationService notificationService, Clock clock) {
        this.jobStore = jobStore;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    @Override
    public JobKindEnum kind() {
        return JobKindEnum.SUMMARY;
    }

    @Override
    public RunMetrics run(ScheduledJob job) throws JobExecutionException {
        ZoneId zoneId = this.clock.getZone();
        LocalDate day = LocalDate.now(this.clock).minusDays(1);
        DailySummary dailySummary;
        try {
            List<JobRunEntity> runs = this.jobStore.listRunsBetween(
                    day.atStartOfDay(zoneId).toInstant(),
                    day.plusDays(1).atStartOfDay(zoneId).toInstant());
            dailySummary = DailySummary.from(day, runs);
        } catch (DbKeeperException e) {
            throw new JobExecutionException("summary failed. can't read job runs. day is %s".formatted(day), e);
        }
        this.notificationService.notifyDailySummary(dailySummary);
        RunMetrics runMetrics = new RunMetrics();
        runMetrics.setFilesAffected(dailySummary.getTotalJobs());
        runMetrics.setMessage("summary for %s sent. %d runs, %d failed".formatted(
                day, dailySummary.getTotalJobs(), dailySummary.getFailedCount()));
        return runMetrics;
    }
}
