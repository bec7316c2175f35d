package com.dbkeeper.server.service.executor;

import com.dbkeeper.server.InMemoryJobStore;
import com.dbkeeper.server.MutableClock;
import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.exception.BusinessException;
import com.dbkeeper.server.exception.JobExecutionException;
import com.dbkeeper.server.model.internal.BandwidthLimit;
import com.dbkeeper.server.model.internal.BandwidthPolicy;
import com.dbkeeper.server.model.internal.RunMetrics;
import com.dbkeeper.server.model.internal.SyncResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyncJobExecutorTest {

    // Tuesday 12:00 in Istanbul
    private static final Instant TUESDAY_NOON = Instant.parse("2024-03-05T09:00:00Z");

    private InMemoryJobStore jobStore;

    private List<BandwidthLimit> requestedLimits;

    private SyncResult syncResult;

    private SyncJobExecutor syncJobExecutor;

    @BeforeEach
    void setUp() {
        this.jobStore = new InMemoryJobStore();
        this.requestedLimits = new ArrayList<>();
        this.syncResult = SyncResult.builder()
                .archiveName("dbkeeper-2024-03-05T12:00")
                .filesTotal(12)
                .bytesOriginal(4096)
                .bytesDeduplicated(1024)
                .duration(Duration.ofSeconds(40))
                .build();
        this.syncJobExecutor = new SyncJobExecutor(
                (backupPath, limit) -> {
                    this.requestedLimits.add(limit);
                    if (this.syncResult == null) {
                        throw new BusinessException("sync failed. borg exited with 2");
                    }
                    return this.syncResult;
                },
                this.jobStore,
                new MutableClock(TUESDAY_NOON, ZoneId.of("Europe/Istanbul")));
    }

    @Test
    void shouldPassPeakLimitToDriver() {
        this.jobStore.setBandwidthPolicy(policy(5000L, null));

        RunMetrics runMetrics = this.syncJobExecutor.run(this.jobStore.getSystemJob(JobKindEnum.SYNC));

        assertEquals(List.of(BandwidthLimit.ofKBs(5000L)), this.requestedLimits);
        assertEquals(4096L, runMetrics.getSizeBytes());
        assertEquals(1024L, runMetrics.getBytesDeduplicated());
        assertEquals(12, runMetrics.getFilesAffected());
        assertFalse(runMetrics.hasErrors());
    }

    @Test
    void shouldFailWithoutCallingDriverWhenPaused() {
        this.jobStore.setBandwidthPolicy(policy(0L, null));

        assertThrows(JobExecutionException.class,
                () -> this.syncJobExecutor.run(this.jobStore.getSystemJob(JobKindEnum.SYNC)));
        assertTrue(this.requestedLimits.isEmpty());
    }

    @Test
    void shouldReportPruneWarningsAsErrors() {
        this.syncResult.getWarnings().add("prune failed. repository is locked");

        RunMetrics runMetrics = this.syncJobExecutor.run(this.jobStore.getSystemJob(JobKindEnum.SYNC));

        assertTrue(runMetrics.hasErrors());
        assertEquals("prune failed. repository is locked", runMetrics.getErrors().get(0));
    }

    @Test
    void shouldWrapDriverFailure() {
        this.syncResult = null;

        JobExecutionException e = assertThrows(JobExecutionException.class,
                () -> this.syncJobExecutor.run(this.jobStore.getSystemJob(JobKindEnum.SYNC)));
        assertTrue(e.getDbKeeperMessage().contains("borg exited with 2"));
    }

    private static BandwidthPolicy policy(Long peakLimitKBs, Long offpeakLimitKBs) {
        return BandwidthPolicy.builder()
                .enabled(true)
                .peakLimitKBs(peakLimitKBs)
                .offpeakLimitKBs(offpeakLimitKBs)
                .peakStart(LocalTime.of(8, 0))
                .peakEnd(LocalTime.of(20, 0))
                .weekendUnlimited(true)
                .build();
    }
}
