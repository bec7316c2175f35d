package com.dbkeeper.server.service.executor;

import com.dbkeeper.server.InMemoryJobStore;
import com.dbkeeper.server.MutableClock;
import com.dbkeeper.server.enums.BackupTypeEnum;
import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.enums.JobRunStatusEnum;
import com.dbkeeper.server.exception.JobExecutionException;
import com.dbkeeper.server.model.internal.BackupFile;
import com.dbkeeper.server.model.internal.RetentionPlan;
import com.dbkeeper.server.model.internal.RetentionPolicy;
import com.dbkeeper.server.model.internal.RunMetrics;
import com.dbkeeper.server.util.BackupFileUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CleanupJobExecutorTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Istanbul");

    private static final long MB = 1024L * 1024L;

    @TempDir
    Path backupRoot;

    private InMemoryJobStore jobStore;

    private CleanupJobExecutor cleanupJobExecutor;

    @BeforeEach
    void setUp() {
        this.jobStore = new InMemoryJobStore();
        this.jobStore.setBackupRoot(this.backupRoot);
        this.jobStore.setZoneId(ZONE);
        this.jobStore.setRetentionPolicy(policy(2, 1));
        this.cleanupJobExecutor = new CleanupJobExecutor(
                this.jobStore, new MutableClock(Instant.parse("2024-03-10T03:00:00Z"), ZONE));
    }

    @Test
    void shouldPreviewWithoutDeleting() throws IOException {
        Path d1 = this.writeBackup("Sales", BackupTypeEnum.FULL, LocalDateTime.of(2024, 3, 1, 1, 0));
        Path d2 = this.writeBackup("Sales", BackupTypeEnum.FULL, LocalDateTime.of(2024, 3, 2, 1, 0));
        Path d3 = this.writeBackup("Sales", BackupTypeEnum.FULL, LocalDateTime.of(2024, 3, 3, 1, 0));
        List<BackupFile> backupFiles = new ArrayList<>();
        backupFiles.add(backupFile("Sales", d1, Instant.parse("2024-02-29T22:00:00Z"), 100 * MB));
        backupFiles.add(backupFile("Sales", d2, Instant.parse("2024-03-01T22:00:00Z"), 150 * MB));
        backupFiles.add(backupFile("Sales", d3, Instant.parse("2024-03-02T22:00:00Z"), 200 * MB));
        this.jobStore.setBackupFiles(backupFiles);

        Map<String, RetentionPlan> plans = this.cleanupJobExecutor.preview(null);

        RetentionPlan plan = plans.get("Sales");
        assertEquals(1, plan.getDelete().size());
        assertEquals(d1.toString(), plan.getDelete().get(0).getFilePath());
        assertEquals(100.0, plan.getDeleteSizeMb(), 0.001);
        assertEquals(350.0, plan.getKeepSizeMb(), 0.001);
        assertTrue(Files.exists(d1));
        assertTrue(Files.exists(d2));
        assertTrue(Files.exists(d3));
    }

    @Test
    void shouldDeleteExpiredBackupsAndEmptyFolders() throws IOException {
        this.jobStore.setRetentionPolicy(policy(1, 1));
        Path oldFull = this.writeBackup("Sales", BackupTypeEnum.FULL, LocalDateTime.of(2024, 3, 1, 1, 0));
        Path oldDiff = this.writeBackup("Sales", BackupTypeEnum.DIFF, LocalDateTime.of(2024, 3, 1, 13, 0));
        Path newFull = this.writeBackup("Sales", BackupTypeEnum.FULL, LocalDateTime.of(2024, 3, 2, 1, 0));
        Path newDiff = this.writeBackup("Sales", BackupTypeEnum.DIFF, LocalDateTime.of(2024, 3, 2, 13, 0));
        Path log = this.writeBackup("Sales", BackupTypeEnum.LOG, LocalDateTime.of(2024, 3, 1, 2, 0));
        Path hrFull = this.writeBackup("Hr", BackupTypeEnum.FULL, LocalDateTime.of(2024, 3, 1, 1, 30));

        RunMetrics runMetrics = this.cleanupJobExecutor.run(this.jobStore.getSystemJob(JobKindEnum.CLEANUP));

        assertFalse(Files.exists(oldFull));
        assertFalse(Files.exists(oldDiff));
        assertTrue(Files.exists(newFull));
        assertTrue(Files.exists(newDiff));
        assertTrue(Files.exists(log));
        assertTrue(Files.exists(hrFull));
        assertEquals(2, runMetrics.getFilesAffected());
        assertFalse(runMetrics.hasErrors());
        assertFalse(Files.exists(oldDiff.getParent()));
        assertEquals(JobRunStatusEnum.SUCCESS, this.jobStore.getLastCleanupStatus());
        assertTrue(this.jobStore.getLastCleanupMessage().contains("deleted 2 files"));
    }

    @Test
    void shouldReportPartialWhenAFileCanNotBeDeleted() throws IOException {
        this.jobStore.setRetentionPolicy(policy(1, 1));
        Path newFull = this.writeBackup("Sales", BackupTypeEnum.FULL, LocalDateTime.of(2024, 3, 2, 1, 0));
        Path oldFull = this.writeBackup("Sales", BackupTypeEnum.FULL, LocalDateTime.of(2024, 3, 1, 1, 0));
        // a non empty directory can not be removed by a file delete
        Path stuck = this.backupRoot.resolve("FULL").resolve("2024-02-29").resolve("Sales_FULL_20240229_010000.bak");
        Files.createDirectories(stuck);
        Files.writeString(stuck.resolve("inner"), "x");
        this.jobStore.setBackupFiles(List.of(
                backupFile("Sales", newFull, Instant.parse("2024-03-01T22:00:00Z"), 10),
                backupFile("Sales", oldFull, Instant.parse("2024-02-29T22:00:00Z"), 10),
                backupFile("Sales", stuck, Instant.parse("2024-02-28T22:00:00Z"), 10)));

        RunMetrics runMetrics = this.cleanupJobExecutor.run(this.jobStore.getSystemJob(JobKindEnum.CLEANUP));

        assertTrue(runMetrics.hasErrors());
        assertEquals(1, runMetrics.getErrors().size());
        assertEquals(1, runMetrics.getFilesAffected());
        assertFalse(Files.exists(oldFull));
        assertTrue(Files.exists(newFull));
        assertEquals(JobRunStatusEnum.PARTIAL, this.jobStore.getLastCleanupStatus());
    }

    @Test
    void shouldNotCountFilesThatAreAlreadyGone() throws IOException {
        this.jobStore.setRetentionPolicy(policy(1, 1));
        Path newFull = this.writeBackup("Sales", BackupTypeEnum.FULL, LocalDateTime.of(2024, 3, 2, 1, 0));
        Path gone = BackupFileUtil.buildBackupFilePath(
                this.backupRoot, "Sales", BackupTypeEnum.FULL, LocalDateTime.of(2024, 3, 1, 1, 0));
        this.jobStore.setBackupFiles(List.of(
                backupFile("Sales", newFull, Instant.parse("2024-03-01T22:00:00Z"), 10 * MB),
                backupFile("Sales", gone, Instant.parse("2024-02-29T22:00:00Z"), 10 * MB)));

        RunMetrics runMetrics = this.cleanupJobExecutor.run(this.jobStore.getSystemJob(JobKindEnum.CLEANUP));

        assertEquals(0, runMetrics.getFilesAffected());
        assertEquals(0L, runMetrics.getSizeBytes());
        assertFalse(runMetrics.hasErrors());
        assertTrue(Files.exists(newFull));
        assertTrue(this.jobStore.getLastCleanupMessage().startsWith("deleted 0 files"));
    }

    @Test
    void shouldWalkBackupTreeOnceForAllDatabases() throws IOException {
        this.jobStore.setRetentionPolicy(policy(1, 1));
        for (String databaseName : List.of("Sales", "Hr", "Stock")) {
            this.writeBackup(databaseName, BackupTypeEnum.FULL, LocalDateTime.of(2024, 3, 1, 1, 0));
            this.writeBackup(databaseName, BackupTypeEnum.FULL, LocalDateTime.of(2024, 3, 2, 1, 0));
        }

        RunMetrics runMetrics = this.cleanupJobExecutor.run(this.jobStore.getSystemJob(JobKindEnum.CLEANUP));

        assertEquals(1, this.jobStore.getBackupListings().get());
        assertEquals(3, runMetrics.getFilesAffected());

        Map<String, RetentionPlan> plans = this.cleanupJobExecutor.preview(null);
        assertEquals(List.of("Hr", "Sales", "Stock"), new ArrayList<>(plans.keySet()));
        assertEquals(2, this.jobStore.getBackupListings().get());
    }

    @Test
    void shouldDeleteNothingWhenPolicyIsInvalid() throws IOException {
        this.jobStore.setRetentionPolicy(policy(-1, 1));
        Path full = this.writeBackup("Sales", BackupTypeEnum.FULL, LocalDateTime.of(2024, 3, 1, 1, 0));

        assertThrows(JobExecutionException.class,
                () -> this.cleanupJobExecutor.run(this.jobStore.getSystemJob(JobKindEnum.CLEANUP)));

        assertTrue(Files.exists(full));
        assertEquals(JobRunStatusEnum.FAILED, this.jobStore.getLastCleanupStatus());
    }

    private Path writeBackup(String databaseName, BackupTypeEnum type, LocalDateTime createdAt) throws IOException {
        Path file = BackupFileUtil.buildBackupFilePath(this.backupRoot, databaseName, type, createdAt);
        Files.createDirectories(file.getParent());
        Files.writeString(file, databaseName);
        return file;
    }

    private static BackupFile backupFile(String databaseName, Path file, Instant createdAt, long sizeBytes) {
        return BackupFile.builder()
                .filePath(file.toString())
                .fileName(file.getFileName().toString())
                .databaseName(databaseName)
                .backupType(BackupTypeEnum.FULL)
                .createdAt(createdAt)
                .sizeBytes(sizeBytes)
                .build();
    }

    private static RetentionPolicy policy(int keepFullCount, int keepDiffPerFull) {
        return RetentionPolicy.builder()
                .enabled(true)
                .schedule("0 6 * * 0")
                .keepFullCount(keepFullCount)
                .keepDiffPerFull(keepDiffPerFull)
                .keepOrphanDiff(0)
                .build();
    }
}
