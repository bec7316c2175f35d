package com.dbkeeper.server.service.executor;

import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.enums.JobRunStatusEnum;
import com.dbkeeper.server.exception.DbKeeperException;
import com.dbkeeper.server.exception.JobExecutionException;
import com.dbkeeper.server.model.internal.BackupFile;
import com.dbkeeper.server.model.internal.RetentionPlan;
import com.dbkeeper.server.model.internal.RetentionPolicy;
import com.dbkeeper.server.model.internal.RunMetrics;
import com.dbkeeper.server.model.internal.ScheduledJob;
import com.dbkeeper.server.service.store.JobStore;
import com.dbkeeper.server.util.BackupFileUtil;
import com.dbkeeper.server.util.RetentionPlanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
@Slf4j
public class CleanupJobExecutor implements JobExecutor {

    private final JobStore jobStore;

    private final Clock clock;

    @Autowired
    public CleanupJobExecutor(JobStore jobStore, Clock clock) {
        this.jobStore = jobStore;
        this.clock = clock;
    }

    @Override
    public JobKindEnum kind() {
        return JobKindEnum.CLEANUP;
    }

    @Override
    public RunMetrics run(ScheduledJob job) throws JobExecutionException {
        Instant startedAt = this.clock.instant();
        // plan everything first, nothing is deleted when a listing fails
        Map<String, RetentionPlan> plans = new LinkedHashMap<>();
        try {
            RetentionPolicy retentionPolicy = this.jobStore.getRetentionPolicy();
            RetentionPlanner.isPolicyValid(retentionPolicy);
            this.listFilesByDatabase().forEach((databaseName, backupFiles) ->
                    plans.put(databaseName, RetentionPlanner.plan(backupFiles, retentionPolicy)));
        } catch (RuntimeException e) {
            this.recordCleanupRun(JobRunStatusEnum.FAILED, e.getMessage());
            throw new JobExecutionException("cleanup failed. can't plan retention", e);
        }
        RunMetrics runMetrics = new RunMetrics();
        int deletedCount = 0;
        long deletedBytes = 0;
        for (Map.Entry<String, RetentionPlan> entry : plans.entrySet()) {
            for (BackupFile backupFile : entry.getValue().getDelete()) {
                Path file = backupFile.toPath();
                try {
                    if (Files.deleteIfExists(file)) {
                        deletedCount++;
                        deletedBytes += backupFile.getSizeBytes();
                        log.info("cleanup deleted file. database is {}, file is {}", entry.getKey(), file);
                    } else {
                        log.info("cleanup skipped file, already gone. database is {}, file is {}",
                                entry.getKey(), file);
                    }
                } catch (IOException e) {
                    log.warn("cleanup can't delete file. database is {}, file is {}", entry.getKey(), file, e);
                    runMetrics.getErrors().add("%s: %s".formatted(backupFile.getFileName(), e));
                }
            }
        }
        int removedFolders = 0;
        try {
            removedFolders = BackupFileUtil.removeEmptyDateFolders(this.jobStore.getBackupRoot());
        } catch (DbKeeperException e) {
            log.warn("cleanup can't remove empty date folders", e);
            runMetrics.getErrors().add(e.getMessage());
        }
        String message = "deleted %d files (%.2f MB) across %d databases, removed %d empty folders"
                .formatted(deletedCount, deletedBytes / (1024.0 * 1024.0), plans.size(), removedFolders);
        if (runMetrics.hasErrors()) {
            message += ", %d errors".formatted(runMetrics.getErrors().size());
        }
        this.recordCleanupRun(
                runMetrics.hasErrors() ? JobRunStatusEnum.PARTIAL : JobRunStatusEnum.SUCCESS,
                message);
        runMetrics.setDurationMillis(this.clock.millis() - startedAt.toEpochMilli());
        runMetrics.setFilesAffected(deletedCount);
        runMetrics.setSizeBytes(deletedBytes);
        runMetrics.setMessage(message);
        return runMetrics;
    }

    public Map<String, RetentionPlan> preview(String databaseName) throws DbKeeperException {
        RetentionPolicy retentionPolicy = this.jobStore.getRetentionPolicy();
        Map<String, List<BackupFile>> filesByDatabase = databaseName == null ?
                this.listFilesByDatabase() : Map.of(databaseName, this.jobStore.listBackupFiles(databaseName));
        Map<String, RetentionPlan> result = new LinkedHashMap<>();
        filesByDatabase.forEach((name, backupFiles) ->
                result.put(name, RetentionPlanner.plan(backupFiles, retentionPolicy)));
        return result;
    }

    // one walk of the backup tree, grouped by database name
    private Map<String, List<BackupFile>> listFilesByDatabase() {
        Map<String, List<BackupFile>> filesByDatabase = new TreeMap<>();
        for (BackupFile backupFile : this.jobStore.listBackupFiles(null)) {
            filesByDatabase.computeIfAbsent(backupFile.getDatabaseName(), k -> new ArrayList<>()).add(backupFile);
        }
        return filesByDatabase;
    }

    private void recordCleanupRun(JobRunStatusEnum status, String message) {
        try {
            this.jobStore.recordCleanupRun(this.clock.instant(), status, message);
        } catch (RuntimeException e) {
            log.error("recordCleanupRun failed. status is {}, message is {}", status, message, e);
        }
    }
}
