package com.dbkeeper.server.service.bussiness;

import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.enums.SyncModeEnum;
import com.dbkeeper.server.model.internal.BackupCompletedEvent;
import com.dbkeeper.server.model.internal.SyncSettings;
import com.dbkeeper.server.service.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Starts one sync {@code bufferMinutes} after the last backup of a burst. Each
 * completion pushes the pending sync further out; earlier completions never
 * pull it back in.
 */
@Service
@Slf4j
public class SyncTriggerService {

    private static final String SYNC_KEY = "after-backups";

    private final DebounceService.ModuleDebounceService debounceService;

    private final ExecutionCoordinator executionCoordinator;

    private final JobStore jobStore;

    private final AtomicReference<Instant> lastBackupCompletedAt = new AtomicReference<>();

    @Autowired
    public SyncTriggerService(
            DebounceService debounceService,
            ExecutionCoordinator executionCoordinator,
            JobStore jobStore) {
        this.debounceService = debounceService.forModule("sync");
        this.executionCoordinator = executionCoordinator;
        this.jobStore = jobStore;
    }

    @EventListener
    public void handleBackupCompleted(BackupCompletedEvent backupCompletedEvent) {
        log.debug("backup completed. jobId is {}, database is {}",
                backupCompletedEvent.getJobId(), backupCompletedEvent.getResourceKey());
        this.onBackupCompleted(backupCompletedEvent.getCompletedAt());
    }

    public void onBackupCompleted(Instant completedAt) {
        Instant latest = this.lastBackupCompletedAt.accumulateAndGet(
                completedAt,
                (previous, current) -> ObjectUtils.isEmpty(previous) || current.isAfter(previous) ?
                        current : previous);
        SyncSettings syncSettings;
        try {
            syncSettings = this.jobStore.getSyncSettings();
        } catch (RuntimeException e) {
            log.error("onBackupCompleted failed. can't read sync settings", e);
            return;
        }
        if (!syncSettings.isEnabled() || syncSettings.getMode() != SyncModeEnum.AFTER_BACKUPS) {
            return;
        }
        Instant fireAt = latest.plus(Duration.ofMinutes(syncSettings.getBufferMinutes()));
        this.debounceService.debounceAt(SYNC_KEY, this::fireSync, fireAt);
        log.info("sync armed after backups. fireAt is {}", fireAt);
    }

    // called when sync settings change
    public void resetPending() {
        this.debounceService.cancel(SYNC_KEY);
    }

    public Instant getPendingFireAt() {
        return this.debounceService.getPendingFireAt(SYNC_KEY);
    }

    public Instant getLastBackupCompletedAt() {
        return this.lastBackupCompletedAt.get();
    }

    private void fireSync() {
        log.info("sync triggered after backups. last backup completed at {}", this.lastBackupCompletedAt.get());
        this.executionCoordinator.execute(this.jobStore.getSystemJob(JobKindEnum.SYNC));
    }
}
