package com.dbkeeper.server.service.bussiness;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Single slot timers keyed by name. Arming a key again replaces the pending
 * task, so only the last request fires.
 */
@Slf4j
@Service
public class DebounceService {

    private final TaskScheduler generalTaskScheduler;

    private final Map<String, PendingTask> taskMap = new ConcurrentHashMap<>();

    @Autowired
    public DebounceService(@Qualifier("generalTaskScheduler") TaskScheduler generalTaskScheduler) {
        this.generalTaskScheduler = generalTaskScheduler;
    }

    public void debounceAt(String key, Runnable task, Instant fireAt) {
        this.taskMap.compute(key, (k, existing) -> {
            // replace the pending task of the same key
            if (ObjectUtils.isNotEmpty(existing)) {
                existing.future().cancel(false);
            }
            PendingTask[] self = new PendingTask[1];
            ScheduledFuture<?> future = this.generalTaskScheduler.schedule(() -> {
                // only the task still in the slot clears it
                this.taskMap.remove(key, self[0]);
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.warn("execute debounce task failed. key is {}", key, e);
                }
            }, fireAt);
            self[0] = new PendingTask(future, fireAt);
            return self[0];
        });
    }

    public void cancel(String key) {
        PendingTask existing = this.taskMap.remove(key);
        if (ObjectUtils.isNotEmpty(existing)) {
            existing.future().cancel(false);
        }
    }

    // null when nothing is pending
    public Instant getPendingFireAt(String key) {
        PendingTask pendingTask = this.taskMap.get(key);
        return ObjectUtils.isEmpty(pendingTask) ? null : pendingTask.fireAt();
    }

    public ModuleDebounceService forModule(String moduleName) {
        return new ModuleDebounceService(this, moduleName);
    }

    private record PendingTask(ScheduledFuture<?> future, Instant fireAt) {
    }

    public static class ModuleDebounceService {

        private final DebounceService debounceService;

        private final String modulePrefix;

        public ModuleDebounceService(DebounceService debounceService, String moduleName) {
            this.debounceService = debounceService;
            this.modulePrefix = moduleName + "::";
        }

        public void debounceAt(String key, Runnable task, Instant fireAt) {
            this.debounceService.debounceAt(this.modulePrefix + key, task, fireAt);
        }

        public void cancel(String key) {
            this.debounceService.cancel(this.modulePrefix + key);
        }

        public Instant getPendingFireAt(String key) {
            return this.debounceService.getPendingFireAt(this.modulePrefix + key);
        }
    }
}
