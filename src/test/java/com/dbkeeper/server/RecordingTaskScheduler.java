package com.dbkeeper.server;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Records one shot tasks instead of running them. Tests fire them by hand.
 */
public class RecordingTaskScheduler implements TaskScheduler {

    private final List<RecordedTask> tasks = new ArrayList<>();

    @Override
    public synchronized ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        RecordedTask recordedTask = new RecordedTask(task, startTime);
        this.tasks.add(recordedTask);
        return recordedTask;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException("trigger scheduling is not recorded");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        throw new UnsupportedOperationException("periodic scheduling is not recorded");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        throw new UnsupportedOperationException("periodic scheduling is not recorded");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        throw new UnsupportedOperationException("periodic scheduling is not recorded");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        throw new UnsupportedOperationException("periodic scheduling is not recorded");
    }

    public synchronized List<RecordedTask> getTasks() {
        return new ArrayList<>(this.tasks);
    }

    // tasks neither cancelled nor run, earliest first
    public synchronized List<RecordedTask> getLiveTasks() {
        return this.tasks.stream()
                .filter(recordedTask -> !recordedTask.isCancelled() && !recordedTask.isDone())
                .sorted(Comparator.comparing(RecordedTask::getStartTime))
                .toList();
    }

    public static class RecordedTask implements ScheduledFuture<Object> {

        private final Runnable task;

        private final Instant startTime;

        private boolean cancelled;

        private boolean done;

        RecordedTask(Runnable task, Instant startTime) {
            this.task = task;
            this.startTime = startTime;
        }

        public Instant getStartTime() {
            return this.startTime;
        }

        // runs the task the way the scheduler would, even when cancelled
        public void fire() {
            this.done = true;
            this.task.run();
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(Duration.between(Instant.now(), this.startTime));
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(this.getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }

        @Override
        public synchronized boolean cancel(boolean mayInterruptIfRunning) {
            if (this.done) {
                return false;
            }
            this.cancelled = true;
            return true;
        }

        @Override
        public synchronized boolean isCancelled() {
            return this.cancelled;
        }

        @Override
        public synchronized boolean isDone() {
            return this.done || this.cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
