package com.dbkeeper.server.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@Slf4j
public class ThreadPoolConfig {

    @Value("${dbkeeper.server.scheduler.trigger-pool-size:4}")
    private int triggerPoolSize;

    @Value("${dbkeeper.server.scheduler.general-pool-size:4}")
    private int generalPoolSize;

    @Value("${dbkeeper.server.scheduler.execution-pool-size:8}")
    private int executionPoolSize;

    @Value("${dbkeeper.server.scheduler.execution-queue-capacity:200}")
    private int executionQueueCapacity;

    // cron timers only, fires return right after handing the job over
    @Bean(name = "triggerTaskScheduler")
    public ThreadPoolTaskScheduler triggerTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(this.triggerPoolSize);
        scheduler.setThreadNamePrefix("Trigger-Thread-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    // debounce timers and async notifications
    @Bean(name = "generalTaskScheduler")
    public ThreadPoolTaskScheduler generalTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(this.generalPoolSize);
        scheduler.setThreadNamePrefix("General-Task-Scheduled-Thread-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = "jobExecutionPool")
    public ThreadPoolTaskExecutor jobExecutionPool() {
        log.info("job execution pool size is {}, queue capacity is {}",
                this.executionPoolSize, this.executionQueueCapacity);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(this.executionPoolSize);
        executor.setMaxPoolSize(this.executionPoolSize);
        executor.setQueueCapacity(this.executionQueueCapacity);
        executor.setKeepAliveSeconds(60);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        executor.setThreadNamePrefix("Job-Execution-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }
}
