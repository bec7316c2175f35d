package com.dbkeeper.server.configuration;

import com.dbkeeper.server.service.bussiness.SchedulerService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.time.ZoneId;

@Configuration
@Slf4j
public class ApplicationLifeCycleConfig {

    @Value("${spring.profiles.active:prod}")
    private String activeProfile;

    private final SchedulerService schedulerService;

    private final ZoneId zoneId;

    @Autowired
    public ApplicationLifeCycleConfig(SchedulerService schedulerService, ZoneId zoneId) {
        this.schedulerService = schedulerService;
        this.zoneId = zoneId;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startUp() {
        log.info("Starting up {} environment, scheduler zone is {}", this.activeProfile, this.zoneId);
        this.schedulerService.reloadAll();
    }

    @PreDestroy
    public void shutDown() {
        log.info("Shutting down scheduler");
        this.schedulerService.shutdown();
    }
}
