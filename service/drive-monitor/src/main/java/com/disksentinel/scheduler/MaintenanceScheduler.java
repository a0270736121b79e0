package com.disksentinel.scheduler;

import com.disksentinel.config.ApplicationConfig;
import com.disksentinel.service.ScanSupervisor;
import com.disksentinel.websocket.EventBus;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Slf4j
@Service
public class MaintenanceScheduler {

    private static final Duration EVICTION_INTERVAL = Duration.ofSeconds(30);

    private final ApplicationConfig config;
    private final EventBus eventBus;
    private final ScanSupervisor scanSupervisor;
    private final ThreadPoolTaskScheduler taskScheduler;

    public MaintenanceScheduler(
            ApplicationConfig config,
            EventBus eventBus,
            ScanSupervisor scanSupervisor,
            @Qualifier("taskScheduler")
            ThreadPoolTaskScheduler taskScheduler) {
        this.config = config;
        this.eventBus = eventBus;
        this.scanSupervisor = scanSupervisor;
        this.taskScheduler = taskScheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        log.info("Application ready, starting subscriber heartbeat every {} and scan record eviction every {}",
                config.getPingInterval(), EVICTION_INTERVAL);
        taskScheduler.scheduleAtFixedRate(this::probeSubscribers, config.getPingInterval());
        taskScheduler.scheduleAtFixedRate(this::evictFinishedScans, EVICTION_INTERVAL);
    }

    // 心跳探测
    void probeSubscribers() {
        try {
            int removed = eventBus.probeLiveness(config.getPongTimeout());
            if (removed > 0) {
                log.info("Heartbeat removed {} unresponsive subscribers", removed);
            }
        } catch (Exception e) {
            log.warn("Subscriber heartbeat failed", e);
        }
    }

    // 过期扫描记录清理
    void evictFinishedScans() {
        try {
            scanSupervisor.evictExpired();
        } catch (Exception e) {
            log.warn("Scan record eviction failed", e);
        }
    }
}
