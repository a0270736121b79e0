package com.disksentinel.service;

import com.disksentinel.config.ApplicationConfig;
import com.disksentinel.exception.ScanAlreadyRunningException;
import com.disksentinel.model.ScanEvent;
import com.disksentinel.model.ScanJobSnapshot;
import com.disksentinel.model.ScanState;
import com.disksentinel.websocket.EventBus;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Future;

/**
 * 扫描任务管理
 *
 * 职责：
 * - 每个设备最多一个未结束的任务（compute 原子检查并插入）
 * - 启动即返回，扫描在 scanExecutor 上运行，任务句柄由本类持有
 * - 取消为协作式，幂等
 * - 终态任务保留一段时间供状态查询，过期后由定时任务清理
 */
@Slf4j
@Service
public class ScanSupervisor {

    private final ScanEngine engine;
    private final EventBus eventBus;
    private final AsyncTaskExecutor executor;
    private final Clock clock;
    private final Duration retention;

    private final ConcurrentMap<String, ScanJob> jobs = new ConcurrentHashMap<>();

    public ScanSupervisor(
            ApplicationConfig config,
            ScanEngine engine,
            EventBus eventBus,
            @Qualifier("scanExecutor")
            AsyncTaskExecutor executor,
            Clock clock) {
        this.engine = engine;
        this.eventBus = eventBus;
        this.executor = executor;
        this.clock = clock;
        this.retention = config.getScan().getStatusRetention();
    }

    public ScanJobSnapshot startScan(String device) {
        DeviceGateway.requireValidName(device);
        ScanJob created = new ScanJob(device, clock);
        ScanJob winner = jobs.compute(device, (k, existing) ->
                existing != null && !existing.isTerminal() ? existing : created);
        if (winner != created) {
            log.info("Scan already running on {}, rejecting start", device);
            throw new ScanAlreadyRunningException(device);
        }

        try {
            Future<?> task = executor.submit(() -> runJob(created));
            created.attach(task);
        } catch (TaskRejectedException e) {
            log.error("Scan executor saturated, cannot start scan on {}", device, e);
            if (created.finish(ScanState.FAILED, "Scan capacity exhausted")) {
                eventBus.publish(ScanEvent.failed(device, "Scan capacity exhausted"));
            }
            jobs.remove(device, created);
            throw e;
        }
        log.info("Scan queued for {}", device);
        return created.snapshot();
    }

    /**
     * @return 是否向一个未结束的任务发出了取消信号
     */
    public boolean cancelScan(String device) {
        ScanJob job = jobs.get(device);
        if (job == null || job.isTerminal()) {
            log.debug("Cancel requested for {} but no active scan", device);
            return false;
        }
        job.requestCancel();
        log.info("Cancel requested for {}", device);
        return true;
    }

    public Optional<ScanJobSnapshot> getStatus(String device) {
        ScanJob job = jobs.get(device);
        return job == null ? Optional.empty() : Optional.of(job.snapshot());
    }

    public boolean isActive(String device) {
        ScanJob job = jobs.get(device);
        return job != null && !job.isTerminal();
    }

    public List<ScanJobSnapshot> activeScans() {
        return jobs.values().stream()
                .filter(j -> !j.isTerminal())
                .map(ScanJob::snapshot)
                .sorted(Comparator.comparing(ScanJobSnapshot::getDevice))
                .toList();
    }

    /**
     * 清理超过保留期的终态任务
     */
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int evicted = 0;
        for (ScanJob job : jobs.values()) {
            Instant finished = job.getFinishedAt();
            if (job.isTerminal() && finished != null && finished.isBefore(cutoff)
                    && jobs.remove(job.getDevice(), job)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} finished scan records", evicted);
        }
        return evicted;
    }

    @PreDestroy
    public void shutdown() {
        for (ScanJob job : jobs.values()) {
            if (!job.isTerminal()) {
                // 只置取消标志，不中断扫描线程：中断会关闭设备通道，任务会以失败而非取消结束
                job.requestCancel();
                Future<?> task = job.getTask();
                if (task != null) {
                    task.cancel(false);
                }
            }
        }
        jobs.clear();
        log.info("ScanSupervisor shutdown completed");
    }

    private void runJob(ScanJob job) {
        try {
            engine.run(job, eventBus::publish);
        } catch (RuntimeException e) {
            log.error("Scan task crashed for {}", job.getDevice(), e);
            if (job.finish(ScanState.FAILED, e.toString())) {
                eventBus.publish(ScanEvent.failed(job.getDevice(), e.toString()));
            }
        } finally {
            if (!job.isTerminal() && job.finish(ScanState.FAILED, "Scan ended unexpectedly")) {
                eventBus.publish(ScanEvent.failed(job.getDevice(), "Scan ended unexpectedly"));
            }
            log.info("Scan finished for {} with state {}", job.getDevice(), job.getState());
        }
    }
}
