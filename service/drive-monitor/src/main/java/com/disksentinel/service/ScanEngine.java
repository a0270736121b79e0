package com.disksentinel.service;

import com.disksentinel.config.ApplicationConfig;
import com.disksentinel.config.TaskExecutorConfig;
import com.disksentinel.device.BlockDeviceReader;
import com.disksentinel.device.DeviceChannel;
import com.disksentinel.exception.BadSectorException;
import com.disksentinel.exception.DeviceException;
import com.disksentinel.exception.DeviceUnavailableException;
import com.disksentinel.model.ScanEvent;
import com.disksentinel.model.ScanState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * 表面扫描引擎
 *
 * 流程：
 * - 取设备容量，按固定分块从 0 读到末尾
 * - 单块读取失败计为坏扇区并继续；设备不可用则任务失败
 * - 整数百分比变化时推送进度，开始时推送 0%
 * - 每个分块之后是协作点：检查取消标志、可选暂停
 * - 不在同一轮扫描中重试坏扇区
 * - 读超时使用本任务独占的读线程；超时的读返回前不提交下一块，连续超时过多判定设备无响应
 */
@Slf4j
@Service
public class ScanEngine {

    private final BlockDeviceReader reader;

    // 缓存的配置参数
    private final int chunkSize;
    private final Duration readTimeout;
    private final Duration chunkPause;
    private final int maxConsecutiveTimeouts;

    public ScanEngine(ApplicationConfig config, BlockDeviceReader reader) {
        this.reader = reader;
        this.chunkSize = config.getChunkSize();
        this.readTimeout = config.getScan().getReadTimeout();
        this.chunkPause = config.getScan().getChunkPause();
        this.maxConsecutiveTimeouts = Math.max(1, config.getScan().getMaxConsecutiveTimeouts());
    }

    /**
     * 在调用线程上执行一次完整扫描，直到任务进入终态。
     */
    public void run(ScanJob job, Consumer<ScanEvent> events) {
        String device = job.getDevice();
        if (job.isCancelRequested()) {
            cancel(job, events);
            return;
        }

        long totalBytes;
        try {
            totalBytes = reader.sizeOf(device);
        } catch (DeviceException e) {
            fail(job, events, e.getMessage());
            return;
        }
        if (totalBytes <= 0) {
            fail(job, events, "Device reports zero size");
            return;
        }

        try (DeviceChannel channel = reader.open(device);
             ChunkReader chunks = new ChunkReader(job, channel)) {
            if (!job.begin(totalBytes, chunkSize)) {
                return;
            }
            log.info("Scan started for {}: {} bytes in {}-byte chunks", device, totalBytes, chunkSize);
            events.accept(ScanEvent.progress(device, 0, 0));

            long scanned = 0;
            int lastPercent = 0;
            while (scanned < totalBytes) {
                int length = (int) Math.min(chunkSize, totalBytes - scanned);
                if (!chunks.read(scanned, length) || Thread.currentThread().isInterrupted()) {
                    cancel(job, events);
                    return;
                }

                scanned += length;
                int percent = (int) (scanned * 100 / totalBytes);
                job.advance(scanned, percent);
                if (percent != lastPercent) {
                    events.accept(ScanEvent.progress(device, percent, job.getBadSectors()));
                    lastPercent = percent;
                }

                if (!yieldBetweenChunks(job)) {
                    cancel(job, events);
                    return;
                }
            }

            if (job.finish(ScanState.COMPLETED, null)) {
                long bad = job.getBadSectors();
                log.info("Scan complete for {}: {} bad sectors", device, bad);
                events.accept(ScanEvent.completed(device, bad));
            }
        } catch (DeviceException e) {
            if (job.isCancelRequested()) {
                // 关停时读线程被中断导致通道关闭，按取消处理
                cancel(job, events);
            } else {
                fail(job, events, e.getMessage());
            }
        }
    }

    /**
     * 分块之间的协作点。返回 false 表示应立即停止。
     */
    private boolean yieldBetweenChunks(ScanJob job) {
        if (job.isCancelRequested() || Thread.currentThread().isInterrupted()) {
            return false;
        }
        if (chunkPause != null && !chunkPause.isZero() && !chunkPause.isNegative()) {
            try {
                Thread.sleep(chunkPause.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        } else {
            Thread.yield();
        }
        return !job.isCancelRequested();
    }

    private void cancel(ScanJob job, Consumer<ScanEvent> events) {
        if (job.finish(ScanState.CANCELLED, "Cancelled")) {
            log.info("Scan cancelled for {}", job.getDevice());
            events.accept(ScanEvent.cancelled(job.getDevice()));
        }
    }

    private void fail(ScanJob job, Consumer<ScanEvent> events, String message) {
        if (job.finish(ScanState.FAILED, message)) {
            log.error("Scan failed for {}: {}", job.getDevice(), message);
            events.accept(ScanEvent.failed(job.getDevice(), message));
        }
    }

    /**
     * 单个任务的分块读取。
     *
     * 未配置读超时时直接在扫描线程上读；否则读在本任务独占的单线程上执行，
     * 超时的读仍占着这个线程，下一块要等它返回后才提交。
     */
    private final class ChunkReader implements AutoCloseable {

        private final ScanJob job;
        private final DeviceChannel channel;
        private final ThreadPoolTaskExecutor executor;
        private Future<Integer> stalled;
        private int consecutiveTimeouts;

        ChunkReader(ScanJob job, DeviceChannel channel) {
            this.job = job;
            this.channel = channel;
            this.executor = timed() ? TaskExecutorConfig.jobReadExecutor(job.getDevice()) : null;
        }

        private boolean timed() {
            return readTimeout != null && !readTimeout.isZero() && !readTimeout.isNegative();
        }

        /**
         * 读取一个分块；坏扇区与超时只记数，设备不可用向上抛出。
         *
         * @return false 表示等待卡住的读时收到取消
         */
        boolean read(long offset, int length) {
            try {
                if (executor == null) {
                    channel.read(offset, length);
                } else {
                    if (!awaitStalled()) {
                        return false;
                    }
                    timedRead(offset, length);
                }
            } catch (BadSectorException e) {
                long bad = job.recordBadSector();
                log.debug("Bad sector on {} at offset {} (total {}): {}", job.getDevice(), offset, bad, e.getMessage());
            } catch (TimeoutException e) {
                long bad = job.recordBadSector();
                log.warn("Read timed out on {} at offset {} after {} ms (total bad {})",
                        job.getDevice(), offset, readTimeout.toMillis(), bad);
            }
            return true;
        }

        private void timedRead(long offset, int length) throws TimeoutException {
            Future<Integer> f;
            try {
                f = executor.submit(() -> channel.read(offset, length));
            } catch (TaskRejectedException e) {
                throw new DeviceUnavailableException(job.getDevice(), "Read executor unavailable", e);
            }
            try {
                f.get(readTimeout.toMillis(), TimeUnit.MILLISECONDS);
                consecutiveTimeouts = 0;
            } catch (TimeoutException e) {
                // 不中断读线程：中断会关闭 FileChannel，后续分块都将失败
                stalled = f;
                countTimeout();
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException e) {
                consecutiveTimeouts = 0;
                Throwable cause = e.getCause();
                if (cause instanceof DeviceException de) {
                    throw de;
                }
                throw new BadSectorException(job.getDevice(), offset, cause);
            }
        }

        /**
         * 等待上一块超时的读返回。返回 false 表示期间收到取消或中断。
         */
        private boolean awaitStalled() {
            while (stalled != null) {
                if (job.isCancelRequested()) {
                    return false;
                }
                try {
                    stalled.get(readTimeout.toMillis(), TimeUnit.MILLISECONDS);
                    stalled = null;
                } catch (TimeoutException e) {
                    countTimeout();
                } catch (ExecutionException e) {
                    // 该块已计为坏扇区
                    stalled = null;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }

        private void countTimeout() {
            if (++consecutiveTimeouts >= maxConsecutiveTimeouts) {
                throw new DeviceUnavailableException(job.getDevice(),
                        "Device not responding: " + consecutiveTimeouts + " consecutive reads timed out");
            }
        }

        @Override
        public void close() {
            if (executor != null) {
                executor.shutdown();
            }
        }
    }
}
