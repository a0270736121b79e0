package com.disksentinel.service;

import com.disksentinel.config.ApplicationConfig;
import com.disksentinel.model.ScanEvent;
import com.disksentinel.model.ScanEventType;
import com.disksentinel.model.ScanState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ScanEngineTest {

    private ApplicationConfig config;
    private final List<ScanEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        config = new ApplicationConfig();
        config.getScan().setChunkSize(512);
        config.getScan().setReadTimeout(Duration.ZERO);
    }

    private ScanEngine engine(FakeBlockDevice device) {
        return new ScanEngine(config, device);
    }

    private static ScanJob job() {
        return new ScanJob("sdx", Clock.systemUTC());
    }

    private List<Integer> progressValues() {
        return events.stream()
                .filter(e -> e.getType() == ScanEventType.PROGRESS)
                .map(ScanEvent::getProgressPercent)
                .toList();
    }

    private long terminalCount() {
        return events.stream().filter(e -> e.getType().isTerminal()).count();
    }

    @Test
    void quarter_steps_for_four_chunk_device() {
        ScanJob job = job();
        engine(new FakeBlockDevice(2048)).run(job, events::add);

        assertThat(progressValues()).containsExactly(0, 25, 50, 75, 100);
        assertThat(events.get(events.size() - 1).getType()).isEqualTo(ScanEventType.COMPLETE);
        assertThat(terminalCount()).isEqualTo(1);
        assertThat(job.getState()).isEqualTo(ScanState.COMPLETED);
        assertThat(job.snapshot().getSectorsScanned()).isEqualTo(4);
        assertThat(job.snapshot().getTotalSectors()).isEqualTo(4);
    }

    @Test
    void progress_is_monotonic_and_never_repeats_for_uneven_size() {
        ScanJob job = job();
        engine(new FakeBlockDevice(512 * 300 + 17)).run(job, events::add);

        List<Integer> values = progressValues();
        assertThat(values.get(0)).isZero();
        assertThat(values.get(values.size() - 1)).isEqualTo(100);
        for (int i = 1; i < values.size(); i++) {
            assertThat(values.get(i)).isGreaterThan(values.get(i - 1));
        }
        assertThat(terminalCount()).isEqualTo(1);
        assertThat(job.snapshot().getTotalSectors()).isEqualTo(301);
    }

    @Test
    void bad_sector_is_counted_and_sweep_continues() {
        FakeBlockDevice device = new FakeBlockDevice(2048);
        device.badOffsets.add(512L);
        ScanJob job = job();

        engine(device).run(job, events::add);

        assertThat(device.reads).containsExactly(0L, 512L, 1024L, 1536L);
        assertThat(job.getState()).isEqualTo(ScanState.COMPLETED);
        assertThat(job.snapshot().getBadSectors()).isEqualTo(1);
        ScanEvent last = events.get(events.size() - 1);
        assertThat(last.getType()).isEqualTo(ScanEventType.COMPLETE);
        assertThat(last.getBadSectors()).isEqualTo(1L);
        assertThat(events.stream().filter(e -> e.getType() == ScanEventType.PROGRESS).map(ScanEvent::getBadSectors))
                .containsExactly(0L, 0L, 1L, 1L, 1L);
    }

    @Test
    void vanished_device_fails_the_job() {
        FakeBlockDevice device = new FakeBlockDevice(2048);
        device.vanishAt = 1024L;
        ScanJob job = job();

        engine(device).run(job, events::add);

        assertThat(job.getState()).isEqualTo(ScanState.FAILED);
        assertThat(device.reads).containsExactly(0L, 512L, 1024L);
        assertThat(progressValues()).containsExactly(0, 25, 50);
        ScanEvent last = events.get(events.size() - 1);
        assertThat(last.getType()).isEqualTo(ScanEventType.FAILED);
        assertThat(last.getMessage()).contains("disappeared");
        assertThat(terminalCount()).isEqualTo(1);
    }

    @Test
    void device_that_cannot_be_opened_fails_without_progress() {
        FakeBlockDevice device = new FakeBlockDevice(2048);
        device.openFails = true;
        ScanJob job = job();

        engine(device).run(job, events::add);

        assertThat(job.getState()).isEqualTo(ScanState.FAILED);
        assertThat(events).extracting(ScanEvent::getType).containsExactly(ScanEventType.FAILED);
    }

    @Test
    void zero_size_device_fails() {
        ScanJob job = job();
        engine(new FakeBlockDevice(0)).run(job, events::add);

        assertThat(job.getState()).isEqualTo(ScanState.FAILED);
        assertThat(events).extracting(ScanEvent::getType).containsExactly(ScanEventType.FAILED);
    }

    @Test
    void cancellation_is_observed_after_the_current_chunk() {
        FakeBlockDevice device = new FakeBlockDevice(2048);
        ScanJob job = job();
        device.onRead = offset -> {
            if (offset == 512L) job.requestCancel();
        };

        engine(device).run(job, events::add);

        assertThat(job.getState()).isEqualTo(ScanState.CANCELLED);
        assertThat(device.reads).containsExactly(0L, 512L);
        assertThat(progressValues()).containsExactly(0, 25, 50);
        assertThat(events.get(events.size() - 1).getType()).isEqualTo(ScanEventType.CANCELLED);
        assertThat(terminalCount()).isEqualTo(1);
    }

    @Test
    void job_cancelled_before_start_never_reads() {
        FakeBlockDevice device = new FakeBlockDevice(2048);
        ScanJob job = job();
        job.requestCancel();

        engine(device).run(job, events::add);

        assertThat(device.reads).isEmpty();
        assertThat(events).extracting(ScanEvent::getType).containsExactly(ScanEventType.CANCELLED);
    }

    @Test
    void stalled_read_is_capped_and_counted_as_bad_sector() {
        config.getScan().setReadTimeout(Duration.ofMillis(100));
        config.getScan().setMaxConsecutiveTimeouts(10);
        FakeBlockDevice device = new FakeBlockDevice(1024);
        CountDownLatch never = new CountDownLatch(1);
        device.onRead = offset -> {
            if (offset == 0L) {
                try {
                    never.await(250, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        ScanJob job = job();

        engine(device).run(job, events::add);

        assertThat(job.getState()).isEqualTo(ScanState.COMPLETED);
        assertThat(job.snapshot().getBadSectors()).isEqualTo(1);
        assertThat(progressValues()).containsExactly(0, 50, 100);
        // 卡住的读返回之前不会提交下一块
        assertThat(device.reads).containsExactly(0L, 512L);
    }

    @Test
    void unresponsive_device_fails_after_consecutive_timeouts() {
        config.getScan().setReadTimeout(Duration.ofMillis(50));
        config.getScan().setMaxConsecutiveTimeouts(3);
        FakeBlockDevice device = new FakeBlockDevice(4096);
        device.hung.add("sdx");
        ScanJob job = job();

        try {
            engine(device).run(job, events::add);
        } finally {
            device.release.countDown();
        }

        assertThat(job.getState()).isEqualTo(ScanState.FAILED);
        assertThat(job.snapshot().getBadSectors()).isEqualTo(1);
        ScanEvent last = events.get(events.size() - 1);
        assertThat(last.getType()).isEqualTo(ScanEventType.FAILED);
        assertThat(last.getMessage()).contains("not responding");
        assertThat(terminalCount()).isEqualTo(1);
    }

    @Test
    void cancel_while_waiting_on_stalled_read_ends_cancelled() {
        config.getScan().setReadTimeout(Duration.ofMillis(50));
        config.getScan().setMaxConsecutiveTimeouts(1000);
        FakeBlockDevice device = new FakeBlockDevice(4096);
        device.hung.add("sdx");
        ScanJob job = job();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            job.requestCancel();
        });
        canceller.start();

        try {
            engine(device).run(job, events::add);
        } finally {
            device.release.countDown();
        }

        assertThat(job.getState()).isEqualTo(ScanState.CANCELLED);
        assertThat(events.get(events.size() - 1).getType()).isEqualTo(ScanEventType.CANCELLED);
        assertThat(terminalCount()).isEqualTo(1);
    }

    @Test
    void read_aborted_after_cancel_request_ends_cancelled_not_failed() {
        FakeBlockDevice device = new FakeBlockDevice(2048);
        device.vanishAt = 512L;
        ScanJob job = job();
        device.onRead = offset -> {
            if (offset == 512L) job.requestCancel();
        };

        engine(device).run(job, events::add);

        assertThat(job.getState()).isEqualTo(ScanState.CANCELLED);
        assertThat(events).filteredOn(e -> e.getType().isTerminal())
                .extracting(ScanEvent::getType).containsExactly(ScanEventType.CANCELLED);
    }
}
