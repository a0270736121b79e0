package com.disksentinel.service;

import com.disksentinel.config.ApplicationConfig;
import com.disksentinel.device.BlockDeviceReader;
import com.disksentinel.device.DeviceChannel;
import com.disksentinel.exception.BadSectorException;
import com.disksentinel.exception.DeviceUnavailableException;
import com.disksentinel.exception.ScanAlreadyRunningException;
import com.disksentinel.model.BenchmarkResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 顺序读速测试：从偏移 0 读取固定大小样本并计时
 */
@Slf4j
@Service
public class BenchmarkService {

    private static final int READ_BLOCK = 64 * 1024;

    private final BlockDeviceReader reader;
    private final ScanSupervisor supervisor;
    private final int sampleSize;

    public BenchmarkService(ApplicationConfig config, BlockDeviceReader reader, ScanSupervisor supervisor) {
        this.reader = reader;
        this.supervisor = supervisor;
        this.sampleSize = Math.max(READ_BLOCK, config.getBenchmark().getSampleSize());
    }

    public BenchmarkResult benchmark(String device) {
        DeviceGateway.requireValidName(device);
        if (supervisor.isActive(device)) {
            throw new ScanAlreadyRunningException(device);
        }
        long size = reader.sizeOf(device);
        long toRead = Math.min(size, sampleSize);
        if (toRead <= 0) {
            throw new DeviceUnavailableException(device, "Device reports zero size");
        }

        long read = 0;
        long start = System.nanoTime();
        try (DeviceChannel channel = reader.open(device)) {
            while (read < toRead) {
                int len = (int) Math.min(READ_BLOCK, toRead - read);
                read += channel.read(read, len);
            }
        } catch (BadSectorException e) {
            throw new DeviceUnavailableException(device, "Read error during benchmark at offset " + e.getOffset(), e);
        }
        long elapsedNanos = Math.max(1, System.nanoTime() - start);

        double mbPerSec = (read / (1024.0 * 1024.0)) / (elapsedNanos / 1_000_000_000.0);
        double rounded = Math.round(mbPerSec * 100.0) / 100.0;
        log.info("Benchmark {}: {} bytes in {} us ({} MB/s)", device, read, elapsedNanos / 1000, rounded);
        return BenchmarkResult.builder()
                .drive(device)
                .bytesRead(read)
                .elapsedMicros(elapsedNanos / 1000)
                .readSpeedMbPerSec(rounded)
                .build();
    }
}
