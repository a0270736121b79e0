package com.disksentinel.service;

import com.disksentinel.model.ScanJobSnapshot;
import com.disksentinel.model.ScanState;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Future;

/**
 * 单个设备的一次扫描任务，由 ScanSupervisor 独占持有。
 *
 * 状态字段由对象锁保护；取消标志为 volatile，扫描线程在分块之间读取。
 */
public class ScanJob {

    private final String device;
    private final Clock clock;

    private ScanState state = ScanState.PENDING;
    private long totalBytes;
    private long bytesScanned;
    private long sectorsScanned;
    private long totalSectors;
    private long badSectors;
    private int chunkSize;
    private int progress;
    private Instant startedAt;
    private Instant finishedAt;
    private String message;

    private volatile boolean cancelRequested;
    private volatile Future<?> task;

    public ScanJob(String device, Clock clock) {
        this.device = device;
        this.clock = clock;
    }

    public String getDevice() {
        return device;
    }

    // ========== 由扫描线程调用 ==========

    synchronized boolean begin(long totalBytes, int chunkSize) {
        if (state != ScanState.PENDING) {
            return false;
        }
        this.totalBytes = totalBytes;
        this.chunkSize = chunkSize;
        this.totalSectors = (totalBytes + chunkSize - 1) / chunkSize;
        this.startedAt = clock.instant();
        this.state = ScanState.RUNNING;
        return true;
    }

    synchronized void advance(long bytesScanned, int progress) {
        this.bytesScanned = bytesScanned;
        this.sectorsScanned++;
        this.progress = progress;
    }

    synchronized long recordBadSector() {
        return ++badSectors;
    }

    synchronized long getBadSectors() {
        return badSectors;
    }

    /**
     * 进入终态。已处于终态时返回 false，保证每个任务只产生一个终态事件。
     */
    synchronized boolean finish(ScanState terminal, String message) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        if (state.isTerminal()) {
            return false;
        }
        this.state = terminal;
        this.message = message;
        this.finishedAt = clock.instant();
        return true;
    }

    // ========== 由请求线程调用 ==========

    void requestCancel() {
        cancelRequested = true;
    }

    boolean isCancelRequested() {
        return cancelRequested;
    }

    void attach(Future<?> task) {
        this.task = task;
    }

    Future<?> getTask() {
        return task;
    }

    public synchronized ScanState getState() {
        return state;
    }

    public synchronized boolean isTerminal() {
        return state.isTerminal();
    }

    synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized ScanJobSnapshot snapshot() {
        return ScanJobSnapshot.builder()
                .device(device)
                .state(state)
                .sectorsScanned(sectorsScanned)
                .totalSectors(totalSectors)
                .badSectors(badSectors)
                .progress(progress)
                .chunkSize(chunkSize)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .message(message)
                .build();
    }

    @Override
    public synchronized String toString() {
        return "ScanJob{" + device + ", " + state + ", " + bytesScanned + "/" + totalBytes + " bytes, bad=" + badSectors + "}";
    }
}
