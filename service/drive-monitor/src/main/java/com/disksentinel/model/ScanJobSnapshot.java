package com.disksentinel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 扫描任务的只读快照，用于状态查询
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanJobSnapshot {
    String device;
    ScanState state;
    long sectorsScanned;
    long totalSectors;
    long badSectors;
    int progress;
    int chunkSize;
    Instant startedAt;
    Instant finishedAt;
    String message;
}
