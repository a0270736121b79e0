package com.disksentinel.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BenchmarkResult {
    String drive;
    long bytesRead;
    long elapsedMicros;
    double readSpeedMbPerSec;
}
