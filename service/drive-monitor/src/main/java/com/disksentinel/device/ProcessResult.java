package com.disksentinel.device;

import lombok.Value;

@Value
public class ProcessResult {
    int exitCode;
    String stdout;
    String stderr;

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
