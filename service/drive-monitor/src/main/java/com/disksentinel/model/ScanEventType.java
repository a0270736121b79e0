package com.disksentinel.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScanEventType {
    PROGRESS("scan_progress"),
    COMPLETE("scan_complete"),
    FAILED("scan_failed"),
    CANCELLED("scan_cancelled"),
    INFO("info"),
    ERROR("error");

    private final String wireName;

    ScanEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == CANCELLED;
    }
}
