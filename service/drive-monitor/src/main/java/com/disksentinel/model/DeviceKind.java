package com.disksentinel.model;

public enum DeviceKind {
    DISK,
    UNKNOWN;

    /**
     * lsblk TYPE 列映射
     */
    public static DeviceKind fromLsblkType(String type) {
        return "disk".equalsIgnoreCase(type) ? DISK : UNKNOWN;
    }
}
