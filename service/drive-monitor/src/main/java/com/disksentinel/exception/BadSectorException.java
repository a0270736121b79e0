package com.disksentinel.exception;

/**
 * 单个分块读取失败。扫描时记为坏扇区计数，读速测试时转为设备不可用
 */
public class BadSectorException extends DeviceException {

    private final long offset;

    public BadSectorException(String device, long offset, Throwable cause) {
        super(device, "read failed at offset " + offset, cause);
        this.offset = offset;
    }

    public long getOffset() {
        return offset;
    }
}
