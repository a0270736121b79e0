package com.disksentinel.exception;

/**
 * 设备访问相关异常的基类，所有失败都限定在产生它的请求或扫描任务内
 */
public class DeviceException extends RuntimeException {

    private final String device;

    public DeviceException(String device, String message) {
        super(message);
        this.device = device;
    }

    public DeviceException(String device, String message, Throwable cause) {
        super(message, cause);
        this.device = device;
    }

    public String getDevice() {
        return device;
    }
}
