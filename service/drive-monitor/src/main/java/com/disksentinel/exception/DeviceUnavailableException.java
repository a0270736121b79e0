package com.disksentinel.exception;

/**
 * 设备消失或出现与单个扇区无关的 I/O 故障
 */
public class DeviceUnavailableException extends DeviceException {

    public DeviceUnavailableException(String device, String message) {
        super(device, message);
    }

    public DeviceUnavailableException(String device, String message, Throwable cause) {
        super(device, message, cause);
    }
}
