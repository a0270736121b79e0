package com.disksentinel.exception;

/**
 * 权限或设备路径问题，调用方可据此提示以更高权限运行
 */
public class DeviceAccessDeniedException extends DeviceException {

    public DeviceAccessDeniedException(String device, String message) {
        super(device, message);
    }
}
