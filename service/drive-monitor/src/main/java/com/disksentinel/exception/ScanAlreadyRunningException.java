package com.disksentinel.exception;

public class ScanAlreadyRunningException extends DeviceException {

    public ScanAlreadyRunningException(String device) {
        super(device, "A scan is already running on " + device);
    }
}
