package com.disksentinel.exception;

public class EraseDisabledException extends DeviceException {

    public EraseDisabledException(String device) {
        super(device, "Secure erase is disabled (app.erase.enabled=false)");
    }
}
