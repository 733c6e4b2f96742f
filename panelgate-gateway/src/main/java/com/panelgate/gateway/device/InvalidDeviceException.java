package com.panelgate.gateway.device;

/**
 * Thrown when a device parameter cannot be turned into a host name.
 */
public class InvalidDeviceException extends RuntimeException {

    public InvalidDeviceException(String message) {
        super(message);
    }
}
