package com.panelgate.gateway.proxy;

/**
 * A staging gateway reached a kiosk that is deployed in the field.
 */
public class ForbiddenEnvironmentException extends RuntimeException {

    public ForbiddenEnvironmentException(String message) {
        super(message);
    }
}
