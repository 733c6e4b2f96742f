package com.panelgate.gateway.proxy;

/**
 * The gateway itself is misconfigured, e.g. the device bearer secret is unavailable.
 */
public class ServerConfigException extends RuntimeException {

    public ServerConfigException(String message) {
        super(message);
    }
}
