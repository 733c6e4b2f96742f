package com.panelgate.gateway.proxy;

import java.time.Duration;

/**
 * The device did not answer the panel-info probe in time. The session continues.
 */
public class HandshakeTimeoutException extends Exception {

    public HandshakeTimeoutException(Duration waited) {
        super("no panel info reply within " + waited.toMillis() + " ms");
    }
}
