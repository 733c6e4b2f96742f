package com.panelgate.gateway.proxy;

import java.io.IOException;

/**
 * Browser side of a relay session.
 */
public interface ClientEndpoint {

    String id();

    /**
     * Send a frame to the browser. Safe to call from several threads.
     */
    void send(RelayFrame frame) throws IOException;

    /**
     * Close the browser connection. Does nothing when already closed.
     */
    void close(int code, String reason);

    boolean isOpen();
}
