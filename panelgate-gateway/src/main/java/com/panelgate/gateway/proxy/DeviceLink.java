package com.panelgate.gateway.proxy;

import java.io.IOException;

/**
 * Open WebSocket to a kiosk.
 */
public interface DeviceLink {

    /**
     * Queue a frame for the device.
     *
     * @throws IOException when the link is already closed
     */
    void send(RelayFrame frame) throws IOException;

    /**
     * Close the link. Idempotent.
     */
    void close();

    /**
     * Receives frames and lifecycle events from a {@link DeviceLink}, on the link's own threads.
     */
    interface Listener {
        void onFrame(RelayFrame frame);

        void onClosed(int code, String reason);

        void onFailure(Throwable failure);
    }
}
