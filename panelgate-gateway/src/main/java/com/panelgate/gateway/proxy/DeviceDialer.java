package com.panelgate.gateway.proxy;

import com.panelgate.gateway.device.DeviceTlsContext;

import java.net.URI;
import java.util.Map;

/**
 * Opens WebSockets to kiosks.
 */
public interface DeviceDialer {

    /**
     * Open a link and block until the handshake has completed.
     *
     * @param listener receives every frame after the handshake
     * @throws BackendConnectException when the connection or handshake fails
     */
    DeviceLink dial(URI uri, DeviceTlsContext tls, Map<String, String> headers, DeviceLink.Listener listener)
            throws BackendConnectException, InterruptedException;
}
