package com.panelgate.gateway.proxy;

import com.panelgate.common.logging.LogRedact;
import com.panelgate.gateway.device.DeviceIdentity;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one browser-to-kiosk relay.
 * <p>
 * Container threads and device link threads only enqueue; the two relay workers are the
 * only consumers. A direction ends when {@link RelayFrame#END} reaches its queue.
 */
@Slf4j
@Getter
public class ProxySession {

    private final String id;
    private final ClientEndpoint client;
    private final String credential;
    private final String rawDevice;

    private final BlockingQueue<RelayFrame> clientInbox = new LinkedBlockingQueue<>();
    private final BlockingDeque<RelayFrame> deviceInbox = new LinkedBlockingDeque<>();
    private final List<RelayFrame> preGateBuffer = new ArrayList<>();

    private final AtomicBoolean tornDown = new AtomicBoolean();

    private volatile String userIdentifier;
    private volatile DeviceIdentity device;
    private volatile DeviceLink link;
    private volatile boolean counted;
    private volatile Throwable deviceFailure;

    ProxySession(ClientEndpoint client, String credential, String rawDevice) {
        this.id = client.id();
        this.client = client;
        this.credential = credential;
        this.rawDevice = rawDevice;
    }

    /**
     * Frame received from the browser.
     */
    public void onClientFrame(RelayFrame frame) {
        clientInbox.offer(frame);
    }

    /**
     * The browser connection has closed.
     */
    public void onClientClosed() {
        clientInbox.offer(RelayFrame.END);
    }

    DeviceLink.Listener deviceListener() {
        return new DeviceLink.Listener() {
            @Override
            public void onFrame(RelayFrame frame) {
                deviceInbox.offer(frame);
            }

            @Override
            public void onClosed(int code, String reason) {
                log.debug("session={} device closed code={}", id, code);
                deviceInbox.offer(RelayFrame.END);
            }

            @Override
            public void onFailure(Throwable failure) {
                log.warn("session={} device={} link failed: {}", id, device,
                        LogRedact.redactSensitiveText(failure.getMessage()));
                deviceFailure = failure;
                deviceInbox.offer(RelayFrame.END);
            }
        };
    }

    void setUserIdentifier(String userIdentifier) {
        this.userIdentifier = userIdentifier;
    }

    void setDevice(DeviceIdentity device) {
        this.device = device;
    }

    void setLink(DeviceLink link) {
        this.link = link;
    }

    void markCounted() {
        this.counted = true;
    }

    /**
     * @return true for the single caller that may tear the session down
     */
    boolean beginTeardown() {
        return tornDown.compareAndSet(false, true);
    }
}
