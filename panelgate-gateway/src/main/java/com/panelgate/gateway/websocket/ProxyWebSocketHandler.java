package com.panelgate.gateway.websocket;

import com.panelgate.common.logging.LogRedact;
import com.panelgate.gateway.proxy.ConnectionGateway;
import com.panelgate.gateway.proxy.ProxySession;
import com.panelgate.gateway.proxy.RelayFrame;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adapts browser WebSocket events to {@link ConnectionGateway} sessions.
 * Container threads only enqueue frames.
 */
@Slf4j
public class ProxyWebSocketHandler extends AbstractWebSocketHandler {

    static final String ATTR_TOKEN = "panelgate.token";
    static final String ATTR_DEVICE = "panelgate.device";

    private final ConnectionGateway gateway;
    private final int maxMessageBytes;
    private final Map<String, ProxySession> sessions = new ConcurrentHashMap<>();

    public ProxyWebSocketHandler(ConnectionGateway gateway, int maxMessageBytes) {
        this.gateway = gateway;
        this.maxMessageBytes = maxMessageBytes;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        Map<String, Object> attrs = session.getAttributes();
        String token = (String) attrs.get(ATTR_TOKEN);
        String device = (String) attrs.get(ATTR_DEVICE);
        log.debug("ws:in:open conn={} device={}", session.getId(), device);

        ProxySession proxySession = gateway.open(new SessionClientEndpoint(session, maxMessageBytes), token, device);
        sessions.put(session.getId(), proxySession);
        gateway.start(proxySession).whenComplete((v, ex) -> sessions.remove(session.getId()));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ProxySession proxySession = sessions.get(session.getId());
        if (proxySession != null) {
            proxySession.onClientFrame(RelayFrame.text(message.getPayload()));
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        ProxySession proxySession = sessions.get(session.getId());
        if (proxySession != null) {
            ByteBuffer payload = message.getPayload();
            byte[] bytes = new byte[payload.remaining()];
            payload.get(bytes);
            proxySession.onClientFrame(RelayFrame.binary(bytes));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ProxySession proxySession = sessions.get(session.getId());
        if (proxySession != null) {
            proxySession.onClientClosed();
        }
        log.info("ws:close conn={} code={} reason={}", session.getId(), status.getCode(),
                LogRedact.redactSensitiveText(status.getReason()));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("ws:error conn={}: {}", session.getId(),
                LogRedact.redactSensitiveText(exception.getMessage()));
    }
}
