package com.panelgate.gateway.websocket;

import com.panelgate.gateway.proxy.ClientEndpoint;
import com.panelgate.gateway.proxy.RelayFrame;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link ClientEndpoint} over a Spring {@link WebSocketSession}. Sends go through a
 * {@link ConcurrentWebSocketSessionDecorator} because both relay workers may write.
 */
@Slf4j
public class SessionClientEndpoint implements ClientEndpoint {

    private static final int SEND_TIME_LIMIT_MS = 10_000;

    private final WebSocketSession session;

    public SessionClientEndpoint(WebSocketSession session, int maxMessageBytes) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, maxMessageBytes * 2);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(RelayFrame frame) throws IOException {
        if (frame.isText()) {
            session.sendMessage(new TextMessage(frame.text()));
        } else {
            session.sendMessage(new BinaryMessage(frame.binary()));
        }
    }

    @Override
    public void close(int code, String reason) {
        try {
            if (session.isOpen()) {
                session.close(new CloseStatus(code, reason == null || reason.isEmpty() ? null : reason));
            }
        } catch (IOException e) {
            log.debug("close error conn={}: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
