package com.panelgate.gateway.proxy;

import com.panelgate.common.logging.LogRedact;
import com.panelgate.gateway.device.DeviceTlsContext;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;

import javax.net.ssl.SSLException;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link DeviceDialer} on OkHttp's WebSocket client.
 * <p>
 * Every dial derives a client from one shared base so connection and thread pools are
 * shared while each device gets its own TLS trust.
 */
@Slf4j
public class OkHttpDeviceDialer implements DeviceDialer {

    private final OkHttpClient baseClient;
    private final Duration connectTimeout;

    public OkHttpDeviceDialer(Duration connectTimeout) {
        this(new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(Duration.ZERO)
                .pingInterval(Duration.ofSeconds(20))
                .build(), connectTimeout);
    }

    OkHttpDeviceDialer(OkHttpClient baseClient, Duration connectTimeout) {
        this.baseClient = baseClient;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public DeviceLink dial(URI uri, DeviceTlsContext tls, Map<String, String> headers,
            DeviceLink.Listener listener) throws BackendConnectException, InterruptedException {
        OkHttpClient client = baseClient.newBuilder()
                .sslSocketFactory(tls.socketFactory(), tls.trustManager())
                .hostnameVerifier(tls.hostnameVerifier())
                .build();

        Request.Builder request = new Request.Builder().url(uri.toString());
        headers.forEach(request::header);

        CompletableFuture<Void> opened = new CompletableFuture<>();
        Bridge bridge = new Bridge(opened, listener);
        WebSocket ws = client.newWebSocket(request.build(), bridge);

        try {
            // the handshake may take longer than the TCP connect
            opened.get(connectTimeout.toMillis() * 2, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            bridge.abandon();
            ws.cancel();
            throw BackendConnectException.classify(e.getCause());
        } catch (TimeoutException e) {
            bridge.abandon();
            ws.cancel();
            throw new BackendConnectException(BackendConnectException.FailureKind.PORT,
                    "handshake timeout", e);
        } catch (InterruptedException e) {
            bridge.abandon();
            ws.cancel();
            throw e;
        }
        return new Link(ws);
    }

    /**
     * Forwards OkHttp callbacks to the session listener. Once abandoned (the dial gave up),
     * nothing reaches the listener any more; a retry dial reuses the same listener.
     */
    static final class Bridge extends WebSocketListener {
        private final CompletableFuture<Void> opened;
        private final DeviceLink.Listener listener;
        private final AtomicBoolean abandoned = new AtomicBoolean();

        Bridge(CompletableFuture<Void> opened, DeviceLink.Listener listener) {
            this.opened = opened;
            this.listener = listener;
        }

        void abandon() {
            abandoned.set(true);
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            opened.complete(null);
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            if (abandoned.get()) {
                return;
            }
            listener.onFrame(RelayFrame.text(text));
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            if (abandoned.get()) {
                return;
            }
            listener.onFrame(RelayFrame.binary(bytes.toByteArray()));
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(code, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            if (abandoned.get()) {
                return;
            }
            listener.onClosed(code, reason);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            if (!opened.isDone()) {
                Throwable failure = t;
                if (response != null && !(t instanceof SSLException)) {
                    failure = new IOException("HTTP " + response.code(), t);
                }
                opened.completeExceptionally(failure);
                return;
            }
            if (abandoned.get()) {
                log.debug("abandoned device socket failed: {}", LogRedact.redactSensitiveText(t.getMessage()));
                return;
            }
            listener.onFailure(t);
        }
    }

    private static final class Link implements DeviceLink {
        private final WebSocket ws;

        Link(WebSocket ws) {
            this.ws = ws;
        }

        @Override
        public void send(RelayFrame frame) throws IOException {
            boolean queued = frame.isText()
                    ? ws.send(frame.text())
                    : ws.send(ByteString.of(frame.binary()));
            if (!queued) {
                throw new IOException("device link closed");
            }
        }

        @Override
        public void close() {
            if (!ws.close(CloseCodes.NORMAL, null)) {
                log.trace("device link already closing");
            }
        }
    }
}
