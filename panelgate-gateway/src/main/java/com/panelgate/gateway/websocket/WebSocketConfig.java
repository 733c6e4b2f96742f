package com.panelgate.gateway.websocket;

import com.panelgate.gateway.config.PanelGateProperties;
import com.panelgate.gateway.proxy.ConnectionGateway;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Registers the relay endpoint at /ws.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ConnectionGateway gateway;
    private final PanelGateProperties properties;

    public WebSocketConfig(ConnectionGateway gateway, PanelGateProperties properties) {
        this.gateway = gateway;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(proxyWebSocketHandler(), "/ws")
                .addInterceptors(connectionInterceptor())
                .setAllowedOrigins("*");
    }

    @Bean
    public ProxyWebSocketHandler proxyWebSocketHandler() {
        return new ProxyWebSocketHandler(gateway, properties.getDevice().getMaxMessageBytes());
    }

    /**
     * Copies the {@code token} and {@code device} query parameters into the session
     * attributes. The handshake is always accepted; rejection is a close code.
     */
    @Bean
    public HandshakeInterceptor connectionInterceptor() {
        return new HandshakeInterceptor() {
            @Override
            public boolean beforeHandshake(@NonNull ServerHttpRequest request,
                    @NonNull ServerHttpResponse response,
                    @NonNull WebSocketHandler wsHandler,
                    @NonNull Map<String, Object> attributes) {
                MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(request.getURI())
                        .build()
                        .getQueryParams();
                attributes.put(ProxyWebSocketHandler.ATTR_TOKEN, decoded(params.getFirst("token")));
                attributes.put(ProxyWebSocketHandler.ATTR_DEVICE, decoded(params.getFirst("device")));
                return true;
            }

            @Override
            public void afterHandshake(@NonNull ServerHttpRequest request,
                    @NonNull ServerHttpResponse response,
                    @NonNull WebSocketHandler wsHandler,
                    @Nullable Exception exception) {
                // nothing to do
            }
        };
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        int max = properties.getDevice().getMaxMessageBytes();
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(max);
        container.setMaxBinaryMessageBufferSize(max);
        container.setMaxSessionIdleTimeout(properties.getRelay().getSessionIdleTimeout().toMillis());
        return container;
    }

    private static String decoded(String raw) {
        return raw == null ? "" : URLDecoder.decode(raw, StandardCharsets.UTF_8);
    }
}
