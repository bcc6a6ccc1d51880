package com.prudhvi.vlm_relay.config;

import com.prudhvi.vlm_relay.websocket.VlmWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Mounts the VLM stream WebSocket endpoint (default /ws).
 *
 * The handshake origin check uses the same allowed origin as the HTTP CORS
 * config, so a dashboard allowed to call /health can also open the stream.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final VlmWebSocketHandler handler;
    private final RelayProperties properties;

    @Value("${cors.allowed-origin:*}")
    private String allowedOrigin;

    public WebSocketConfig(VlmWebSocketHandler handler, RelayProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, properties.getWebsocket().getPath())
                .setAllowedOriginPatterns(allowedOrigin);
    }
}
