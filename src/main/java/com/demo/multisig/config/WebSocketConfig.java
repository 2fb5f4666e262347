package com.demo.multisig.config;

import com.demo.multisig.websocket.NotificationSocketHandler;
import com.demo.multisig.websocket.UserHandshakeInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final NotificationSocketHandler handler;
    private final UserHandshakeInterceptor handshakeInterceptor;

    @Value("${app.cors.allowed-origins:}")
    private String corsOrigins;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        var reg = registry.addHandler(handler, "/ws/notifications")
                .addInterceptors(handshakeInterceptor);
        String[] origins = WebConfig.origins(corsOrigins);
        if (origins.length > 0) {
            reg.setAllowedOrigins(origins);
        } else {
            reg.setAllowedOriginPatterns("*");
        }
    }
}
