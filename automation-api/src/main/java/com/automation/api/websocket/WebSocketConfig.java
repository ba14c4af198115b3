package com.automation.api.websocket;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final EventStreamWebSocketHandler eventStreamHandler;

    public WebSocketConfig(EventStreamWebSocketHandler eventStreamHandler) {
        this.eventStreamHandler = eventStreamHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // Producers are services, not browsers
        registry.addHandler(eventStreamHandler, "/api/events/in")
            .setAllowedOrigins("*");
    }
}
