package com.ridedispatch.api.dispatch.service.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@ConditionalOnWebApplication
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final DispatchWebSocketHandler dispatchWebSocketHandler;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(dispatchWebSocketHandler, "/ws/dispatch")
                .setAllowedOrigins("*");
    }
}
