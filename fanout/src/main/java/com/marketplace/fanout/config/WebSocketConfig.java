package com.marketplace.fanout.config;

import com.marketplace.fanout.transport.FanoutWebSocketHandler;
import com.marketplace.fanout.transport.IdentityHandshakeInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
class WebSocketConfig implements WebSocketConfigurer {

    private final FanoutWebSocketHandler handler;

    @Value("${fanout.websocket.path:/ws}") private String websocketPath;
    @Value("${fanout.websocket.allowed-origins:*}") private String[] allowedOrigins;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, websocketPath)
                .addInterceptors(new IdentityHandshakeInterceptor())
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
