package com.pricestream.config;

import com.pricestream.api.websocket.CallerIdentityHandshakeInterceptor;
import com.pricestream.api.websocket.PriceStreamWebSocketHandler;
import com.pricestream.subscription.ConnectionConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the raw WebSocket price stream at {@code /ws}.
 *
 * <p>The handshake interceptor resolves the caller from query parameters before the
 * handler sees the session. Inbound frames are capped at {@code max-message-bytes}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final PriceStreamWebSocketHandler priceStreamWebSocketHandler;
    private final CallerIdentityHandshakeInterceptor callerIdentityHandshakeInterceptor;
    private final ConnectionConfig connectionConfig;

    public WebSocketConfig(
            PriceStreamWebSocketHandler priceStreamWebSocketHandler,
            CallerIdentityHandshakeInterceptor callerIdentityHandshakeInterceptor,
            ConnectionConfig connectionConfig) {
        this.priceStreamWebSocketHandler = priceStreamWebSocketHandler;
        this.callerIdentityHandshakeInterceptor = callerIdentityHandshakeInterceptor;
        this.connectionConfig = connectionConfig;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(priceStreamWebSocketHandler, "/ws")
                .addInterceptors(callerIdentityHandshakeInterceptor)
                .setAllowedOriginPatterns(connectionConfig.getAllowedOrigins().toArray(String[]::new));
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(connectionConfig.getMaxMessageBytes());
        container.setMaxBinaryMessageBufferSize(connectionConfig.getMaxMessageBytes());
        return container;
    }
}
