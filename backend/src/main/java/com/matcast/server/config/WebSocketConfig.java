package com.matcast.server.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import com.matcast.server.security.HubHandshakeInterceptor;
import com.matcast.server.socket.MatchWebSocketHandler;

/**
 * Raw WebSocket endpoints, one per channel kind:
 *   /ws/match/{matchId}
 *   /ws/tournament/{tournamentId}
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final MatchWebSocketHandler handler;
    private final HubHandshakeInterceptor handshakeInterceptor;

    @Value("${matcast.ws.allowed-origins:http://localhost:3000}")
    private String allowedOrigins;

    @Value("${matcast.ws.max-text-message-bytes:65536}")
    private int maxTextMessageBytes;

    public WebSocketConfig(MatchWebSocketHandler handler, HubHandshakeInterceptor handshakeInterceptor) {
        this.handler = handler;
        this.handshakeInterceptor = handshakeInterceptor;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, "/ws/match/*", "/ws/tournament/*")
                .addInterceptors(handshakeInterceptor)
                .setAllowedOrigins(parseOrigins(allowedOrigins));
    }

    /**
     * Frame size cap for inbound text; commands are tiny.
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxTextMessageBytes);
        container.setMaxBinaryMessageBufferSize(maxTextMessageBytes);
        return container;
    }

    static String[] parseOrigins(String raw) {
        if (raw == null || raw.isBlank()) return new String[] {"http://localhost:3000"};
        return raw.split("\\s*,\\s*");
    }
}
