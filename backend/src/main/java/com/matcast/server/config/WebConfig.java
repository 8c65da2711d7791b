package com.matcast.server.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig {

    // Comma-separated list of allowed origins, shared with the WebSocket endpoints
    @Value("${matcast.ws.allowed-origins:http://localhost:3000}")
    private String corsOrigins;

    @Bean
    public WebMvcConfigurer corsConfigurer() {
        final String[] origins = WebSocketConfig.parseOrigins(corsOrigins);

        return new WebMvcConfigurer() {
            @Override
            public void addCorsMappings(@NonNull CorsRegistry registry) {
                registry.addMapping("/api/**")
                        .allowedOrigins(origins)
                        .allowedMethods("GET", "HEAD", "OPTIONS")
                        .allowedHeaders("*")
                        .allowCredentials(true);
            }
        };
    }
}
