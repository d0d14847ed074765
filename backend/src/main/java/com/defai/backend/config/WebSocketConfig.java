package com.defai.backend.config;

import com.defai.backend.service.stream.SentimentStreamHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.List;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String SENTIMENT_STREAM_PATH = "/ws/sentiment";

    private final SentimentStreamHandler sentimentStreamHandler;
    private final OracleProperties properties;
    private final Environment environment;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        List<String> origins = resolveAllowedOrigins();
        var registration = registry.addHandler(sentimentStreamHandler, SENTIMENT_STREAM_PATH);
        if (origins.isEmpty() && !isProd()) {
            registration.setAllowedOriginPatterns("*");
        } else {
            registration.setAllowedOrigins(origins.toArray(new String[0]));
        }
    }

    private boolean isProd() {
        for (String profile : environment.getActiveProfiles()) {
            if ("prod".equalsIgnoreCase(profile) || "production".equalsIgnoreCase(profile)) {
                return true;
            }
        }
        return false;
    }

    private List<String> resolveAllowedOrigins() {
        List<String> configured = properties.getStream().getAllowedOrigins();
        if (configured == null || configured.isEmpty()) {
            configured = properties.getCors().getAllowedOrigins();
        }
        return configured == null ? List.of() : configured;
    }
}
