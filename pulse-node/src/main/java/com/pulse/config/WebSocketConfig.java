package com.pulse.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.relay.RelayWebSocketHandler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * 릴레이 모드가 켜진 노드에서만 버스 릴레이 엔드포인트를 등록한다.
 */
@Configuration
@EnableWebSocket
@ConditionalOnProperty(prefix = "pulse.relay", name = "enabled", havingValue = "true")
public class WebSocketConfig implements WebSocketConfigurer {

    private final PulseProperties properties;
    private final ObjectMapper objectMapper;

    public WebSocketConfig(PulseProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Bean
    public RelayWebSocketHandler relayWebSocketHandler() {
        return new RelayWebSocketHandler(objectMapper);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // 모든 출처에서의 접속을 허용한다. (프로덕션에서는 제한 필요)
        registry.addHandler(relayWebSocketHandler(), properties.getRelay().getPath())
                .setAllowedOriginPatterns("*");
    }
}
