package com.pulse.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.bus.InMemoryRealtimeBus;
import com.pulse.bus.RealtimeBus;
import com.pulse.bus.WebSocketRealtimeBus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * pulse.bus.mode 값에 따라 버스 구현을 선택한다.
 */
@Configuration
public class BusConfig {

    @Bean
    @ConditionalOnProperty(prefix = "pulse.bus", name = "mode", havingValue = "in-memory", matchIfMissing = true)
    public RealtimeBus inMemoryRealtimeBus() {
        return new InMemoryRealtimeBus();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "pulse.bus", name = "mode", havingValue = "websocket")
    public RealtimeBus webSocketRealtimeBus(PulseProperties properties, ObjectMapper objectMapper) {
        PulseProperties.Bus bus = properties.getBus();
        return new WebSocketRealtimeBus(new StandardWebSocketClient(), bus.getRelayUrl(), objectMapper,
                bus.getSubscribeTimeout());
    }
}
