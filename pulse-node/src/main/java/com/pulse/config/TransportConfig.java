package com.pulse.config;

import com.pulse.transport.TransportEngine;
import com.pulse.transport.webrtc.WebRtcTransportEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TransportConfig {

    @Bean(destroyMethod = "close")
    public TransportEngine transportEngine(PulseProperties properties) {
        return new WebRtcTransportEngine(properties.getTransport());
    }
}
