package com.pulse.support;

import com.pulse.transport.LoopbackTransportEngine;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * 네이티브 WebRTC 대신 프로세스 내부 루프백 엔진을 쓰게 한다.
 */
@TestConfiguration
public class LoopbackTransportConfig {

    @Bean
    @Primary
    public LoopbackTransportEngine loopbackTransportEngine() {
        return new LoopbackTransportEngine();
    }
}
