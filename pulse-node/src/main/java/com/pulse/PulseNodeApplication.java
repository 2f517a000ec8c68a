package com.pulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot 진입점. 참가자 노드 하나를 실행한다.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PulseNodeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PulseNodeApplication.class, args);
    }
}
