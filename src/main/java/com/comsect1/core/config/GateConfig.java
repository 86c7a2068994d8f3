package com.comsect1.core.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GateConfig {

    // CLI runs have no actuator; keep gate metrics in memory unless a registry is supplied
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry gateMeterRegistry() {
        return new SimpleMeterRegistry();
    }
}
