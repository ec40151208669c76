package com.coderco.common.startup;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(StartupProperties.class)
public class StartupGateConfig {

    @Bean
    public StartupGate startupGate(StartupProperties startupProperties) {
        return new StartupGate(startupProperties);
    }

    @Bean
    public ServiceLifecycle serviceLifecycle() {
        return new ServiceLifecycle();
    }
}
