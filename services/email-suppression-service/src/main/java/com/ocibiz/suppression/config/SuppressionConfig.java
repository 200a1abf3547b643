package com.ocibiz.suppression.config;

import com.ocibiz.suppression.domain.EmailSuppressionService;
import com.ocibiz.suppression.domain.SuppressionGateway;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the framework-free domain service. */
@Configuration(proxyBeanMethods = false)
public class SuppressionConfig {

    @Bean
    public EmailSuppressionService emailSuppressionService(
            SuppressionGateway gateway, MeterRegistry meterRegistry) {
        return new EmailSuppressionService(gateway, meterRegistry);
    }
}
