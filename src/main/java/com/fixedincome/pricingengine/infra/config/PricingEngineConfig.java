package com.fixedincome.pricingengine.infra.config;

import com.fixedincome.pricingengine.domain.pricing.YieldSolver;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PricingEngineConfig {

    @Bean
    public YieldSolver yieldSolver() {
        return new YieldSolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
