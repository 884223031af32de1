package com.fixedincome.pricingengine.domain.service.montecarlo;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "montecarlo")
public class MonteCarloProperties {

    private int pathCount = 100_000;
    private int batchSize = 8_000;
    private boolean antithetic = true;
    private long seed = 42L;
    private boolean vectorized = true;
    private boolean parallel = false;

    public MonteCarloConfig toConfig() {
        return MonteCarloConfig.builder()
                .batchSize(batchSize)
                .antithetic(antithetic)
                .seed(seed)
                .vectorized(vectorized)
                .parallel(parallel)
                .build();
    }
}
