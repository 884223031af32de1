package com.fixedincome.pricingengine.domain.service.montecarlo;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
public class MonteCarloConfig {

    private static final MonteCarloConfig DEFAULT = MonteCarloConfig.builder().build();

    @Builder.Default
    private final int batchSize = 8_000;

    @Builder.Default
    private final boolean antithetic = true;

    @Builder.Default
    private final long seed = 42L;

    @Builder.Default
    private final boolean vectorized = true;

    @Builder.Default
    private final boolean parallel = false;

    public static MonteCarloConfig defaults() {
        return DEFAULT;
    }
}
