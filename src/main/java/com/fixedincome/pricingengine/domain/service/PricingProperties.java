package com.fixedincome.pricingengine.domain.service;

import com.fixedincome.pricingengine.domain.model.Compounding;
import com.fixedincome.pricingengine.domain.pricing.YieldSolver;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "pricing")
public class PricingProperties {

    private Compounding compounding = Compounding.SEMI;
    private double yieldInitialGuess = YieldSolver.DEFAULT_INITIAL_GUESS;
    private double underlyingTenorYears = 5.0;
    private boolean demoEnabled = false;
}
