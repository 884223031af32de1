package com.fixedincome.pricingengine.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class OptionPricingReport {

    private OptionType type;
    private double forward;
    private double strike;
    private double expiry;
    private double volatility;
    private double discountFactor;
    private double blackPrice;
    private double blackVega;
    private double blackDelta;
    private McResult monteCarlo;
    private long calcDurationMicros;

    public double monteCarloError() {
        return monteCarlo.getPrice() - blackPrice;
    }

    /**
     * Whether the simulated price lies within {@code multiple} standard errors of the closed form.
     */
    public boolean agreesWithin(double multiple) {
        return Math.abs(monteCarloError()) <= multiple * monteCarlo.getStandardError();
    }
}
