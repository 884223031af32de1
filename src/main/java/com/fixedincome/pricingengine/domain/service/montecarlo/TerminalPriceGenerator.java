package com.fixedincome.pricingengine.domain.service.montecarlo;

/**
 * Lognormal terminal forward: F_T = F_0 · exp(drift + σ√T · Z) with drift = -σ²T/2.
 * The array and scalar forms evaluate the same expression so both give identical bits.
 */
final class TerminalPriceGenerator {

    private final double forward;
    private final double drift;
    private final double volSqrtT;

    TerminalPriceGenerator(double forward, double sigma, double timeToExpiry) {
        this.forward = forward;
        this.drift = -0.5 * sigma * sigma * timeToExpiry;
        this.volSqrtT = sigma * Math.sqrt(timeToExpiry);
    }

    double terminal(double z) {
        return forward * StrictMath.exp(drift + volSqrtT * z);
    }

    double[] terminal(double[] draws) {
        double[] prices = new double[draws.length];
        for (int i = 0; i < draws.length; i++) {
            prices[i] = forward * StrictMath.exp(drift + volSqrtT * draws[i]);
        }
        return prices;
    }

    double[] antithetic(double[] draws) {
        double[] prices = new double[draws.length];
        for (int i = 0; i < draws.length; i++) {
            prices[i] = forward * StrictMath.exp(drift + volSqrtT * (-draws[i]));
        }
        return prices;
    }
}
