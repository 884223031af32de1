package com.fixedincome.pricingengine.domain.pricing;

import org.apache.commons.math3.special.Erf;

/**
 * Black-76 closed form for European options on a forward or futures price.
 * <ul>
 *   <li>d1 = [ln(F/K) + σ²T/2] / (σ√T), d2 = d1 - σ√T</li>
 *   <li>call = D[F·N(d1) - K·N(d2)], put = D[K·N(-d2) - F·N(-d1)]</li>
 *   <li>vega = D·F·φ(d1)·√T, delta = D·N(d1) (call) or -D·N(-d1) (put)</li>
 * </ul>
 * Expired or zero-volatility inputs collapse to discounted intrinsic value.
 * Inputs are not validated; non-positive F or K yield NaN.
 */
public final class Black76 {

    private static final double SQRT_2 = Math.sqrt(2.0);
    private static final double INV_SQRT_2PI = 1.0 / Math.sqrt(2.0 * Math.PI);

    private Black76() {
    }

    public static double price(double forward, double strike, double timeToExpiry,
                               double volatility, double discountFactor, boolean isCall) {
        if (isDegenerate(timeToExpiry, volatility)) {
            return isCall
                    ? discountFactor * Math.max(forward - strike, 0.0)
                    : discountFactor * Math.max(strike - forward, 0.0);
        }

        double d1 = d1(forward, strike, timeToExpiry, volatility);
        double d2 = d1 - volatility * Math.sqrt(timeToExpiry);

        if (isCall) {
            return discountFactor * (forward * normCdf(d1) - strike * normCdf(d2));
        }
        return discountFactor * (strike * normCdf(-d2) - forward * normCdf(-d1));
    }

    public static double vega(double forward, double strike, double timeToExpiry,
                              double volatility, double discountFactor) {
        if (isDegenerate(timeToExpiry, volatility)) {
            return 0.0;
        }
        double d1 = d1(forward, strike, timeToExpiry, volatility);
        return discountFactor * forward * normPdf(d1) * Math.sqrt(timeToExpiry);
    }

    public static double delta(double forward, double strike, double timeToExpiry,
                               double volatility, double discountFactor, boolean isCall) {
        if (isDegenerate(timeToExpiry, volatility)) {
            return isCall
                    ? discountFactor * (forward > strike ? 1.0 : 0.0)
                    : discountFactor * (forward < strike ? -1.0 : 0.0);
        }

        double d1 = d1(forward, strike, timeToExpiry, volatility);
        return isCall
                ? discountFactor * normCdf(d1)
                : -discountFactor * normCdf(-d1);
    }

    static double d1(double forward, double strike, double timeToExpiry, double volatility) {
        return (Math.log(forward / strike) + 0.5 * volatility * volatility * timeToExpiry)
                / (volatility * Math.sqrt(timeToExpiry));
    }

    static double normCdf(double x) {
        return 0.5 * (1.0 + Erf.erf(x / SQRT_2));
    }

    static double normPdf(double x) {
        return INV_SQRT_2PI * Math.exp(-0.5 * x * x);
    }

    private static boolean isDegenerate(double timeToExpiry, double volatility) {
        return timeToExpiry <= 0.0 || volatility <= 0.0;
    }
}
