package com.fixedincome.pricingengine.domain.curve;

import com.fixedincome.pricingengine.domain.model.Compounding;

/**
 * Flat-yield discounting family shared by {@link DiscountCurve} and the sensitivity engine.
 * <ul>
 *   <li>continuous: P = e^(-yt)</li>
 *   <li>discrete, m periods per year: P = (1 + y/m)^(-mt)</li>
 * </ul>
 * Derivatives are taken with respect to the yield.
 */
public final class Discounting {

    private Discounting() {
    }

    public static double factor(double time, double yield, Compounding compounding) {
        if (compounding.isContinuous()) {
            return Math.exp(-yield * time);
        }
        double m = compounding.periodsPerYear();
        return Math.pow(1.0 + yield / m, -m * time);
    }

    public static double firstDerivative(double time, double yield, Compounding compounding) {
        if (compounding.isContinuous()) {
            return -time * Math.exp(-yield * time);
        }
        double m = compounding.periodsPerYear();
        double base = 1.0 + yield / m;
        return -time * Math.pow(base, -m * time - 1.0);
    }

    public static double secondDerivative(double time, double yield, Compounding compounding) {
        if (compounding.isContinuous()) {
            return time * time * Math.exp(-yield * time);
        }
        double m = compounding.periodsPerYear();
        double base = 1.0 + yield / m;
        return (time * time + time / m) * Math.pow(base, -m * time - 2.0);
    }

    /**
     * Inverts {@link #factor} for the yield that reprices {@code discountFactor} at {@code time}.
     */
    public static double impliedYield(double time, double discountFactor, Compounding compounding) {
        if (compounding.isContinuous()) {
            return -Math.log(discountFactor) / time;
        }
        double m = compounding.periodsPerYear();
        return m * (Math.pow(1.0 / discountFactor, 1.0 / (m * time)) - 1.0);
    }
}
