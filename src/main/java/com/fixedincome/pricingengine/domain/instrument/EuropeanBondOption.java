package com.fixedincome.pricingengine.domain.instrument;

import com.fixedincome.pricingengine.domain.curve.DiscountCurve;
import com.fixedincome.pricingengine.domain.model.McResult;
import com.fixedincome.pricingengine.domain.model.OptionType;
import com.fixedincome.pricingengine.domain.pricing.Black76;
import com.fixedincome.pricingengine.domain.service.montecarlo.MonteCarloConfig;
import com.fixedincome.pricingengine.domain.service.montecarlo.MonteCarloEngine;
import lombok.Getter;

/**
 * European option on a zero-coupon bond maturing {@code underlyingTenorYears} after expiry.
 * The underlying forward is read off the curve as 1/P(0, expiry + tenor).
 */
@Getter
public class EuropeanBondOption {

    public static final double DEFAULT_UNDERLYING_TENOR = 5.0;
    public static final int DEFAULT_PATHS = 100_000;

    private final OptionType type;
    private final double strike;
    private final double expiry;
    private final double underlyingTenorYears;

    public EuropeanBondOption(OptionType type, double strike, double expiry) {
        this(type, strike, expiry, DEFAULT_UNDERLYING_TENOR);
    }

    public EuropeanBondOption(OptionType type, double strike, double expiry, double underlyingTenorYears) {
        this.type = type;
        this.strike = strike;
        this.expiry = expiry;
        this.underlyingTenorYears = underlyingTenorYears;
    }

    public double forwardPrice(DiscountCurve curve) {
        return curve.fwdBondPrice(expiry + underlyingTenorYears);
    }

    public double priceBlack(DiscountCurve curve, double sigma) {
        return Black76.price(forwardPrice(curve), strike, expiry, sigma, curve.df(expiry), type.isCall());
    }

    public double vegaBlack(DiscountCurve curve, double sigma) {
        return Black76.vega(forwardPrice(curve), strike, expiry, sigma, curve.df(expiry));
    }

    public double deltaBlack(DiscountCurve curve, double sigma) {
        return Black76.delta(forwardPrice(curve), strike, expiry, sigma, curve.df(expiry), type.isCall());
    }

    public double priceMonteCarlo(DiscountCurve curve, double sigma) {
        return priceMonteCarlo(curve, sigma, DEFAULT_PATHS);
    }

    public double priceMonteCarlo(DiscountCurve curve, double sigma, int paths) {
        return MonteCarloEngine.mcPrice(forwardPrice(curve), strike, sigma, expiry, curve.df(expiry), type, paths);
    }

    public McResult priceMonteCarloWithStats(DiscountCurve curve, double sigma, int paths, MonteCarloConfig config) {
        return MonteCarloEngine.mcPriceWithStats(forwardPrice(curve), strike, sigma, expiry, curve.df(expiry),
                type, paths, config);
    }
}
