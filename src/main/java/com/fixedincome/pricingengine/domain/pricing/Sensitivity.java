package com.fixedincome.pricingengine.domain.pricing;

import com.fixedincome.pricingengine.domain.curve.Discounting;
import com.fixedincome.pricingengine.domain.model.CashFlow;
import com.fixedincome.pricingengine.domain.model.Compounding;

import java.util.List;

/**
 * Analytic yield sensitivities of a cash-flow stream under a flat yield.
 * Duration and convexity return 0 for a zero-priced stream.
 */
public final class Sensitivity {

    static final double ONE_BASIS_POINT = 1e-4;

    private Sensitivity() {
    }

    public static double price(List<CashFlow> cashFlows, double yield, Compounding compounding) {
        double p = 0.0;
        for (CashFlow cf : cashFlows) {
            p += cf.amount() * Discounting.factor(cf.time(), yield, compounding);
        }
        return p;
    }

    /** ∂P/∂y */
    public static double priceDelta(List<CashFlow> cashFlows, double yield, Compounding compounding) {
        double dPdy = 0.0;
        for (CashFlow cf : cashFlows) {
            dPdy += cf.amount() * Discounting.firstDerivative(cf.time(), yield, compounding);
        }
        return dPdy;
    }

    /** ∂²P/∂y² */
    public static double priceGamma(List<CashFlow> cashFlows, double yield, Compounding compounding) {
        double d2Pdy2 = 0.0;
        for (CashFlow cf : cashFlows) {
            d2Pdy2 += cf.amount() * Discounting.secondDerivative(cf.time(), yield, compounding);
        }
        return d2Pdy2;
    }

    public static double modifiedDuration(List<CashFlow> cashFlows, double yield, Compounding compounding) {
        double p = price(cashFlows, yield, compounding);
        if (p == 0.0) return 0.0;
        return -priceDelta(cashFlows, yield, compounding) / p;
    }

    public static double dv01(List<CashFlow> cashFlows, double yield, Compounding compounding) {
        return -priceDelta(cashFlows, yield, compounding) * ONE_BASIS_POINT;
    }

    public static double convexity(List<CashFlow> cashFlows, double yield, Compounding compounding) {
        double p = price(cashFlows, yield, compounding);
        if (p == 0.0) return 0.0;
        return priceGamma(cashFlows, yield, compounding) / p;
    }
}
