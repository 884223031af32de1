package com.fixedincome.pricingengine.domain.instrument;

import com.fixedincome.pricingengine.domain.curve.DiscountCurve;
import com.fixedincome.pricingengine.domain.curve.Discounting;
import com.fixedincome.pricingengine.domain.model.CashFlow;
import com.fixedincome.pricingengine.domain.model.Compounding;
import com.fixedincome.pricingengine.domain.pricing.Sensitivity;
import com.fixedincome.pricingengine.domain.pricing.YieldSolver;
import com.fixedincome.pricingengine.domain.schedule.CashFlowScheduler;
import lombok.Getter;

import java.util.List;

/**
 * Fixed-coupon bullet bond. Risk measures use the flat yield implied by the curve at the
 * final cash-flow date.
 */
@Getter
public class Bond {

    static final double FALLBACK_YIELD = 0.05;

    private final double face;
    private final double couponRate;
    private final int couponsPerYear;
    private final double maturityYears;
    private final List<CashFlow> cashFlows;

    public Bond(double face, double couponRate, int couponsPerYear, double maturityYears) {
        this.face = face;
        this.couponRate = couponRate;
        this.couponsPerYear = couponsPerYear;
        this.maturityYears = maturityYears;
        this.cashFlows = CashFlowScheduler.bulletSchedule(face, couponRate, couponsPerYear, maturityYears);
    }

    public double price(DiscountCurve curve) {
        double price = 0.0;
        for (CashFlow cf : cashFlows) {
            price += cf.amount() * curve.df(cf.time());
        }
        return price;
    }

    public double price(double yield, Compounding compounding) {
        return price(DiscountCurve.flat(yield, compounding));
    }

    public double yieldFromPrice(double cleanPrice, Compounding compounding, YieldSolver solver) {
        return solver.solve(this::price, cleanPrice, compounding);
    }

    public double dv01(DiscountCurve curve, Compounding compounding) {
        return Sensitivity.dv01(cashFlows, impliedYield(curve, compounding), compounding);
    }

    public double modifiedDuration(DiscountCurve curve, Compounding compounding) {
        return Sensitivity.modifiedDuration(cashFlows, impliedYield(curve, compounding), compounding);
    }

    public double convexity(DiscountCurve curve, Compounding compounding) {
        return Sensitivity.convexity(cashFlows, impliedYield(curve, compounding), compounding);
    }

    double impliedYield(DiscountCurve curve, Compounding compounding) {
        if (cashFlows.isEmpty()) return FALLBACK_YIELD;

        double maturity = cashFlows.get(cashFlows.size() - 1).time();
        double df = curve.df(maturity);
        if (df <= 0.0) return FALLBACK_YIELD;

        return Discounting.impliedYield(maturity, df, compounding);
    }
}
