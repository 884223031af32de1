package com.fixedincome.pricingengine.domain.schedule;

import com.fixedincome.pricingengine.domain.exception.InvalidInputException;
import com.fixedincome.pricingengine.domain.model.CashFlow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class CashFlowScheduler {

    private CashFlowScheduler() {
    }

    /**
     * Bullet bond schedule: level coupons every {@code 1/couponsPerYear} years with the
     * principal folded into the final payment, which always lands exactly on maturity.
     * Negative coupon rates are accepted.
     */
    public static List<CashFlow> bulletSchedule(double face, double couponRate,
                                                int couponsPerYear, double maturityYears) {
        requireFinite(face, "face");
        requireFinite(couponRate, "couponRate");
        requireFinite(maturityYears, "maturityYears");
        if (maturityYears <= 0.0) {
            throw new InvalidInputException("maturity must be positive: " + maturityYears);
        }
        if (couponsPerYear <= 0) {
            throw new InvalidInputException("coupon frequency must be positive: " + couponsPerYear);
        }
        if (face <= 0.0) {
            throw new InvalidInputException("face value must be positive: " + face);
        }

        double couponAmount = couponRate * face / couponsPerYear;
        double step = 1.0 / couponsPerYear;
        long payments = Math.round(maturityYears * couponsPerYear);

        List<CashFlow> flows = new ArrayList<>((int) Math.max(payments, 1));
        for (int i = 1; i <= payments; i++) {
            double time = i == payments ? maturityYears : i * step;
            flows.add(new CashFlow(time, couponAmount));
        }

        if (flows.isEmpty()) {
            flows.add(new CashFlow(maturityYears, face));
        } else {
            int last = flows.size() - 1;
            flows.set(last, flows.get(last).withAmount(flows.get(last).amount() + face));
        }
        return Collections.unmodifiableList(flows);
    }

    private static void requireFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new InvalidInputException(name + " must be finite: " + value);
        }
    }
}
