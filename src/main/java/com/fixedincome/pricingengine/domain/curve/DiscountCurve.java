package com.fixedincome.pricingengine.domain.curve;

import com.fixedincome.pricingengine.domain.exception.InvalidInputException;
import com.fixedincome.pricingengine.domain.model.Compounding;
import com.fixedincome.pricingengine.domain.model.DayCountConvention;
import com.fixedincome.pricingengine.domain.model.ZeroQuote;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable zero curve P(0,t), either flat-yield or bootstrapped from zero quotes.
 * Bootstrapped curves interpolate log-linearly between quotes and extrapolate flat
 * beyond the first and last quote.
 */
@Slf4j
@Getter
public final class DiscountCurve {

    private final double flatYield;
    private final Compounding compounding;
    private final DayCountConvention dayCount;
    private final List<ZeroQuote> quotes;

    private DiscountCurve(double flatYield, Compounding compounding,
                          DayCountConvention dayCount, List<ZeroQuote> quotes) {
        this.flatYield = flatYield;
        this.compounding = compounding;
        this.dayCount = dayCount;
        this.quotes = quotes;
    }

    public static DiscountCurve flat(double yield, Compounding compounding, DayCountConvention dayCount) {
        if (!Double.isFinite(yield)) {
            throw new InvalidInputException("yield must be finite: " + yield);
        }
        if (compounding == null) {
            throw new InvalidInputException("compounding must not be null");
        }
        return new DiscountCurve(yield, compounding,
                dayCount != null ? dayCount : DayCountConvention.ACT_365F, List.of());
    }

    public static DiscountCurve flat(double yield, Compounding compounding) {
        return flat(yield, compounding, DayCountConvention.ACT_365F);
    }

    public static DiscountCurve bootstrapped(List<ZeroQuote> quotes) {
        if (quotes == null || quotes.isEmpty()) {
            throw new InvalidInputException("cannot bootstrap a curve from an empty quote list");
        }
        List<ZeroQuote> sorted = new ArrayList<>(quotes.size());
        for (ZeroQuote quote : quotes) {
            sorted.add(Objects.requireNonNull(quote, "quote"));
        }
        sorted.sort(Comparator.comparingDouble(ZeroQuote::time));

        log.debug("[Curve] bootstrapped: quotes={}, first={}, last={}",
                sorted.size(), sorted.get(0).time(), sorted.get(sorted.size() - 1).time());

        return new DiscountCurve(0.0, Compounding.CONTINUOUS, DayCountConvention.ACT_365F,
                Collections.unmodifiableList(sorted));
    }

    public boolean isBootstrapped() {
        return !quotes.isEmpty();
    }

    public double df(double t) {
        if (!Double.isFinite(t)) {
            throw new InvalidInputException("time must be finite: " + t);
        }
        if (t <= 0.0) {
            return 1.0;
        }
        if (quotes.isEmpty()) {
            return Discounting.factor(t, flatYield, compounding);
        }
        return interpolate(t);
    }

    public double fwdBondPrice(double t) {
        double discount = df(t);
        return discount > 0.0 ? 1.0 / discount : 0.0;
    }

    private double interpolate(double t) {
        int idx = lowerBound(t);
        if (idx == 0) {
            return quotes.get(0).discountFactor();
        }
        if (idx == quotes.size()) {
            return quotes.get(quotes.size() - 1).discountFactor();
        }

        ZeroQuote prev = quotes.get(idx - 1);
        ZeroQuote next = quotes.get(idx);
        double t0 = prev.time();
        double t1 = next.time();
        double df0 = prev.discountFactor();
        double df1 = next.discountFactor();

        if (t1 == t0) {
            return df0;
        }
        double weight = (t - t0) / (t1 - t0);
        if (df0 <= 0.0 || df1 <= 0.0) {
            return df0 + weight * (df1 - df0);
        }
        double logDf = Math.log(df0) + weight * (Math.log(df1) - Math.log(df0));
        return Math.exp(logDf);
    }

    // first index whose quote time is >= t
    private int lowerBound(double t) {
        int lo = 0;
        int hi = quotes.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (quotes.get(mid).time() < t) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
