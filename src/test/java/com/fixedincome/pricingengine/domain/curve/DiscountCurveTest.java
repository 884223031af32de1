package com.fixedincome.pricingengine.domain.curve;

import com.fixedincome.pricingengine.domain.exception.InvalidInputException;
import com.fixedincome.pricingengine.domain.model.Compounding;
import com.fixedincome.pricingengine.domain.model.DayCountConvention;
import com.fixedincome.pricingengine.domain.model.ZeroQuote;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DiscountCurveTest {

    private static final List<ZeroQuote> QUOTES = List.of(
            new ZeroQuote(1.0, 0.95),
            new ZeroQuote(2.0, 0.90),
            new ZeroQuote(3.0, 0.85));

    @Test
    void flatContinuousCurveDiscountsExponentially() {
        DiscountCurve curve = DiscountCurve.flat(0.05, Compounding.CONTINUOUS, DayCountConvention.ACT_365F);

        assertThat(curve.df(2.0)).isCloseTo(Math.exp(-0.10), within(1e-15));
        assertThat(curve.isBootstrapped()).isFalse();
    }

    @Test
    void flatDiscreteCurveCompoundsPerPeriod() {
        DiscountCurve curve = DiscountCurve.flat(0.05, Compounding.SEMI, DayCountConvention.THIRTY_360);

        assertThat(curve.df(2.0)).isCloseTo(Math.pow(1.025, -4.0), within(1e-15));
        assertThat(curve.getDayCount()).isEqualTo(DayCountConvention.THIRTY_360);
    }

    @Test
    void negativeYieldIsAllowed() {
        DiscountCurve curve = DiscountCurve.flat(-0.01, Compounding.ANNUAL);

        assertThat(curve.df(1.0)).isGreaterThan(1.0);
    }

    @Test
    void nonPositiveTimeAlwaysDiscountsToOne() {
        DiscountCurve flat = DiscountCurve.flat(0.07, Compounding.QUARTERLY);
        DiscountCurve boot = DiscountCurve.bootstrapped(QUOTES);

        for (double t : new double[]{0.0, -0.5, -10.0}) {
            assertThat(flat.df(t)).as("flat df(%s)", t).isEqualTo(1.0);
            assertThat(boot.df(t)).as("bootstrapped df(%s)", t).isEqualTo(1.0);
        }
    }

    @Test
    void forwardBondPriceIsReciprocalOfDiscountFactor() {
        DiscountCurve flat = DiscountCurve.flat(0.04, Compounding.MONTHLY);
        DiscountCurve boot = DiscountCurve.bootstrapped(QUOTES);

        for (double t : new double[]{0.25, 1.0, 2.5, 6.0}) {
            assertThat(flat.fwdBondPrice(t)).isEqualTo(1.0 / flat.df(t));
            assertThat(boot.fwdBondPrice(t)).isEqualTo(1.0 / boot.df(t));
        }
    }

    @Test
    void logLinearInterpolationStaysBetweenQuotesAndDecreases() {
        DiscountCurve curve = DiscountCurve.bootstrapped(QUOTES);

        double df15 = curve.df(1.5);
        double df25 = curve.df(2.5);

        assertThat(df15).isStrictlyBetween(0.90, 0.95);
        assertThat(df25).isStrictlyBetween(0.85, 0.90);
        assertThat(df15).isGreaterThan(df25);
        assertThat(df15).isCloseTo(Math.sqrt(0.95 * 0.90), within(1e-14));
    }

    @Test
    void bootstrappedCurveExtrapolatesFlat() {
        DiscountCurve curve = DiscountCurve.bootstrapped(QUOTES);

        assertThat(curve.df(0.5)).isEqualTo(0.95);
        assertThat(curve.df(1.0)).isEqualTo(0.95);
        assertThat(curve.df(7.0)).isEqualTo(0.85);
    }

    @Test
    void quotesAreSortedByTime() {
        DiscountCurve curve = DiscountCurve.bootstrapped(List.of(
                new ZeroQuote(3.0, 0.85),
                new ZeroQuote(1.0, 0.95),
                new ZeroQuote(2.0, 0.90)));

        assertThat(curve.getQuotes()).extracting(ZeroQuote::time).containsExactly(1.0, 2.0, 3.0);
        assertThat(curve.df(1.5)).isEqualTo(DiscountCurve.bootstrapped(QUOTES).df(1.5));
    }

    @Test
    void duplicateQuoteTimesArePermitted() {
        DiscountCurve curve = DiscountCurve.bootstrapped(List.of(
                new ZeroQuote(1.0, 0.95),
                new ZeroQuote(1.0, 0.94),
                new ZeroQuote(2.0, 0.90)));

        assertThat(curve.df(1.0)).isEqualTo(0.95);
        assertThat(curve.df(1.5)).isStrictlyBetween(0.90, 0.94);
    }

    @Test
    void rejectsInvalidConstructionInputs() {
        assertThatThrownBy(() -> DiscountCurve.flat(Double.NaN, Compounding.ANNUAL))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> DiscountCurve.flat(Double.POSITIVE_INFINITY, Compounding.ANNUAL))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> DiscountCurve.bootstrapped(List.of()))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new ZeroQuote(0.0, 0.9))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new ZeroQuote(1.0, -0.1))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new ZeroQuote(Double.NaN, 0.9))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void rejectsNonFiniteTime() {
        DiscountCurve curve = DiscountCurve.flat(0.05, Compounding.ANNUAL);

        assertThatThrownBy(() -> curve.df(Double.NaN)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> curve.fwdBondPrice(Double.POSITIVE_INFINITY))
                .isInstanceOf(InvalidInputException.class);
    }
}
