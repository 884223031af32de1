package com.fixedincome.pricingengine.domain.pricing;

import com.fixedincome.pricingengine.domain.exception.UnbracketedRootException;
import com.fixedincome.pricingengine.domain.model.Compounding;
import com.fixedincome.pricingengine.domain.model.YieldSolution;
import lombok.extern.slf4j.Slf4j;

/**
 * Inverts a price function for its yield: a fixed 10-step bisection on [0, 1]
 * (widened once to [0, 2]) followed by Newton-Raphson from the bisection midpoint.
 * Newton uses a central-difference derivative and keeps every iterate inside
 * [0.001, 2.0].
 */
@Slf4j
public class YieldSolver {

    public static final double DEFAULT_INITIAL_GUESS = 0.05;

    static final double LOWER_BOUND = 0.0;
    static final double UPPER_BOUND = 1.0;
    static final double EXPANDED_UPPER_BOUND = 2.0;
    static final int BISECTION_ITERATIONS = 10;
    static final int MAX_NEWTON_ITERATIONS = 100;
    static final double PRICE_TOLERANCE = 1e-12;
    static final double MIN_DERIVATIVE = 1e-15;
    static final double MIN_YIELD = 0.001;
    static final double MAX_YIELD = 2.0;

    public double solve(PriceFunction pricer, double targetPrice, Compounding compounding) {
        return solve(pricer, targetPrice, compounding, DEFAULT_INITIAL_GUESS);
    }

    /**
     * The bisection midpoint always seeds Newton; {@code initialGuess} is kept for callers
     * that pass one and is only reported in the debug log.
     */
    public double solve(PriceFunction pricer, double targetPrice, Compounding compounding,
                        double initialGuess) {
        return solveWithStatus(pricer, targetPrice, compounding, initialGuess).getYield();
    }

    public YieldSolution solveWithStatus(PriceFunction pricer, double targetPrice, Compounding compounding) {
        return solveWithStatus(pricer, targetPrice, compounding, DEFAULT_INITIAL_GUESS);
    }

    public YieldSolution solveWithStatus(PriceFunction pricer, double targetPrice,
                                         Compounding compounding, double initialGuess) {
        Bracket bracket = bisect(pricer, targetPrice, compounding);
        YieldSolution solution = newton(pricer, targetPrice, compounding, bracket.midpoint());

        log.debug("[YieldSolver] target={}, guess={}, bracket=[{}, {}], yield={}, converged={}, iterations={}",
                targetPrice, initialGuess, bracket.lower(), bracket.upper(),
                solution.getYield(), solution.isConverged(), solution.getNewtonIterations());
        return solution;
    }

    Bracket bisect(PriceFunction pricer, double targetPrice, Compounding compounding) {
        double lo = LOWER_BOUND;
        double hi = UPPER_BOUND;
        double fLo = priceError(pricer, lo, targetPrice, compounding);
        double fHi = priceError(pricer, hi, targetPrice, compounding);

        if (fLo * fHi > 0) {
            hi = EXPANDED_UPPER_BOUND;
            fHi = priceError(pricer, hi, targetPrice, compounding);
            if (fLo * fHi > 0) {
                throw new UnbracketedRootException(lo, hi, fLo, fHi);
            }
        }

        double initialWidth = hi - lo;
        for (int i = 0; i < BISECTION_ITERATIONS; i++) {
            double mid = (lo + hi) / 2.0;
            double fMid = priceError(pricer, mid, targetPrice, compounding);
            if (fLo * fMid < 0) {
                hi = mid;
            } else {
                lo = mid;
                fLo = fMid;
            }
        }
        return new Bracket(lo, hi, initialWidth);
    }

    YieldSolution newton(PriceFunction pricer, double targetPrice, Compounding compounding, double start) {
        double y = start;
        double error = Double.NaN;
        int iterations = 0;

        for (; iterations < MAX_NEWTON_ITERATIONS; iterations++) {
            error = priceError(pricer, y, targetPrice, compounding);
            if (Math.abs(error) < PRICE_TOLERANCE) {
                return YieldSolution.builder()
                        .yield(y)
                        .converged(true)
                        .newtonIterations(iterations)
                        .residual(error)
                        .build();
            }

            double derivative = derivative(pricer, y, compounding);
            if (Math.abs(derivative) < MIN_DERIVATIVE) {
                log.debug("[YieldSolver] derivative underflow at y={}, f'={}", y, derivative);
                break;
            }

            y = clamp(y - error / derivative);
        }

        return YieldSolution.builder()
                .yield(y)
                .converged(false)
                .newtonIterations(iterations)
                .residual(error)
                .build();
    }

    private static double derivative(PriceFunction pricer, double y, Compounding compounding) {
        double h = Math.max(1e-8, 1e-6 * Math.abs(y));
        double up = pricer.price(y + h, compounding);
        double down = pricer.price(y - h, compounding);
        return (up - down) / (2.0 * h);
    }

    private static double priceError(PriceFunction pricer, double y, double targetPrice, Compounding compounding) {
        return pricer.price(y, compounding) - targetPrice;
    }

    private static double clamp(double y) {
        return Math.max(MIN_YIELD, Math.min(MAX_YIELD, y));
    }

    record Bracket(double lower, double upper, double initialWidth) {

        double midpoint() {
            return (lower + upper) / 2.0;
        }

        double width() {
            return upper - lower;
        }
    }
}
