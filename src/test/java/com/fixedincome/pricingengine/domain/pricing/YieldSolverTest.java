package com.fixedincome.pricingengine.domain.pricing;

import com.fixedincome.pricingengine.domain.curve.Discounting;
import com.fixedincome.pricingengine.domain.exception.UnbracketedRootException;
import com.fixedincome.pricingengine.domain.model.CashFlow;
import com.fixedincome.pricingengine.domain.model.Compounding;
import com.fixedincome.pricingengine.domain.model.YieldSolution;
import com.fixedincome.pricingengine.domain.schedule.CashFlowScheduler;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class YieldSolverTest {

    private final YieldSolver solver = new YieldSolver();

    private final List<CashFlow> bond = CashFlowScheduler.bulletSchedule(100.0, 0.05, 2, 7.0);
    private final PriceFunction bondPricer = (y, c) -> Sensitivity.price(bond, y, c);

    @Test
    void recoversYieldFromItsOwnPrice() {
        double target = bondPricer.price(0.06, Compounding.SEMI);

        double y = solver.solve(bondPricer, target, Compounding.SEMI, 0.05);

        assertThat(y).isCloseTo(0.06, within(1e-6));
    }

    @Test
    void reportsConvergenceStatus() {
        double target = bondPricer.price(0.0825, Compounding.CONTINUOUS);

        YieldSolution solution = solver.solveWithStatus(bondPricer, target, Compounding.CONTINUOUS);

        assertThat(solution.isConverged()).isTrue();
        assertThat(Math.abs(solution.getResidual())).isLessThan(1e-12);
        assertThat(solution.getYield()).isCloseTo(0.0825, within(1e-9));
        assertThat(solution.getNewtonIterations()).isLessThan(YieldSolver.MAX_NEWTON_ITERATIONS);
    }

    @Test
    void bisectionShrinksUnitBracketByExactly1024() {
        double target = bondPricer.price(0.06, Compounding.SEMI);

        YieldSolver.Bracket bracket = solver.bisect(bondPricer, target, Compounding.SEMI);

        assertThat(bracket.initialWidth()).isEqualTo(1.0);
        assertThat(bracket.width()).isEqualTo(bracket.initialWidth() / 1024);
        assertThat(0.06).isBetween(bracket.lower(), bracket.upper());
    }

    @Test
    void widensBracketToTwoWhenRootLiesAboveOne() {
        PriceFunction zero = (y, c) -> 100.0 * Discounting.factor(1.0, y, c);
        double target = zero.price(1.5, Compounding.CONTINUOUS);

        YieldSolver.Bracket bracket = solver.bisect(zero, target, Compounding.CONTINUOUS);

        assertThat(bracket.initialWidth()).isEqualTo(2.0);
        assertThat(bracket.width()).isEqualTo(2.0 / 1024);
        assertThat(solver.solve(zero, target, Compounding.CONTINUOUS)).isCloseTo(1.5, within(1e-9));
    }

    @Test
    void failsWhenNoRootInZeroToTwo() {
        assertThatThrownBy(() -> solver.solve(bondPricer, 1_000.0, Compounding.SEMI))
                .isInstanceOf(UnbracketedRootException.class)
                .satisfies(e -> {
                    UnbracketedRootException ex = (UnbracketedRootException) e;
                    assertThat(ex.getLowerBound()).isEqualTo(0.0);
                    assertThat(ex.getUpperBound()).isEqualTo(2.0);
                    assertThat(ex.getLowerError()).isNegative();
                    assertThat(ex.getUpperError()).isNegative();
                });
    }

    @Test
    void flatPriceFunctionStopsSilentlyOnZeroDerivative() {
        PriceFunction step = (y, c) -> y <= 0.7 ? 10.0 : 0.0;

        YieldSolution solution = solver.solveWithStatus(step, 5.0, Compounding.ANNUAL);

        assertThat(solution.isConverged()).isFalse();
        assertThat(solution.getNewtonIterations()).isZero();
        assertThat(solution.getYield()).isCloseTo(0.7, within(1.0 / 1024));
        assertThat(solver.solve(step, 5.0, Compounding.ANNUAL)).isEqualTo(solution.getYield());
    }

    @Test
    void iteratesStayInsideClampRange() {
        double target = bondPricer.price(0.0015, Compounding.ANNUAL);

        double y = solver.solve(bondPricer, target, Compounding.ANNUAL);

        assertThat(y).isBetween(YieldSolver.MIN_YIELD, YieldSolver.MAX_YIELD);
        assertThat(y).isCloseTo(0.0015, within(1e-9));
    }
}
