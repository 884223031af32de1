package com.fixedincome.pricingengine.domain.service;

import com.fixedincome.pricingengine.domain.curve.DiscountCurve;
import com.fixedincome.pricingengine.domain.instrument.Bond;
import com.fixedincome.pricingengine.domain.model.BondAnalyticsReport;
import com.fixedincome.pricingengine.domain.model.Compounding;
import com.fixedincome.pricingengine.domain.model.YieldSolution;
import com.fixedincome.pricingengine.domain.pricing.Sensitivity;
import com.fixedincome.pricingengine.domain.pricing.YieldSolver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class BondAnalyticsService {

    private final YieldSolver yieldSolver;
    private final PricingProperties properties;
    private final MeterRegistry meterRegistry;

    private Counter unconvergedCounter;

    @PostConstruct
    void initMetrics() {
        unconvergedCounter = Counter.builder("pricing.yield.unconverged")
                .description("Yield inversions that stopped without meeting the price tolerance")
                .register(meterRegistry);
    }

    public BondAnalyticsReport analyze(Bond bond, DiscountCurve curve) {
        return analyze(bond, bond.price(curve), properties.getCompounding());
    }

    public BondAnalyticsReport analyze(Bond bond, double marketPrice, Compounding compounding) {
        YieldSolution solution = yieldSolver.solveWithStatus(
                bond::price, marketPrice, compounding, properties.getYieldInitialGuess());

        if (!solution.isConverged()) {
            unconvergedCounter.increment();
            log.warn("[Bond] yield did not converge: price={}, yield={}, residual={}",
                    marketPrice, solution.getYield(), solution.getResidual());
        }

        double y = solution.getYield();
        BondAnalyticsReport report = BondAnalyticsReport.builder()
                .price(marketPrice)
                .yield(y)
                .compounding(compounding)
                .modifiedDuration(Sensitivity.modifiedDuration(bond.getCashFlows(), y, compounding))
                .dv01(Sensitivity.dv01(bond.getCashFlows(), y, compounding))
                .convexity(Sensitivity.convexity(bond.getCashFlows(), y, compounding))
                .cashFlowCount(bond.getCashFlows().size())
                .build();

        log.info("[Bond] analysed: price={}, yield={}, duration={}, dv01={}, convexity={}",
                String.format("%.6f", report.getPrice()),
                String.format("%.6f", report.getYield()),
                String.format("%.4f", report.getModifiedDuration()),
                String.format("%.6f", report.getDv01()),
                String.format("%.4f", report.getConvexity()));
        return report;
    }
}
