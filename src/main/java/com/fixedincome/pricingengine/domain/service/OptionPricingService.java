package com.fixedincome.pricingengine.domain.service;

import com.fixedincome.pricingengine.domain.curve.DiscountCurve;
import com.fixedincome.pricingengine.domain.instrument.EuropeanBondOption;
import com.fixedincome.pricingengine.domain.model.McResult;
import com.fixedincome.pricingengine.domain.model.OptionPricingReport;
import com.fixedincome.pricingengine.domain.model.OptionType;
import com.fixedincome.pricingengine.domain.service.montecarlo.MonteCarloProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

@Slf4j
@Service
@RequiredArgsConstructor
public class OptionPricingService {

    private final MonteCarloProperties mcProperties;
    private final PricingProperties pricingProperties;
    private final MeterRegistry meterRegistry;

    private Timer mcTimer;

    @PostConstruct
    void initMetrics() {
        mcTimer = Timer.builder("pricing.mc.duration")
                .description("Monte Carlo option pricing duration")
                .register(meterRegistry);
    }

    public EuropeanBondOption bondOption(OptionType type, double strike, double expiry) {
        return new EuropeanBondOption(type, strike, expiry, pricingProperties.getUnderlyingTenorYears());
    }

    public OptionPricingReport price(EuropeanBondOption option, DiscountCurve curve, double sigma) {
        long startNano = System.nanoTime();

        McResult mc = option.priceMonteCarloWithStats(curve, sigma, mcProperties.getPathCount(),
                mcProperties.toConfig());
        long elapsedNanos = System.nanoTime() - startNano;
        mcTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);

        OptionPricingReport report = OptionPricingReport.builder()
                .type(option.getType())
                .forward(option.forwardPrice(curve))
                .strike(option.getStrike())
                .expiry(option.getExpiry())
                .volatility(sigma)
                .discountFactor(curve.df(option.getExpiry()))
                .blackPrice(option.priceBlack(curve, sigma))
                .blackVega(option.vegaBlack(curve, sigma))
                .blackDelta(option.deltaBlack(curve, sigma))
                .monteCarlo(mc)
                .calcDurationMicros(elapsedNanos / 1_000)
                .build();

        log.info("[Option] priced: type={}, F={}, K={}, T={}, σ={}, black={}, mc={} ± {}, paths={}, elapsed={}μs",
                report.getType(),
                String.format("%.6f", report.getForward()),
                report.getStrike(), report.getExpiry(), sigma,
                String.format("%.6f", report.getBlackPrice()),
                String.format("%.6f", mc.getPrice()),
                String.format("%.6f", mc.getConfidenceHalfWidth95()),
                mc.getEffectivePathCount(), report.getCalcDurationMicros());

        if (!report.agreesWithin(3.0)) {
            log.warn("[Option] Monte Carlo deviates from Black-76 by more than 3 standard errors: diff={}, se={}",
                    report.monteCarloError(), mc.getStandardError());
        }
        return report;
    }
}
