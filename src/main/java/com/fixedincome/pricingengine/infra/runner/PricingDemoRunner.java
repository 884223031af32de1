package com.fixedincome.pricingengine.infra.runner;

import com.fixedincome.pricingengine.domain.curve.DiscountCurve;
import com.fixedincome.pricingengine.domain.instrument.Bond;
import com.fixedincome.pricingengine.domain.instrument.EuropeanBondOption;
import com.fixedincome.pricingengine.domain.model.Compounding;
import com.fixedincome.pricingengine.domain.model.DayCountConvention;
import com.fixedincome.pricingengine.domain.model.OptionType;
import com.fixedincome.pricingengine.domain.model.ZeroQuote;
import com.fixedincome.pricingengine.domain.service.BondAnalyticsService;
import com.fixedincome.pricingengine.domain.service.OptionPricingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "pricing", name = "demo-enabled", havingValue = "true")
public class PricingDemoRunner implements CommandLineRunner {

    private final BondAnalyticsService bondAnalyticsService;
    private final OptionPricingService optionPricingService;

    @Override
    public void run(String... args) {
        DiscountCurve flat = DiscountCurve.flat(0.05, Compounding.SEMI, DayCountConvention.ACT_365F);
        DiscountCurve boot = DiscountCurve.bootstrapped(List.of(
                new ZeroQuote(0.5, 0.9753),
                new ZeroQuote(1.0, 0.9512),
                new ZeroQuote(2.0, 0.9048),
                new ZeroQuote(5.0, 0.7788),
                new ZeroQuote(10.0, 0.6065)));

        Bond bond = new Bond(100.0, 0.06, 2, 5.0);
        log.info("[Demo] 5y 6% semi-annual bond on flat 5% curve");
        bondAnalyticsService.analyze(bond, flat);
        log.info("[Demo] same bond on bootstrapped curve");
        bondAnalyticsService.analyze(bond, boot);

        for (OptionType type : OptionType.values()) {
            EuropeanBondOption option = optionPricingService.bondOption(type, 1.25, 1.0);
            optionPricingService.price(option, flat, 0.20);
        }
    }
}
