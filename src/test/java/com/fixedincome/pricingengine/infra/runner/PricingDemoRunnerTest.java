package com.fixedincome.pricingengine.infra.runner;

import com.fixedincome.pricingengine.domain.curve.DiscountCurve;
import com.fixedincome.pricingengine.domain.instrument.Bond;
import com.fixedincome.pricingengine.domain.instrument.EuropeanBondOption;
import com.fixedincome.pricingengine.domain.model.OptionType;
import com.fixedincome.pricingengine.domain.service.BondAnalyticsService;
import com.fixedincome.pricingengine.domain.service.OptionPricingService;
import org.junit.jupiter.api.Test;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PricingDemoRunnerTest {

    @Test
    void analysesBondOnBothCurvesAndPricesCallAndPut() {
        BondAnalyticsService bondService = mock(BondAnalyticsService.class);
        OptionPricingService optionService = mock(OptionPricingService.class);
        when(optionService.bondOption(any(OptionType.class), anyDouble(), anyDouble()))
                .thenAnswer(inv -> new EuropeanBondOption(
                        inv.getArgument(0, OptionType.class),
                        inv.getArgument(1, Double.class),
                        inv.getArgument(2, Double.class)));

        new PricingDemoRunner(bondService, optionService).run();

        verify(bondService, times(2)).analyze(any(Bond.class), any(DiscountCurve.class));
        verify(optionService).bondOption(eq(OptionType.CALL), eq(1.25), eq(1.0));
        verify(optionService).bondOption(eq(OptionType.PUT), eq(1.25), eq(1.0));
        verify(optionService, times(2)).price(any(EuropeanBondOption.class), any(DiscountCurve.class), eq(0.20));
    }
}
