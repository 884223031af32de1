package com.fixedincome.pricingengine.domain.pricing;

import com.fixedincome.pricingengine.domain.model.Compounding;

@FunctionalInterface
public interface PriceFunction {

    double price(double yield, Compounding compounding);
}
