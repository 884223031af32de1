package com.fixedincome.pricingengine.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class McResult {

    private final double price;
    private final double standardError;
    private final double confidenceHalfWidth95;
    private final long effectivePathCount;

    public double lowerBound95() {
        return price - confidenceHalfWidth95;
    }

    public double upperBound95() {
        return price + confidenceHalfWidth95;
    }
}
