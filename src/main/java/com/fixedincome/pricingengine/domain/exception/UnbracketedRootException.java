package com.fixedincome.pricingengine.domain.exception;

import lombok.Getter;

@Getter
public class UnbracketedRootException extends IllegalStateException {

    private final double lowerBound;
    private final double upperBound;
    private final double lowerError;
    private final double upperError;

    public UnbracketedRootException(double lowerBound, double upperBound,
                                    double lowerError, double upperError) {
        super(String.format("unable to bracket root in [%s, %s]: f(lo)=%.6e, f(hi)=%.6e",
                lowerBound, upperBound, lowerError, upperError));
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.lowerError = lowerError;
        this.upperError = upperError;
    }
}
