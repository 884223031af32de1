package com.fixedincome.pricingengine.domain.model;

import com.fixedincome.pricingengine.domain.exception.InvalidInputException;

public record ZeroQuote(double time, double discountFactor) {

    public ZeroQuote {
        if (!Double.isFinite(time) || time <= 0.0) {
            throw new InvalidInputException("quote time must be positive and finite: " + time);
        }
        if (!Double.isFinite(discountFactor) || discountFactor <= 0.0) {
            throw new InvalidInputException("quote discount factor must be positive and finite: " + discountFactor);
        }
    }
}
