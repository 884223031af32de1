package com.fixedincome.pricingengine.domain.model;

public record CashFlow(double time, double amount) {

    public CashFlow withAmount(double newAmount) {
        return new CashFlow(time, newAmount);
    }
}
