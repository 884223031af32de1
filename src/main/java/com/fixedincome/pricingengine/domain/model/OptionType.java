package com.fixedincome.pricingengine.domain.model;

public enum OptionType {
    CALL, PUT;

    public boolean isCall() {
        return this == CALL;
    }

    public static OptionType of(boolean isCall) {
        return isCall ? CALL : PUT;
    }
}
