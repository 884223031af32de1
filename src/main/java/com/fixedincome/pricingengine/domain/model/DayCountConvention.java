package com.fixedincome.pricingengine.domain.model;

public enum DayCountConvention {
    ACT_365F,
    THIRTY_360
}
