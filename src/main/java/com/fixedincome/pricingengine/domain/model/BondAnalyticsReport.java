package com.fixedincome.pricingengine.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class BondAnalyticsReport {

    private double price;
    private double yield;
    private Compounding compounding;
    private double modifiedDuration;
    private double dv01;
    private double convexity;
    private int cashFlowCount;
}
