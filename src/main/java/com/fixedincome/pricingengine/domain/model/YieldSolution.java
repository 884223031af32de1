package com.fixedincome.pricingengine.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a yield inversion. {@code converged} is false when Newton stopped on a
 * near-zero derivative or ran out of iterations; {@code yield} is then the last iterate.
 */
@Getter
@Builder
@ToString
public class YieldSolution {

    private final double yield;
    private final boolean converged;
    private final int newtonIterations;
    private final double residual;
}
