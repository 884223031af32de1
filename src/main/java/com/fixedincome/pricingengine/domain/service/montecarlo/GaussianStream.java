package com.fixedincome.pricingengine.domain.service.montecarlo;

import java.util.SplittableRandom;

/**
 * Seeded stream of standard normal draws. Sub-streams are carved off in a fixed order,
 * so each batch of a simulation sees the same draws no matter which thread runs it.
 */
public final class GaussianStream {

    private final SplittableRandom rng;

    private GaussianStream(SplittableRandom rng) {
        this.rng = rng;
    }

    public static GaussianStream seeded(long seed) {
        return new GaussianStream(new SplittableRandom(seed));
    }

    public static GaussianStream[] partition(long seed, int count) {
        SplittableRandom root = new SplittableRandom(seed);
        GaussianStream[] streams = new GaussianStream[count];
        for (int i = 0; i < count; i++) {
            streams[i] = new GaussianStream(root.split());
        }
        return streams;
    }

    public double next() {
        return rng.nextGaussian();
    }

    public double[] next(int count) {
        double[] draws = new double[count];
        for (int i = 0; i < count; i++) {
            draws[i] = rng.nextGaussian();
        }
        return draws;
    }
}
