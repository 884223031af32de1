package com.fixedincome.pricingengine.domain.service.montecarlo;

import com.fixedincome.pricingengine.domain.exception.InvalidInputException;
import com.fixedincome.pricingengine.domain.model.McResult;
import com.fixedincome.pricingengine.domain.model.OptionType;
import lombok.extern.slf4j.Slf4j;

import java.util.stream.IntStream;

/**
 * Monte Carlo pricer for European options on a lognormal forward (Black-76 measure).
 * Draws are processed in batches, each with its own random sub-stream; antithetic mode
 * reuses every draw as -Z and counts both paths.
 */
@Slf4j
public final class MonteCarloEngine {

    static final double Z_95 = 1.96;

    private MonteCarloEngine() {
    }

    public static double mcPrice(double forward, double strike, double sigma, double timeToExpiry,
                                 double discountFactor, OptionType type, int pathCount) {
        return mcPriceAdvanced(forward, strike, sigma, timeToExpiry, discountFactor, type, pathCount,
                MonteCarloConfig.defaults());
    }

    public static double mcPriceAdvanced(double forward, double strike, double sigma, double timeToExpiry,
                                         double discountFactor, OptionType type, int pathCount,
                                         MonteCarloConfig config) {
        if (timeToExpiry <= 0.0) {
            return discountFactor * payoff(forward, strike, type);
        }
        PayoffSums sums = simulate(forward, strike, sigma, timeToExpiry, type, pathCount, config);
        return discountFactor * (sums.sum / sums.count);
    }

    public static McResult mcPriceWithStats(double forward, double strike, double sigma, double timeToExpiry,
                                            double discountFactor, OptionType type, int pathCount) {
        return mcPriceWithStats(forward, strike, sigma, timeToExpiry, discountFactor, type, pathCount,
                MonteCarloConfig.defaults());
    }

    public static McResult mcPriceWithStats(double forward, double strike, double sigma, double timeToExpiry,
                                            double discountFactor, OptionType type, int pathCount,
                                            MonteCarloConfig config) {
        if (timeToExpiry <= 0.0) {
            return McResult.builder()
                    .price(discountFactor * payoff(forward, strike, type))
                    .standardError(0.0)
                    .confidenceHalfWidth95(0.0)
                    .effectivePathCount(0)
                    .build();
        }

        PayoffSums sums = simulate(forward, strike, sigma, timeToExpiry, type, pathCount, config);
        double mean = sums.sum / sums.count;
        double variance = Math.max(sums.sumSquares / sums.count - mean * mean, 0.0);
        double standardError = discountFactor * Math.sqrt(variance / sums.count);

        return McResult.builder()
                .price(discountFactor * mean)
                .standardError(standardError)
                .confidenceHalfWidth95(Z_95 * standardError)
                .effectivePathCount(sums.count)
                .build();
    }

    public static double payoff(double terminalForward, double strike, OptionType type) {
        return type == OptionType.CALL
                ? Math.max(terminalForward - strike, 0.0)
                : Math.max(strike - terminalForward, 0.0);
    }

    private static PayoffSums simulate(double forward, double strike, double sigma, double timeToExpiry,
                                       OptionType type, int pathCount, MonteCarloConfig config) {
        if (config.getBatchSize() <= 0) {
            throw new InvalidInputException("batch size must be positive: " + config.getBatchSize());
        }

        long startNano = System.nanoTime();
        TerminalPriceGenerator generator = new TerminalPriceGenerator(forward, sigma, timeToExpiry);

        int batchSize = config.getBatchSize();
        int batchCount = pathCount <= 0 ? 0 : (int) ((pathCount + (long) batchSize - 1) / batchSize);
        GaussianStream[] streams = GaussianStream.partition(config.getSeed(), batchCount);

        PayoffSums[] batches = new PayoffSums[batchCount];
        IntStream indices = IntStream.range(0, batchCount);
        if (config.isParallel()) {
            indices = indices.parallel();
        }
        indices.forEach(b -> {
            int size = Math.min(batchSize, pathCount - b * batchSize);
            batches[b] = config.isVectorized() && size > 1
                    ? runVectorized(generator, streams[b], size, strike, type, config.isAntithetic())
                    : runScalar(generator, streams[b], size, strike, type, config.isAntithetic());
        });

        PayoffSums total = new PayoffSums();
        for (PayoffSums batch : batches) {
            total.merge(batch);
        }

        log.debug("[MC] simulated: F0={}, K={}, sigma={}, T={}, type={}, paths={}, batches={}, config={}, elapsed={}μs",
                forward, strike, sigma, timeToExpiry, type, total.count, batchCount, config,
                (System.nanoTime() - startNano) / 1_000);
        return total;
    }

    private static PayoffSums runVectorized(TerminalPriceGenerator generator, GaussianStream stream, int size,
                                            double strike, OptionType type, boolean antithetic) {
        PayoffSums sums = new PayoffSums();
        double[] draws = stream.next(size);
        double[] up = generator.terminal(draws);

        if (antithetic) {
            double[] down = generator.antithetic(draws);
            for (int i = 0; i < size; i++) {
                sums.add(payoff(up[i], strike, type));
                sums.add(payoff(down[i], strike, type));
            }
        } else {
            for (int i = 0; i < size; i++) {
                sums.add(payoff(up[i], strike, type));
            }
        }
        return sums;
    }

    private static PayoffSums runScalar(TerminalPriceGenerator generator, GaussianStream stream, int size,
                                        double strike, OptionType type, boolean antithetic) {
        PayoffSums sums = new PayoffSums();
        for (int i = 0; i < size; i++) {
            double z = stream.next();
            sums.add(payoff(generator.terminal(z), strike, type));
            if (antithetic) {
                sums.add(payoff(generator.terminal(-z), strike, type));
            }
        }
        return sums;
    }

    private static final class PayoffSums {
        private double sum;
        private double sumSquares;
        private long count;

        void add(double payoff) {
            sum += payoff;
            sumSquares += payoff * payoff;
            count++;
        }

        void merge(PayoffSums other) {
            sum += other.sum;
            sumSquares += other.sumSquares;
            count += other.count;
        }
    }
}
