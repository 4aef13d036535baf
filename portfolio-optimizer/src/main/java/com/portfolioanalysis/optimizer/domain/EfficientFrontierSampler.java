package com.portfolioanalysis.optimizer.domain;

import com.portfolioanalysis.optimizer.domain.exception.PortfolioEngineException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Monte Carlo approximation of the efficient frontier.
 *
 * <p>Each draw produces a random weight vector, its expected return (annualized mean periodic
 * return), its risk and its Sharpe ratio. No drawn portfolio is guaranteed to be Pareto-optimal;
 * the frontier is approximated by sampling density only.
 *
 * <p>Draws are grouped into fixed-size chunks. The generator of each chunk is seeded from a master
 * generator in chunk order and every draw is written to a pre-allocated slot, so a given seed
 * produces the same population whether the chunks run on the calling thread or on the executor.
 */
@Slf4j
public class EfficientFrontierSampler {

    public static final int DEFAULT_CHUNK_SIZE = 5000;

    private final WeightSamplingMode samplingMode;
    private final ExecutorService executor;
    private final int chunkSize;
    private final int parallelThreshold;

    /**
     * Sequential sampler with uniform-normalized weights.
     */
    public EfficientFrontierSampler() {
        this(WeightSamplingMode.UNIFORM_NORMALIZED, null, DEFAULT_CHUNK_SIZE, Integer.MAX_VALUE);
    }

    /**
     * @param executor          executor for chunk-parallel runs, or null to always run on the caller
     * @param parallelThreshold smallest sample count that is dispatched to the executor
     */
    public EfficientFrontierSampler(WeightSamplingMode samplingMode, ExecutorService executor,
                                    int chunkSize, int parallelThreshold) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        this.samplingMode = samplingMode;
        this.executor = executor;
        this.chunkSize = chunkSize;
        this.parallelThreshold = parallelThreshold;
    }

    /**
     * A sampler sharing this one's executor and chunking but drawing weights with another mode.
     */
    public EfficientFrontierSampler withSamplingMode(WeightSamplingMode mode) {
        if (mode == null || mode == samplingMode) {
            return this;
        }
        return new EfficientFrontierSampler(mode, executor, chunkSize, parallelThreshold);
    }

    public FrontierPopulation sample(StatisticsBundle statistics, int numPortfolios) {
        return sample(statistics, numPortfolios, PortfolioMetricsCalculator.DEFAULT_RISK_FREE_RATE);
    }

    public FrontierPopulation sample(StatisticsBundle statistics, int numPortfolios, double riskFreeRate) {
        return sample(statistics, numPortfolios, riskFreeRate, ThreadLocalRandom.current().nextLong());
    }

    /**
     * Draw {@code numPortfolios} portfolios. The same seed always yields the same population.
     *
     * @throws IllegalArgumentException if numPortfolios is negative
     * @throws com.portfolioanalysis.optimizer.domain.exception.DegenerateRiskException
     *         if a drawn portfolio has zero variance
     */
    public FrontierPopulation sample(StatisticsBundle statistics, int numPortfolios, double riskFreeRate,
                                     long seed) {
        if (numPortfolios < 0) {
            throw new IllegalArgumentException("Number of portfolios must not be negative: " + numPortfolios);
        }
        if (numPortfolios == 0) {
            return FrontierPopulation.empty();
        }

        int chunks = (numPortfolios + chunkSize - 1) / chunkSize;
        RandomGenerator master = new Well19937c(seed);
        long[] chunkSeeds = new long[chunks];
        for (int chunk = 0; chunk < chunks; chunk++) {
            chunkSeeds[chunk] = master.nextLong();
        }

        PortfolioPoint[] slots = new PortfolioPoint[numPortfolios];
        boolean parallel = executor != null && chunks > 1 && numPortfolios >= parallelThreshold;

        log.info("Sampling {} portfolios over {} assets in {} chunk(s), mode={}, parallel={}",
                numPortfolios, statistics.size(), chunks, samplingMode, parallel);

        if (parallel) {
            runParallel(statistics, riskFreeRate, chunkSeeds, slots);
        } else {
            for (int chunk = 0; chunk < chunks; chunk++) {
                fillChunk(statistics, riskFreeRate, chunk, chunkSeeds[chunk], slots);
            }
        }

        return FrontierPopulation.ofSlots(slots);
    }

    private void runParallel(StatisticsBundle statistics, double riskFreeRate, long[] chunkSeeds,
                             PortfolioPoint[] slots) {
        List<Future<?>> futures = new ArrayList<>(chunkSeeds.length);
        for (int chunk = 0; chunk < chunkSeeds.length; chunk++) {
            final int index = chunk;
            futures.add(executor.submit(
                    () -> fillChunk(statistics, riskFreeRate, index, chunkSeeds[index], slots)));
        }

        try {
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while sampling portfolios", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof PortfolioEngineException engineException) {
                throw engineException;
            }
            throw new IllegalStateException("Portfolio sampling failed", e.getCause());
        }
    }

    private void fillChunk(StatisticsBundle statistics, double riskFreeRate, int chunk, long chunkSeed,
                           PortfolioPoint[] slots) {
        RandomGenerator random = new Well19937c(chunkSeed);
        int from = chunk * chunkSize;
        int to = Math.min(slots.length, from + chunkSize);

        for (int i = from; i < to; i++) {
            Weights weights = samplingMode.sample(random, statistics.size());
            slots[i] = PortfolioPoint.evaluate(weights,
                    statistics.portfolioReturn(weights),
                    statistics.portfolioRisk(weights),
                    riskFreeRate);
        }

        log.debug("Filled sample slots [{}, {})", from, to);
    }

    public WeightSamplingMode getSamplingMode() {
        return samplingMode;
    }
}
