package com.portfolioanalysis.optimizer.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking optimization metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class OptimizationMetricsService {

    private final Counter simulationsCompletedCounter;
    private final Counter simulationsFailedCounter;
    private final Counter portfoliosSampledCounter;
    private final Counter cacheHitsCounter;
    private final Counter cacheMissesCounter;
    private final Timer samplingTimer;

    public OptimizationMetricsService(MeterRegistry meterRegistry) {
        this.simulationsCompletedCounter = Counter.builder("portfolio.simulations.completed")
                .description("Total number of simulations completed successfully")
                .register(meterRegistry);

        this.simulationsFailedCounter = Counter.builder("portfolio.simulations.failed")
                .description("Total number of simulations that failed")
                .register(meterRegistry);

        this.portfoliosSampledCounter = Counter.builder("portfolio.portfolios.sampled")
                .description("Total number of random portfolios sampled")
                .register(meterRegistry);

        this.cacheHitsCounter = Counter.builder("portfolio.cache.hits")
                .description("Price table cache lookups served from the cache")
                .register(meterRegistry);

        this.cacheMissesCounter = Counter.builder("portfolio.cache.misses")
                .description("Price table cache lookups that required a refetch")
                .register(meterRegistry);

        this.samplingTimer = Timer.builder("portfolio.sampling.time")
                .description("Efficient frontier sampling time")
                .register(meterRegistry);

        log.info("OptimizationMetricsService initialized with Micrometer metrics");
    }

    /**
     * Record a completed simulation with its sampling time and population size.
     */
    public void recordSimulationCompleted(long samplingTimeMs, int portfolios) {
        simulationsCompletedCounter.increment();
        portfoliosSampledCounter.increment(portfolios);
        samplingTimer.record(samplingTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordSimulationFailed() {
        simulationsFailedCounter.increment();
    }

    public void recordCacheHit() {
        cacheHitsCounter.increment();
    }

    public void recordCacheMiss() {
        cacheMissesCounter.increment();
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Completed=%d, Failed=%d, Sampled=%d, CacheHits=%d, CacheMisses=%d, AvgSampling=%.2fs",
                (long) simulationsCompletedCounter.count(),
                (long) simulationsFailedCounter.count(),
                (long) portfoliosSampledCounter.count(),
                (long) cacheHitsCounter.count(),
                (long) cacheMissesCounter.count(),
                samplingTimer.mean(TimeUnit.SECONDS));
    }
}
