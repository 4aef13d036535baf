package com.portfolioanalysis.optimizer.config;

import com.portfolioanalysis.optimizer.domain.EfficientFrontierSampler;
import com.portfolioanalysis.optimizer.domain.OptimalPortfolioSelector;
import com.portfolioanalysis.optimizer.domain.PortfolioMetricsCalculator;
import com.portfolioanalysis.optimizer.domain.SelectionResolver;
import com.portfolioanalysis.optimizer.domain.StatisticsBuilder;
import com.portfolioanalysis.optimizer.domain.WeightSamplingMode;
import com.portfolioanalysis.optimizer.infrastructure.FilePriceTableCache;
import com.portfolioanalysis.optimizer.infrastructure.PriceTableCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;

/**
 * Wires the stateless engine components as shared singletons.
 */
@Configuration
@Slf4j
public class EngineConfig {

    @Bean
    public StatisticsBuilder statisticsBuilder() {
        return new StatisticsBuilder();
    }

    @Bean
    public PortfolioMetricsCalculator portfolioMetricsCalculator(StatisticsBuilder statisticsBuilder) {
        return new PortfolioMetricsCalculator(statisticsBuilder);
    }

    @Bean
    public EfficientFrontierSampler efficientFrontierSampler(
            @Qualifier("samplerExecutorService") ExecutorService samplerExecutorService,
            @Value("${portfolio.frontier.sampling-mode:UNIFORM_NORMALIZED}") WeightSamplingMode samplingMode,
            @Value("${portfolio.frontier.chunk-size:5000}") int chunkSize,
            @Value("${portfolio.frontier.parallel-threshold:20000}") int parallelThreshold) {
        log.info("Frontier sampler: mode={}, chunkSize={}, parallelThreshold={}",
                samplingMode, chunkSize, parallelThreshold);
        return new EfficientFrontierSampler(samplingMode, samplerExecutorService, chunkSize, parallelThreshold);
    }

    @Bean
    public OptimalPortfolioSelector optimalPortfolioSelector() {
        return new OptimalPortfolioSelector();
    }

    @Bean
    public SelectionResolver selectionResolver() {
        return new SelectionResolver();
    }

    @Bean
    @ConditionalOnProperty(name = "portfolio.cache.enabled", havingValue = "true", matchIfMissing = true)
    public PriceTableCache priceTableCache(@Value("${portfolio.cache.directory:data/cache}") String directory) {
        log.info("Price table cache directory: {}", directory);
        return new FilePriceTableCache(Path.of(directory));
    }
}
