package com.portfolioanalysis.optimizer.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Monte Carlo frontier sampling.
 */
class EfficientFrontierSamplerTest {

    private StatisticsBundle statistics;

    @BeforeEach
    void setUp() {
        PriceTable table = PriceTableFixtures.randomWalk(List.of("A", "B", "C", "D"), 300, 42L);
        statistics = new StatisticsBuilder().build(table);
    }

    @Test
    void testSample_WeightsAreLongOnlyAndFullyInvested() {
        FrontierPopulation population = new EfficientFrontierSampler().sample(statistics, 1000, 0.03, 1L);

        assertEquals(1000, population.size());
        for (PortfolioPoint point : population.getPoints()) {
            double sum = 0.0;
            for (double weight : point.getWeights().getValues()) {
                assertTrue(weight >= 0, "Weights must be non-negative");
                sum += weight;
            }
            assertEquals(1.0, sum, 1e-9);
        }
    }

    @Test
    void testSample_PointsUseAnnualizedMeanReturn() {
        FrontierPopulation population = new EfficientFrontierSampler().sample(statistics, 50, 0.02, 5L);

        for (PortfolioPoint point : population.getPoints()) {
            assertEquals(statistics.portfolioReturn(point.getWeights()), point.getExpectedReturn(), 1e-12);
            assertEquals(statistics.portfolioRisk(point.getWeights()), point.getRisk(), 1e-12);
            assertEquals((point.getExpectedReturn() - 0.02) / point.getRisk(), point.getSharpeRatio(), 1e-12);
        }
    }

    @Test
    void testSample_SameSeedSamePopulation() {
        EfficientFrontierSampler sampler = new EfficientFrontierSampler();

        FrontierPopulation first = sampler.sample(statistics, 2000, 0.03, 99L);
        FrontierPopulation second = sampler.sample(statistics, 2000, 0.03, 99L);

        assertEquals(first, second);
    }

    @Test
    void testSample_DifferentSeedDifferentPopulation() {
        EfficientFrontierSampler sampler = new EfficientFrontierSampler();

        FrontierPopulation first = sampler.sample(statistics, 100, 0.03, 1L);
        FrontierPopulation second = sampler.sample(statistics, 100, 0.03, 2L);

        assertNotEquals(first, second);
    }

    @Test
    void testSample_ZeroPortfolios() {
        FrontierPopulation population = new EfficientFrontierSampler().sample(statistics, 0);

        assertTrue(population.isEmpty());
    }

    @Test
    void testSample_NegativePortfolios() {
        EfficientFrontierSampler sampler = new EfficientFrontierSampler();

        assertThrows(IllegalArgumentException.class, () -> sampler.sample(statistics, -1));
    }

    @Test
    void testSample_DirichletMode() {
        EfficientFrontierSampler sampler = new EfficientFrontierSampler()
                .withSamplingMode(WeightSamplingMode.DIRICHLET);

        FrontierPopulation population = sampler.sample(statistics, 500, 0.03, 3L);

        assertEquals(WeightSamplingMode.DIRICHLET, sampler.getSamplingMode());
        assertEquals(500, population.size());
        population.getPoints().forEach(point ->
                assertEquals(1.0, java.util.Arrays.stream(point.getWeights().getValues()).sum(), 1e-9));
    }

    @Test
    void testWithSamplingMode_SameModeReturnsSameSampler() {
        EfficientFrontierSampler sampler = new EfficientFrontierSampler();

        assertSame(sampler, sampler.withSamplingMode(WeightSamplingMode.UNIFORM_NORMALIZED));
        assertSame(sampler, sampler.withSamplingMode(null));
    }

    @Test
    void testSample_SingleAssetAlwaysFullWeight() {
        PriceTable table = PriceTableFixtures.randomWalk(List.of("A"), 100, 8L);
        StatisticsBundle single = new StatisticsBuilder().build(table);

        FrontierPopulation population = new EfficientFrontierSampler().sample(single, 10, 0.03, 4L);

        population.getPoints().forEach(point -> assertEquals(1.0, point.getWeights().get(0), 1e-12));
    }

    @Test
    void testConstructor_NonPositiveChunkSize() {
        assertThrows(IllegalArgumentException.class,
                () -> new EfficientFrontierSampler(WeightSamplingMode.UNIFORM_NORMALIZED, null, 0, 1));
    }
}
