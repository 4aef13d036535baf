package com.portfolioanalysis.optimizer.domain;

import com.portfolioanalysis.optimizer.domain.exception.EmptyPopulationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OptimalPortfolioSelector.
 */
class OptimalPortfolioSelectorTest {

    private final OptimalPortfolioSelector selector = new OptimalPortfolioSelector();

    private static PortfolioPoint point(double risk, double sharpe) {
        return PortfolioPoint.builder()
                .weights(new Weights(new double[]{1.0}))
                .expectedReturn(sharpe * risk)
                .risk(risk)
                .sharpeRatio(sharpe)
                .build();
    }

    private static FrontierPopulation population(PortfolioPoint... points) {
        return new FrontierPopulation(List.of(points));
    }

    @Test
    void testMaxSharpe_PicksHighest() {
        FrontierPopulation population = population(point(0.2, 0.5), point(0.3, 1.5), point(0.1, 1.0));

        assertEquals(1, selector.maxSharpeIndex(population));
        assertSame(population.get(1), selector.maxSharpe(population));
    }

    @Test
    void testMaxSharpe_TieGoesToLowerIndex() {
        FrontierPopulation population = population(point(0.2, 0.5), point(0.3, 1.5), point(0.1, 1.5));

        assertEquals(1, selector.maxSharpeIndex(population));
    }

    @Test
    void testMinRisk_IsTrueMinimum() {
        FrontierPopulation population = population(point(0.25, 0.5), point(0.15, 0.2), point(0.35, 1.0));

        PortfolioPoint minRisk = selector.minRisk(population);

        for (PortfolioPoint candidate : population.getPoints()) {
            assertTrue(minRisk.getRisk() <= candidate.getRisk());
        }
        assertEquals(1, selector.minRiskIndex(population));
    }

    @Test
    void testMinRisk_TieGoesToLowerIndex() {
        FrontierPopulation population = population(point(0.3, 0.5), point(0.1, 0.2), point(0.1, 1.0));

        assertEquals(1, selector.minRiskIndex(population));
    }

    @Test
    void testNearMinRiskEdge_DefaultThreshold() {
        FrontierPopulation population = population(
                point(0.1000, 0.1), point(0.1005, 0.2), point(0.1008, 0.3), point(0.1020, 0.4));

        List<Integer> indices = selector.nearMinRiskEdgeIndices(population, OptimalPortfolioSelector.DEFAULT_EDGE_THRESHOLD);

        assertEquals(List.of(0, 1, 2), indices);
        assertEquals(3, selector.nearMinRiskEdge(population).size());
    }

    @Test
    void testNearMinRiskEdge_ZeroThresholdReturnsOnlyMinimum() {
        FrontierPopulation population = population(point(0.2, 0.1), point(0.1, 0.2), point(0.3, 0.3), point(0.1, 0.4));

        List<Integer> indices = selector.nearMinRiskEdgeIndices(population, 0.0);

        assertEquals(List.of(1, 3), indices);
    }

    @Test
    void testNearMinRiskEdge_KeepsGenerationOrder() {
        FrontierPopulation population = population(point(0.1004, 0.1), point(0.1, 0.2), point(0.1002, 0.3));

        List<PortfolioPoint> edge = selector.nearMinRiskEdge(population, 0.001);

        assertEquals(List.of(population.get(0), population.get(1), population.get(2)), edge);
    }

    @Test
    void testNearMinRiskEdge_NegativeThreshold() {
        FrontierPopulation population = population(point(0.1, 0.1));

        assertThrows(IllegalArgumentException.class, () -> selector.nearMinRiskEdge(population, -0.01));
    }

    @Test
    void testSelectors_EmptyPopulation() {
        FrontierPopulation empty = FrontierPopulation.empty();

        assertThrows(EmptyPopulationException.class, () -> selector.maxSharpe(empty));
        assertThrows(EmptyPopulationException.class, () -> selector.minRisk(empty));
        assertThrows(EmptyPopulationException.class, () -> selector.nearMinRiskEdge(empty));
    }

    @Test
    void testSelectors_Idempotent() {
        List<PortfolioPoint> points = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            points.add(point(0.1 + (i * 37 % 50) / 100.0, (i * 13 % 50) / 10.0));
        }
        FrontierPopulation population = new FrontierPopulation(points);

        assertEquals(selector.maxSharpeIndex(population), selector.maxSharpeIndex(population));
        assertEquals(selector.minRiskIndex(population), selector.minRiskIndex(population));
        assertEquals(selector.nearMinRiskEdgeIndices(population, 0.05),
                selector.nearMinRiskEdgeIndices(population, 0.05));
    }

    @Test
    void testSelectors_OnSampledPopulation() {
        // Arrange
        StatisticsBundle statistics = new StatisticsBuilder()
                .build(PriceTableFixtures.randomWalk(List.of("AAPL", "MSFT", "GOOG", "GLD"), 300, 21L));
        FrontierPopulation population = new EfficientFrontierSampler().sample(statistics, 2000, 0.03, 99L);

        // Act
        PortfolioPoint minRisk = selector.minRisk(population);
        PortfolioPoint maxSharpe = selector.maxSharpe(population);
        List<PortfolioPoint> edge = selector.nearMinRiskEdge(population, 0.0);

        // Assert
        for (PortfolioPoint point : population.getPoints()) {
            assertTrue(minRisk.getRisk() <= point.getRisk());
            assertTrue(maxSharpe.getSharpeRatio() >= point.getSharpeRatio());
        }
        assertFalse(edge.isEmpty());
        assertTrue(edge.stream().allMatch(p -> p.getRisk() == minRisk.getRisk()));
        assertSame(minRisk, selector.minRisk(population));
    }

    @Test
    void testSelectors_OnZeroSampleRun() {
        // Arrange
        StatisticsBundle statistics = new StatisticsBuilder()
                .build(PriceTableFixtures.randomWalk(List.of("AAPL", "MSFT"), 50, 22L));
        FrontierPopulation population = new EfficientFrontierSampler().sample(statistics, 0, 0.03, 1L);

        // Act & Assert
        assertEquals(0, population.size());
        assertThrows(EmptyPopulationException.class, () -> selector.maxSharpe(population));
        assertThrows(EmptyPopulationException.class, () -> selector.minRisk(population));
        assertThrows(EmptyPopulationException.class, () -> selector.nearMinRiskEdge(population, 0.001));
    }
}
