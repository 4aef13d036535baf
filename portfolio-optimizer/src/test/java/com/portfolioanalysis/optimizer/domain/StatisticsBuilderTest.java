package com.portfolioanalysis.optimizer.domain;

import com.portfolioanalysis.optimizer.domain.exception.InsufficientDataException;
import com.portfolioanalysis.optimizer.domain.exception.InvalidWeightsException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StatisticsBuilder and StatisticsBundle.
 */
class StatisticsBuilderTest {

    private final StatisticsBuilder builder = new StatisticsBuilder();

    @Test
    void testBuild_CovarianceSymmetricWithNonNegativeDiagonal() {
        PriceTable table = PriceTableFixtures.randomWalk(List.of("A", "B", "C"), 300, 7L);

        StatisticsBundle statistics = builder.build(table);

        assertEquals(3, statistics.size());
        for (int i = 0; i < 3; i++) {
            assertTrue(statistics.covariance(i, i) >= 0, "Variance must be non-negative");
            for (int j = 0; j < 3; j++) {
                assertEquals(statistics.covariance(i, j), statistics.covariance(j, i), 1e-15);
            }
        }
    }

    @Test
    void testBuild_ConstantGrowthMeanReturn() {
        double[][] prices = new double[10][1];
        prices[0][0] = 100.0;
        for (int row = 1; row < prices.length; row++) {
            prices[row][0] = prices[row - 1][0] * 1.01;
        }
        PriceTable table = new PriceTable(PriceTableFixtures.dates(10), List.of("A"), prices);

        StatisticsBundle statistics = builder.build(table);

        assertEquals(0.01 * 252, statistics.meanReturn(0), 1e-9);
        assertEquals(0.0, statistics.covariance(0, 0), 1e-12);
    }

    @Test
    void testBuild_SampleCovarianceIsUnbiased() {
        // Returns +10%, -10%, +10%: mean 1/30, unbiased variance 0.01333...
        double[][] prices = {{100.0}, {110.0}, {99.0}, {108.9}};
        PriceTable table = new PriceTable(PriceTableFixtures.dates(4), List.of("A"), prices);

        StatisticsBundle statistics = builder.build(table);

        double mean = 0.1 / 3;
        double variance = (2 * Math.pow(0.1 - mean, 2) + Math.pow(-0.1 - mean, 2)) / 2;
        assertEquals(mean * 252, statistics.meanReturn(0), 1e-9);
        assertEquals(variance * 252, statistics.covariance(0, 0), 1e-9);
    }

    @Test
    void testBuild_TooFewRows() {
        PriceTable table = new PriceTable(PriceTableFixtures.dates(2), List.of("A"),
                new double[][]{{100.0}, {101.0}});

        assertThrows(InsufficientDataException.class, () -> builder.build(table));
    }

    @Test
    void testBuild_NoColumns() {
        PriceTable table = new PriceTable(List.of(), List.of(), new double[0][]);

        assertThrows(InsufficientDataException.class, () -> builder.build(table));
    }

    @Test
    void testPeriodicReturns_DropsRowAfterZeroPrice() {
        double[][] prices = {{100.0}, {0.0}, {50.0}, {55.0}};
        PriceTable table = new PriceTable(PriceTableFixtures.dates(4), List.of("A"), prices);

        double[][] returns = builder.periodicReturns(table);

        assertEquals(2, returns.length);
        assertEquals(-1.0, returns[0][0], 1e-12);
        assertEquals(0.1, returns[1][0], 1e-12);
    }

    @Test
    void testPortfolioRisk_MatchesQuadraticForm() {
        PriceTable table = PriceTableFixtures.randomWalk(List.of("A", "B"), 260, 11L);
        StatisticsBundle statistics = builder.build(table);
        Weights weights = new Weights(new double[]{0.3, 0.7});

        double variance = 0.0;
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                variance += weights.get(i) * statistics.covariance(i, j) * weights.get(j);
            }
        }

        assertEquals(Math.sqrt(variance), statistics.portfolioRisk(weights), 1e-12);
        assertEquals(0.3 * statistics.meanReturn(0) + 0.7 * statistics.meanReturn(1),
                statistics.portfolioReturn(weights), 1e-12);
    }

    @Test
    void testPortfolioReturn_DimensionMismatch() {
        StatisticsBundle statistics = builder.build(PriceTableFixtures.randomWalk(List.of("A", "B"), 50, 3L));

        assertThrows(InvalidWeightsException.class,
                () -> statistics.portfolioReturn(new Weights(new double[]{1.0})));
    }
}
