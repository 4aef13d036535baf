package com.portfolioanalysis.optimizer.domain;

import com.portfolioanalysis.optimizer.domain.exception.DegenerateRiskException;
import com.portfolioanalysis.optimizer.domain.exception.InsufficientDataException;
import com.portfolioanalysis.optimizer.domain.exception.InvalidWeightsException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CAGR-based portfolio metrics.
 */
class PortfolioMetricsCalculatorTest {

    private final PortfolioMetricsCalculator calculator = new PortfolioMetricsCalculator();

    /**
     * Asset A rises linearly from 100 to 200 over 252 rows, asset B oscillates around 50.
     */
    private static PriceTable linearDoublingTable() {
        int rows = 252;
        double[][] prices = new double[rows][2];
        for (int row = 0; row < rows; row++) {
            prices[row][0] = 100.0 + 100.0 * row / (rows - 1);
            prices[row][1] = row % 2 == 0 ? 50.0 : 51.0;
        }
        return new PriceTable(PriceTableFixtures.dates(rows), List.of("A", "B"), prices);
    }

    @Test
    void testMetrics_LinearDoublingOverOneYear() {
        PortfolioPoint point = calculator.metrics(linearDoublingTable(), new double[]{1.0, 0.0});

        assertEquals(1.0, point.getExpectedReturn(), 1e-9);
        assertTrue(point.getRisk() > 0);
        assertEquals((point.getExpectedReturn() - 0.03) / point.getRisk(), point.getSharpeRatio(), 1e-12);
    }

    @Test
    void testMetrics_RenormalizesWeights() {
        PriceTable table = linearDoublingTable();

        PortfolioPoint raw = calculator.metrics(table, new double[]{2.0, 2.0}, 0.0);
        PortfolioPoint normalized = calculator.metrics(table, new double[]{0.5, 0.5}, 0.0);

        assertEquals(normalized.getExpectedReturn(), raw.getExpectedReturn(), 1e-12);
        assertEquals(normalized.getRisk(), raw.getRisk(), 1e-12);
        assertEquals(0.5, raw.getWeights().get(0), 1e-12);
    }

    @Test
    void testMetrics_WrongWeightCount() {
        assertThrows(InvalidWeightsException.class,
                () -> calculator.metrics(linearDoublingTable(), new double[]{1.0}));
    }

    @Test
    void testMetrics_ZeroWeights() {
        assertThrows(InvalidWeightsException.class,
                () -> calculator.metrics(linearDoublingTable(), new double[]{0.0, 0.0}));
    }

    @Test
    void testMetrics_FlatPricesHaveDegenerateRisk() {
        double[][] prices = new double[20][2];
        for (double[] row : prices) {
            row[0] = 10.0;
            row[1] = 20.0;
        }
        PriceTable table = new PriceTable(PriceTableFixtures.dates(20), List.of("A", "B"), prices);

        assertThrows(DegenerateRiskException.class, () -> calculator.metrics(table, new double[]{1.0, 1.0}));
    }

    @Test
    void testMetrics_AllocationMapIgnoresUnknownSymbols() {
        PriceTable table = linearDoublingTable();

        PortfolioPoint fromMap = calculator.metrics(table, Map.of("A", 3.0, "ZZZ", 7.0), 0.03);
        PortfolioPoint fromArray = calculator.metrics(table, new double[]{1.0, 0.0}, 0.03);

        assertEquals(fromArray.getExpectedReturn(), fromMap.getExpectedReturn(), 1e-12);
        assertEquals(fromArray.getRisk(), fromMap.getRisk(), 1e-12);
    }

    @Test
    void testAssetCagrs_ZeroInitialPrice() {
        double[][] prices = {{0.0}, {1.0}, {2.0}};
        PriceTable table = new PriceTable(PriceTableFixtures.dates(3), List.of("A"), prices);

        assertThrows(InsufficientDataException.class, () -> calculator.assetCagrs(table));
    }

    @Test
    void testAssetCagrs_SingleRow() {
        PriceTable table = new PriceTable(PriceTableFixtures.dates(1), List.of("A"), new double[][]{{1.0}});

        assertThrows(InsufficientDataException.class, () -> calculator.assetCagrs(table));
    }

    @Test
    void testAssetCagrs_HalfYearUsesFractionalYears() {
        int rows = 126;
        double[][] prices = new double[rows][1];
        for (int row = 0; row < rows; row++) {
            prices[row][0] = row == rows - 1 ? 121.0 : 100.0 + row * 0.1;
        }
        PriceTable table = new PriceTable(PriceTableFixtures.dates(rows), List.of("A"), prices);

        double[] cagrs = calculator.assetCagrs(table);

        // 21% over half a year compounds to 1.21^2 - 1
        assertEquals(Math.pow(1.21, 2.0) - 1.0, cagrs[0], 1e-9);
    }
}
