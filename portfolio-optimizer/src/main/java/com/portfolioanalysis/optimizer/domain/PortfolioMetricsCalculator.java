package com.portfolioanalysis.optimizer.domain;

import com.portfolioanalysis.optimizer.domain.exception.InsufficientDataException;
import com.portfolioanalysis.optimizer.domain.exception.InvalidWeightsException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Metrics for one caller-supplied allocation.
 *
 * <p>Expected return here is CAGR-based: each asset grows at (last / first)^(1 / years) - 1 with
 * years = rows / 252, and the portfolio return is the weighted sum of those rates. This differs on
 * purpose from {@link StatisticsBundle#portfolioReturn(Weights)}, which annualizes the mean
 * periodic return. Risk uses the same annualized covariance in both places.
 */
@Slf4j
@RequiredArgsConstructor
public class PortfolioMetricsCalculator {

    public static final double DEFAULT_RISK_FREE_RATE = 0.03;

    private final StatisticsBuilder statisticsBuilder;

    public PortfolioMetricsCalculator() {
        this(new StatisticsBuilder());
    }

    public PortfolioPoint metrics(PriceTable priceTable, double[] weights) {
        return metrics(priceTable, weights, DEFAULT_RISK_FREE_RATE);
    }

    /**
     * Calculate CAGR return, annualized risk and Sharpe ratio for the given raw weights.
     * Weights are re-normalized by their sum.
     *
     * @throws InvalidWeightsException    if the weight count differs from the column count,
     *                                    or the weights cannot be normalized
     * @throws InsufficientDataException  if the table is too short or an initial price is zero
     * @throws com.portfolioanalysis.optimizer.domain.exception.DegenerateRiskException
     *                                    if the portfolio has zero variance
     */
    public PortfolioPoint metrics(PriceTable priceTable, double[] weights, double riskFreeRate) {
        if (weights == null || weights.length != priceTable.columnCount()) {
            throw new InvalidWeightsException(String.format("Expected %d weights but got %d",
                    priceTable.columnCount(), weights == null ? 0 : weights.length));
        }

        Weights normalized = Weights.normalize(weights);
        StatisticsBundle statistics = statisticsBuilder.build(priceTable);

        double[] cagrs = assetCagrs(priceTable);
        double portfolioReturn = 0.0;
        for (int i = 0; i < cagrs.length; i++) {
            portfolioReturn += normalized.get(i) * cagrs[i];
        }

        double risk = statistics.portfolioRisk(normalized);

        log.debug("Portfolio metrics - CAGR return: {}, risk: {}", portfolioReturn, risk);
        return PortfolioPoint.evaluate(normalized, portfolioReturn, risk, riskFreeRate);
    }

    /**
     * Calculate metrics for a symbol-keyed allocation against the table's actual columns.
     */
    public PortfolioPoint metrics(PriceTable priceTable, Map<String, Double> allocations, double riskFreeRate) {
        Weights weights = Weights.fromAllocations(allocations, priceTable.getAssets());
        return metrics(priceTable, weights.getValues(), riskFreeRate);
    }

    /**
     * Compound annual growth rate of every column over the whole table.
     */
    public double[] assetCagrs(PriceTable priceTable) {
        if (priceTable.rowCount() < 2) {
            throw new InsufficientDataException("Need at least 2 price rows to compute CAGR");
        }

        double years = (double) priceTable.rowCount() / StatisticsBuilder.TRADING_DAYS_PER_YEAR;
        double[] cagrs = new double[priceTable.columnCount()];

        for (int col = 0; col < cagrs.length; col++) {
            double initial = priceTable.firstPrice(col);
            if (!(initial > 0)) {
                throw new InsufficientDataException(
                        "Initial price of " + priceTable.getAssets().get(col) + " is not positive");
            }
            cagrs[col] = Math.pow(priceTable.lastPrice(col) / initial, 1.0 / years) - 1.0;
        }
        return cagrs;
    }
}
