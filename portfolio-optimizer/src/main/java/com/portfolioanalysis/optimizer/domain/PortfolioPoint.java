package com.portfolioanalysis.optimizer.domain;

import com.portfolioanalysis.optimizer.domain.exception.DegenerateRiskException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single evaluated portfolio: its weights, expected annual return,
 * annualized standard deviation and Sharpe ratio.
 */
@Value
@Builder
@Jacksonized
public class PortfolioPoint {

    /**
     * Risks at or below this value are treated as zero.
     */
    public static final double ZERO_RISK_EPSILON = 1e-12;

    Weights weights;
    double expectedReturn;
    double risk;
    double sharpeRatio;

    /**
     * Evaluate the Sharpe ratio and build the point.
     *
     * @throws DegenerateRiskException if the risk is numerically zero
     */
    public static PortfolioPoint evaluate(Weights weights, double expectedReturn, double risk,
                                          double riskFreeRate) {
        if (!(risk > ZERO_RISK_EPSILON)) {
            throw new DegenerateRiskException(risk);
        }

        return PortfolioPoint.builder()
                .weights(weights)
                .expectedReturn(expectedReturn)
                .risk(risk)
                .sharpeRatio((expectedReturn - riskFreeRate) / risk)
                .build();
    }
}
