package com.portfolioanalysis.optimizer.domain.exception;

/**
 * Thrown when a portfolio has zero variance, which leaves its Sharpe ratio undefined.
 */
public class DegenerateRiskException extends PortfolioEngineException {

    public DegenerateRiskException(double risk) {
        super("DEGENERATE_RISK",
                String.format("Portfolio risk %.3e is numerically zero; Sharpe ratio is undefined", risk));
    }
}
