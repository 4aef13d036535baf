package com.portfolioanalysis.optimizer.domain.exception;

/**
 * Thrown when a price table is too short or too sparse to compute statistics.
 * Callers recover by fetching a longer window or dropping the asset.
 */
public class InsufficientDataException extends PortfolioEngineException {

    public InsufficientDataException(String message) {
        super("INSUFFICIENT_DATA", message);
    }
}
