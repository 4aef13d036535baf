package com.portfolioanalysis.optimizer.domain.exception;

/**
 * Thrown when a selection index does not address a point of the population.
 */
public class IndexOutOfRangeException extends PortfolioEngineException {

    public IndexOutOfRangeException(int index, int size) {
        super("INDEX_OUT_OF_RANGE",
                String.format("Portfolio index %d is outside [0, %d)", index, size));
    }
}
