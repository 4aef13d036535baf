package com.portfolioanalysis.optimizer.domain.exception;

/**
 * Thrown when caller-supplied weights cannot be normalized into a long-only allocation.
 */
public class InvalidWeightsException extends PortfolioEngineException {

    public InvalidWeightsException(String message) {
        super("INVALID_WEIGHTS", message);
    }
}
