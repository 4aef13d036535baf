package com.portfolioanalysis.optimizer.domain.exception;

/**
 * Thrown when a selector is asked to pick from a population with no points.
 */
public class EmptyPopulationException extends PortfolioEngineException {

    public EmptyPopulationException(String operation) {
        super("EMPTY_POPULATION", "Cannot compute " + operation + " on an empty frontier population");
    }
}
