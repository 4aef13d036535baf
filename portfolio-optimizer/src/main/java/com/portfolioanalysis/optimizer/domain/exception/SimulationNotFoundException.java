package com.portfolioanalysis.optimizer.domain.exception;

/**
 * Thrown when a simulation id is unknown or its session has expired.
 */
public class SimulationNotFoundException extends PortfolioEngineException {

    public SimulationNotFoundException(String simulationId) {
        super("SIMULATION_NOT_FOUND", "Simulation not found: " + simulationId);
    }
}
