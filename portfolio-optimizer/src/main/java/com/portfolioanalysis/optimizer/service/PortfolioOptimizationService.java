package com.portfolioanalysis.optimizer.service;

import com.portfolioanalysis.optimizer.controller.dto.EvaluationRequest;
import com.portfolioanalysis.optimizer.controller.dto.PortfolioPageResponse;
import com.portfolioanalysis.optimizer.controller.dto.PortfolioPointResponse;
import com.portfolioanalysis.optimizer.controller.dto.SimulationRequest;
import com.portfolioanalysis.optimizer.controller.dto.SimulationResponse;

/**
 * Service interface for efficient frontier simulations.
 */
public interface PortfolioOptimizationService {

    /**
     * Load prices, sample the frontier and store the result as a new session.
     *
     * @param request the simulation request
     * @return the summary of the new simulation
     */
    SimulationResponse runSimulation(SimulationRequest request);

    /**
     * Summary of a stored simulation.
     */
    SimulationResponse getSimulation(String simulationId);

    /**
     * A page of the sampled population in generation order.
     */
    PortfolioPageResponse getPortfolios(String simulationId, int offset, int limit);

    /**
     * The sampled portfolio at a population index, such as a point picked on the chart.
     */
    PortfolioPointResponse resolvePortfolio(String simulationId, int index);

    /**
     * CAGR-based metrics of an allocation on the simulation's price table.
     */
    PortfolioPointResponse evaluateAllocation(String simulationId, EvaluationRequest request);
}
