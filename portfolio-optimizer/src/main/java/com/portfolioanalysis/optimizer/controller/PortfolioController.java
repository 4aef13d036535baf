package com.portfolioanalysis.optimizer.controller;

import com.portfolioanalysis.optimizer.controller.dto.EvaluationRequest;
import com.portfolioanalysis.optimizer.controller.dto.PortfolioPageResponse;
import com.portfolioanalysis.optimizer.controller.dto.PortfolioPointResponse;
import com.portfolioanalysis.optimizer.controller.dto.SimulationRequest;
import com.portfolioanalysis.optimizer.controller.dto.SimulationResponse;
import com.portfolioanalysis.optimizer.service.PortfolioOptimizationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for frontier simulations.
 */
@RestController
@RequestMapping("/simulations")
@RequiredArgsConstructor
@Slf4j
public class PortfolioController {

    private final PortfolioOptimizationService optimizationService;

    /**
     * Run a new simulation.
     *
     * @param request the simulation request
     * @return the simulation summary
     */
    @PostMapping
    public ResponseEntity<SimulationResponse> runSimulation(@Valid @RequestBody SimulationRequest request) {

        log.info("POST /simulations - Symbols: {}, Portfolios: {}",
                request.getSymbols(), request.getNumPortfolios());

        SimulationResponse response = optimizationService.runSimulation(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{simulationId}")
    public ResponseEntity<SimulationResponse> getSimulation(@PathVariable String simulationId) {

        log.info("GET /simulations/{}", simulationId);

        return ResponseEntity.ok(optimizationService.getSimulation(simulationId));
    }

    /**
     * Page through the sampled portfolios in generation order.
     */
    @GetMapping("/{simulationId}/portfolios")
    public ResponseEntity<PortfolioPageResponse> getPortfolios(
            @PathVariable String simulationId,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "500") int limit) {

        log.info("GET /simulations/{}/portfolios - offset: {}, limit: {}", simulationId, offset, limit);

        return ResponseEntity.ok(optimizationService.getPortfolios(simulationId, offset, limit));
    }

    /**
     * Resolve a population index, e.g. a point picked on the frontier chart.
     */
    @GetMapping("/{simulationId}/portfolios/{index}")
    public ResponseEntity<PortfolioPointResponse> resolvePortfolio(
            @PathVariable String simulationId,
            @PathVariable int index) {

        log.info("GET /simulations/{}/portfolios/{}", simulationId, index);

        return ResponseEntity.ok(optimizationService.resolvePortfolio(simulationId, index));
    }

    @PostMapping("/{simulationId}/evaluations")
    public ResponseEntity<PortfolioPointResponse> evaluateAllocation(
            @PathVariable String simulationId,
            @Valid @RequestBody EvaluationRequest request) {

        log.info("POST /simulations/{}/evaluations - Allocations: {}", simulationId, request.getAllocations());

        return ResponseEntity.ok(optimizationService.evaluateAllocation(simulationId, request));
    }
}
