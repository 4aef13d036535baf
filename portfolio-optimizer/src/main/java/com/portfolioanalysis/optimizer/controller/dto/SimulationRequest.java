package com.portfolioanalysis.optimizer.controller.dto;

import com.portfolioanalysis.optimizer.domain.WeightSamplingMode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for running a new frontier simulation.
 * Optional fields fall back to the configured defaults. Without symbols, the allocation keys are
 * used, and without either the configured default portfolio.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SimulationRequest {

    @Size(max = 50, message = "At most 50 symbols are supported")
    private List<String> symbols;

    @Min(value = 1, message = "Number of portfolios must be at least 1")
    @Max(value = 100000, message = "Number of portfolios must not exceed 100000")
    private Integer numPortfolios;

    @DecimalMin(value = "-1.0", message = "Risk-free rate must be at least -1")
    @DecimalMax(value = "1.0", message = "Risk-free rate must not exceed 1")
    private Double riskFreeRate;

    @PositiveOrZero(message = "Edge threshold must not be negative")
    private Double edgeThreshold;

    private Long seed;

    private WeightSamplingMode samplingMode;

    /**
     * Current holdings as symbol to weight; evaluated with CAGR-based metrics when present.
     */
    private Map<String, Double> allocations;
}
