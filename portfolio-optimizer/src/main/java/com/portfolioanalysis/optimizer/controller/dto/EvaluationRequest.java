package com.portfolioanalysis.optimizer.controller.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for evaluating an allocation against a simulation's price table.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationRequest {

    @NotEmpty(message = "Allocations are required")
    private Map<String, Double> allocations;

    @DecimalMin(value = "-1.0", message = "Risk-free rate must be at least -1")
    @DecimalMax(value = "1.0", message = "Risk-free rate must not exceed 1")
    private Double riskFreeRate;
}
