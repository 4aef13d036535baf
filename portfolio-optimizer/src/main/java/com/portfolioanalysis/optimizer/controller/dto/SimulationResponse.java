package com.portfolioanalysis.optimizer.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.portfolioanalysis.optimizer.domain.WeightSamplingMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Response DTO summarizing a simulation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SimulationResponse {

    private String simulationId;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime createdAt;

    private List<String> assets;
    private List<String> excludedSymbols;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;

    private int priceRows;

    // Annualized mean periodic returns per asset
    private Map<String, Double> meanReturns;

    private List<AssetSummaryResponse> assetSummaries;

    private WeightSamplingMode samplingMode;
    private long seed;
    private double riskFreeRate;
    private int portfolioCount;

    private PortfolioPointResponse maxSharpe;
    private PortfolioPointResponse minRisk;
    private List<PortfolioPointResponse> minRiskEdge;

    // Populated only when allocations were supplied
    private PortfolioPointResponse currentPortfolio;

    private String message;
}
