package com.portfolioanalysis.optimizer.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for a contiguous page of sampled portfolios.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PortfolioPageResponse {

    private String simulationId;
    private int offset;
    private int limit;
    private int total;
    private List<PortfolioPointResponse> portfolios;
}
