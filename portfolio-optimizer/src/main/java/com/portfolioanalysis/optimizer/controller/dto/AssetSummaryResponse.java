package com.portfolioanalysis.optimizer.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Per-asset view of the price history a simulation ran on.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AssetSummaryResponse {

    private String symbol;
    private String displayName;
    private double firstPrice;
    private double latestPrice;

    /**
     * Simple return from the first to the latest price as a fraction (0.25 is +25%).
     * Null when the first price is zero.
     */
    private Double totalReturn;

    private int dataPoints;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;
}
