package com.portfolioanalysis.optimizer.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.portfolioanalysis.optimizer.domain.PortfolioPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One portfolio with its weights keyed by symbol.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PortfolioPointResponse {

    // Position in the sampled population; null for evaluated allocations
    private Integer index;
    private Map<String, Double> weights;
    private double expectedReturn;
    private double risk;
    private double sharpeRatio;
    private ReturnConvention returnConvention;

    public static PortfolioPointResponse from(PortfolioPoint point, List<String> assets, Integer index,
                                              ReturnConvention returnConvention) {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (int i = 0; i < assets.size(); i++) {
            weights.put(assets.get(i), point.getWeights().get(i));
        }

        return PortfolioPointResponse.builder()
                .index(index)
                .weights(weights)
                .expectedReturn(point.getExpectedReturn())
                .risk(point.getRisk())
                .sharpeRatio(point.getSharpeRatio())
                .returnConvention(returnConvention)
                .build();
    }
}
