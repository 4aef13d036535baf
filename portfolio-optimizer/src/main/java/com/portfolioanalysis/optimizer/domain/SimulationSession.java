package com.portfolioanalysis.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one optimization run: the price table it was computed on and the sampled population.
 * Sessions are stored by id and handed to the engine explicitly; nothing is shared between them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SimulationSession {

    private String id;

    private LocalDateTime createdAt;

    private double riskFreeRate;

    private double edgeThreshold;

    private WeightSamplingMode samplingMode;

    private long seed;

    @Builder.Default
    private List<String> requestedSymbols = new ArrayList<>();

    @Builder.Default
    private List<String> excludedSymbols = new ArrayList<>();

    // Holdings supplied with the run, evaluated against the same price table
    @Builder.Default
    private Map<String, Double> allocations = new LinkedHashMap<>();

    private PriceTable priceTable;

    private FrontierPopulation population;
}
