package com.portfolioanalysis.optimizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sample holdings used when a simulation request names no symbols.
 */
@Data
@Component
@ConfigurationProperties(prefix = "portfolio")
public class DefaultPortfolioProperties {

    /**
     * Ticker to weight, in the order the assets are requested. Weights need not sum to 1.
     */
    private Map<String, Double> defaultAllocations = new LinkedHashMap<>();
}
