package com.portfolioanalysis.optimizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive names of known tickers, loaded from {@code asset-catalog.yml}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "portfolio.assets")
public class AssetCatalogProperties {

    /**
     * Ticker to full name, e.g. {@code AAPL: Apple Inc. (Technology)}
     */
    private Map<String, String> names = new LinkedHashMap<>();
}
