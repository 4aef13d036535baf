package com.portfolioanalysis.optimizer.service;

import com.portfolioanalysis.optimizer.config.AssetCatalogProperties;
import com.portfolioanalysis.optimizer.controller.dto.AssetInfoResponse;
import com.portfolioanalysis.optimizer.controller.dto.AssetSummaryResponse;
import com.portfolioanalysis.optimizer.domain.PriceTable;
import com.portfolioanalysis.optimizer.domain.Symbols;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ticker names and per-asset price history summaries.
 */
@Service
@Slf4j
public class AssetInfoService {

    private final Map<String, String> names;

    public AssetInfoService(AssetCatalogProperties catalogProperties) {
        Map<String, String> canonical = new LinkedHashMap<>();
        catalogProperties.getNames().forEach((symbol, name) -> {
            String normalized = Symbols.normalize(symbol);
            if (normalized != null && name != null && !name.isBlank()) {
                canonical.put(normalized, name.trim());
            }
        });
        this.names = Collections.unmodifiableMap(canonical);
        log.info("Asset catalog loaded with {} entries", names.size());
    }

    /**
     * @return the full name, or the symbol itself when the catalog has no entry
     */
    public String getFullName(String symbol) {
        String normalized = requireSymbol(symbol);
        return names.getOrDefault(normalized, normalized);
    }

    /**
     * @return {@code "TICKER - Full Name"}, or the bare ticker when the catalog has no entry
     */
    public String getDisplayName(String symbol) {
        String normalized = requireSymbol(symbol);
        String fullName = names.get(normalized);
        return fullName != null ? normalized + " - " + fullName : normalized;
    }

    public AssetInfoResponse getAssetInfo(String symbol) {
        String normalized = requireSymbol(symbol);
        return AssetInfoResponse.builder()
                .symbol(normalized)
                .fullName(getFullName(normalized))
                .displayName(getDisplayName(normalized))
                .known(names.containsKey(normalized))
                .build();
    }

    public List<AssetInfoResponse> getCatalog() {
        List<AssetInfoResponse> catalog = new ArrayList<>(names.size());
        for (String symbol : names.keySet()) {
            catalog.add(getAssetInfo(symbol));
        }
        return catalog;
    }

    /**
     * Latest price, total return, data points and date range of every column.
     */
    public List<AssetSummaryResponse> summarize(PriceTable priceTable) {
        List<AssetSummaryResponse> summaries = new ArrayList<>(priceTable.columnCount());
        if (priceTable.rowCount() == 0) {
            return summaries;
        }

        int last = priceTable.rowCount() - 1;
        for (int col = 0; col < priceTable.columnCount(); col++) {
            String symbol = priceTable.getAssets().get(col);
            double first = priceTable.price(0, col);
            double latest = priceTable.price(last, col);

            summaries.add(AssetSummaryResponse.builder()
                    .symbol(symbol)
                    .displayName(getDisplayName(symbol))
                    .firstPrice(first)
                    .latestPrice(latest)
                    .totalReturn(first > 0 ? (latest - first) / first : null)
                    .dataPoints(priceTable.rowCount())
                    .startDate(priceTable.getDates().get(0))
                    .endDate(priceTable.getDates().get(last))
                    .build());
        }
        return summaries;
    }

    private static String requireSymbol(String symbol) {
        String normalized = Symbols.normalize(symbol);
        if (normalized == null) {
            throw new IllegalArgumentException("Symbol is required");
        }
        return normalized;
    }
}
