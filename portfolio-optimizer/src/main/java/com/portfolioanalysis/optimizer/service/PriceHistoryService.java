package com.portfolioanalysis.optimizer.service;

import com.portfolioanalysis.optimizer.domain.PriceTable;
import com.portfolioanalysis.optimizer.domain.StatisticsBuilder;
import com.portfolioanalysis.optimizer.domain.Symbols;
import com.portfolioanalysis.optimizer.infrastructure.CacheLookup;
import com.portfolioanalysis.optimizer.infrastructure.CacheState;
import com.portfolioanalysis.optimizer.infrastructure.PriceTableCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;

/**
 * Price history provider backed by {@link MarketDataService} with a validate-or-refetch cache.
 *
 * <p>Cache handling has three states. VALID serves the cached table. ABSENT and INVALID both
 * trigger a full refetch of every requested symbol, after which the cache is overwritten.
 * An invalid cache is never patched.
 */
@Service
@Slf4j
public class PriceHistoryService implements PriceHistoryProvider {

    private final MarketDataService marketDataService;
    private final PriceTableCache priceTableCache;
    private final OptimizationMetricsService metricsService;
    private final int lookbackYears;
    private final double minCoverage;
    private final int maxFetchAttempts;

    public PriceHistoryService(MarketDataService marketDataService,
                               @Nullable PriceTableCache priceTableCache,
                               OptimizationMetricsService metricsService,
                               @Value("${portfolio.history.lookback-years:5}") int lookbackYears,
                               @Value("${portfolio.history.min-coverage:0.9}") double minCoverage,
                               @Value("${portfolio.history.max-fetch-attempts:3}") int maxFetchAttempts) {
        this.marketDataService = marketDataService;
        this.priceTableCache = priceTableCache;
        this.metricsService = metricsService;
        this.lookbackYears = lookbackYears;
        this.minCoverage = minCoverage;
        this.maxFetchAttempts = Math.max(1, maxFetchAttempts);
    }

    @Override
    public PriceHistoryResult loadPriceTable(List<String> symbols) {
        List<String> requested = normalizeSymbols(symbols);
        LocalDate endDate = LocalDate.now();
        log.info("Loading price history for {} over {} years ending {}", requested, lookbackYears, endDate);

        if (priceTableCache != null && !requested.isEmpty()) {
            CacheLookup lookup = priceTableCache.lookup(requested, endDate);
            if (lookup.getState() == CacheState.VALID) {
                log.info("Price cache VALID for {}", requested);
                metricsService.recordCacheHit();
                return new PriceHistoryResult(lookup.getPriceTable(), List.of(), true);
            }
            log.info("Price cache {} ({}). Refetching all symbols.", lookup.getState(), lookup.getReason());
            metricsService.recordCacheMiss();
        }

        LocalDate startDate = endDate.minusDays(365L * lookbackYears);
        double requiredRows = minCoverage * StatisticsBuilder.TRADING_DAYS_PER_YEAR * lookbackYears;

        Map<String, NavigableMap<LocalDate, Double>> accepted = new LinkedHashMap<>();
        List<String> excluded = new ArrayList<>();

        for (String symbol : requested) {
            NavigableMap<LocalDate, Double> series = fetchWithRetry(symbol, startDate, endDate);

            if (series == null) {
                excluded.add(symbol);
            } else if (series.size() < requiredRows) {
                log.warn("Insufficient data for {}: {} rows, need {}. Excluding from portfolio.",
                        symbol, series.size(), requiredRows);
                excluded.add(symbol);
            } else if (series.values().stream().anyMatch(p -> p == null || !Double.isFinite(p) || p < 0)) {
                log.warn("Invalid prices for {}. Excluding from portfolio.", symbol);
                excluded.add(symbol);
            } else {
                accepted.put(symbol, series);
            }
        }

        PriceTable priceTable = align(accepted, excluded);

        if (priceTableCache != null && priceTable.columnCount() > 0) {
            priceTableCache.store(priceTable, endDate);
        }

        log.info("Price table ready: {} (excluded: {})", priceTable, excluded);
        return new PriceHistoryResult(priceTable, List.copyOf(excluded), false);
    }

    /**
     * Align accepted series on the dates of the first one.
     * A series lacking any of those dates is dropped, never gap-filled.
     */
    private PriceTable align(Map<String, NavigableMap<LocalDate, Double>> accepted, List<String> excluded) {
        if (accepted.isEmpty()) {
            return new PriceTable(List.of(), List.of(), new double[0][]);
        }

        List<LocalDate> calendar = new ArrayList<>(accepted.values().iterator().next().keySet());
        Map<String, double[]> columns = new LinkedHashMap<>();

        for (Map.Entry<String, NavigableMap<LocalDate, Double>> entry : accepted.entrySet()) {
            NavigableMap<LocalDate, Double> series = entry.getValue();
            if (!series.keySet().containsAll(calendar)) {
                log.warn("Missing dates for {} relative to {}. Excluding from portfolio.",
                        entry.getKey(), columns.isEmpty() ? entry.getKey() : columns.keySet().iterator().next());
                excluded.add(entry.getKey());
                continue;
            }

            double[] column = new double[calendar.size()];
            for (int row = 0; row < calendar.size(); row++) {
                column[row] = series.get(calendar.get(row));
            }
            columns.put(entry.getKey(), column);
        }

        return PriceTable.fromColumns(calendar, columns);
    }

    /**
     * Data-access failures are retried; anything else propagates.
     *
     * @return the series, or null when every attempt failed
     */
    private NavigableMap<LocalDate, Double> fetchWithRetry(String symbol, LocalDate startDate, LocalDate endDate) {
        for (int attempt = 1; attempt <= maxFetchAttempts; attempt++) {
            try {
                return marketDataService.loadAdjustedCloses(symbol, startDate, endDate);
            } catch (DataAccessException e) {
                if (attempt < maxFetchAttempts) {
                    log.warn("Fetch for {} failed (attempt {}/{}): {}. Retrying...",
                            symbol, attempt, maxFetchAttempts, e.getMessage());
                } else {
                    log.error("Error fetching data for {} after {} attempts: {}. Excluding from portfolio.",
                            symbol, maxFetchAttempts, e.getMessage(), e);
                }
            }
        }
        return null;
    }

    private static List<String> normalizeSymbols(List<String> symbols) {
        Set<String> unique = new LinkedHashSet<>();
        if (symbols != null) {
            for (String symbol : symbols) {
                String normalized = Symbols.normalize(symbol);
                if (normalized != null) {
                    unique.add(normalized);
                }
            }
        }
        return new ArrayList<>(unique);
    }
}
