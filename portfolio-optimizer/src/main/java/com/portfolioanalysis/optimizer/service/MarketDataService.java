package com.portfolioanalysis.optimizer.service;

import com.portfolioanalysis.optimizer.domain.HistoricalPrice;
import com.portfolioanalysis.optimizer.repository.HistoricalPriceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Source of adjusted closing prices for a single symbol.
 * Reads the prices ingested into the database; the upstream market-data feed is not called here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataService {

    private final HistoricalPriceRepository historicalPriceRepository;

    /**
     * Load adjusted closes for the symbol and date range, keyed and ordered by date.
     *
     * @return the series, empty if no prices are stored for the range
     */
    @Transactional(readOnly = true)
    public NavigableMap<LocalDate, Double> loadAdjustedCloses(String symbol, LocalDate startDate, LocalDate endDate) {
        log.debug("Loading adjusted closes for {} from {} to {}", symbol, startDate, endDate);

        List<HistoricalPrice> prices = historicalPriceRepository
                .findBySymbolAndDateRange(symbol, startDate, endDate);

        NavigableMap<LocalDate, Double> series = new TreeMap<>();
        for (HistoricalPrice price : prices) {
            series.put(price.getDate(), price.getAdjustedClose().doubleValue());
        }

        log.info("Loaded {} adjusted closes for {}", series.size(), symbol);
        return series;
    }
}
