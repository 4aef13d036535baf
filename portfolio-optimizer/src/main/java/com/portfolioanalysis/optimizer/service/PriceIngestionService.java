package com.portfolioanalysis.optimizer.service;

import com.portfolioanalysis.optimizer.domain.HistoricalPrice;
import com.portfolioanalysis.optimizer.domain.Symbols;
import com.portfolioanalysis.optimizer.infrastructure.PriceTableCache;
import com.portfolioanalysis.optimizer.repository.HistoricalPriceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Service for ingesting CSV price history into the database.
 * Supports Yahoo Finance CSV format. Any change to stored prices invalidates the price table cache.
 */
@Service
@Slf4j
public class PriceIngestionService {

    static final int BATCH_SIZE = 1000;

    private static final DateTimeFormatter[] DATE_FORMATTERS = {
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yyyy")
    };

    private final HistoricalPriceRepository historicalPriceRepository;
    private final PriceTableCache priceTableCache;

    public PriceIngestionService(HistoricalPriceRepository historicalPriceRepository,
                                 @Nullable PriceTableCache priceTableCache) {
        this.historicalPriceRepository = historicalPriceRepository;
        this.priceTableCache = priceTableCache;
    }

    /**
     * Ingest CSV data from an input stream.
     * Expected format: Date,Open,High,Low,Close,Adj Close,Volume
     *
     * @param symbol      the stock symbol
     * @param inputStream the CSV input stream
     * @return number of records inserted
     */
    @Transactional
    public int ingestCsv(String symbol, InputStream inputStream) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            return ingest(normalizeSymbol(symbol), reader);
        }
    }

    /**
     * Ingest CSV data passed as a string, as received in a request body.
     */
    @Transactional
    public int ingestCsv(String symbol, String csvContent) throws IOException {
        try (BufferedReader reader = new BufferedReader(new StringReader(csvContent))) {
            return ingest(normalizeSymbol(symbol), reader);
        }
    }

    /**
     * Delete every stored price of a symbol.
     *
     * @return number of records deleted
     */
    @Transactional
    public int deleteSymbolData(String symbol) {
        String normalized = normalizeSymbol(symbol);
        int deleted = historicalPriceRepository.deleteBySymbol(normalized);
        log.info("Deleted {} price records for {}", deleted, normalized);
        if (deleted > 0) {
            invalidateCache();
        }
        return deleted;
    }

    private int ingest(String symbol, BufferedReader reader) throws IOException {
        log.info("Starting CSV ingestion for symbol: {}", symbol);

        Set<LocalDate> knownDates = new HashSet<>(historicalPriceRepository.findDatesBySymbol(symbol));
        List<HistoricalPrice> batch = new ArrayList<>();
        int inserted = 0;
        int priceColumn = 1;
        boolean firstLine = true;

        String line;
        while ((line = reader.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }

            if (firstLine) {
                firstLine = false;
                if (line.toLowerCase(Locale.ROOT).contains("date")) {
                    priceColumn = resolvePriceColumn(line);
                    log.debug("Using column {} of header '{}' for {}", priceColumn, line, symbol);
                    continue;
                }
            }

            HistoricalPrice price = parseCsvLine(symbol, line, priceColumn);
            if (price == null) {
                continue;
            }
            if (!knownDates.add(price.getDate())) {
                log.debug("Skipping duplicate {} price on {}", symbol, price.getDate());
                continue;
            }

            batch.add(price);
            if (batch.size() >= BATCH_SIZE) {
                historicalPriceRepository.saveAll(batch);
                inserted += batch.size();
                log.info("Batch inserted {} records for {}", batch.size(), symbol);
                batch.clear();
            }
        }

        if (!batch.isEmpty()) {
            historicalPriceRepository.saveAll(batch);
            inserted += batch.size();
            log.info("Inserted final batch of {} records for {}", batch.size(), symbol);
        }

        if (inserted > 0) {
            invalidateCache();
        }

        long totalRecords = historicalPriceRepository.countBySymbol(symbol);
        log.info("CSV ingestion completed for {}. Inserted {}, total records in DB: {}",
                symbol, inserted, totalRecords);
        return inserted;
    }

    private void invalidateCache() {
        if (priceTableCache != null) {
            priceTableCache.invalidate();
        }
    }

    /**
     * Locate the adjusted close column, falling back to Close and then to the second column.
     */
    static int resolvePriceColumn(String header) {
        String[] names = header.split(",", -1);
        int closeColumn = -1;
        for (int i = 0; i < names.length; i++) {
            String name = names[i].trim().replace("\"", "").toLowerCase(Locale.ROOT);
            if (name.equals("adj close") || name.equals("adj_close") || name.equals("adjusted close")) {
                return i;
            }
            if (name.equals("close") && closeColumn < 0) {
                closeColumn = i;
            }
        }
        return closeColumn >= 0 ? closeColumn : 1;
    }

    /**
     * Parse a single CSV line, or return null if it is malformed.
     */
    private HistoricalPrice parseCsvLine(String symbol, String line, int priceColumn) {
        String[] parts = line.split(",", -1);

        if (parts.length <= priceColumn) {
            log.warn("Invalid CSV line format (expected {}+ columns): {}", priceColumn + 1, line);
            return null;
        }

        try {
            LocalDate date = parseDate(parts[0].trim());
            BigDecimal adjustedClose = new BigDecimal(parts[priceColumn].trim());
            if (adjustedClose.signum() < 0) {
                log.warn("Negative price in line: {}", line);
                return null;
            }

            return HistoricalPrice.builder()
                    .symbol(symbol)
                    .date(date)
                    .adjustedClose(adjustedClose)
                    .build();

        } catch (NumberFormatException | DateTimeParseException e) {
            log.warn("Failed to parse CSV line: {} - Error: {}", line, e.getMessage());
            return null;
        }
    }

    /**
     * Parse date with multiple format support.
     */
    static LocalDate parseDate(String dateStr) {
        DateTimeParseException lastFailure = null;
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(dateStr, formatter);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        throw new DateTimeParseException("Unable to parse date: " + dateStr, dateStr, 0, lastFailure);
    }

    private static String normalizeSymbol(String symbol) {
        String normalized = Symbols.normalize(symbol);
        if (normalized == null) {
            throw new IllegalArgumentException("Symbol is required");
        }
        return normalized;
    }
}
