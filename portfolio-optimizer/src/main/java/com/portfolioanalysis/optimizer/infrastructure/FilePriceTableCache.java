package com.portfolioanalysis.optimizer.infrastructure;

import com.portfolioanalysis.optimizer.domain.PriceTable;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * CSV-file cache of a price table.
 * Layout: a header {@code Date,SYM1,SYM2,...} followed by one row per trading date.
 * A sidecar file holds the end date of the lookback window the table was fetched for.
 */
@Slf4j
public class FilePriceTableCache implements PriceTableCache {

    static final String DATE_COLUMN = "Date";
    static final String FILE_NAME = "price-table.csv";
    static final String WINDOW_FILE_NAME = "price-table.window";

    private final Path cacheFile;
    private final Path windowFile;

    public FilePriceTableCache(Path directory) {
        this.cacheFile = directory.resolve(FILE_NAME);
        this.windowFile = directory.resolve(WINDOW_FILE_NAME);
    }

    @Override
    public CacheLookup lookup(List<String> symbols, LocalDate windowEnd) {
        if (!Files.isRegularFile(cacheFile)) {
            log.debug("No price cache at {}", cacheFile);
            return CacheLookup.absent();
        }

        try {
            LocalDate cachedWindowEnd = readWindowEnd();
            if (!cachedWindowEnd.equals(windowEnd)) {
                return CacheLookup.invalid("cached window ends " + cachedWindowEnd + ", need " + windowEnd);
            }

            PriceTable cached = read();
            List<String> missing = symbols.stream()
                    .filter(symbol -> cached.columnIndex(symbol) < 0)
                    .toList();
            if (!missing.isEmpty()) {
                return CacheLookup.invalid("cached table lacks symbols " + missing);
            }
            return CacheLookup.valid(cached.select(symbols));

        } catch (InvalidCacheException e) {
            return CacheLookup.invalid(e.getMessage());
        } catch (IOException e) {
            log.warn("Failed to read price cache {}: {}", cacheFile, e.getMessage());
            return CacheLookup.invalid("unreadable cache file: " + e.getMessage());
        }
    }

    @Override
    public synchronized void store(PriceTable priceTable, LocalDate windowEnd) {
        Path temp = null;
        try {
            Files.createDirectories(cacheFile.getParent());
            temp = Files.createTempFile(cacheFile.getParent(), "price-table", ".tmp");

            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                writer.write(DATE_COLUMN + "," + String.join(",", priceTable.getAssets()));
                writer.newLine();
                for (int row = 0; row < priceTable.rowCount(); row++) {
                    StringBuilder line = new StringBuilder(priceTable.getDates().get(row).toString());
                    for (int col = 0; col < priceTable.columnCount(); col++) {
                        line.append(',').append(priceTable.price(row, col));
                    }
                    writer.write(line.toString());
                    writer.newLine();
                }
            }

            // A table is never left paired with a window it was not fetched for
            Files.deleteIfExists(windowFile);
            replace(temp, cacheFile);
            Files.writeString(windowFile, windowEnd.toString(), StandardCharsets.UTF_8);
            log.info("Stored price table {} for window ending {} in cache {}", priceTable, windowEnd, cacheFile);

        } catch (IOException e) {
            log.error("Failed to write price cache {}: {}", cacheFile, e.getMessage(), e);
        } finally {
            deleteTemp(temp);
        }
    }

    @Override
    public synchronized void invalidate() {
        try {
            boolean removed = Files.deleteIfExists(cacheFile);
            Files.deleteIfExists(windowFile);
            if (removed) {
                log.info("Invalidated price cache {}", cacheFile);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to invalidate price cache " + cacheFile, e);
        }
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary cache file {}: {}", temp, e.getMessage());
        }
    }

    private LocalDate readWindowEnd() throws IOException {
        if (!Files.isRegularFile(windowFile)) {
            throw new InvalidCacheException("lookback window unknown");
        }
        return parseDate(Files.readString(windowFile, StandardCharsets.UTF_8));
    }

    private PriceTable read() throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(cacheFile, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            if (header == null || !header.startsWith(DATE_COLUMN + ",")) {
                throw new InvalidCacheException("missing Date header");
            }

            List<String> assets = Arrays.stream(header.split(",", -1))
                    .skip(1)
                    .map(String::trim)
                    .toList();

            List<LocalDate> dates = new ArrayList<>();
            List<double[]> rows = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                String[] cells = line.split(",", -1);
                if (cells.length != assets.size() + 1) {
                    throw new InvalidCacheException("row " + (rows.size() + 1) + " has a missing cell");
                }

                LocalDate date = parseDate(cells[0]);
                if (!dates.isEmpty() && !date.isAfter(dates.get(dates.size() - 1))) {
                    throw new InvalidCacheException("dates are not strictly ascending at " + date);
                }

                double[] prices = new double[assets.size()];
                for (int col = 0; col < prices.length; col++) {
                    prices[col] = parsePrice(cells[col + 1], date);
                }
                dates.add(date);
                rows.add(prices);
            }

            if (rows.size() < 2) {
                throw new InvalidCacheException("fewer than 2 rows");
            }

            try {
                return new PriceTable(dates, assets, rows.toArray(new double[0][]));
            } catch (IllegalArgumentException e) {
                throw new InvalidCacheException(e.getMessage());
            }
        }
    }

    private static LocalDate parseDate(String cell) {
        try {
            return LocalDate.parse(cell.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidCacheException("unparseable date '" + cell + "'");
        }
    }

    private static double parsePrice(String cell, LocalDate date) {
        if (cell.isBlank()) {
            throw new InvalidCacheException("missing price on " + date);
        }
        try {
            double price = Double.parseDouble(cell.trim());
            if (!Double.isFinite(price) || price < 0) {
                throw new InvalidCacheException("invalid price " + cell + " on " + date);
            }
            return price;
        } catch (NumberFormatException e) {
            throw new InvalidCacheException("unparseable price '" + cell + "' on " + date);
        }
    }

    /**
     * Raised while reading when the file breaks the cache contract.
     */
    private static class InvalidCacheException extends RuntimeException {
        InvalidCacheException(String message) {
            super(message);
        }
    }
}
