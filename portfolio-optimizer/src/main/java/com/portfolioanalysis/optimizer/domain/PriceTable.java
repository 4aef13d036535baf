package com.portfolioanalysis.optimizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable table of adjusted closing prices.
 * Rows are trading dates in strictly ascending order, columns are unique asset symbols,
 * and every cell holds a finite, non-negative price.
 */
@EqualsAndHashCode
public final class PriceTable {

    private final List<LocalDate> dates;
    private final List<String> assets;
    private final double[][] prices;

    @JsonCreator
    public PriceTable(@JsonProperty("dates") List<LocalDate> dates,
                      @JsonProperty("assets") List<String> assets,
                      @JsonProperty("prices") double[][] prices) {
        if (dates == null || assets == null || prices == null) {
            throw new IllegalArgumentException("Dates, assets and prices are required");
        }
        if (dates.size() != prices.length) {
            throw new IllegalArgumentException(String.format(
                    "Row count mismatch: %d dates but %d price rows", dates.size(), prices.length));
        }

        Set<String> seen = new HashSet<>();
        for (String asset : assets) {
            if (asset == null || asset.isBlank() || !seen.add(asset)) {
                throw new IllegalArgumentException("Asset identifiers must be unique and non-blank: " + assets);
            }
        }

        for (int row = 0; row < dates.size(); row++) {
            if (row > 0 && !dates.get(row).isAfter(dates.get(row - 1))) {
                throw new IllegalArgumentException("Dates must be strictly ascending at " + dates.get(row));
            }
            if (prices[row] == null || prices[row].length != assets.size()) {
                throw new IllegalArgumentException("Price row " + row + " does not match the asset count");
            }
            for (double price : prices[row]) {
                if (!Double.isFinite(price) || price < 0) {
                    throw new IllegalArgumentException(
                            "Invalid price " + price + " on " + dates.get(row));
                }
            }
        }

        this.dates = List.copyOf(dates);
        this.assets = List.copyOf(assets);
        this.prices = deepCopy(prices);
    }

    /**
     * Build a table from per-asset price columns that share the given date index.
     */
    public static PriceTable fromColumns(List<LocalDate> dates, Map<String, double[]> columns) {
        List<String> assets = new ArrayList<>(columns.keySet());
        double[][] prices = new double[dates.size()][assets.size()];

        for (int col = 0; col < assets.size(); col++) {
            double[] column = columns.get(assets.get(col));
            if (column.length != dates.size()) {
                throw new IllegalArgumentException("Column " + assets.get(col) + " does not match the date index");
            }
            for (int row = 0; row < dates.size(); row++) {
                prices[row][col] = column[row];
            }
        }

        return new PriceTable(dates, assets, prices);
    }

    public List<LocalDate> getDates() {
        return dates;
    }

    public List<String> getAssets() {
        return assets;
    }

    public double[][] getPrices() {
        return deepCopy(prices);
    }

    public int rowCount() {
        return dates.size();
    }

    public int columnCount() {
        return assets.size();
    }

    public double price(int row, int column) {
        return prices[row][column];
    }

    public double firstPrice(int column) {
        return prices[0][column];
    }

    public double lastPrice(int column) {
        return prices[prices.length - 1][column];
    }

    /**
     * @return the column index of the asset, or -1 when the table has no such column
     */
    public int columnIndex(String asset) {
        return assets.indexOf(asset);
    }

    public double[] column(int column) {
        double[] values = new double[prices.length];
        for (int row = 0; row < prices.length; row++) {
            values[row] = prices[row][column];
        }
        return values;
    }

    /**
     * Project the table onto the given assets, in the given order.
     */
    public PriceTable select(List<String> selectedAssets) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (String asset : selectedAssets) {
            int index = columnIndex(asset);
            if (index < 0) {
                throw new IllegalArgumentException("Asset not present in price table: " + asset);
            }
            columns.put(asset, column(index));
        }
        return fromColumns(dates, columns);
    }

    private static double[][] deepCopy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }

    @Override
    public String toString() {
        return "PriceTable{assets=" + assets + ", rows=" + dates.size() + "}";
    }
}
