package com.portfolioanalysis.optimizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.portfolioanalysis.optimizer.domain.exception.InvalidWeightsException;
import lombok.EqualsAndHashCode;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Long-only, fully-invested allocation: every entry is non-negative and the entries sum to 1.
 */
@Slf4j
@EqualsAndHashCode
public final class Weights {

    public static final double SUM_TOLERANCE = 1e-9;

    private final double[] values;

    @JsonCreator
    public Weights(@JsonProperty("values") double[] values) {
        checkEntries(values);
        double sum = Arrays.stream(values).sum();
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new InvalidWeightsException("Weights must sum to 1 but sum to " + sum);
        }
        this.values = values.clone();
    }

    /**
     * Divide each raw weight by the total so the result sums to 1.
     *
     * @throws InvalidWeightsException if the vector is empty, has a negative or non-finite entry,
     *                                 or sums to zero or less
     */
    public static Weights normalize(double[] raw) {
        checkEntries(raw);

        double sum = Arrays.stream(raw).sum();
        if (!(sum > 0)) {
            throw new InvalidWeightsException("Weights must have a positive sum but sum to " + sum);
        }

        double[] normalized = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            normalized[i] = raw[i] / sum;
        }
        return new Weights(normalized);
    }

    /**
     * Re-derive a weight vector for the given asset columns from a symbol-keyed allocation.
     * Keys are matched in canonical form, so {@code "aapl "} and {@code "AAPL"} are one symbol and
     * their weights add up. Symbols that are not among the assets are dropped; assets without an
     * allocation get zero.
     */
    public static Weights fromAllocations(Map<String, Double> allocations, List<String> assets) {
        if (allocations == null || allocations.isEmpty()) {
            throw new InvalidWeightsException("Allocations must not be empty");
        }

        Map<String, Double> canonical = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : allocations.entrySet()) {
            String symbol = Symbols.normalize(entry.getKey());
            if (symbol == null) {
                log.warn("Allocation with blank symbol ignored");
            } else if (entry.getValue() != null) {
                canonical.merge(symbol, entry.getValue(), Double::sum);
            }
        }

        Set<String> columns = new HashSet<>();
        double[] raw = new double[assets.size()];
        for (int i = 0; i < assets.size(); i++) {
            String asset = Symbols.normalize(assets.get(i));
            columns.add(asset);
            Double allocation = canonical.get(asset);
            raw[i] = allocation != null ? allocation : 0.0;
        }

        canonical.keySet().stream()
                .filter(symbol -> !columns.contains(symbol))
                .forEach(symbol -> log.warn("Allocation for {} ignored: symbol not in price table", symbol));

        return normalize(raw);
    }

    private static void checkEntries(double[] values) {
        if (values == null || values.length == 0) {
            throw new InvalidWeightsException("Weights must contain at least one entry");
        }
        for (double value : values) {
            if (!Double.isFinite(value) || value < 0) {
                throw new InvalidWeightsException("Weights must be finite and non-negative, got " + value);
            }
        }
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] getValues() {
        return values.clone();
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
