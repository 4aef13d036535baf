package com.portfolioanalysis.optimizer.domain;

import com.portfolioanalysis.optimizer.domain.exception.InvalidWeightsException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.List;

/**
 * Annualized mean returns and covariance of a set of assets.
 * Produced by {@link StatisticsBuilder}; never mutated after construction.
 */
public final class StatisticsBundle {

    private final List<String> assets;
    private final RealVector meanReturns;
    private final RealMatrix covariance;

    StatisticsBundle(List<String> assets, RealVector meanReturns, RealMatrix covariance) {
        if (meanReturns.getDimension() != assets.size()
                || covariance.getRowDimension() != assets.size()
                || covariance.getColumnDimension() != assets.size()) {
            throw new IllegalArgumentException("Statistics dimension does not match asset count " + assets.size());
        }
        this.assets = List.copyOf(assets);
        this.meanReturns = meanReturns.copy();
        this.covariance = covariance.copy();
    }

    public List<String> getAssets() {
        return assets;
    }

    public int size() {
        return assets.size();
    }

    public double meanReturn(int asset) {
        return meanReturns.getEntry(asset);
    }

    public double covariance(int row, int column) {
        return covariance.getEntry(row, column);
    }

    public double[] getMeanReturns() {
        return meanReturns.toArray();
    }

    public double[][] getCovariance() {
        return covariance.getData();
    }

    /**
     * Expected annual return as the weighted sum of annualized mean periodic returns.
     */
    public double portfolioReturn(Weights weights) {
        return toVector(weights).dotProduct(meanReturns);
    }

    /**
     * Annualized standard deviation, sqrt(w' . Cov . w).
     */
    public double portfolioRisk(Weights weights) {
        RealVector w = toVector(weights);
        double variance = covariance.preMultiply(w).dotProduct(w);
        // rounding can push the quadratic form of a PSD matrix a hair below zero
        return Math.sqrt(Math.max(variance, 0.0));
    }

    private RealVector toVector(Weights weights) {
        if (weights.size() != assets.size()) {
            throw new InvalidWeightsException(String.format(
                    "Expected %d weights but got %d", assets.size(), weights.size()));
        }
        return new ArrayRealVector(weights.getValues(), false);
    }
}
