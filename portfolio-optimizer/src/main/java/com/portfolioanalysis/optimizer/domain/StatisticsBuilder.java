package com.portfolioanalysis.optimizer.domain;

import com.portfolioanalysis.optimizer.domain.exception.InsufficientDataException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.Covariance;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a price table into annualized mean returns and an annualized covariance matrix.
 *
 * <p>Periodic return of asset a at row t is (p[t] - p[t-1]) / p[t-1]. The mean vector is the
 * column mean of periodic returns and the covariance is the unbiased (N-1) sample covariance,
 * both multiplied by {@value #TRADING_DAYS_PER_YEAR}.
 */
@Slf4j
public class StatisticsBuilder {

    public static final int TRADING_DAYS_PER_YEAR = 252;

    /**
     * Build the statistics bundle for every column of the table.
     *
     * @throws InsufficientDataException if the table has no columns or fewer than two
     *                                   periodic returns remain after dropping incomplete rows
     */
    public StatisticsBundle build(PriceTable priceTable) {
        if (priceTable.columnCount() == 0) {
            throw new InsufficientDataException("Price table has no asset columns");
        }

        double[][] returns = periodicReturns(priceTable);
        if (returns.length < 2) {
            throw new InsufficientDataException(String.format(
                    "Need at least 2 periodic returns to estimate covariance, got %d from %d price rows",
                    returns.length, priceTable.rowCount()));
        }

        RealMatrix returnMatrix = MatrixUtils.createRealMatrix(returns);
        double[] meanReturns = new double[priceTable.columnCount()];
        for (int col = 0; col < meanReturns.length; col++) {
            meanReturns[col] = StatUtils.mean(returnMatrix.getColumn(col)) * TRADING_DAYS_PER_YEAR;
        }

        RealMatrix covariance = new Covariance(returnMatrix, true)
                .getCovarianceMatrix()
                .scalarMultiply(TRADING_DAYS_PER_YEAR);

        log.debug("Built statistics for {} assets from {} periodic returns",
                priceTable.columnCount(), returns.length);

        return new StatisticsBundle(priceTable.getAssets(), new ArrayRealVector(meanReturns, false), covariance);
    }

    /**
     * Relative differences between consecutive rows.
     * Rows containing a non-finite return (a zero previous price) are dropped.
     */
    public double[][] periodicReturns(PriceTable priceTable) {
        List<double[]> rows = new ArrayList<>();
        int dropped = 0;

        for (int row = 1; row < priceTable.rowCount(); row++) {
            double[] periodic = new double[priceTable.columnCount()];
            boolean complete = true;

            for (int col = 0; col < periodic.length; col++) {
                double previous = priceTable.price(row - 1, col);
                periodic[col] = (priceTable.price(row, col) - previous) / previous;
                if (!Double.isFinite(periodic[col])) {
                    complete = false;
                }
            }

            if (complete) {
                rows.add(periodic);
            } else {
                dropped++;
            }
        }

        if (dropped > 0) {
            log.warn("Dropped {} periodic return rows with undefined values", dropped);
        }
        return rows.toArray(new double[0][]);
    }
}
