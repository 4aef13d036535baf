package com.portfolioanalysis.optimizer.domain;

import com.portfolioanalysis.optimizer.domain.exception.EmptyPopulationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks distinguished portfolios out of a sampled population.
 * Ties always go to the point generated first.
 */
public class OptimalPortfolioSelector {

    public static final double DEFAULT_EDGE_THRESHOLD = 0.001;

    public PortfolioPoint maxSharpe(FrontierPopulation population) {
        return population.get(maxSharpeIndex(population));
    }

    public PortfolioPoint minRisk(FrontierPopulation population) {
        return population.get(minRiskIndex(population));
    }

    public List<PortfolioPoint> nearMinRiskEdge(FrontierPopulation population) {
        return nearMinRiskEdge(population, DEFAULT_EDGE_THRESHOLD);
    }

    /**
     * Every point whose risk is within {@code threshold} of the population minimum, in generation order.
     * This approximates the left edge of the sampled cloud; it is not a Pareto frontier, and a point
     * dominated by another one may still fall inside the band.
     */
    public List<PortfolioPoint> nearMinRiskEdge(FrontierPopulation population, double threshold) {
        List<PortfolioPoint> edge = new ArrayList<>();
        for (int index : nearMinRiskEdgeIndices(population, threshold)) {
            edge.add(population.get(index));
        }
        return edge;
    }

    public int maxSharpeIndex(FrontierPopulation population) {
        requireNonEmpty(population, "maximum Sharpe ratio");

        int best = 0;
        for (int i = 1; i < population.size(); i++) {
            if (population.get(i).getSharpeRatio() > population.get(best).getSharpeRatio()) {
                best = i;
            }
        }
        return best;
    }

    public int minRiskIndex(FrontierPopulation population) {
        requireNonEmpty(population, "minimum risk");

        int best = 0;
        for (int i = 1; i < population.size(); i++) {
            if (population.get(i).getRisk() < population.get(best).getRisk()) {
                best = i;
            }
        }
        return best;
    }

    public List<Integer> nearMinRiskEdgeIndices(FrontierPopulation population, double threshold) {
        if (!(threshold >= 0)) {
            throw new IllegalArgumentException("Edge threshold must be non-negative: " + threshold);
        }
        requireNonEmpty(population, "minimum-risk edge");

        double minRisk = population.get(minRiskIndex(population)).getRisk();
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < population.size(); i++) {
            if (population.get(i).getRisk() - minRisk <= threshold) {
                indices.add(i);
            }
        }
        return indices;
    }

    private static void requireNonEmpty(FrontierPopulation population, String operation) {
        if (population == null || population.isEmpty()) {
            throw new EmptyPopulationException(operation);
        }
    }
}
