package com.portfolioanalysis.optimizer.domain;

import com.portfolioanalysis.optimizer.domain.exception.IndexOutOfRangeException;

import java.util.List;

/**
 * Maps an index chosen by a client, such as a clicked chart point, back to the sampled portfolio.
 * Pure lookup: nothing is recomputed, so the same index always yields the same point.
 */
public class SelectionResolver {

    public PortfolioPoint resolve(FrontierPopulation population, int index) {
        if (index < 0 || index >= population.size()) {
            throw new IndexOutOfRangeException(index, population.size());
        }
        return population.get(index);
    }

    /**
     * A contiguous run of points starting at {@code offset}, truncated at the end of the population.
     */
    public List<PortfolioPoint> resolvePage(FrontierPopulation population, int offset, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Page limit must not be negative: " + limit);
        }
        if (offset < 0 || (offset >= population.size() && !(offset == 0 && population.isEmpty()))) {
            throw new IndexOutOfRangeException(offset, population.size());
        }
        int end = (int) Math.min((long) offset + limit, population.size());
        return population.getPoints().subList(offset, end);
    }
}
