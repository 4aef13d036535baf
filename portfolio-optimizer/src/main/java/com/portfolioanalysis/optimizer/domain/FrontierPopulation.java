package com.portfolioanalysis.optimizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;

import java.util.Arrays;
import java.util.List;

/**
 * Sampled portfolios in generation order.
 * The position of a point in this list is its index for the lifetime of the population.
 */
@EqualsAndHashCode
public final class FrontierPopulation {

    private static final FrontierPopulation EMPTY = new FrontierPopulation(List.of());

    private final List<PortfolioPoint> points;

    @JsonCreator
    public FrontierPopulation(@JsonProperty("points") List<PortfolioPoint> points) {
        this.points = List.copyOf(points);
    }

    public static FrontierPopulation empty() {
        return EMPTY;
    }

    static FrontierPopulation ofSlots(PortfolioPoint[] slots) {
        return new FrontierPopulation(Arrays.asList(slots));
    }

    public List<PortfolioPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return points.isEmpty();
    }

    public PortfolioPoint get(int index) {
        return points.get(index);
    }

    @Override
    public String toString() {
        return "FrontierPopulation{size=" + points.size() + "}";
    }
}
