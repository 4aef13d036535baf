package com.portfolioanalysis.optimizer.controller.dto;

/**
 * How the expected return of a reported portfolio was computed.
 */
public enum ReturnConvention {
    /** Mean periodic return multiplied by 252, used for sampled portfolios. */
    ANNUALIZED_MEAN,
    /** Weighted compound annual growth rate, used for evaluated allocations. */
    CAGR
}
