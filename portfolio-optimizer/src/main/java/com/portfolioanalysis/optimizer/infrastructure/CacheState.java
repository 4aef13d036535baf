package com.portfolioanalysis.optimizer.infrastructure;

/**
 * State of a persisted price table with respect to one request.
 * Only {@link #VALID} content is ever served; the other two states force a full refetch.
 */
public enum CacheState {
    ABSENT,
    INVALID,
    VALID
}
