package com.portfolioanalysis.optimizer.infrastructure;

import com.portfolioanalysis.optimizer.domain.PriceTable;

import java.time.LocalDate;
import java.util.List;

/**
 * Persistent cache of the last fetched price table.
 * Validate-before-trust: a lookup either returns a complete table for every requested symbol
 * or reports why it cannot, and a store replaces the previous content wholesale.
 */
public interface PriceTableCache {

    /**
     * Inspect the cached table for the requested symbols.
     *
     * @param symbols   the symbols that must all be present as columns
     * @param windowEnd last day of the lookback window the caller needs; a table fetched for
     *                  another window is INVALID
     * @return the cache state, with the table projected onto the requested symbols when VALID
     */
    CacheLookup lookup(List<String> symbols, LocalDate windowEnd);

    /**
     * Replace the cached table.
     *
     * @param priceTable the freshly fetched table
     * @param windowEnd  last day of the lookback window the table was fetched for
     */
    void store(PriceTable priceTable, LocalDate windowEnd);

    /**
     * Drop the cached table so the next lookup is ABSENT.
     * Called whenever the underlying price history changes.
     */
    void invalidate();
}
