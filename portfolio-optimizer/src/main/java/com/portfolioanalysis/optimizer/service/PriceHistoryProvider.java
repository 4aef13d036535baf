package com.portfolioanalysis.optimizer.service;

import java.util.List;

/**
 * Supplies a clean, date-aligned price table for a set of symbols.
 *
 * <p>The returned table has no missing cells and only contains symbols with enough history for the
 * lookback window. Symbols that cannot be served are reported as excluded rather than failing the
 * whole request, so callers must take the active asset set from the table's columns.
 */
public interface PriceHistoryProvider {

    /**
     * Load the price table for the requested symbols.
     *
     * @param symbols requested symbols; blanks and duplicates are ignored
     * @return the table and the excluded symbols
     */
    PriceHistoryResult loadPriceTable(List<String> symbols);
}
