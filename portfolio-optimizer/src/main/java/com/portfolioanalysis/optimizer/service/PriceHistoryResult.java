package com.portfolioanalysis.optimizer.service;

import com.portfolioanalysis.optimizer.domain.PriceTable;
import lombok.Value;

import java.util.List;

/**
 * Price table produced for a request, plus the requested symbols that were left out of it.
 */
@Value
public class PriceHistoryResult {

    PriceTable priceTable;
    List<String> excludedSymbols;
    boolean fromCache;
}
