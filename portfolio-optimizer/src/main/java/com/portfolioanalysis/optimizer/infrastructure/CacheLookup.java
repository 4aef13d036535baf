package com.portfolioanalysis.optimizer.infrastructure;

import com.portfolioanalysis.optimizer.domain.PriceTable;
import lombok.Value;

/**
 * Outcome of a cache lookup. The table is present only when the state is VALID.
 */
@Value
public class CacheLookup {

    CacheState state;
    PriceTable priceTable;
    String reason;

    public static CacheLookup absent() {
        return new CacheLookup(CacheState.ABSENT, null, "no cached price table");
    }

    public static CacheLookup invalid(String reason) {
        return new CacheLookup(CacheState.INVALID, null, reason);
    }

    public static CacheLookup valid(PriceTable priceTable) {
        return new CacheLookup(CacheState.VALID, priceTable, null);
    }
}
