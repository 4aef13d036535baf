package com.portfolioanalysis.optimizer.domain;

import java.util.Locale;

/**
 * Canonical form of ticker symbols: trimmed and upper-cased.
 */
public final class Symbols {

    private Symbols() {
    }

    /**
     * @return the canonical symbol, or null for a null or blank input
     */
    public static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return null;
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
