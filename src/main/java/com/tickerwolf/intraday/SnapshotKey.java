package com.tickerwolf.intraday;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Cache key: upper-cased symbol plus the trading date it was fetched for.
 */
public record SnapshotKey(String symbol, LocalDate tradingDate) {
    public SnapshotKey {
        if (symbol == null || symbol.trim().isEmpty()) {
            throw new IllegalArgumentException("symbol must not be empty");
        }
        if (tradingDate == null) {
            throw new IllegalArgumentException("tradingDate must not be null");
        }
        symbol = symbol.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * {@code {namespace}:{SYMBOL}:{YYYY-MM-DD}}
     */
    public String storeKey(String namespace) {
        return namespace + ":" + symbol + ":" + tradingDate;
    }
}
