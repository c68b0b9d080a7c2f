package com.tickerwolf.model;

/**
 * Primary key and symbol of a row in {@code tickers}.
 */
public final class TickerRef {
    public final long id;
    public final String symbol;

    public TickerRef(long id, String symbol) {
        this.id = id;
        this.symbol = symbol == null ? "" : symbol.trim();
    }

    @Override
    public String toString() {
        return symbol + "#" + id;
    }
}
