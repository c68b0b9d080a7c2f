package com.tickerwolf.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Most recent bar-set fetched for one symbol and trading date.
 *
 * <p>Instances are immutable. The bar list is sorted by timestamp ascending and can be
 * iterated any number of times.
 */
public final class IntradaySnapshot {
    public final String symbol;
    public final LocalDate tradingDate;
    public final List<OhlcvBar> bars;
    public final Instant fetchedAt;

    public IntradaySnapshot(String symbol, LocalDate tradingDate, List<OhlcvBar> bars, Instant fetchedAt) {
        if (symbol == null || symbol.trim().isEmpty()) {
            throw new IllegalArgumentException("symbol must not be empty");
        }
        if (tradingDate == null || fetchedAt == null) {
            throw new IllegalArgumentException("tradingDate and fetchedAt are required");
        }
        this.symbol = symbol.trim().toUpperCase(Locale.ROOT);
        this.tradingDate = tradingDate;
        this.fetchedAt = fetchedAt;
        List<OhlcvBar> sorted = new ArrayList<>(bars == null ? List.of() : bars);
        sorted.sort(Comparator.comparing(bar -> bar.timestamp));
        this.bars = Collections.unmodifiableList(sorted);
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    /**
     * Timestamp of the latest bar, or {@code null} when there are no bars.
     */
    public Instant asOf() {
        return bars.isEmpty() ? null : bars.get(bars.size() - 1).timestamp;
    }

    public OptionalDouble lastPrice() {
        return bars.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(bars.get(bars.size() - 1).close);
    }

    public OptionalDouble dayHigh() {
        return bars.stream().mapToDouble(bar -> bar.high).max();
    }

    public OptionalDouble dayLow() {
        return bars.stream().mapToDouble(bar -> bar.low).min();
    }

    public long totalVolume() {
        long sum = 0L;
        for (OhlcvBar bar : bars) {
            sum += Math.max(0L, bar.volume);
        }
        return sum;
    }

    /**
     * Session of the latest bar in {@code marketZone}; CLOSED when there are no bars.
     */
    public MarketSession session(ZoneId marketZone) {
        return MarketSession.classify(asOf(), marketZone);
    }

    @Override
    public String toString() {
        return "IntradaySnapshot{symbol=" + symbol + ", tradingDate=" + tradingDate
                + ", bars=" + bars.size() + ", fetchedAt=" + fetchedAt + "}";
    }
}
