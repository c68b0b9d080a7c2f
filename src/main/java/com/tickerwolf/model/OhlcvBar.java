package com.tickerwolf.model;

import java.time.Instant;

/**
 * One 1-minute open/high/low/close/volume sample.
 */
public final class OhlcvBar {
    public final Instant timestamp;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final long volume;

    public OhlcvBar(Instant timestamp, double open, double high, double low, double close, long volume) {
        if (timestamp == null) {
            throw new IllegalArgumentException("bar timestamp must not be null");
        }
        this.timestamp = timestamp;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    /**
     * True when prices are finite and non-negative, volume is non-negative and
     * {@code low <= open, close <= high}.
     */
    public boolean isConsistent() {
        if (!isPrice(open) || !isPrice(high) || !isPrice(low) || !isPrice(close) || volume < 0L) {
            return false;
        }
        return low <= open && low <= close && open <= high && close <= high;
    }

    private static boolean isPrice(double value) {
        return Double.isFinite(value) && value >= 0.0;
    }

    @Override
    public String toString() {
        return "OhlcvBar{t=" + timestamp + ", o=" + open + ", h=" + high + ", l=" + low
                + ", c=" + close + ", v=" + volume + "}";
    }
}
