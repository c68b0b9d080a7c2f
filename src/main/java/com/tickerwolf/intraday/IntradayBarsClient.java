package com.tickerwolf.intraday;

import com.tickerwolf.core.diagnostics.Outcome;
import com.tickerwolf.model.OhlcvBar;

import java.time.LocalDate;
import java.util.List;

/**
 * Upstream source of 1-minute bars.
 *
 * <p>Failures are returned, not thrown: {@code NOT_FOUND}, {@code RATE_LIMITED},
 * {@code UNAVAILABLE}, {@code TIMEOUT} or {@code INVALID_PAYLOAD}. On success the bars are
 * ordered by timestamp ascending.
 */
public interface IntradayBarsClient {
    Outcome<List<OhlcvBar>> fetchBars(String symbol, LocalDate tradingDate);
}
