package com.tickerwolf.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MarketSessionTest {
    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    @Test
    void classifiesExtendedHoursInMarketTime() {
        // January: New York is UTC-5
        assertEquals(MarketSession.OVERNIGHT, MarketSession.classify(Instant.parse("2025-01-02T08:59:00Z"), NEW_YORK));
        assertEquals(MarketSession.PRE, MarketSession.classify(Instant.parse("2025-01-02T09:00:00Z"), NEW_YORK));
        assertEquals(MarketSession.PRE, MarketSession.classify(Instant.parse("2025-01-02T14:29:00Z"), NEW_YORK));
        assertEquals(MarketSession.REGULAR, MarketSession.classify(Instant.parse("2025-01-02T14:30:00Z"), NEW_YORK));
        assertEquals(MarketSession.AFTER, MarketSession.classify(Instant.parse("2025-01-02T21:00:00Z"), NEW_YORK));
        assertEquals(MarketSession.OVERNIGHT, MarketSession.classify(Instant.parse("2025-01-03T01:00:00Z"), NEW_YORK));
    }

    @Test
    void weekendsAndMissingTimestampsAreClosed() {
        assertEquals(MarketSession.CLOSED, MarketSession.classify(Instant.parse("2025-01-04T15:00:00Z"), NEW_YORK));
        assertEquals(MarketSession.CLOSED, MarketSession.classify(null, NEW_YORK));
        assertEquals("closed", MarketSession.CLOSED.code());
    }
}
