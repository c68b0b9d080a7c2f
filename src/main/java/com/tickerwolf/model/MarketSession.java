package com.tickerwolf.model;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Extended-hours session buckets in market-local time.
 */
public enum MarketSession {
    PRE("pre", "Pre-market"),
    REGULAR("regular", "Regular session"),
    AFTER("after", "After hours"),
    OVERNIGHT("overnight", "Overnight session"),
    CLOSED("closed", "Market closed");

    private final String code;
    private final String label;

    MarketSession(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    /**
     * overnight 20:00-04:00, pre 04:00-09:30, regular 09:30-16:00, after 16:00-20:00.
     * Weekends are CLOSED.
     */
    public static MarketSession classify(Instant timestamp, ZoneId marketZone) {
        if (timestamp == null || marketZone == null) {
            return CLOSED;
        }
        ZonedDateTime local = timestamp.atZone(marketZone);
        switch (local.getDayOfWeek()) {
            case SATURDAY:
            case SUNDAY:
                return CLOSED;
            default:
                break;
        }
        int hhmm = local.getHour() * 100 + local.getMinute();
        if (hhmm >= 2000 || hhmm < 400) {
            return OVERNIGHT;
        }
        if (hhmm < 930) {
            return PRE;
        }
        if (hhmm < 1600) {
            return REGULAR;
        }
        return AFTER;
    }
}
