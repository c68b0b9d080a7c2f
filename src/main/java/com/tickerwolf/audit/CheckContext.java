package com.tickerwolf.audit;

/**
 * Parameters shared by every cross-check of one run.
 */
public record CheckContext(int sampleLimit, boolean detail, int maxItems) {
    public static final CheckContext DEFAULT = new CheckContext(0, false, 25);

    public CheckContext {
        if (sampleLimit < 0) {
            throw new IllegalArgumentException("sampleLimit must be >= 0");
        }
        maxItems = Math.max(0, maxItems);
    }
}
