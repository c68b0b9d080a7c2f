package com.tickerwolf.audit;

/**
 * Per-table health bucket.
 */
public enum TableStatus {
    OK,
    WARN,
    FAIL;

    public static TableStatus fromHealth(double healthPercent) {
        if (healthPercent >= 95.0) {
            return OK;
        }
        if (healthPercent >= 80.0) {
            return WARN;
        }
        return FAIL;
    }
}
