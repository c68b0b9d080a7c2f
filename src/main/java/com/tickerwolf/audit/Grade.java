package com.tickerwolf.audit;

/**
 * Coarse bucket for the overall system health percent.
 */
public enum Grade {
    EXCELLENT("Excellent"),
    GOOD("Good"),
    POOR("Poor");

    private final String label;

    Grade(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Grade fromHealth(double systemHealthPercent) {
        if (systemHealthPercent >= 95.0) {
            return EXCELLENT;
        }
        if (systemHealthPercent >= 80.0) {
            return GOOD;
        }
        return POOR;
    }
}
