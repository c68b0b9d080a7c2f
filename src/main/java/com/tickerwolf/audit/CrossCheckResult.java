package com.tickerwolf.audit;

import java.util.List;

/**
 * Anomaly count of one cross-check, or an error marker when the check itself failed.
 */
public final class CrossCheckResult {
    public final String label;
    public final Long anomalyCount;
    public final List<String> offenders;
    public final String error;

    private CrossCheckResult(String label, Long anomalyCount, List<String> offenders, String error) {
        this.label = label;
        this.anomalyCount = anomalyCount;
        this.offenders = offenders == null ? List.of() : List.copyOf(offenders);
        this.error = error;
    }

    public static CrossCheckResult ok(String label, long anomalyCount, List<String> offenders) {
        if (anomalyCount < 0L) {
            throw new IllegalArgumentException("anomaly count must be >= 0: " + anomalyCount);
        }
        return new CrossCheckResult(label, anomalyCount, offenders, null);
    }

    public static CrossCheckResult failed(String label, String error) {
        String note = error == null || error.isBlank() ? "check failed" : error.trim();
        return new CrossCheckResult(label, null, List.of(), note);
    }

    public boolean isError() {
        return error != null;
    }

    @Override
    public String toString() {
        return isError() ? label + ": ERROR(" + error + ")" : label + ": " + anomalyCount;
    }
}
