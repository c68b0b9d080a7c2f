package com.tickerwolf.audit;

import java.util.List;

/**
 * Raw output of a cross-check: the anomaly count and, with detail, offending identifiers.
 */
public record CheckFinding(long count, List<String> offenders) {
    public CheckFinding {
        offenders = offenders == null ? List.of() : List.copyOf(offenders);
    }

    public static CheckFinding of(long count) {
        return new CheckFinding(count, List.of());
    }
}
