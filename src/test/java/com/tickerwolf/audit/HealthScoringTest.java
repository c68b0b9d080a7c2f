package com.tickerwolf.audit;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HealthScoringTest {
    private static final LocalDate TODAY = LocalDate.of(2025, 3, 12);

    private final HealthScoring scoring = new HealthScoring(0.7, 0.3, 7, 2.0);

    @Test
    void completenessHandlesEmptyUniverse() {
        assertEquals(0.0, scoring.completeness(5, 0), 1e-12);
        assertEquals(0.5, scoring.completeness(5, 10), 1e-12);
        assertEquals(1.0, scoring.completeness(12, 10), 1e-12);
    }

    @Test
    void freshnessStaysFullWithinCadenceThenDecaysLinearly() {
        assertEquals(1.0, scoring.freshness(TODAY, TODAY, 4), 1e-12);
        assertEquals(1.0, scoring.freshness(TODAY.minusDays(4), TODAY, 4), 1e-12);
        assertEquals(1.0 - 1.0 / 7.0, scoring.freshness(TODAY.minusDays(5), TODAY, 4), 1e-12);
        assertEquals(0.0, scoring.freshness(TODAY.minusDays(11), TODAY, 4), 1e-12);
        assertEquals(0.0, scoring.freshness(TODAY.minusDays(40), TODAY, 4), 1e-12);
        assertEquals(0.0, scoring.freshness(null, TODAY, 4), 1e-12);
        // rows dated in the future count as fresh
        assertEquals(1.0, scoring.freshness(TODAY.plusDays(2), TODAY, 4), 1e-12);
    }

    @Test
    void healthBlendsWeightsAndRoundsHalfUp() {
        assertEquals(100.0, scoring.healthPercent(1.0, 1.0), 1e-12);
        assertEquals(0.0, scoring.healthPercent(0.0, 0.0), 1e-12);
        assertEquals(70.0, scoring.healthPercent(1.0, 0.0), 1e-12);
        assertEquals(93.0, scoring.healthPercent(0.9, 1.0), 1e-12);
        assertEquals(82.86, scoring.healthPercent(1.0, 3.0 / 7.0), 1e-12);
        assertEquals(0.01, HealthScoring.round2(0.005), 1e-12);
    }

    @Test
    void statusAndGradeBoundaries() {
        assertEquals(TableStatus.OK, TableStatus.fromHealth(95.0));
        assertEquals(TableStatus.WARN, TableStatus.fromHealth(94.99));
        assertEquals(TableStatus.WARN, TableStatus.fromHealth(80.0));
        assertEquals(TableStatus.FAIL, TableStatus.fromHealth(79.99));

        assertEquals(Grade.EXCELLENT, Grade.fromHealth(95.0));
        assertEquals(Grade.GOOD, Grade.fromHealth(94.99));
        assertEquals(Grade.GOOD, Grade.fromHealth(80.0));
        assertEquals(Grade.POOR, Grade.fromHealth(79.99));
    }

    @Test
    void systemHealthCountsCriticalTablesTwice() {
        TableSpec critical = new TableSpec("ticker_price_histories", "t", TableSpec.TimeKind.TIMESTAMP, true, 4);
        TableSpec plain = new TableSpec("ticker_indicators", "t", TableSpec.TimeKind.TIMESTAMP, false, 4);

        double health = scoring.systemHealth(
                List.of(50.0, 100.0),
                List.of(scoring.weightOf(critical), scoring.weightOf(plain)));

        assertEquals(66.67, health, 1e-12);
        assertEquals(0.0, scoring.systemHealth(List.of(), List.of()), 1e-12);
    }

    @Test
    void invalidWeightsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new HealthScoring(0.0, 0.0, 7, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new HealthScoring(-1.0, 1.0, 7, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new HealthScoring(0.7, 0.3, 7, 0.0));
    }
}
