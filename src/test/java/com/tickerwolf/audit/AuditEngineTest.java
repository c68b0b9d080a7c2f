package com.tickerwolf.audit;

import com.tickerwolf.MutableClock;
import com.tickerwolf.config.Config;
import com.tickerwolf.output.AuditReportJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuditEngineTest {
    private static final String PRICES = "ticker_price_histories";
    private static final String INDICATORS = "ticker_indicators";
    private static final String SNAPSHOTS = "ticker_feature_snapshots";
    private static final String METRICS = "ticker_feature_metrics";
    // 2025-03-12 10:00 in New York
    private static final Instant NOW = Instant.parse("2025-03-12T14:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2025, 3, 12);

    private FakeAuditStore store;
    private MutableClock clock;
    private AuditEngine engine;

    @BeforeEach
    void setUp() {
        store = new FakeAuditStore();
        clock = new MutableClock(NOW);
        engine = AuditEngine.create(Config.defaults(Path.of(".")), store, clock);
    }

    @Test
    void completeAndFreshTablesGradeExcellent() throws Exception {
        for (String table : List.of(PRICES, INDICATORS, SNAPSHOTS, METRICS)) {
            store.table(table, 1_000L, 10L, TODAY);
        }

        AuditReport report = engine.run(0, false);

        assertEquals(List.of(PRICES, INDICATORS, SNAPSHOTS, METRICS), List.copyOf(report.tables.keySet()));
        for (TableAuditResult table : report.tables.values()) {
            assertEquals(100.0, table.healthPercent, 1e-9);
            assertEquals(TableStatus.OK, table.status);
        }
        assertEquals(100.0, report.systemHealthPercent, 1e-9);
        assertEquals(Grade.EXCELLENT, report.grade);
        assertEquals(11, report.cross.size());
    }

    @Test
    void statusesFollowThresholdsAndOverallIsCriticalWeightedMean() throws Exception {
        store.table(PRICES, 900L, 9L, TODAY);
        store.table(INDICATORS, 500L, 10L, TODAY.minusDays(8));
        store.table(SNAPSHOTS, 50L, 5L, TODAY.minusDays(1));
        store.table(METRICS, 100L, 10L, TODAY.minusDays(4));

        AuditReport report = engine.run(0, false);

        TableAuditResult prices = report.tables.get(PRICES);
        assertEquals(0.9, prices.completenessRatio, 1e-9);
        assertEquals(1.0, prices.freshnessRatio, 1e-9);
        assertEquals(93.0, prices.healthPercent, 1e-9);
        assertEquals(TableStatus.WARN, prices.status);

        // 8 days old with a 4 day cadence: 4 of 7 decay days used
        TableAuditResult indicators = report.tables.get(INDICATORS);
        assertEquals(1.0 - 4.0 / 7.0, indicators.freshnessRatio, 1e-9);
        assertEquals(82.86, indicators.healthPercent, 1e-9);
        assertEquals(TableStatus.WARN, indicators.status);

        assertEquals(65.0, report.tables.get(SNAPSHOTS).healthPercent, 1e-9);
        assertEquals(TableStatus.FAIL, report.tables.get(SNAPSHOTS).status);
        assertEquals(100.0, report.tables.get(METRICS).healthPercent, 1e-9);
        assertEquals(TableStatus.OK, report.tables.get(METRICS).status);

        for (TableAuditResult table : report.tables.values()) {
            assertTrue(table.healthPercent >= 0.0 && table.healthPercent <= 100.0);
            assertEquals(TableStatus.fromHealth(table.healthPercent), table.status);
        }

        double expected = (2.0 * 93.0 + 82.86 + 65.0 + 100.0) / 5.0;
        assertEquals(Math.round(expected * 100.0) / 100.0, report.systemHealthPercent, 1e-9);
        assertEquals(Grade.GOOD, report.grade);
    }

    @Test
    void repeatedRunsProduceIdenticalReports() throws Exception {
        store.table(PRICES, 900L, 9L, TODAY);
        store.table(INDICATORS, 500L, 7L, TODAY.minusDays(6));
        store.duplicates = 3L;

        AuditReport first = engine.run(5, true);
        clock.advance(Duration.ofMinutes(3));
        AuditReport second = engine.run(5, true);

        assertEquals(AuditReportJson.toJson(first, false), AuditReportJson.toJson(second, false));
        assertFalse(first.generatedAt.equals(second.generatedAt));
    }

    @Test
    void detailAddsIdentifiersWithoutChangingScores() throws Exception {
        store.table(PRICES, 900L, 7L, TODAY);
        store.duplicates = 2L;

        AuditReport plain = engine.run(0, false);
        AuditReport detailed = engine.run(0, true);

        assertEquals(plain.systemHealthPercent, detailed.systemHealthPercent, 1e-9);
        assertEquals(plain.tables.get(PRICES).healthPercent, detailed.tables.get(PRICES).healthPercent, 1e-9);
        assertTrue(plain.tables.get(PRICES).missingTickers.isEmpty());
        assertEquals(3, detailed.tables.get(PRICES).missingTickers.size());
        assertEquals(List.of("1@2025-01-02"), detailed.cross.get(CrossCheckEngine.DUPLICATE_SNAPSHOTS).offenders);
        assertEquals(2L, detailed.cross.get(CrossCheckEngine.DUPLICATE_SNAPSHOTS).anomalyCount);
    }

    @Test
    void failingTableIsMarkedAndRunContinues() throws Exception {
        for (String table : List.of(PRICES, INDICATORS, SNAPSHOTS, METRICS)) {
            store.table(table, 100L, 10L, TODAY);
        }
        store.brokenTables.add(INDICATORS);

        AuditReport report = engine.run(0, false);

        TableAuditResult broken = report.tables.get(INDICATORS);
        assertEquals(TableStatus.FAIL, broken.status);
        assertEquals(0.0, broken.healthPercent, 1e-9);
        assertNotNull(broken.error);
        assertTrue(broken.error.contains("does not exist"));
        assertNull(report.tables.get(PRICES).error);
        assertEquals(TableStatus.OK, report.tables.get(PRICES).status);
        // 2*100 + 0 + 100 + 100 over 5
        assertEquals(80.0, report.systemHealthPercent, 1e-9);
        assertEquals(Grade.GOOD, report.grade);
        // coverage check on the broken table fails on its own
        assertTrue(report.cross.get(CrossCheckEngine.MISSING_INDICATORS).isError());
        assertFalse(report.cross.get(CrossCheckEngine.NO_PRICE_HISTORY).isError());
    }

    @Test
    void unreachableStoreAbortsTheRun() {
        store.table(PRICES, 100L, 10L, TODAY);
        store.unreachableTables.add(SNAPSHOTS);

        assertThrows(StoreUnavailableException.class, () -> engine.run(0, false));
    }

    @Test
    void emptyTableScoresZero() throws Exception {
        AuditReport report = engine.run(0, false);

        TableAuditResult metrics = report.tables.get(METRICS);
        assertEquals(0L, metrics.rowCount);
        assertEquals(0.0, metrics.completenessRatio, 1e-9);
        assertEquals(0.0, metrics.freshnessRatio, 1e-9);
        assertEquals(TableStatus.FAIL, metrics.status);
        assertEquals(Grade.POOR, report.grade);
    }

    @Test
    void sampleLimitBoundsTheUniverse() throws Exception {
        store.table(PRICES, 1_000L, 4L, TODAY);

        AuditReport report = engine.run(4, false);

        assertEquals(4L, report.sampledTickers);
        assertEquals(1.0, report.tables.get(PRICES).completenessRatio, 1e-9);
        assertEquals(1_000L, report.tables.get(PRICES).rowCount);
    }

    @Test
    void negativeSampleLimitIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> engine.run(-1, false));
    }

    @Test
    void telemetryRecordsEverySection() throws Exception {
        store.table(PRICES, 10L, 10L, TODAY);

        engine.run(0, false);

        String summary = engine.lastTelemetry().getSummary();
        assertTrue(summary.contains("run_mode=AUDIT"));
        assertTrue(summary.contains("TABLE_SCAN"));
        assertTrue(summary.contains("CROSS_CHECKS"));
        assertTrue(summary.contains("AGGREGATE"));
    }
}
