package com.tickerwolf.db;

import com.tickerwolf.MutableClock;
import com.tickerwolf.audit.AuditEngine;
import com.tickerwolf.audit.AuditReport;
import com.tickerwolf.audit.CrossCheckEngine;
import com.tickerwolf.audit.Grade;
import com.tickerwolf.audit.TableAuditResult;
import com.tickerwolf.config.Config;
import com.tickerwolf.output.AuditReportJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuditRunIntegrationTest {
    private MutableClock clock;
    private AuditEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        Database database = H2Support.newDatabase();
        H2Support.exec(database,
                "INSERT INTO tickers(id, ticker, active) VALUES (1, 'AAPL', TRUE), (2, 'MSFT', TRUE), (3, 'TSLA', TRUE), (4, 'NVDA', TRUE)",
                "INSERT INTO ticker_price_histories(ticker_id, t, o, h, l, c, v) VALUES "
                        + "(1, TIMESTAMP WITH TIME ZONE '2025-03-11 20:00:00+00', 10, 11, 9, 10.5, 100), "
                        + "(2, TIMESTAMP WITH TIME ZONE '2025-03-11 20:00:00+00', 20, 21, 19, 20.5, 200), "
                        + "(3, TIMESTAMP WITH TIME ZONE '2025-03-11 20:00:00+00', 30, 31, 29, 30.5, 300)",
                "INSERT INTO ticker_indicators(ticker_id, t, indicator, val) VALUES "
                        + "(1, TIMESTAMP WITH TIME ZONE '2025-03-11 20:00:00+00', 'rsi14', 55), "
                        + "(2, TIMESTAMP WITH TIME ZONE '2025-03-11 20:00:00+00', 'rsi14', 61)",
                "INSERT INTO ticker_feature_snapshots(ticker_id, t, indicators) VALUES "
                        + "(1, DATE '2025-03-11', '{\"rsi\":55}'), (1, DATE '2025-03-11', '{\"rsi\":55}'), "
                        + "(2, DATE '2025-03-11', '{}')",
                "INSERT INTO ticker_feature_metrics(ticker_id, t, sharpe_60) VALUES (1, DATE '2025-03-11', 1.2)"
        );
        clock = new MutableClock(Instant.parse("2025-03-12T14:00:00Z"));
        engine = AuditEngine.create(Config.defaults(Path.of(".")), new JdbcAuditStore(database), clock);
    }

    @Test
    void auditOverSeededStore() throws Exception {
        AuditReport report = engine.run(0, true);

        TableAuditResult prices = report.tables.get("ticker_price_histories");
        assertEquals(3L, prices.rowCount);
        assertEquals(0.75, prices.completenessRatio, 1e-9);
        assertEquals(1.0, prices.freshnessRatio, 1e-9);
        assertEquals(82.5, prices.healthPercent, 1e-9);
        assertEquals(List.of("NVDA"), prices.missingTickers);

        assertEquals(1L, report.cross.get(CrossCheckEngine.NO_PRICE_HISTORY).anomalyCount);
        assertEquals(3L, report.cross.get(CrossCheckEngine.MISSING_METRICS).anomalyCount);
        assertEquals(1L, report.cross.get(CrossCheckEngine.DUPLICATE_SNAPSHOTS).anomalyCount);
        assertEquals(1L, report.cross.get(CrossCheckEngine.SNAPSHOTS_WITHOUT_METRICS).anomalyCount);
        assertEquals(1L, report.cross.get(CrossCheckEngine.EMPTY_SNAPSHOT_INDICATORS).anomalyCount);
        assertEquals(0L, report.cross.get(CrossCheckEngine.INCONSISTENT_OHLC).anomalyCount);
        assertEquals(0L, report.failedChecks());
        assertEquals(Grade.POOR, report.grade);
    }

    @Test
    void unchangedStoreGivesIdenticalReports() throws Exception {
        AuditReport first = engine.run(0, false);
        clock.advance(Duration.ofSeconds(30));
        AuditReport second = engine.run(0, false);

        assertEquals(AuditReportJson.toJson(first, false), AuditReportJson.toJson(second, false));
        assertFalse(AuditReportJson.toJson(first).equals(AuditReportJson.toJson(second)));
    }

    @Test
    void sampleLimitCoversFirstTickersOnly() throws Exception {
        AuditReport report = engine.run(2, false);

        assertEquals(2L, report.sampledTickers);
        assertEquals(1.0, report.tables.get("ticker_price_histories").completenessRatio, 1e-9);
        assertEquals(3L, report.tables.get("ticker_price_histories").rowCount);
        assertEquals(0L, report.cross.get(CrossCheckEngine.NO_PRICE_HISTORY).anomalyCount);
        assertEquals(1L, report.cross.get(CrossCheckEngine.MISSING_METRICS).anomalyCount);
    }
}
