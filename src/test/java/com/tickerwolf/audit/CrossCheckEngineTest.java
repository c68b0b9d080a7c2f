package com.tickerwolf.audit;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrossCheckEngineTest {

    @Test
    void resultsKeepRegistrationOrder() throws Exception {
        CrossCheckEngine engine = new CrossCheckEngine()
                .register("b", ctx -> CheckFinding.of(2))
                .register("a", ctx -> CheckFinding.of(0))
                .register("c", ctx -> CheckFinding.of(7));

        Map<String, CrossCheckResult> results = engine.runAll();

        assertEquals(List.of("b", "a", "c"), List.copyOf(results.keySet()));
        assertEquals(2L, results.get("b").anomalyCount);
        assertEquals(0L, results.get("a").anomalyCount);
    }

    @Test
    void failingCheckDoesNotStopTheOthers() throws Exception {
        CrossCheckEngine engine = new CrossCheckEngine()
                .register("first", ctx -> CheckFinding.of(1))
                .register("broken", ctx -> {
                    throw new SQLException("column \"indicators\" does not exist", "42703");
                })
                .register("runtime", ctx -> {
                    throw new IllegalStateException("boom");
                })
                .register("last", ctx -> CheckFinding.of(3));

        Map<String, CrossCheckResult> results = engine.runAll();

        assertEquals(4, results.size());
        assertTrue(results.get("broken").isError());
        assertNull(results.get("broken").anomalyCount);
        assertTrue(results.get("broken").error.contains("does not exist"));
        assertTrue(results.get("runtime").isError());
        assertFalse(results.get("first").isError());
        assertEquals(3L, results.get("last").anomalyCount);
    }

    @Test
    void lostConnectionEscalates() {
        CrossCheckEngine engine = new CrossCheckEngine()
                .register("ok", ctx -> CheckFinding.of(1))
                .register("down", ctx -> {
                    throw new SQLException("connection reset", "08006");
                });

        assertThrows(StoreUnavailableException.class, engine::runAll);
    }

    @Test
    void negativeOrMissingFindingsBecomeErrors() throws Exception {
        CrossCheckEngine engine = new CrossCheckEngine()
                .register("negative", ctx -> CheckFinding.of(-1))
                .register("nothing", ctx -> null);

        Map<String, CrossCheckResult> results = engine.runAll();

        assertTrue(results.get("negative").isError());
        assertTrue(results.get("nothing").isError());
    }

    @Test
    void offendersAreReportedOnlyWithDetailAndCapped() throws Exception {
        CrossCheckEngine engine = new CrossCheckEngine()
                .register("dupes", ctx -> new CheckFinding(4, List.of("a", "b", "c", "d")));

        CrossCheckResult plain = engine.runOne("dupes", new CheckContext(0, false, 2));
        CrossCheckResult detailed = engine.runOne("dupes", new CheckContext(0, true, 2));

        assertTrue(plain.offenders.isEmpty());
        assertEquals(List.of("a", "b"), detailed.offenders);
        assertEquals(4L, detailed.anomalyCount);
    }

    @Test
    void labelsMustBeUnique() {
        CrossCheckEngine engine = new CrossCheckEngine().register("x", ctx -> CheckFinding.of(0));

        assertThrows(IllegalArgumentException.class, () -> engine.register("x", ctx -> CheckFinding.of(1)));
        assertThrows(IllegalArgumentException.class, () -> engine.register(" ", ctx -> CheckFinding.of(1)));
        assertThrows(IllegalArgumentException.class, () -> engine.runOne("missing", CheckContext.DEFAULT));
    }

    @Test
    void standardRegistryCoversEveryRule() throws Exception {
        CrossCheckEngine engine = CrossCheckEngine.standard(new FakeAuditStore());

        List<String> labels = engine.labels();
        assertEquals(11, labels.size());
        assertEquals(CrossCheckEngine.NO_PRICE_HISTORY, labels.get(0));
        assertEquals(CrossCheckEngine.INCONSISTENT_OHLC, labels.get(10));
        // every active ticker lacks price history in an empty fake store
        assertEquals(10L, engine.runOne(CrossCheckEngine.NO_PRICE_HISTORY, CheckContext.DEFAULT).anomalyCount);
    }
}
