package com.tickerwolf.audit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered registry of independent cross-checks.
 *
 * <p>A failing check yields an error marker and never stops the others. Only a lost store
 * connection escapes as {@link StoreUnavailableException}.
 */
public final class CrossCheckEngine {
    private static final Logger LOG = LogManager.getLogger(CrossCheckEngine.class);

    public static final String NO_PRICE_HISTORY = "Tickers with no price history";
    public static final String MISSING_INDICATORS = "Tickers missing indicators";
    public static final String MISSING_SNAPSHOTS = "Tickers missing snapshots";
    public static final String MISSING_METRICS = "Tickers missing metrics";
    public static final String SNAPSHOTS_WITHOUT_METRICS = "Snapshots without matching metrics";
    public static final String METRICS_WITHOUT_SNAPSHOTS = "Metrics without matching snapshots";
    public static final String DANGLING_PRICE_ROWS = "Price rows referencing unknown tickers";
    public static final String DUPLICATE_SNAPSHOTS = "Duplicate snapshot (ticker_id, t) pairs";
    public static final String DUPLICATE_METRICS = "Duplicate metric (ticker_id, t) pairs";
    public static final String EMPTY_SNAPSHOT_INDICATORS = "Snapshots with empty indicators JSON";
    public static final String INCONSISTENT_OHLC = "Price bars with inconsistent OHLC";

    private static final List<String> TICKER_DATE_KEY = List.of("ticker_id", "t");

    private final Map<String, CrossCheck> checks = new LinkedHashMap<>();

    public CrossCheckEngine register(String label, CrossCheck check) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("check label must not be empty");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null: " + label);
        }
        if (checks.putIfAbsent(label, check) != null) {
            throw new IllegalArgumentException("duplicate check label: " + label);
        }
        return this;
    }

    public List<String> labels() {
        return new ArrayList<>(checks.keySet());
    }

    public Map<String, CrossCheckResult> runAll() throws StoreUnavailableException {
        return runAll(CheckContext.DEFAULT);
    }

    public Map<String, CrossCheckResult> runAll(CheckContext context) throws StoreUnavailableException {
        Map<String, CrossCheckResult> out = new LinkedHashMap<>();
        for (String label : checks.keySet()) {
            out.put(label, runOne(label, context));
        }
        return out;
    }

    public CrossCheckResult runOne(String label, CheckContext context) throws StoreUnavailableException {
        CrossCheck check = checks.get(label);
        if (check == null) {
            throw new IllegalArgumentException("unknown check: " + label);
        }
        try {
            CheckFinding finding = check.evaluate(context);
            if (finding == null) {
                return CrossCheckResult.failed(label, "check returned no result");
            }
            if (finding.count() < 0L) {
                return CrossCheckResult.failed(label, "negative anomaly count " + finding.count());
            }
            List<String> offenders = context.detail() ? limit(finding.offenders(), context.maxItems()) : List.of();
            return CrossCheckResult.ok(label, finding.count(), offenders);
        } catch (SQLException e) {
            if (StoreUnavailableException.isConnectionFailure(e)) {
                throw new StoreUnavailableException("store unavailable during check '" + label + "'", e);
            }
            LOG.warn("cross-check failed label='{}' sql_state={} err={}", label, e.getSQLState(), e.getMessage());
            return CrossCheckResult.failed(label, describe(e));
        } catch (RuntimeException e) {
            LOG.warn("cross-check failed label='{}' err={}", label, e.toString());
            return CrossCheckResult.failed(label, describe(e));
        }
    }

    /**
     * The standard consistency rules over the ticker tables, in presentation order.
     */
    public static CrossCheckEngine standard(AuditStore store) {
        CrossCheckEngine engine = new CrossCheckEngine();
        engine.register(NO_PRICE_HISTORY, ctx -> missing(store, "ticker_price_histories", ctx));
        engine.register(MISSING_INDICATORS, ctx -> missing(store, "ticker_indicators", ctx));
        engine.register(MISSING_SNAPSHOTS, ctx -> missing(store, "ticker_feature_snapshots", ctx));
        engine.register(MISSING_METRICS, ctx -> missing(store, "ticker_feature_metrics", ctx));
        engine.register(SNAPSHOTS_WITHOUT_METRICS,
                ctx -> orphans(store, "ticker_feature_snapshots", "ticker_feature_metrics", ctx));
        engine.register(METRICS_WITHOUT_SNAPSHOTS,
                ctx -> orphans(store, "ticker_feature_metrics", "ticker_feature_snapshots", ctx));
        engine.register(DANGLING_PRICE_ROWS, ctx -> new CheckFinding(
                store.countDanglingTickerRefs("ticker_price_histories"),
                ctx.detail() ? store.listDanglingTickerRefs("ticker_price_histories", ctx.maxItems()) : List.of()));
        engine.register(DUPLICATE_SNAPSHOTS, ctx -> duplicates(store, "ticker_feature_snapshots", ctx));
        engine.register(DUPLICATE_METRICS, ctx -> duplicates(store, "ticker_feature_metrics", ctx));
        engine.register(EMPTY_SNAPSHOT_INDICATORS, ctx -> new CheckFinding(
                store.countEmptyJson("ticker_feature_snapshots", "indicators"),
                ctx.detail() ? store.listEmptyJson("ticker_feature_snapshots", "indicators", ctx.maxItems()) : List.of()));
        engine.register(INCONSISTENT_OHLC, ctx -> new CheckFinding(
                store.countInconsistentOhlc(),
                ctx.detail() ? store.listInconsistentOhlc(ctx.maxItems()) : List.of()));
        return engine;
    }

    private static CheckFinding missing(AuditStore store, String table, CheckContext ctx) throws SQLException {
        long count = store.countSampledTickersWithoutRows(table, ctx.sampleLimit());
        List<String> offenders = ctx.detail() && count > 0L
                ? store.listSampledTickersWithoutRows(table, ctx.sampleLimit(), ctx.maxItems())
                : List.of();
        return new CheckFinding(count, offenders);
    }

    private static CheckFinding orphans(AuditStore store, String left, String right, CheckContext ctx) throws SQLException {
        long count = store.countOrphanTickers(left, right);
        List<String> offenders = ctx.detail() && count > 0L
                ? store.listOrphanTickers(left, right, ctx.maxItems())
                : List.of();
        return new CheckFinding(count, offenders);
    }

    private static CheckFinding duplicates(AuditStore store, String table, CheckContext ctx) throws SQLException {
        long count = store.countDuplicateExcess(table, TICKER_DATE_KEY);
        List<String> offenders = ctx.detail() && count > 0L
                ? store.listDuplicateKeys(table, TICKER_DATE_KEY, ctx.maxItems())
                : List.of();
        return new CheckFinding(count, offenders);
    }

    private static List<String> limit(List<String> values, int maxItems) {
        if (values.size() <= maxItems) {
            return values;
        }
        return values.subList(0, maxItems);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        String text = message == null || message.isBlank() ? e.getClass().getSimpleName() : message.trim();
        return text.length() <= 240 ? text : text.substring(0, 240) + "...";
    }
}
