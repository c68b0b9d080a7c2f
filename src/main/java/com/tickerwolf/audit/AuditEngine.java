package com.tickerwolf.audit;

import com.tickerwolf.config.Config;
import com.tickerwolf.core.RunTelemetry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Scores every registered table, runs the cross-checks and aggregates them into one report.
 *
 * <p>Table scans and checks are read-only and run on a bounded pool. Results are joined before
 * aggregation and laid out in registration order, so two runs over the same data produce the
 * same report apart from {@code generatedAt}.
 */
public final class AuditEngine {
    private static final Logger LOG = LogManager.getLogger(AuditEngine.class);

    private final AuditStore store;
    private final TableScanner scanner;
    private final CrossCheckEngine crossChecks;
    private final List<TableSpec> tables;
    private final HealthScoring scoring;
    private final int concurrency;
    private final int maxItems;
    private final Clock clock;

    private volatile RunTelemetry lastTelemetry;

    public AuditEngine(
            AuditStore store,
            TableScanner scanner,
            CrossCheckEngine crossChecks,
            List<TableSpec> tables,
            HealthScoring scoring,
            int concurrency,
            int maxItems,
            Clock clock
    ) {
        this.store = store;
        this.scanner = scanner;
        this.crossChecks = crossChecks;
        this.tables = List.copyOf(tables);
        this.scoring = scoring;
        this.concurrency = Math.max(1, concurrency);
        this.maxItems = Math.max(0, maxItems);
        this.clock = clock;
    }

    public static AuditEngine create(Config config, AuditStore store, Clock clock) {
        HealthScoring scoring = HealthScoring.fromConfig(config);
        ZoneId zone = ZoneId.of(config.getString("audit.market_zone", "America/New_York"));
        int maxItems = config.getInt("audit.detail.max_items", 25);
        return new AuditEngine(
                store,
                new TableScanner(store, scoring, clock, zone, maxItems),
                CrossCheckEngine.standard(store),
                TableSpec.defaults(config),
                scoring,
                config.getInt("audit.concurrency", 4),
                maxItems,
                clock
        );
    }

    public AuditReport run(int sampleLimit, boolean detail) throws StoreUnavailableException {
        if (sampleLimit < 0) {
            throw new IllegalArgumentException("sample_limit must be >= 0: " + sampleLimit);
        }
        RunTelemetry telemetry = new RunTelemetry("AUDIT", "manual", clock);
        lastTelemetry = telemetry;

        telemetry.startStep(RunTelemetry.STEP_UNIVERSE);
        long sampled;
        try {
            sampled = store.countSampledTickers(sampleLimit);
        } catch (SQLException e) {
            telemetry.endStep(RunTelemetry.STEP_UNIVERSE, 0, 0, 1, "sql_state=" + e.getSQLState());
            throw new StoreUnavailableException("ticker universe unavailable: " + e.getMessage(), e);
        }
        telemetry.endStep(RunTelemetry.STEP_UNIVERSE, sampleLimit, sampled, 0);
        final long universe = sampled;

        CheckContext context = new CheckContext(sampleLimit, detail, maxItems);
        List<String> labels = crossChecks.labels();
        Map<String, TableAuditResult> tableResults = new HashMap<>();
        Map<String, CrossCheckResult> checkResults = new HashMap<>();

        int total = tables.size() + labels.size();
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(concurrency, total)));
        CompletionService<TaskResult> completion = new ExecutorCompletionService<>(pool);
        telemetry.startStep(RunTelemetry.STEP_TABLE_SCAN);
        telemetry.startStep(RunTelemetry.STEP_CROSS_CHECKS);
        try {
            for (TableSpec spec : tables) {
                completion.submit(() -> scanTable(spec, universe, sampleLimit, detail));
            }
            for (String label : labels) {
                completion.submit(() -> runCheck(label, context));
            }
            for (int i = 0; i < total; i++) {
                Future<TaskResult> future = completion.take();
                TaskResult result;
                try {
                    result = future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.warn("audit task failed unexpectedly err={}", cause.toString());
                    telemetry.incrementErrors(1);
                    continue;
                }
                if (result.fatal != null) {
                    throw result.fatal;
                }
                if (result.table != null) {
                    tableResults.put(result.table.tableName, result.table);
                }
                if (result.check != null) {
                    checkResults.put(result.check.label, result.check);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("audit run interrupted", e);
        } finally {
            pool.shutdownNow();
        }

        Map<String, TableAuditResult> orderedTables = new LinkedHashMap<>();
        List<Double> health = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        long failedTables = 0L;
        for (TableSpec spec : tables) {
            TableAuditResult result = tableResults.get(spec.name);
            if (result == null) {
                result = TableAuditResult.failed(spec.name, "table scan did not complete");
            }
            if (result.isError()) {
                failedTables++;
            }
            orderedTables.put(spec.name, result);
            health.add(result.healthPercent);
            weights.add(scoring.weightOf(spec));
        }
        telemetry.endStep(RunTelemetry.STEP_TABLE_SCAN, tables.size(), tables.size() - failedTables, failedTables);

        Map<String, CrossCheckResult> orderedChecks = new LinkedHashMap<>();
        long failedChecks = 0L;
        for (String label : labels) {
            CrossCheckResult result = checkResults.get(label);
            if (result == null) {
                result = CrossCheckResult.failed(label, "check did not complete");
            }
            if (result.isError()) {
                failedChecks++;
            }
            orderedChecks.put(label, result);
        }
        telemetry.endStep(RunTelemetry.STEP_CROSS_CHECKS, labels.size(), labels.size() - failedChecks, failedChecks);

        telemetry.startStep(RunTelemetry.STEP_AGGREGATE);
        double systemHealth = scoring.systemHealth(health, weights);
        AuditReport report = new AuditReport(clock.instant(), sampleLimit, detail, sampled,
                orderedTables, orderedChecks, systemHealth);
        telemetry.endStep(RunTelemetry.STEP_AGGREGATE, tables.size(), 1, 0);
        telemetry.finish();

        LOG.info("audit complete health={} grade={} failed_tables={} failed_checks={} elapsed_ms={}",
                report.systemHealthPercent, report.grade.label(), failedTables, failedChecks,
                telemetry.totalElapsedMs());
        LOG.debug("audit telemetry\n{}", telemetry.getSummary());
        return report;
    }

    /**
     * Telemetry of the most recent run, or {@code null} before the first run.
     */
    public RunTelemetry lastTelemetry() {
        return lastTelemetry;
    }

    private TaskResult scanTable(TableSpec spec, long sampled, int sampleLimit, boolean detail) {
        try {
            return TaskResult.table(scanner.scan(spec, sampled, sampleLimit, detail));
        } catch (StoreUnavailableException e) {
            return TaskResult.fatal(e);
        } catch (TableScanException e) {
            LOG.warn("table scan failed table={} err={}", e.table(), e.getMessage());
            return TaskResult.table(TableAuditResult.failed(spec.name, e.getMessage()));
        } catch (RuntimeException e) {
            LOG.warn("table scan failed table={} err={}", spec.name, e.toString());
            return TaskResult.table(TableAuditResult.failed(spec.name, "scan failed: " + e));
        }
    }

    private TaskResult runCheck(String label, CheckContext context) {
        try {
            return TaskResult.check(crossChecks.runOne(label, context));
        } catch (StoreUnavailableException e) {
            return TaskResult.fatal(e);
        }
    }

    private static final class TaskResult {
        private final TableAuditResult table;
        private final CrossCheckResult check;
        private final StoreUnavailableException fatal;

        private TaskResult(TableAuditResult table, CrossCheckResult check, StoreUnavailableException fatal) {
            this.table = table;
            this.check = check;
            this.fatal = fatal;
        }

        static TaskResult table(TableAuditResult table) {
            return new TaskResult(table, null, null);
        }

        static TaskResult check(CrossCheckResult check) {
            return new TaskResult(null, check, null);
        }

        static TaskResult fatal(StoreUnavailableException fatal) {
            return new TaskResult(null, null, fatal);
        }
    }
}
