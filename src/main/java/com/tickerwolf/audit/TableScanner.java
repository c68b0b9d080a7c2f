package com.tickerwolf.audit;

import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Computes row count, completeness and freshness of one table.
 */
public final class TableScanner {
    private final AuditStore store;
    private final HealthScoring scoring;
    private final Clock clock;
    private final ZoneId marketZone;
    private final int maxItems;

    public TableScanner(AuditStore store, HealthScoring scoring, Clock clock, ZoneId marketZone, int maxItems) {
        this.store = store;
        this.scoring = scoring;
        this.clock = clock;
        this.marketZone = marketZone;
        this.maxItems = Math.max(0, maxItems);
    }

    /**
     * @param sampledTickers size of the sampled active universe, computed once per run
     */
    public TableAuditResult scan(TableSpec spec, long sampledTickers, int sampleLimit, boolean detail)
            throws TableScanException, StoreUnavailableException {
        try {
            long rowCount = store.countRows(spec.name);
            long withData = rowCount == 0L ? 0L : store.countSampledTickersWithRows(spec.name, sampleLimit);
            LocalDate newest = rowCount == 0L
                    ? null
                    : store.newestRowDate(spec.name, spec.timeColumn, spec.timeKind, marketZone);
            LocalDate today = LocalDate.now(clock.withZone(marketZone));

            double completeness = scoring.completeness(withData, sampledTickers);
            double freshness = scoring.freshness(newest, today, spec.cadenceDays);
            double health = scoring.healthPercent(completeness, freshness);

            List<String> missing = List.of();
            if (detail && withData < sampledTickers) {
                missing = store.listSampledTickersWithoutRows(spec.name, sampleLimit, maxItems);
            }
            return new TableAuditResult(spec.name, rowCount, sampledTickers, withData,
                    completeness, freshness, health, newest, missing);
        } catch (SQLException e) {
            if (StoreUnavailableException.isConnectionFailure(e)) {
                throw new StoreUnavailableException("store unavailable while scanning " + spec.name, e);
            }
            throw new TableScanException(spec.name, "scan failed: " + e.getMessage(), e);
        }
    }
}
