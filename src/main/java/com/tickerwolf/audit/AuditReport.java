package com.tickerwolf.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one audit run. Map iteration follows table and check registration order.
 */
public final class AuditReport {
    public final Instant generatedAt;
    public final int sampleLimit;
    public final boolean detail;
    public final long sampledTickers;
    public final Map<String, TableAuditResult> tables;
    public final Map<String, CrossCheckResult> cross;
    public final double systemHealthPercent;
    public final Grade grade;

    public AuditReport(
            Instant generatedAt,
            int sampleLimit,
            boolean detail,
            long sampledTickers,
            Map<String, TableAuditResult> tables,
            Map<String, CrossCheckResult> cross,
            double systemHealthPercent
    ) {
        this.generatedAt = generatedAt;
        this.sampleLimit = sampleLimit;
        this.detail = detail;
        this.sampledTickers = sampledTickers;
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
        this.cross = Collections.unmodifiableMap(new LinkedHashMap<>(cross));
        this.systemHealthPercent = systemHealthPercent;
        this.grade = Grade.fromHealth(systemHealthPercent);
    }

    public long failedTables() {
        return tables.values().stream().filter(t -> t.status == TableStatus.FAIL).count();
    }

    public long failedChecks() {
        return cross.values().stream().filter(CrossCheckResult::isError).count();
    }
}
