package com.tickerwolf.audit;

import java.time.LocalDate;
import java.util.List;

/**
 * Scores for one audited table. Immutable.
 */
public final class TableAuditResult {
    public final String tableName;
    public final long rowCount;
    public final long sampledTickers;
    public final long tickersWithData;
    public final double completenessRatio;
    public final double freshnessRatio;
    public final double healthPercent;
    public final TableStatus status;
    public final LocalDate newestRowDate;
    public final List<String> missingTickers;
    public final String error;

    public TableAuditResult(
            String tableName,
            long rowCount,
            long sampledTickers,
            long tickersWithData,
            double completenessRatio,
            double freshnessRatio,
            double healthPercent,
            LocalDate newestRowDate,
            List<String> missingTickers
    ) {
        this(tableName, rowCount, sampledTickers, tickersWithData, completenessRatio, freshnessRatio,
                healthPercent, TableStatus.fromHealth(healthPercent), newestRowDate, missingTickers, null);
    }

    private TableAuditResult(
            String tableName,
            long rowCount,
            long sampledTickers,
            long tickersWithData,
            double completenessRatio,
            double freshnessRatio,
            double healthPercent,
            TableStatus status,
            LocalDate newestRowDate,
            List<String> missingTickers,
            String error
    ) {
        this.tableName = tableName;
        this.rowCount = Math.max(0L, rowCount);
        this.sampledTickers = Math.max(0L, sampledTickers);
        this.tickersWithData = Math.max(0L, tickersWithData);
        this.completenessRatio = completenessRatio;
        this.freshnessRatio = freshnessRatio;
        this.healthPercent = healthPercent;
        this.status = status;
        this.newestRowDate = newestRowDate;
        this.missingTickers = missingTickers == null ? List.of() : List.copyOf(missingTickers);
        this.error = error;
    }

    /**
     * A table whose scoring failed: health 0, status FAIL and the failure text as error note.
     */
    public static TableAuditResult failed(String tableName, String error) {
        String note = error == null || error.isBlank() ? "table scan failed" : error.trim();
        return new TableAuditResult(tableName, 0L, 0L, 0L, 0.0, 0.0, 0.0, TableStatus.FAIL, null, List.of(), note);
    }

    public boolean isError() {
        return error != null;
    }

    @Override
    public String toString() {
        return "TableAuditResult{" + tableName + ", rows=" + rowCount + ", health=" + healthPercent
                + ", status=" + status + (error == null ? "" : ", error=" + error) + "}";
    }
}
