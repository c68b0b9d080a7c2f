package com.tickerwolf.output;

import com.tickerwolf.audit.AuditReport;
import com.tickerwolf.audit.CrossCheckResult;
import com.tickerwolf.audit.TableAuditResult;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ReportFixtures {
    static final Instant GENERATED_AT = Instant.parse("2025-03-12T14:00:00Z");

    private ReportFixtures() {
    }

    static AuditReport report(boolean detail) {
        Map<String, TableAuditResult> tables = new LinkedHashMap<>();
        tables.put("ticker_price_histories", new TableAuditResult("ticker_price_histories", 12_345L, 4L, 3L,
                0.75, 1.0, 82.5, LocalDate.of(2025, 3, 11), detail ? List.of("NVDA") : List.of()));
        tables.put("ticker_indicators", TableAuditResult.failed("ticker_indicators", "relation missing"));

        Map<String, CrossCheckResult> cross = new LinkedHashMap<>();
        cross.put("Tickers with no price history",
                CrossCheckResult.ok("Tickers with no price history", 1L, detail ? List.of("NVDA") : List.of()));
        cross.put("Price bars with inconsistent OHLC", CrossCheckResult.ok("Price bars with inconsistent OHLC", 0L, List.of()));
        cross.put("Duplicate metric (ticker_id, t) pairs",
                CrossCheckResult.failed("Duplicate metric (ticker_id, t) pairs", "timeout"));
        return new AuditReport(GENERATED_AT, 0, detail, 4L, tables, cross, 55.0);
    }
}
