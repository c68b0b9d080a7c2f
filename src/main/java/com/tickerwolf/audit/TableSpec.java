package com.tickerwolf.audit;

import com.tickerwolf.config.Config;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One audited table: its name, the column holding the row date and the expected ingestion cadence.
 */
public final class TableSpec {
    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    public enum TimeKind {
        DATE,
        TIMESTAMP
    }

    public final String name;
    public final String timeColumn;
    public final TimeKind timeKind;
    public final boolean critical;
    public final int cadenceDays;

    public TableSpec(String name, String timeColumn, TimeKind timeKind, boolean critical, int cadenceDays) {
        this.name = requireIdentifier(name);
        this.timeColumn = requireIdentifier(timeColumn);
        this.timeKind = timeKind == null ? TimeKind.DATE : timeKind;
        this.critical = critical;
        this.cadenceDays = Math.max(0, cadenceDays);
    }

    /**
     * The four ticker-keyed tables in presentation order. Price history is critical.
     * {@code audit.cadence_days.<table>} overrides {@code audit.cadence_days} per table.
     */
    public static List<TableSpec> defaults(Config config) {
        int cadence = config.getInt("audit.cadence_days", 4);
        return List.of(
                new TableSpec("ticker_price_histories", "t", TimeKind.TIMESTAMP, true,
                        config.getInt("audit.cadence_days.ticker_price_histories", cadence)),
                new TableSpec("ticker_indicators", "t", TimeKind.TIMESTAMP, false,
                        config.getInt("audit.cadence_days.ticker_indicators", cadence)),
                new TableSpec("ticker_feature_snapshots", "t", TimeKind.DATE, false,
                        config.getInt("audit.cadence_days.ticker_feature_snapshots", cadence)),
                new TableSpec("ticker_feature_metrics", "t", TimeKind.DATE, false,
                        config.getInt("audit.cadence_days.ticker_feature_metrics", cadence))
        );
    }

    static String requireIdentifier(String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("invalid identifier: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return name + (critical ? " (critical)" : "");
    }
}
