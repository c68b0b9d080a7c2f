package com.tickerwolf.audit;

import java.sql.SQLException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory {@link AuditStore} with per-table figures. Sampling is ignored except for the universe size.
 */
final class FakeAuditStore implements AuditStore {
    long universe = 10L;
    final Map<String, Long> rows = new HashMap<>();
    final Map<String, Long> tickersWithRows = new HashMap<>();
    final Map<String, LocalDate> newest = new HashMap<>();
    final Set<String> brokenTables = new HashSet<>();
    final Set<String> unreachableTables = new HashSet<>();
    long duplicates = 0L;

    void table(String name, long rowCount, long withRows, LocalDate newestDate) {
        rows.put(name, rowCount);
        tickersWithRows.put(name, withRows);
        if (newestDate != null) {
            newest.put(name, newestDate);
        }
    }

    @Override
    public long countSampledTickers(int sampleLimit) {
        return sampleLimit > 0 ? Math.min(universe, sampleLimit) : universe;
    }

    @Override
    public long countRows(String table) throws SQLException {
        failIfNeeded(table);
        return rows.getOrDefault(table, 0L);
    }

    @Override
    public long countSampledTickersWithRows(String table, int sampleLimit) throws SQLException {
        failIfNeeded(table);
        return tickersWithRows.getOrDefault(table, 0L);
    }

    @Override
    public long countSampledTickersWithoutRows(String table, int sampleLimit) throws SQLException {
        failIfNeeded(table);
        return Math.max(0L, countSampledTickers(sampleLimit) - tickersWithRows.getOrDefault(table, 0L));
    }

    @Override
    public List<String> listSampledTickersWithoutRows(String table, int sampleLimit, int maxItems) throws SQLException {
        long missing = countSampledTickersWithoutRows(table, sampleLimit);
        List<String> out = new ArrayList<>();
        for (int i = 0; i < missing && i < maxItems; i++) {
            out.add(String.format("T%03d", i));
        }
        return out;
    }

    @Override
    public LocalDate newestRowDate(String table, String column, TableSpec.TimeKind kind, ZoneId zone) throws SQLException {
        failIfNeeded(table);
        return newest.get(table);
    }

    @Override
    public long countOrphanTickers(String left, String right) {
        return 0L;
    }

    @Override
    public List<String> listOrphanTickers(String left, String right, int maxItems) {
        return List.of();
    }

    @Override
    public long countDanglingTickerRefs(String table) {
        return 0L;
    }

    @Override
    public List<String> listDanglingTickerRefs(String table, int maxItems) {
        return List.of();
    }

    @Override
    public long countDuplicateExcess(String table, List<String> keyColumns) {
        return duplicates;
    }

    @Override
    public List<String> listDuplicateKeys(String table, List<String> keyColumns, int maxItems) {
        return duplicates > 0 ? List.of("1@2025-01-02") : List.of();
    }

    @Override
    public long countEmptyJson(String table, String column) {
        return 0L;
    }

    @Override
    public List<String> listEmptyJson(String table, String column, int maxItems) {
        return List.of();
    }

    @Override
    public long countInconsistentOhlc() {
        return 0L;
    }

    @Override
    public List<String> listInconsistentOhlc(int maxItems) {
        return List.of();
    }

    private void failIfNeeded(String table) throws SQLException {
        if (unreachableTables.contains(table)) {
            throw new SQLException("connection refused", "08001");
        }
        if (brokenTables.contains(table)) {
            throw new SQLException("relation \"" + table + "\" does not exist", "42P01");
        }
    }
}
