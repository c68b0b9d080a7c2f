package com.tickerwolf.audit;

import java.sql.SQLException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Read-only queries the audit runs against the relational store.
 *
 * <p>"Sampled" queries are restricted to the first {@code sampleLimit} active tickers by id,
 * or to every active ticker when {@code sampleLimit} is 0. Row counts are always exact.
 * Offender lists are sorted and hold at most {@code maxItems} entries.
 */
public interface AuditStore {

    long countSampledTickers(int sampleLimit) throws SQLException;

    long countRows(String table) throws SQLException;

    long countSampledTickersWithRows(String table, int sampleLimit) throws SQLException;

    long countSampledTickersWithoutRows(String table, int sampleLimit) throws SQLException;

    List<String> listSampledTickersWithoutRows(String table, int sampleLimit, int maxItems) throws SQLException;

    /**
     * Date of the newest row in {@code table}, as seen in {@code zone}; {@code null} for an empty table.
     */
    LocalDate newestRowDate(String table, String column, TableSpec.TimeKind kind, ZoneId zone) throws SQLException;

    long countOrphanTickers(String left, String right) throws SQLException;

    List<String> listOrphanTickers(String left, String right, int maxItems) throws SQLException;

    long countDanglingTickerRefs(String table) throws SQLException;

    List<String> listDanglingTickerRefs(String table, int maxItems) throws SQLException;

    /**
     * Rows beyond the first in every group sharing the same {@code keyColumns} values.
     */
    long countDuplicateExcess(String table, List<String> keyColumns) throws SQLException;

    List<String> listDuplicateKeys(String table, List<String> keyColumns, int maxItems) throws SQLException;

    long countEmptyJson(String table, String column) throws SQLException;

    List<String> listEmptyJson(String table, String column, int maxItems) throws SQLException;

    long countInconsistentOhlc() throws SQLException;

    List<String> listInconsistentOhlc(int maxItems) throws SQLException;
}
