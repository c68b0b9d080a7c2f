package com.tickerwolf.db.mybatis;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Read-only audit queries. Table and column names are substituted verbatim ({@code ${...}}),
 * callers must pass validated identifiers only.
 */
public interface AuditMapper {
    String SAMPLE = "(SELECT id, ticker FROM tickers WHERE active = TRUE ORDER BY id"
            + "<if test='sampleLimit &gt; 0'> LIMIT #{sampleLimit}</if>) s";
    String BAD_OHLC = "(o IS NULL OR h IS NULL OR l IS NULL OR c IS NULL " +
            "OR l > o OR l > c OR o > h OR c > h OR l < 0 OR COALESCE(v, 0) < 0)";

    @Select("<script>SELECT COUNT(*) FROM " + SAMPLE + "</script>")
    long countSampledTickers(@Param("sampleLimit") int sampleLimit);

    @Select("SELECT COUNT(*) FROM ${table}")
    long countRows(@Param("table") String table);

    @Select("<script>SELECT COUNT(*) FROM " + SAMPLE
            + " WHERE EXISTS (SELECT 1 FROM ${table} x WHERE x.ticker_id = s.id)</script>")
    long countSampledTickersWithRows(@Param("table") String table, @Param("sampleLimit") int sampleLimit);

    @Select("<script>SELECT COUNT(*) FROM " + SAMPLE
            + " WHERE NOT EXISTS (SELECT 1 FROM ${table} x WHERE x.ticker_id = s.id)</script>")
    long countSampledTickersWithoutRows(@Param("table") String table, @Param("sampleLimit") int sampleLimit);

    @Select("<script>SELECT s.ticker FROM " + SAMPLE
            + " WHERE NOT EXISTS (SELECT 1 FROM ${table} x WHERE x.ticker_id = s.id)"
            + " ORDER BY s.ticker LIMIT #{maxItems}</script>")
    List<String> listSampledTickersWithoutRows(
            @Param("table") String table,
            @Param("sampleLimit") int sampleLimit,
            @Param("maxItems") int maxItems
    );

    @Select("SELECT MAX(${column}) FROM ${table}")
    LocalDate selectNewestDate(@Param("table") String table, @Param("column") String column);

    @Select("SELECT MAX(${column}) FROM ${table}")
    OffsetDateTime selectNewestTimestamp(@Param("table") String table, @Param("column") String column);

    @Select("SELECT COUNT(DISTINCT l.ticker_id) FROM ${left} l " +
            "WHERE NOT EXISTS (SELECT 1 FROM ${right} r WHERE r.ticker_id = l.ticker_id)")
    long countOrphanTickers(@Param("left") String left, @Param("right") String right);

    @Select("SELECT DISTINCT l.ticker_id FROM ${left} l " +
            "WHERE NOT EXISTS (SELECT 1 FROM ${right} r WHERE r.ticker_id = l.ticker_id) " +
            "ORDER BY l.ticker_id LIMIT #{maxItems}")
    List<Long> listOrphanTickers(
            @Param("left") String left,
            @Param("right") String right,
            @Param("maxItems") int maxItems
    );

    @Select("SELECT COUNT(*) FROM ${table} c " +
            "WHERE NOT EXISTS (SELECT 1 FROM tickers t WHERE t.id = c.ticker_id)")
    long countDanglingTickerRefs(@Param("table") String table);

    @Select("SELECT c.id FROM ${table} c " +
            "WHERE NOT EXISTS (SELECT 1 FROM tickers t WHERE t.id = c.ticker_id) " +
            "ORDER BY c.id LIMIT #{maxItems}")
    List<Long> listDanglingTickerRefs(@Param("table") String table, @Param("maxItems") int maxItems);

    @Select("SELECT COALESCE(SUM(d.n - 1), 0) FROM " +
            "(SELECT COUNT(*) AS n FROM ${table} GROUP BY ${keyColumns} HAVING COUNT(*) > 1) d")
    long countDuplicateExcess(@Param("table") String table, @Param("keyColumns") String keyColumns);

    @Select("SELECT ${keyLabel} AS k FROM ${table} GROUP BY ${keyColumns} HAVING COUNT(*) > 1 " +
            "ORDER BY k LIMIT #{maxItems}")
    List<String> listDuplicateKeys(
            @Param("table") String table,
            @Param("keyColumns") String keyColumns,
            @Param("keyLabel") String keyLabel,
            @Param("maxItems") int maxItems
    );

    @Select("SELECT COUNT(*) FROM ${table} WHERE ${column} IS NULL " +
            "OR TRIM(CAST(${column} AS VARCHAR)) IN ('', '{}', '[]', 'null')")
    long countEmptyJson(@Param("table") String table, @Param("column") String column);

    @Select("SELECT id FROM ${table} WHERE ${column} IS NULL " +
            "OR TRIM(CAST(${column} AS VARCHAR)) IN ('', '{}', '[]', 'null') " +
            "ORDER BY id LIMIT #{maxItems}")
    List<Long> listEmptyJson(
            @Param("table") String table,
            @Param("column") String column,
            @Param("maxItems") int maxItems
    );

    @Select("SELECT COUNT(*) FROM ticker_price_histories WHERE " + BAD_OHLC)
    long countInconsistentOhlc();

    @Select("SELECT id FROM ticker_price_histories WHERE " + BAD_OHLC + " ORDER BY id LIMIT #{maxItems}")
    List<Long> listInconsistentOhlc(@Param("maxItems") int maxItems);
}
