package com.tickerwolf.db;

import com.tickerwolf.audit.AuditStore;
import com.tickerwolf.audit.TableSpec;
import com.tickerwolf.db.mybatis.AuditMapper;
import com.tickerwolf.db.mybatis.MyBatisSupport;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * {@link AuditStore} over the ticker tables through {@link AuditMapper}.
 *
 * <p>Only the known ticker tables and simple lower-case column names are accepted, because
 * they are spliced into the statements as identifiers.
 */
public final class JdbcAuditStore implements AuditStore {
    private static final Set<String> TABLES = Set.of(
            "tickers",
            "ticker_price_histories",
            "ticker_indicators",
            "ticker_feature_snapshots",
            "ticker_feature_metrics"
    );
    private static final Pattern COLUMN = Pattern.compile("[a-z_][a-z0-9_]*");

    private final Database database;

    public JdbcAuditStore(Database database) {
        this.database = database;
    }

    @Override
    public long countSampledTickers(int sampleLimit) throws SQLException {
        return query(mapper -> mapper.countSampledTickers(sampleLimit));
    }

    @Override
    public long countRows(String table) throws SQLException {
        String t = table(table);
        return query(mapper -> mapper.countRows(t));
    }

    @Override
    public long countSampledTickersWithRows(String table, int sampleLimit) throws SQLException {
        String t = table(table);
        return query(mapper -> mapper.countSampledTickersWithRows(t, sampleLimit));
    }

    @Override
    public long countSampledTickersWithoutRows(String table, int sampleLimit) throws SQLException {
        String t = table(table);
        return query(mapper -> mapper.countSampledTickersWithoutRows(t, sampleLimit));
    }

    @Override
    public List<String> listSampledTickersWithoutRows(String table, int sampleLimit, int maxItems) throws SQLException {
        String t = table(table);
        return query(mapper -> mapper.listSampledTickersWithoutRows(t, sampleLimit, Math.max(0, maxItems)));
    }

    @Override
    public LocalDate newestRowDate(String table, String column, TableSpec.TimeKind kind, ZoneId zone) throws SQLException {
        String t = table(table);
        String c = column(column);
        if (kind == TableSpec.TimeKind.TIMESTAMP) {
            OffsetDateTime newest = query(mapper -> mapper.selectNewestTimestamp(t, c));
            return newest == null ? null : newest.atZoneSameInstant(zone).toLocalDate();
        }
        return query(mapper -> mapper.selectNewestDate(t, c));
    }

    @Override
    public long countOrphanTickers(String left, String right) throws SQLException {
        String l = table(left);
        String r = table(right);
        return query(mapper -> mapper.countOrphanTickers(l, r));
    }

    @Override
    public List<String> listOrphanTickers(String left, String right, int maxItems) throws SQLException {
        String l = table(left);
        String r = table(right);
        return toText(query(mapper -> mapper.listOrphanTickers(l, r, Math.max(0, maxItems))));
    }

    @Override
    public long countDanglingTickerRefs(String table) throws SQLException {
        String t = table(table);
        return query(mapper -> mapper.countDanglingTickerRefs(t));
    }

    @Override
    public List<String> listDanglingTickerRefs(String table, int maxItems) throws SQLException {
        String t = table(table);
        return toText(query(mapper -> mapper.listDanglingTickerRefs(t, Math.max(0, maxItems))));
    }

    @Override
    public long countDuplicateExcess(String table, List<String> keyColumns) throws SQLException {
        String t = table(table);
        String keys = keyList(keyColumns);
        return query(mapper -> mapper.countDuplicateExcess(t, keys));
    }

    @Override
    public List<String> listDuplicateKeys(String table, List<String> keyColumns, int maxItems) throws SQLException {
        String t = table(table);
        String keys = keyList(keyColumns);
        String label = keyLabel(keyColumns);
        return query(mapper -> mapper.listDuplicateKeys(t, keys, label, Math.max(0, maxItems)));
    }

    @Override
    public long countEmptyJson(String table, String column) throws SQLException {
        String t = table(table);
        String c = column(column);
        return query(mapper -> mapper.countEmptyJson(t, c));
    }

    @Override
    public List<String> listEmptyJson(String table, String column, int maxItems) throws SQLException {
        String t = table(table);
        String c = column(column);
        return toText(query(mapper -> mapper.listEmptyJson(t, c, Math.max(0, maxItems))));
    }

    @Override
    public long countInconsistentOhlc() throws SQLException {
        return query(AuditMapper::countInconsistentOhlc);
    }

    @Override
    public List<String> listInconsistentOhlc(int maxItems) throws SQLException {
        return toText(query(mapper -> mapper.listInconsistentOhlc(Math.max(0, maxItems))));
    }

    private <T> T query(MapperCall<T> call) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return call.apply(session.getMapper(AuditMapper.class));
        } catch (PersistenceException e) {
            throw PersistenceErrors.unwrap(e);
        }
    }

    private static String table(String name) {
        if (name == null || !TABLES.contains(name)) {
            throw new IllegalArgumentException("table not auditable: " + name);
        }
        return name;
    }

    private static String column(String name) {
        if (name == null || !COLUMN.matcher(name).matches()) {
            throw new IllegalArgumentException("invalid column: " + name);
        }
        return name;
    }

    private static String keyList(List<String> keyColumns) {
        if (keyColumns == null || keyColumns.isEmpty()) {
            throw new IllegalArgumentException("key columns must not be empty");
        }
        List<String> parts = new ArrayList<>();
        for (String key : keyColumns) {
            parts.add(column(key));
        }
        return String.join(", ", parts);
    }

    private static String keyLabel(List<String> keyColumns) {
        List<String> parts = new ArrayList<>();
        for (String key : keyColumns) {
            parts.add("CAST(" + column(key) + " AS VARCHAR)");
        }
        return String.join(" || '@' || ", parts);
    }

    private static List<String> toText(List<Long> ids) {
        List<String> out = new ArrayList<>(ids.size());
        for (Long id : ids) {
            out.add(String.valueOf(id));
        }
        return out;
    }

    @FunctionalInterface
    private interface MapperCall<T> {
        T apply(AuditMapper mapper);
    }
}
