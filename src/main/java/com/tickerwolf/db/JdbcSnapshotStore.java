package com.tickerwolf.db;

import com.tickerwolf.db.mybatis.IntradaySnapshotMapper;
import com.tickerwolf.db.mybatis.IntradaySnapshotRow;
import com.tickerwolf.db.mybatis.MyBatisSupport;
import com.tickerwolf.intraday.SnapshotCodec;
import com.tickerwolf.intraday.SnapshotKey;
import com.tickerwolf.intraday.SnapshotStore;
import com.tickerwolf.intraday.SnapshotStoreException;
import com.tickerwolf.model.IntradaySnapshot;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.json.JSONException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Snapshot store backed by the {@code intraday_snapshots} table, one row per cache key.
 *
 * <p>A save is an update-or-insert inside one transaction, so readers see the old or the
 * new payload and never a partial one.
 */
public final class JdbcSnapshotStore implements SnapshotStore {
    private static final String UNIQUE_VIOLATION = "23505";

    private final Database database;
    private final String namespace;

    public JdbcSnapshotStore(Database database, String namespace) {
        this.database = database;
        this.namespace = namespace == null || namespace.isBlank() ? "intraday" : namespace.trim();
    }

    @Override
    public String namespace() {
        return namespace;
    }

    @Override
    public Optional<IntradaySnapshot> load(SnapshotKey key) throws SnapshotStoreException {
        String cacheKey = key.storeKey(namespace);
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            IntradaySnapshotRow row = session.getMapper(IntradaySnapshotMapper.class).selectByKey(cacheKey);
            if (row == null || row.getPayload() == null) {
                return Optional.empty();
            }
            return Optional.of(SnapshotCodec.decode(row.getPayload()));
        } catch (SQLException e) {
            throw new SnapshotStoreException("snapshot load failed key=" + cacheKey, e);
        } catch (PersistenceException e) {
            throw new SnapshotStoreException("snapshot load failed key=" + cacheKey, PersistenceErrors.unwrap(e));
        } catch (IllegalArgumentException e) {
            throw new SnapshotStoreException("snapshot payload unreadable key=" + cacheKey, e);
        }
    }

    @Override
    public void save(SnapshotKey key, IntradaySnapshot snapshot) throws SnapshotStoreException {
        String payload;
        try {
            payload = SnapshotCodec.encode(snapshot);
        } catch (JSONException | IllegalArgumentException e) {
            throw new SnapshotStoreException("snapshot payload unwritable key=" + key.storeKey(namespace), e);
        }
        IntradaySnapshotRow row = IntradaySnapshotRow.builder()
                .cacheKey(key.storeKey(namespace))
                .symbol(key.symbol())
                .tradingDate(key.tradingDate())
                .payload(payload)
                .fetchedAt(snapshot.fetchedAt.atOffset(ZoneOffset.UTC))
                .build();
        try {
            upsert(row);
        } catch (SQLException e) {
            if (!UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new SnapshotStoreException("snapshot save failed key=" + row.getCacheKey(), e);
            }
            // lost an insert race for the same key; the row exists now
            try {
                upsert(row);
            } catch (SQLException retry) {
                throw new SnapshotStoreException("snapshot save failed key=" + row.getCacheKey(), retry);
            }
        }
    }

    @Override
    public int purgeOlderThan(LocalDate cutoff) throws SnapshotStoreException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(IntradaySnapshotMapper.class).deleteOlderThan(namespace + ":%", cutoff);
        } catch (SQLException e) {
            throw new SnapshotStoreException("snapshot purge failed", e);
        } catch (PersistenceException e) {
            throw new SnapshotStoreException("snapshot purge failed", PersistenceErrors.unwrap(e));
        }
    }

    private void upsert(IntradaySnapshotRow row) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            try {
                IntradaySnapshotMapper mapper = session.getMapper(IntradaySnapshotMapper.class);
                if (mapper.update(row) == 0) {
                    mapper.insert(row);
                }
                conn.commit();
            } catch (PersistenceException e) {
                conn.rollback();
                throw PersistenceErrors.unwrap(e);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }
}
