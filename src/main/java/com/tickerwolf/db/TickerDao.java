package com.tickerwolf.db;

import com.tickerwolf.db.mybatis.MyBatisSupport;
import com.tickerwolf.db.mybatis.TickerMapper;
import com.tickerwolf.db.mybatis.TickerRow;
import com.tickerwolf.model.TickerRef;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * DAO for the ticker universe.
 */
public final class TickerDao {
    private final Database database;

    public TickerDao(Database database) {
        this.database = database;
    }

    /**
     * Active tickers ordered by id; {@code limit <= 0} returns all of them.
     */
    public List<TickerRef> listActive(int limit) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            List<TickerRow> rows = session.getMapper(TickerMapper.class).selectActive(Math.max(0, limit));
            List<TickerRef> out = new ArrayList<>(rows.size());
            for (TickerRow row : rows) {
                if (row == null || row.getTicker() == null || row.getTicker().isBlank()) {
                    continue;
                }
                out.add(new TickerRef(row.getId(), row.getTicker()));
            }
            return out;
        } catch (PersistenceException e) {
            throw PersistenceErrors.unwrap(e);
        }
    }

    public TickerRef findBySymbol(String symbol) throws SQLException {
        if (symbol == null || symbol.isBlank()) {
            return null;
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            TickerRow row = session.getMapper(TickerMapper.class).selectBySymbol(symbol.trim());
            return row == null ? null : new TickerRef(row.getId(), row.getTicker());
        } catch (PersistenceException e) {
            throw PersistenceErrors.unwrap(e);
        }
    }
}
