package com.tickerwolf.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent PostgreSQL bootstrap for the audited tables and the snapshot store table.
 *
 * <p>{@code ticker_price_histories} carries no foreign key to {@code tickers}: the table is
 * range-partitioned upstream, so dangling references are reported by the audit instead.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);

    public void run(Database database) throws SQLException {
        String lastSql = "";
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            for (String sql : buildStatements(database.schema())) {
                lastSql = sql;
                st.execute(sql);
            }
        } catch (SQLException e) {
            String detail = "migration_failed: schema=" + database.schema()
                    + ", failed_sql=" + summarizeSql(lastSql)
                    + ", cause=" + (e.getMessage() == null ? "" : e.getMessage());
            LOG.error(detail);
            throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    private List<String> buildStatements(String schema) {
        List<String> sqls = new ArrayList<>();
        sqls.add("CREATE SCHEMA IF NOT EXISTS " + schema);
        sqls.add("SET search_path TO " + schema + ", public");

        sqls.add("CREATE TABLE IF NOT EXISTS tickers (" +
                "id BIGSERIAL PRIMARY KEY," +
                "ticker TEXT NOT NULL UNIQUE," +
                "name TEXT NULL," +
                "market TEXT NULL," +
                "active BOOLEAN NULL," +
                "prev_close NUMERIC(16,6) NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_tickers_active ON tickers(active)");

        sqls.add("CREATE TABLE IF NOT EXISTS ticker_price_histories (" +
                "id BIGSERIAL PRIMARY KEY," +
                "ticker_id BIGINT NOT NULL," +
                "ticker VARCHAR(16) NULL," +
                "resolution VARCHAR(8) NOT NULL DEFAULT '1d'," +
                "t TIMESTAMPTZ NOT NULL," +
                "o NUMERIC(16,6) NULL," +
                "h NUMERIC(16,6) NULL," +
                "l NUMERIC(16,6) NULL," +
                "c NUMERIC(16,6) NULL," +
                "v BIGINT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (ticker_id, resolution, t)" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_tph_ticker_t ON ticker_price_histories(ticker_id, t)");

        sqls.add("CREATE TABLE IF NOT EXISTS ticker_indicators (" +
                "id BIGSERIAL PRIMARY KEY," +
                "ticker_id BIGINT NOT NULL REFERENCES tickers(id) ON DELETE CASCADE," +
                "resolution VARCHAR(8) NOT NULL DEFAULT '1d'," +
                "t TIMESTAMPTZ NOT NULL," +
                "indicator TEXT NOT NULL," +
                "value NUMERIC(24,8) NULL," +
                "meta JSONB NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (ticker_id, resolution, t, indicator)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS ticker_feature_snapshots (" +
                "id BIGSERIAL PRIMARY KEY," +
                "ticker_id BIGINT NOT NULL REFERENCES tickers(id) ON DELETE CASCADE," +
                "t DATE NOT NULL," +
                "indicators JSONB NULL," +
                "embedding JSONB NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (ticker_id, t)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS ticker_feature_metrics (" +
                "id BIGSERIAL PRIMARY KEY," +
                "ticker_id BIGINT NOT NULL REFERENCES tickers(id) ON DELETE CASCADE," +
                "t DATE NOT NULL," +
                "sharpe_60 DOUBLE PRECISION NULL," +
                "volatility_30 DOUBLE PRECISION NULL," +
                "drawdown DOUBLE PRECISION NULL," +
                "beta_60 DOUBLE PRECISION NULL," +
                "momentum_10 DOUBLE PRECISION NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (ticker_id, t)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS intraday_snapshots (" +
                "cache_key TEXT PRIMARY KEY," +
                "symbol TEXT NOT NULL," +
                "trading_date DATE NOT NULL," +
                "payload TEXT NOT NULL," +
                "fetched_at TIMESTAMPTZ NOT NULL" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_intraday_snapshots_date ON intraday_snapshots(trading_date)");
        return sqls;
    }

    private String summarizeSql(String sql) {
        if (sql == null) {
            return "";
        }
        String normalized = sql.replaceAll("\\s+", " ").trim();
        return normalized.length() <= 160 ? normalized : normalized.substring(0, 160) + "...";
    }
}
