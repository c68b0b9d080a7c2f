package com.tickerwolf.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * Database connection manager backed by PostgreSQL.
 */
public final class Database {
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");
    private static final Logger LOG = LogManager.getLogger(Database.class);

    private final DataSource dataSource;
    private final String jdbcUrl;
    private final String schema;
    private final boolean sqlLogEnabled;
    private final boolean applySearchPath;

    public Database(String jdbcUrl, String user, String pass, String schema, boolean sqlLogEnabled) {
        if (isBlank(jdbcUrl)) {
            throw new IllegalArgumentException("db.url must not be empty");
        }
        this.jdbcUrl = jdbcUrl.trim();
        if (!this.jdbcUrl.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.url must use PostgreSQL JDBC URL (jdbc:postgresql://...)");
        }
        this.schema = normalizeSchema(schema);
        this.sqlLogEnabled = sqlLogEnabled;
        this.applySearchPath = true;

        PGSimpleDataSource pg = new PGSimpleDataSource();
        pg.setUrl(this.jdbcUrl);
        if (!isBlank(user)) {
            pg.setUser(user.trim());
        }
        if (pass != null) {
            pg.setPassword(pass);
        }
        pg.setCurrentSchema(this.schema);
        pg.setApplicationName("tickerwolf");
        this.dataSource = pg;
    }

    private Database(DataSource dataSource, String label, boolean sqlLogEnabled) {
        this.dataSource = dataSource;
        this.jdbcUrl = isBlank(label) ? "datasource" : label.trim();
        this.schema = "public";
        this.sqlLogEnabled = sqlLogEnabled;
        this.applySearchPath = false;
    }

    /**
     * Wraps an already configured data source. No search path is applied to its connections.
     */
    public static Database wrap(DataSource dataSource, String label, boolean sqlLogEnabled) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        return new Database(dataSource, label, sqlLogEnabled);
    }

    public Connection connect() throws SQLException {
        Connection raw;
        try {
            raw = dataSource.getConnection();
        } catch (SQLException e) {
            String details = "DB connect failed: jdbc_url=" + maskedJdbcUrl()
                    + ", schema=" + schema
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + safe(e.getMessage());
            LOG.error(details);
            // connection class state; the driver's own state stays on the cause
            throw new SQLException(details, "08001", e.getErrorCode(), e);
        }
        if (applySearchPath) {
            try (Statement st = raw.createStatement()) {
                st.execute("SET search_path TO " + schema + ", public");
            } catch (SQLException e) {
                raw.close();
                throw e;
            }
        }
        return sqlLogEnabled ? SqlLogProxy.wrapConnection(raw, SQL_LOG) : raw;
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        String out = jdbcUrl;
        out = out.replaceAll("(?i)(password=)[^&]+", "$1***");
        out = out.replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
        return out;
    }

    private String normalizeSchema(String raw) {
        String value = isBlank(raw) ? "tickerwolf" : raw.trim();
        if (!value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("invalid db.schema, allowed pattern: [A-Za-z_][A-Za-z0-9_]*");
        }
        return value;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private String classifyConnectFailure(SQLException e) {
        String msg = safe(e == null ? null : e.getMessage()).toLowerCase(Locale.ROOT);
        if (msg.contains("password authentication failed") || msg.contains("permission denied")) {
            return "auth";
        }
        if (msg.contains("connection refused") || msg.contains("connect timed out")) {
            return "unreachable";
        }
        if (msg.contains("does not exist")) {
            return "missing_database";
        }
        return "connection_error";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
