package com.tickerwolf.db;

import org.h2.jdbcx.JdbcDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * In-memory H2 databases in PostgreSQL mode loaded with {@code h2-schema.sql}.
 */
public final class H2Support {
    private H2Support() {
    }

    public static Database newDatabase() throws SQLException, IOException {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:tw_" + UUID.randomUUID().toString().replace("-", "")
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        ds.setPassword("");
        Database database = Database.wrap(ds, "h2-test", false);
        String script;
        try (InputStream in = H2Support.class.getResourceAsStream("/h2-schema.sql")) {
            if (in == null) {
                throw new IOException("h2-schema.sql not on test classpath");
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) {
                    st.execute(sql);
                }
            }
        }
        return database;
    }

    public static void exec(Database database, String... statements) throws SQLException {
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            for (String sql : statements) {
                st.execute(sql);
            }
        }
    }
}
