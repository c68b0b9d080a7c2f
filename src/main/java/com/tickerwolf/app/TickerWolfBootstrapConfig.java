package com.tickerwolf.app;

import com.tickerwolf.app.properties.DbProperties;
import com.tickerwolf.app.properties.IntradayProperties;
import com.tickerwolf.audit.AuditEngine;
import com.tickerwolf.audit.AuditStore;
import com.tickerwolf.config.Config;
import com.tickerwolf.db.Database;
import com.tickerwolf.db.JdbcAuditStore;
import com.tickerwolf.db.JdbcSnapshotStore;
import com.tickerwolf.db.MigrationRunner;
import com.tickerwolf.db.TickerDao;
import com.tickerwolf.intraday.InMemorySnapshotStore;
import com.tickerwolf.intraday.IntradayBarsClient;
import com.tickerwolf.intraday.PolygonIntradayClient;
import com.tickerwolf.intraday.SnapshotCache;
import com.tickerwolf.intraday.SnapshotStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Configuration
@EnableConfigurationProperties({DbProperties.class, IntradayProperties.class})
public class TickerWolfBootstrapConfig {
    @Bean
    public Config tickerWolfConfig(Environment environment) {
        Map<String, Object> rawProperties = new LinkedHashMap<>(Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of));
        String apiKey = System.getenv("POLYGON_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            rawProperties.put("polygon.api_key", apiKey.trim());
        }
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, rawProperties);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Lazy
    public Database database(DbProperties dbProperties) {
        Database database = new Database(
                readDbUrl(dbProperties),
                readDbUser(dbProperties),
                readDbPass(dbProperties),
                readDbSchema(dbProperties),
                isSqlLogEnabled(dbProperties)
        );
        try {
            new MigrationRunner().run(database);
        } catch (Exception e) {
            throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
        }
        return database;
    }

    @Bean
    @Lazy
    public AuditStore auditStore(Database database) {
        return new JdbcAuditStore(database);
    }

    @Bean
    @Lazy
    public AuditEngine auditEngine(Config config, AuditStore auditStore, Clock clock) {
        return AuditEngine.create(config, auditStore, clock);
    }

    @Bean
    @Lazy
    public TickerDao tickerDao(Database database) {
        return new TickerDao(database);
    }

    @Bean
    @Lazy
    public SnapshotStore snapshotStore(IntradayProperties intradayProperties, ObjectProvider<Database> database) {
        String kind = intradayProperties.getStore() == null ? "" : intradayProperties.getStore().trim().toLowerCase(Locale.ROOT);
        if ("jdbc".equals(kind)) {
            return new JdbcSnapshotStore(database.getObject(), intradayProperties.getNamespace());
        }
        return new InMemorySnapshotStore(intradayProperties.getNamespace());
    }

    @Bean
    @Lazy
    public IntradayBarsClient intradayBarsClient(Config config, Clock clock) {
        return new PolygonIntradayClient(config, clock);
    }

    @Bean(destroyMethod = "close")
    @Lazy
    public SnapshotCache snapshotCache(Config config, SnapshotStore snapshotStore, IntradayBarsClient client, Clock clock) {
        return SnapshotCache.create(config, snapshotStore, client, clock);
    }

    private String readDbUrl(DbProperties dbProperties) {
        return firstNonBlank(
                System.getenv("TICKERWOLF_DB_URL"),
                dbProperties == null ? null : dbProperties.getUrl(),
                "jdbc:postgresql://localhost:5432/tickerwolf"
        );
    }

    private String readDbUser(DbProperties dbProperties) {
        return firstNonBlank(
                System.getenv("TICKERWOLF_DB_USER"),
                dbProperties == null ? null : dbProperties.getUser(),
                "tickerwolf"
        );
    }

    private String readDbPass(DbProperties dbProperties) {
        return firstNonBlank(
                System.getenv("TICKERWOLF_DB_PASS"),
                dbProperties == null ? null : dbProperties.getPass(),
                "tickerwolf"
        );
    }

    private String readDbSchema(DbProperties dbProperties) {
        return firstNonBlank(
                dbProperties == null ? null : dbProperties.getSchema(),
                "tickerwolf"
        );
    }

    private boolean isSqlLogEnabled(DbProperties dbProperties) {
        if (dbProperties == null || dbProperties.getSqlLog() == null) {
            return false;
        }
        return dbProperties.getSqlLog().isEnabled();
    }

    private String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
