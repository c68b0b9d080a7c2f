package com.tickerwolf.app;

import com.tickerwolf.app.properties.IntradayProperties;
import com.tickerwolf.audit.AuditEngine;
import com.tickerwolf.audit.AuditReport;
import com.tickerwolf.audit.StoreUnavailableException;
import com.tickerwolf.config.Config;
import com.tickerwolf.db.TickerDao;
import com.tickerwolf.intraday.SnapshotCache;
import com.tickerwolf.model.TickerRef;
import com.tickerwolf.output.AuditConsoleRenderer;
import com.tickerwolf.output.AuditReportJson;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;
import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class TickerWolfApplication {
    private static final Logger LOG = LogManager.getLogger(TickerWolfApplication.class);
    private static final Logger AUDIT_LOG = LogManager.getLogger("AUDIT");
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final PrintStream out;
    private final PrintStream err;

    public TickerWolfApplication() {
        this(System.out, System.err);
    }

    TickerWolfApplication(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exit = new TickerWolfApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            printHelp(options);
            err.println("ERROR: " + e.getMessage());
            return 2;
        }
        if (cmd.hasOption("help")) {
            printHelp(options);
            return 0;
        }
        if (!cmd.hasOption("audit") && !cmd.hasOption("prefetch")
                && !cmd.hasOption("prefetch-loop") && !cmd.hasOption("purge-snapshots")) {
            printHelp(options);
            err.println("ERROR: one of --audit, --prefetch, --prefetch-loop, --purge-snapshots is required.");
            return 2;
        }

        Integer limit;
        Integer days;
        try {
            limit = optionalNonNegativeInt(cmd, "limit");
            days = optionalNonNegativeInt(cmd, "days");
        } catch (IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            return 2;
        }

        try (ConfigurableApplicationContext context = bootstrap()) {
            Config config = context.getBean(Config.class);
            installLogRoutingIfNeeded(config);
            if (cmd.hasOption("audit")) {
                return runAudit(context, config, limit == null ? 0 : limit, cmd.hasOption("detail"), cmd.hasOption("export"));
            }
            if (cmd.hasOption("purge-snapshots")) {
                IntradayProperties intraday = context.getBean(IntradayProperties.class);
                int retention = days == null ? intraday.getRetentionDays() : days;
                int removed = context.getBean(SnapshotCache.class).purge(retention);
                out.println("Purged " + removed + " snapshot entries older than " + retention + " days.");
                return 0;
            }
            if (cmd.hasOption("prefetch-loop")) {
                return runPrefetchLoop(context, limit, cmd.hasOption("force"));
            }
            return runPrefetch(context, cmd.getOptionValue("symbol"), limit, cmd.hasOption("force"));
        } catch (Exception e) {
            LOG.error("command failed", e);
            err.println("FATAL: " + e.getMessage());
            return 1;
        }
    }

    private int runAudit(ConfigurableApplicationContext context, Config config, int limit, boolean detail, boolean export)
            throws Exception {
        out.println("Running Ticker Data Audit...");
        AuditEngine engine = context.getBean(AuditEngine.class);
        long started = System.nanoTime();
        AuditReport report;
        try {
            report = engine.run(limit, detail);
        } catch (StoreUnavailableException e) {
            LOG.error("audit aborted, store unavailable", e);
            err.println("ERROR: store unavailable: " + e.getMessage());
            return 1;
        }
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
        new AuditConsoleRenderer(!LOG_ROUTE_INSTALLED && System.console() != null).render(report, elapsedMs, out);

        AUDIT_LOG.info(AuditReportJson.toJson(report));
        if (engine.lastTelemetry() != null) {
            AUDIT_LOG.info("audit telemetry\n{}", engine.lastTelemetry().getSummary());
        }
        if (export) {
            ZoneId zone = ZoneId.of(config.getString("audit.market_zone", "America/New_York"));
            Path path = AuditReportJson.export(report, config.getPath("audit.export.dir"), zone);
            out.println("Exported JSON report -> " + path);
        }
        return 0;
    }

    private int runPrefetch(ConfigurableApplicationContext context, String symbol, Integer limit, boolean force)
            throws SQLException {
        SnapshotCache cache = context.getBean(SnapshotCache.class);
        List<TickerRef> tickers = resolveTickers(context, symbol, limit);
        if (tickers.isEmpty()) {
            out.println("No active tickers to prefetch.");
            return 0;
        }
        int available = cache.warmMany(tickers, force);
        out.println(String.format(Locale.US, "Prefetched %d/%d symbols%s.", available, tickers.size(), force ? " (forced)" : ""));
        return 0;
    }

    private int runPrefetchLoop(ConfigurableApplicationContext context, Integer limit, boolean force)
            throws InterruptedException {
        SnapshotCache cache = context.getBean(SnapshotCache.class);
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        CountDownLatch stopped = new CountDownLatch(1);
        AtomicInteger rounds = new AtomicInteger();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdownNow();
            stopped.countDown();
        }, "prefetch-loop-shutdown"));
        // fixed delay: the next round starts one minute after the previous one finished
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                List<TickerRef> tickers = resolveTickers(context, null, limit);
                int available = cache.warmMany(tickers, force);
                LOG.info("prefetch round={} requested={} available={}", rounds.incrementAndGet(), tickers.size(), available);
            } catch (SQLException e) {
                LOG.warn("prefetch round skipped, ticker universe unavailable: {}", e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("prefetch round failed", e);
            }
        }, 0L, 1L, TimeUnit.MINUTES);
        out.println("Prefetch loop started, one batch per minute. Ctrl+C to stop.");
        stopped.await();
        return 0;
    }

    private List<TickerRef> resolveTickers(ConfigurableApplicationContext context, String symbol, Integer limit)
            throws SQLException {
        TickerDao tickerDao = context.getBean(TickerDao.class);
        if (symbol != null && !symbol.isBlank()) {
            TickerRef known = tickerDao.findBySymbol(symbol);
            return List.of(known == null ? new TickerRef(0L, symbol.trim().toUpperCase(Locale.ROOT)) : known);
        }
        int effectiveLimit = limit == null ? context.getBean(IntradayProperties.class).getPrefetch().getLimit() : limit;
        return tickerDao.listActive(effectiveLimit);
    }

    ConfigurableApplicationContext bootstrap() {
        System.setProperty(LoggingSystem.SYSTEM_PROPERTY, LoggingSystem.NONE);
        return new SpringApplicationBuilder(TickerWolfBootstrapConfig.class)
                .web(WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .logStartupInfo(false)
                .run();
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED || !config.getBoolean("app.log_routing.enabled", false)) {
            return;
        }
        synchronized (TickerWolfApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("tickerwolf.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(TickerWolfApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                LOG.info("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (Exception e) {
                err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    static Integer optionalNonNegativeInt(CommandLine cmd, String option) {
        String raw = cmd.getOptionValue(option);
        if (raw == null) {
            return null;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 0) {
                throw new IllegalArgumentException("--" + option + " must be >= 0");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + option + " must be an integer: " + raw);
        }
    }

    private void printHelp(Options options) {
        HelpFormatter formatter = new HelpFormatter();
        PrintWriter writer = new PrintWriter(out);
        formatter.printHelp(writer, formatter.getWidth(), "tickerwolf", null, options,
                formatter.getLeftPadding(), formatter.getDescPadding(), null, true);
        writer.flush();
    }

    static Options buildOptions() {
        Options options = new Options();
        OptionGroup commands = new OptionGroup();
        commands.addOption(Option.builder().longOpt("audit").desc("Run the cross-table data audit").build());
        commands.addOption(Option.builder().longOpt("prefetch").desc("Warm intraday snapshots for active tickers").build());
        commands.addOption(Option.builder().longOpt("prefetch-loop").desc("Warm intraday snapshots once per minute until stopped").build());
        commands.addOption(Option.builder().longOpt("purge-snapshots").desc("Evict intraday snapshots older than the retention window").build());
        options.addOptionGroup(commands);

        options.addOption(Option.builder().longOpt("limit").hasArg().argName("N")
                .desc("Audit: ticker sample size (0 = all). Prefetch: max tickers").build());
        options.addOption(Option.builder().longOpt("detail").desc("Audit: include offending identifiers").build());
        options.addOption(Option.builder().longOpt("export").desc("Audit: write the report as JSON").build());
        options.addOption(Option.builder().longOpt("symbol").hasArg().argName("SYMBOL")
                .desc("Prefetch: a single symbol").build());
        options.addOption(Option.builder().longOpt("force").desc("Prefetch: ignore the freshness window").build());
        options.addOption(Option.builder().longOpt("days").hasArg().argName("N")
                .desc("Purge: retention in days").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        return options;
    }
}
