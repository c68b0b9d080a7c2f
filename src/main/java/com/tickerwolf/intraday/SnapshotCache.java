package com.tickerwolf.intraday;

import com.tickerwolf.config.Config;
import com.tickerwolf.core.RunTelemetry;
import com.tickerwolf.core.diagnostics.CauseCode;
import com.tickerwolf.core.diagnostics.Outcome;
import com.tickerwolf.model.IntradaySnapshot;
import com.tickerwolf.model.OhlcvBar;
import com.tickerwolf.model.TickerRef;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Read-through cache of intraday snapshots keyed by symbol and today's trading date.
 *
 * <p>An entry younger than the freshness window is served without an upstream call. Otherwise
 * one caller per key becomes the leader and fetches; every concurrent caller for that key waits
 * for the leader and receives the same result, whatever force flag it passed. Keys never block
 * each other. When a fetch fails, times out or is rate limited the previous entry for the key is
 * served, then the newest entry of the previous trading dates, and otherwise a miss. Nothing is
 * thrown to callers.
 */
public final class SnapshotCache implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger("INGEST");

    private final SnapshotStore store;
    private final IntradayBarsClient client;
    private final Clock clock;
    private final ZoneId marketZone;
    private final Duration freshness;
    private final Duration requestTimeout;
    private final int lookbackDays;
    private final int warmConcurrency;
    private final ExecutorService fetchExecutor;
    private final ConcurrentHashMap<SnapshotKey, CompletableFuture<CacheLookup>> inFlight = new ConcurrentHashMap<>();

    private volatile RunTelemetry lastWarmTelemetry;

    public SnapshotCache(
            SnapshotStore store,
            IntradayBarsClient client,
            Clock clock,
            ZoneId marketZone,
            Duration freshness,
            Duration requestTimeout,
            int lookbackDays,
            int warmConcurrency
    ) {
        if (store == null || client == null || clock == null || marketZone == null) {
            throw new IllegalArgumentException("store, client, clock and marketZone are required");
        }
        this.store = store;
        this.client = client;
        this.clock = clock;
        this.marketZone = marketZone;
        this.freshness = freshness == null || freshness.isNegative() ? Duration.ZERO : freshness;
        this.requestTimeout = requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()
                ? Duration.ofSeconds(10)
                : requestTimeout;
        this.lookbackDays = Math.max(0, lookbackDays);
        this.warmConcurrency = Math.max(1, warmConcurrency);
        this.fetchExecutor = Executors.newCachedThreadPool(daemonThreads("intraday-fetch"));
    }

    public static SnapshotCache create(Config config, SnapshotStore store, IntradayBarsClient client, Clock clock) {
        return new SnapshotCache(
                store,
                client,
                clock,
                ZoneId.of(config.getString("intraday.market_zone", "America/New_York")),
                Duration.ofSeconds(Math.max(0, config.getInt("intraday.freshness_seconds", 60))),
                Duration.ofSeconds(Math.max(1, config.getInt("intraday.request_timeout_seconds", 10))),
                config.getInt("intraday.fallback_lookback_days", 5),
                config.getInt("intraday.warm.concurrency", 8)
        );
    }

    public Optional<IntradaySnapshot> get(String symbol, boolean force) {
        return lookup(symbol, force).asOptional();
    }

    /**
     * Like {@link #get} but reports where the snapshot came from.
     *
     * @throws IllegalArgumentException for a blank symbol
     */
    public CacheLookup lookup(String symbol, boolean force) {
        SnapshotKey key = new SnapshotKey(symbol, today());
        if (!force) {
            Optional<IntradaySnapshot> current = loadQuietly(key);
            if (current.isPresent() && isFresh(current.get())) {
                return CacheLookup.freshHit(current.get());
            }
        }

        CompletableFuture<CacheLookup> mine = new CompletableFuture<>();
        CompletableFuture<CacheLookup> leader = inFlight.putIfAbsent(key, mine);
        if (leader != null) {
            return await(key, leader);
        }
        try {
            CacheLookup result = lead(key, force);
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            LOG.warn("intraday refresh crashed key={} err={}", key.storeKey(store.namespace()), e.toString());
            CacheLookup result = degrade(key, CauseCode.UNAVAILABLE);
            mine.complete(result);
            return result;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /**
     * Runs {@link #lookup} for every distinct symbol on a bounded pool.
     *
     * @return number of symbols for which a snapshot, fresh or fallback, was available
     */
    public int warmMany(Collection<TickerRef> tickers, boolean force) {
        List<String> symbols = new ArrayList<>();
        if (tickers != null) {
            for (TickerRef ticker : tickers) {
                if (ticker != null && !ticker.symbol.isEmpty()) {
                    symbols.add(ticker.symbol);
                }
            }
        }
        return warmSymbols(symbols, force);
    }

    public int warmSymbols(Collection<String> symbols, boolean force) {
        Set<String> distinct = new LinkedHashSet<>();
        if (symbols != null) {
            for (String symbol : symbols) {
                if (symbol != null && !symbol.trim().isEmpty()) {
                    distinct.add(symbol.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        RunTelemetry telemetry = new RunTelemetry("PREFETCH", force ? "force" : "scheduled", clock);
        lastWarmTelemetry = telemetry;
        telemetry.startStep(RunTelemetry.STEP_INTRADAY_WARM);
        telemetry.incrementCounter("intraday.requested", distinct.size());
        if (distinct.isEmpty()) {
            telemetry.endStep(RunTelemetry.STEP_INTRADAY_WARM, 0, 0, 0);
            telemetry.finish();
            return 0;
        }

        int available = 0;
        int failed = 0;
        ExecutorService pool = Executors.newFixedThreadPool(
                Math.min(warmConcurrency, distinct.size()), daemonThreads("intraday-warm"));
        CompletionService<CacheLookup> completion = new ExecutorCompletionService<>(pool);
        try {
            for (String symbol : distinct) {
                completion.submit(() -> lookup(symbol, force));
            }
            for (int i = 0; i < distinct.size(); i++) {
                Future<CacheLookup> future = completion.take();
                try {
                    CacheLookup result = future.get();
                    telemetry.incrementCounter("intraday." + result.source.name().toLowerCase(Locale.ROOT), 1);
                    if (result.isAvailable()) {
                        available++;
                    }
                } catch (ExecutionException e) {
                    failed++;
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.warn("intraday warm task failed err={}", cause.toString());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("intraday warm interrupted after available={}", available);
        } finally {
            pool.shutdownNow();
        }
        telemetry.incrementCounter("intraday.available", available);
        telemetry.incrementCounter("intraday.missed", distinct.size() - available);
        telemetry.endStep(RunTelemetry.STEP_INTRADAY_WARM, distinct.size(), available, failed);
        telemetry.finish();
        LOG.info("intraday warm done requested={} available={} fetched={} stale={} missed={} elapsed_ms={}",
                distinct.size(), available, telemetry.counter("intraday.fetched"),
                telemetry.counter("intraday.stale") + telemetry.counter("intraday.fallback"),
                distinct.size() - available, telemetry.totalElapsedMs());
        return available;
    }

    /**
     * Drops entries older than {@code retentionDays} trading-date days.
     */
    public int purge(int retentionDays) {
        LocalDate cutoff = today().minusDays(Math.max(0, retentionDays));
        try {
            int removed = store.purgeOlderThan(cutoff);
            LOG.info("intraday purge cutoff={} removed={}", cutoff, removed);
            return removed;
        } catch (SnapshotStoreException e) {
            LOG.warn("intraday purge failed cutoff={} err={}", cutoff, e.getMessage());
            return 0;
        }
    }

    public RunTelemetry lastWarmTelemetry() {
        return lastWarmTelemetry;
    }

    int inFlightCount() {
        return inFlight.size();
    }

    @Override
    public void close() {
        fetchExecutor.shutdownNow();
    }

    private CacheLookup lead(SnapshotKey key, boolean force) {
        Optional<IntradaySnapshot> prior = loadQuietly(key);
        // a leader that finished between our freshness check and putIfAbsent already stored a fresh entry
        if (!force && prior.isPresent() && isFresh(prior.get())) {
            return CacheLookup.freshHit(prior.get());
        }
        Outcome<List<OhlcvBar>> outcome = consistentOnly(key, fetchBounded(key));
        if (outcome.success) {
            IntradaySnapshot snapshot = new IntradaySnapshot(key.symbol(), key.tradingDate(), outcome.value, clock.instant());
            try {
                store.save(key, snapshot);
            } catch (SnapshotStoreException e) {
                LOG.warn("intraday store write failed key={} err={}", key.storeKey(store.namespace()), e.getMessage());
            }
            LOG.debug("intraday fetched key={} bars={}", key.storeKey(store.namespace()), snapshot.bars.size());
            return CacheLookup.fetched(snapshot);
        }
        if (prior.isPresent()) {
            LOG.warn("intraday fetch failed, serving stale key={} cause={} fetched_at={}",
                    key.storeKey(store.namespace()), outcome.causeCode, prior.get().fetchedAt);
            return CacheLookup.stale(prior.get(), outcome.causeCode);
        }
        return fallbackOrMiss(key, outcome.causeCode);
    }

    private Outcome<List<OhlcvBar>> fetchBounded(SnapshotKey key) {
        Future<Outcome<List<OhlcvBar>>> call = fetchExecutor.submit(() -> client.fetchBars(key.symbol(), key.tradingDate()));
        try {
            Outcome<List<OhlcvBar>> outcome = call.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                return Outcome.failure(CauseCode.UNAVAILABLE, "cache", Map.of("error", "null_outcome"));
            }
            if (outcome.success && outcome.value == null) {
                return Outcome.failure(CauseCode.INVALID_PAYLOAD, "cache", Map.of("error", "null_bars"));
            }
            return outcome;
        } catch (TimeoutException e) {
            call.cancel(true);
            return Outcome.failure(CauseCode.TIMEOUT, "cache");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.warn("intraday client error symbol={} err={}", key.symbol(), cause.toString());
            return Outcome.failure(CauseCode.UNAVAILABLE, "cache");
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return Outcome.failure(CauseCode.TIMEOUT, "cache");
        }
    }

    /**
     * Drops bars that break {@code low <= open, close <= high} or carry negative volume or
     * non-finite prices. A non-empty batch with no usable bar becomes {@code INVALID_PAYLOAD}.
     */
    private Outcome<List<OhlcvBar>> consistentOnly(SnapshotKey key, Outcome<List<OhlcvBar>> outcome) {
        if (!outcome.success) {
            return outcome;
        }
        List<OhlcvBar> kept = new ArrayList<>(outcome.value.size());
        for (OhlcvBar bar : outcome.value) {
            if (bar != null && bar.isConsistent()) {
                kept.add(bar);
            }
        }
        int dropped = outcome.value.size() - kept.size();
        if (dropped == 0) {
            return outcome;
        }
        LOG.warn("intraday dropped inconsistent bars key={} dropped={} kept={}",
                key.storeKey(store.namespace()), dropped, kept.size());
        if (kept.isEmpty()) {
            return Outcome.failure(CauseCode.INVALID_PAYLOAD, "cache", Map.of("dropped", dropped));
        }
        return Outcome.success(kept, "cache", Map.of("dropped", dropped));
    }

    private CacheLookup await(SnapshotKey key, CompletableFuture<CacheLookup> leader) {
        try {
            return leader.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return degrade(key, CauseCode.TIMEOUT);
        } catch (ExecutionException e) {
            return degrade(key, CauseCode.UNAVAILABLE);
        }
    }

    private CacheLookup degrade(SnapshotKey key, CauseCode cause) {
        Optional<IntradaySnapshot> prior = loadQuietly(key);
        if (prior.isPresent()) {
            return CacheLookup.stale(prior.get(), cause);
        }
        return fallbackOrMiss(key, cause);
    }

    private CacheLookup fallbackOrMiss(SnapshotKey key, CauseCode cause) {
        LocalDate date = key.tradingDate();
        int checked = 0;
        while (checked < lookbackDays) {
            date = date.minusDays(1);
            if (date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY) {
                continue;
            }
            checked++;
            Optional<IntradaySnapshot> earlier = loadQuietly(new SnapshotKey(key.symbol(), date));
            if (earlier.isPresent() && !earlier.get().isEmpty()) {
                LOG.warn("intraday fetch failed, serving {} snapshot key={} cause={}",
                        date, key.storeKey(store.namespace()), cause);
                return CacheLookup.fallback(earlier.get(), cause);
            }
        }
        LOG.warn("intraday fetch failed, no snapshot available key={} cause={}", key.storeKey(store.namespace()), cause);
        return CacheLookup.miss(cause);
    }

    private Optional<IntradaySnapshot> loadQuietly(SnapshotKey key) {
        try {
            return store.load(key);
        } catch (SnapshotStoreException e) {
            LOG.warn("intraday store read failed key={} err={}", key.storeKey(store.namespace()), e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isFresh(IntradaySnapshot snapshot) {
        Duration age = Duration.between(snapshot.fetchedAt, clock.instant());
        return age.compareTo(freshness) < 0;
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(marketZone));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
