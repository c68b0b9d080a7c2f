package com.tickerwolf.intraday;

import com.tickerwolf.config.Config;
import com.tickerwolf.core.diagnostics.CauseCode;
import com.tickerwolf.core.diagnostics.Outcome;
import com.tickerwolf.model.OhlcvBar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Polygon aggregates client for 1-minute bars, extended hours included.
 *
 * <p>The request window ends at the current time (or at the end of {@code tradingDate} for a
 * past date) and reaches back {@code polygon.max_age_minutes}. HTTP 429 is reported at once as
 * {@code RATE_LIMITED}; server errors, I/O failures and attempt timeouts are retried with exponential
 * backoff. Each attempt is bounded by {@code polygon.attempt_timeout_seconds}; the whole call,
 * retries included, is bounded by the cache's {@code intraday.request_timeout_seconds}.
 */
public final class PolygonIntradayClient implements IntradayBarsClient {
    private static final Logger LOG = LogManager.getLogger("INGEST");
    private static final String OWNER = "polygon";

    private final String baseUrl;
    private final String apiKey;
    private final int attemptTimeoutSec;
    private final int maxAgeMinutes;
    private final int maxRetries;
    private final long retryBackoffMs;
    private final ZoneId marketZone;
    private final Clock clock;
    private final HttpClient httpClient;

    public PolygonIntradayClient(Config config, Clock clock) {
        this.baseUrl = trimTrailingSlash(config.getString("polygon.base_url", "https://api.polygon.io"));
        this.apiKey = config.getString("polygon.api_key", "");
        this.attemptTimeoutSec = Math.max(1, config.getInt("polygon.attempt_timeout_seconds", 3));
        this.maxAgeMinutes = Math.max(1, config.getInt("polygon.max_age_minutes", 1440));
        this.maxRetries = Math.max(0, config.getInt("polygon.max_retries", 3));
        this.retryBackoffMs = Math.max(0L, config.getLong("polygon.retry_backoff_ms", 500L));
        this.marketZone = ZoneId.of(config.getString("intraday.market_zone", "America/New_York"));
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(attemptTimeoutSec))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public Outcome<List<OhlcvBar>> fetchBars(String symbol, LocalDate tradingDate) {
        String ticker = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        if (ticker.isEmpty() || tradingDate == null) {
            return Outcome.failure(CauseCode.NOT_FOUND, OWNER, Map.of("reason", "empty_symbol"));
        }
        URI uri = buildUri(ticker, tradingDate);
        String lastError = "";
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                HttpRequest request = HttpRequest.newBuilder()
                        .uri(uri)
                        .header("Accept", "application/json")
                        .header("User-Agent", "tickerwolf/1.0")
                        .timeout(Duration.ofSeconds(attemptTimeoutSec))
                        .GET()
                        .build();
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                if (status == 429) {
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("symbol", ticker);
                    details.put("status", status);
                    response.headers().firstValue("Retry-After").ifPresent(value -> details.put("retry_after", value));
                    return Outcome.failure(CauseCode.RATE_LIMITED, OWNER, details);
                }
                if (status == 404) {
                    return Outcome.failure(CauseCode.NOT_FOUND, OWNER, Map.of("symbol", ticker, "status", status));
                }
                if (status >= 500) {
                    lastError = "http_status=" + status;
                } else if (status / 100 != 2) {
                    return Outcome.failure(CauseCode.UNAVAILABLE, OWNER, Map.of("symbol", ticker, "status", status));
                } else {
                    return parse(ticker, response.body(), attempt + 1);
                }
            } catch (HttpTimeoutException e) {
                lastError = "timeout";
            } catch (IOException e) {
                lastError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Outcome.failure(CauseCode.TIMEOUT, OWNER, Map.of("symbol", ticker, "error", "interrupted"));
            }
            if (attempt >= maxRetries) {
                break;
            }
            LOG.debug("polygon retry symbol={} attempt={} err={}", ticker, attempt + 1, lastError);
            try {
                Thread.sleep(retryBackoffMs * (1L << Math.min(attempt, 10)));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return Outcome.failure(CauseCode.TIMEOUT, OWNER, Map.of("symbol", ticker, "error", "interrupted"));
            }
        }
        CauseCode cause = "timeout".equals(lastError) ? CauseCode.TIMEOUT : CauseCode.UNAVAILABLE;
        return Outcome.failure(cause, OWNER, Map.of("symbol", ticker, "error", lastError, "attempts", maxRetries + 1));
    }

    URI buildUri(String ticker, LocalDate tradingDate) {
        Instant now = clock.instant();
        Instant endOfDay = tradingDate.plusDays(1).atStartOfDay(marketZone).toInstant();
        Instant to = now.isBefore(endOfDay) ? now : endOfDay;
        Instant from = to.minus(Duration.ofMinutes(maxAgeMinutes));
        StringBuilder url = new StringBuilder(baseUrl)
                .append("/v2/aggs/ticker/")
                .append(URLEncoder.encode(ticker, StandardCharsets.UTF_8))
                .append("/range/1/minute/")
                .append(from.toEpochMilli())
                .append('/')
                .append(to.toEpochMilli())
                .append("?adjusted=true&sort=asc&extended=true&limit=50000");
        if (!apiKey.isEmpty()) {
            url.append("&apiKey=").append(URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
        }
        return URI.create(url.toString());
    }

    private Outcome<List<OhlcvBar>> parse(String ticker, String body, int attempts) {
        JSONObject root;
        try {
            root = new JSONObject(body == null ? "" : body);
        } catch (JSONException e) {
            return Outcome.failure(CauseCode.INVALID_PAYLOAD, OWNER, Map.of("symbol", ticker, "error", String.valueOf(e.getMessage())));
        }
        String status = root.optString("status", "");
        if ("ERROR".equalsIgnoreCase(status) || "NOT_AUTHORIZED".equalsIgnoreCase(status)) {
            return Outcome.failure(CauseCode.UNAVAILABLE, OWNER,
                    Map.of("symbol", ticker, "error", root.optString("error", status)));
        }
        JSONArray results = root.optJSONArray("results");
        if (results == null || results.isEmpty()) {
            return Outcome.failure(CauseCode.NOT_FOUND, OWNER, Map.of("symbol", ticker, "reason", "no_results"));
        }
        List<OhlcvBar> bars = new ArrayList<>(results.length());
        int dropped = 0;
        try {
            for (int i = 0; i < results.length(); i++) {
                JSONObject item = results.getJSONObject(i);
                OhlcvBar bar = new OhlcvBar(
                        Instant.ofEpochMilli(item.getLong("t")),
                        item.getDouble("o"),
                        item.getDouble("h"),
                        item.getDouble("l"),
                        item.getDouble("c"),
                        Math.round(item.optDouble("v", 0.0))
                );
                if (bar.isConsistent()) {
                    bars.add(bar);
                } else {
                    dropped++;
                }
            }
        } catch (JSONException e) {
            return Outcome.failure(CauseCode.INVALID_PAYLOAD, OWNER, Map.of("symbol", ticker, "error", String.valueOf(e.getMessage())));
        }
        if (dropped > 0) {
            LOG.warn("polygon dropped inconsistent bars symbol={} dropped={}", ticker, dropped);
        }
        if (bars.isEmpty()) {
            return Outcome.failure(CauseCode.NOT_FOUND, OWNER, Map.of("symbol", ticker, "reason", "no_valid_bars"));
        }
        bars.sort(Comparator.comparing(bar -> bar.timestamp));
        return Outcome.success(bars, OWNER, Map.of("attempts", attempts, "bars", bars.size(), "dropped", dropped));
    }

    private static String trimTrailingSlash(String value) {
        String out = value == null ? "" : value.trim();
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
