package com.tickerwolf.config;

import java.lang.reflect.Array;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Flat, string-keyed view of the application configuration with built-in defaults.
 *
 * <p>Keys use dotted snake case ({@code intraday.freshness_seconds}). Values bound by Spring
 * are flattened into the same key space, so relaxed names such as
 * {@code intraday.freshness-seconds} should be avoided in property files.
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    /**
     * Build Config from Spring-bound configuration properties.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    public static Config defaults(Path workingDir) {
        return new Config(workingDir);
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        if (getString(key).isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (config == null || key == null || key.trim().isEmpty()) {
            return;
        }
        config.props.setProperty(key.trim(), value == null ? "" : value);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");

        defaults.put("audit.concurrency", "4");
        defaults.put("audit.market_zone", "America/New_York");
        defaults.put("audit.weight.completeness", "0.7");
        defaults.put("audit.weight.freshness", "0.3");
        defaults.put("audit.critical_weight", "2");
        defaults.put("audit.freshness.decay_days", "7");
        defaults.put("audit.cadence_days", "4");
        defaults.put("audit.detail.max_items", "25");
        defaults.put("audit.export.dir", "outputs/audit");

        defaults.put("intraday.namespace", "intraday");
        defaults.put("intraday.market_zone", "America/New_York");
        defaults.put("intraday.freshness_seconds", "60");
        defaults.put("intraday.request_timeout_seconds", "10");
        defaults.put("intraday.fallback_lookback_days", "5");
        defaults.put("intraday.retention_days", "5");
        defaults.put("intraday.warm.concurrency", "8");
        defaults.put("intraday.prefetch.limit", "500");
        defaults.put("intraday.store", "memory");

        defaults.put("polygon.base_url", "https://api.polygon.io");
        defaults.put("polygon.api_key", "");
        defaults.put("polygon.max_age_minutes", "1440");
        defaults.put("polygon.attempt_timeout_seconds", "3");
        defaults.put("polygon.max_retries", "3");
        defaults.put("polygon.retry_backoff_ms", "500");

        return Collections.unmodifiableMap(defaults);
    }
}
