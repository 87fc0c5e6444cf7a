package com.aegis.config;


import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Flat key/value settings.
 *
 * <p>Lookup order: {@code ./aegis.properties} in the working directory, then
 * {@code aegis.properties} on the classpath, then the built-in defaults. Typed
 * getters accept a fallback used when a value is missing or malformed.
 */
public final class Config {
    public static final String FILE_NAME = "aegis.properties";

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                config.props.load(in);
            }
        } catch (IOException e) {
            System.err.println("WARN: classpath " + FILE_NAME + " unreadable, using defaults: " + e.getMessage());
        }

        Path local = workingDir.resolve(FILE_NAME);
        if (Files.exists(local)) {
            Properties override = new Properties();
            try (InputStream in = Files.newInputStream(local)) {
                override.load(in);
                config.props.putAll(override);
            } catch (IOException e) {
                System.err.println("WARN: failed to read " + local + ": " + e.getMessage());
            }
        }
        return config;
    }

    /** Builds a config from explicit entries only; classpath and working-directory files are ignored. */
    public static Config of(Path workingDir, Map<String, String> entries) {
        Config config = new Config(workingDir);
        if (entries != null) {
            config.props.putAll(entries);
        }
        return config;
    }

    public static Config defaults() {
        return of(Path.of(".").toAbsolutePath().normalize(), Collections.emptyMap());
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
        return value.isEmpty() ? fallback : value;
    }

    public int getInt(String key, int fallback) {
        try {
            return Integer.parseInt(getString(key));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public long getLong(String key, long fallback) {
        try {
            return Long.parseLong(getString(key));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public double getDouble(String key, double fallback) {
        try {
            return Double.parseDouble(getString(key));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public Duration getSeconds(String key, long fallbackSeconds) {
        return Duration.ofSeconds(getLong(key, fallbackSeconds));
    }

    public ZoneId getZone(String key, ZoneId fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        try {
            return ZoneId.of(value);
        } catch (RuntimeException e) {
            System.err.println("WARN: invalid zone '" + value + "' for " + key + ", using " + fallback);
            return fallback;
        }
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> d = new HashMap<>();
        d.put("app.zone", "Asia/Seoul");
        d.put("outputs.dir", "outputs");

        d.put("http.connect_timeout_sec", "10");
        d.put("http.request_timeout_sec", "15");
        d.put("http.user_agent", "Mozilla/5.0 (compatible; aegis-signal-core/1.0)");
        d.put("yahoo.chart_url", "https://query1.finance.yahoo.com/v8/finance/chart/");

        d.put("calendar.resource", "calendar/aegis-calendar.json");

        d.put("sentiment.cache_ttl_sec", "600");
        d.put("sentiment.index_symbol", "^KS11");
        d.put("sentiment.breadth_symbols",
                "005930.KS,000660.KS,035420.KS,035720.KS,005380.KS,000270.KS,068270.KS,051910.KS,006400.KS,"
                        + "015760.KS,055550.KS,105560.KS,086790.KS,316140.KS");

        d.put("global.cache_ttl_sec", "300");
        d.put("global.pool_size", "4");

        d.put("integrity.cache_ttl_sec", "60");

        d.put("optimizer.weights_file", "data/optimized_weights.json");
        d.put("optimizer.history_limit", "100");
        d.put("optimizer.persist_limit", "50");

        d.put("veto.min_fundamental_score", "-2.0");
        d.put("veto.min_market_context_score", "-2.0");
        d.put("veto.min_traded_value", "10000000000");
        d.put("veto.max_daily_volatility", "15.0");

        d.put("execution.buy_cost_rate", "0.00015");
        d.put("execution.sell_cost_rate", "0.0023");
        return Collections.unmodifiableMap(d);
    }
}
