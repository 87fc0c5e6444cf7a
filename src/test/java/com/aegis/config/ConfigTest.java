package com.aegis.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfigTest {

    @Test
    void defaultsShouldCoverVetoAndCostThresholds() {
        Config config = Config.defaults();

        assertEquals(-2.0, config.getDouble("veto.min_fundamental_score", 0.0), 1e-9);
        assertEquals(1.0e10, config.getDouble("veto.min_traded_value", 0.0), 1e-3);
        assertEquals(0.0023, config.getDouble("execution.sell_cost_rate", 0.0), 1e-12);
        assertEquals(Duration.ofSeconds(600), config.getSeconds("sentiment.cache_ttl_sec", 1));
        assertEquals(ZoneId.of("Asia/Seoul"), config.getZone("app.zone", ZoneId.of("UTC")));
    }

    @Test
    void typedGettersShouldFallBackOnMalformedValues() {
        Config config = Config.of(Path.of("."), Map.of(
                "a.int", "twelve",
                "a.double", "",
                "a.zone", "Mars/Olympus"));

        assertEquals(7, config.getInt("a.int", 7));
        assertEquals(1.5, config.getDouble("a.double", 1.5), 1e-9);
        assertEquals(ZoneId.of("UTC"), config.getZone("a.zone", ZoneId.of("UTC")));
        assertEquals("fb", config.getString("missing.key", "fb"));
    }

    @Test
    void getListShouldSplitOnCommaAndSemicolon() {
        Config config = Config.of(Path.of("."), Map.of("symbols", " 005930.KS, 000660.KS;;035420.KS "));

        assertEquals(List.of("005930.KS", "000660.KS", "035420.KS"), config.getList("symbols"));
        assertEquals(14, Config.defaults().getList("sentiment.breadth_symbols").size());
    }

    @Test
    void loadShouldLetWorkingDirectoryFileOverrideClasspath(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(Config.FILE_NAME),
                "veto.max_daily_volatility=9.5\noutputs.dir=custom\n", StandardCharsets.UTF_8);

        Config config = Config.load(dir);

        assertEquals(9.5, config.getDouble("veto.max_daily_volatility", 0.0), 1e-9);
        assertEquals(dir.resolve("custom").normalize(), config.getPath("outputs.dir"));
        assertEquals(-2.0, config.getDouble("veto.min_market_context_score", 0.0), 1e-9);
    }
}
