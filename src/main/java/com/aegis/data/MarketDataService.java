package com.aegis.data;

import com.aegis.config.Config;
import com.aegis.data.http.HttpClientEx;
import com.aegis.model.ChartSeries;
import com.aegis.model.PriceBar;
import com.aegis.model.Quote;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads price history from the Yahoo chart endpoint.
 *
 * <p>Every fetch either returns parsed data or throws {@link MarketDataException};
 * callers decide which neutral default to substitute.
 */
public class MarketDataService {
    public static final String DEFAULT_CHART_URL = "https://query1.finance.yahoo.com/v8/finance/chart/";

    private final HttpClientEx http;
    private final String chartUrl;

    public MarketDataService(HttpClientEx http) {
        this(http, DEFAULT_CHART_URL);
    }

    public MarketDataService(HttpClientEx http, Config config) {
        this(http, config.getString("yahoo.chart_url", DEFAULT_CHART_URL));
    }

    public MarketDataService(HttpClientEx http, String chartUrl) {
        this.http = http;
        this.chartUrl = chartUrl;
    }

    public ChartSeries fetchChart(String symbol, String range, String interval) {
        if (http == null) {
            throw new MarketDataException(symbol, "no http client configured");
        }
        String url = chartUrl + URLEncoder.encode(symbol, StandardCharsets.UTF_8)
                + "?range=" + range + "&interval=" + interval;
        String body;
        try {
            body = http.getText(url);
        } catch (IOException e) {
            throw new MarketDataException(symbol, "chart request failed: " + e.getMessage(), e);
        }
        return parseChart(symbol, body);
    }

    /** Daily bars over the given range, oldest first. */
    public List<PriceBar> fetchDailyBars(String symbol, String range) {
        return fetchChart(symbol, range, "1d").bars;
    }

    /** Quote from the last two daily closes. */
    public Quote fetchQuote(String symbol) {
        return lastTwoFromHistory(symbol, fetchDailyBars(symbol, "5d"));
    }

    /** One-minute bars of the current session together with the previous close. */
    public ChartSeries fetchIntraday(String symbol) {
        return fetchChart(symbol, "1d", "1m");
    }

    public static Quote lastTwoFromHistory(String symbol, List<PriceBar> history) {
        if (history == null || history.size() < 2) {
            throw new MarketDataException(symbol, "fewer than two closes available");
        }
        double last = history.get(history.size() - 1).close;
        double prev = history.get(history.size() - 2).close;
        if (prev <= 0.0) {
            throw new MarketDataException(symbol, "non-positive previous close");
        }
        return Quote.fromCloses(symbol, last, prev);
    }

    static ChartSeries parseChart(String symbol, String body) {
        try {
            JSONObject root = new JSONObject(body);
            JSONObject chart = root.optJSONObject("chart");
            JSONArray result = chart == null ? null : chart.optJSONArray("result");
            JSONObject r0 = (result == null || result.length() == 0) ? null : result.optJSONObject(0);
            if (r0 == null) {
                throw new MarketDataException(symbol, "chart payload has no result");
            }

            Double previousClose = null;
            JSONObject meta = r0.optJSONObject("meta");
            if (meta != null) {
                double prev = meta.optDouble("chartPreviousClose", Double.NaN);
                if (!Double.isFinite(prev)) {
                    prev = meta.optDouble("previousClose", Double.NaN);
                }
                if (Double.isFinite(prev) && prev > 0.0) {
                    previousClose = prev;
                }
            }

            List<PriceBar> out = new ArrayList<>();
            JSONArray timestamps = r0.optJSONArray("timestamp");
            JSONObject indicators = r0.optJSONObject("indicators");
            JSONArray quoteArr = indicators == null ? null : indicators.optJSONArray("quote");
            JSONObject quote0 = (quoteArr == null || quoteArr.length() == 0) ? null : quoteArr.optJSONObject(0);
            JSONArray closes = quote0 == null ? null : quote0.optJSONArray("close");
            if (timestamps == null || closes == null) {
                return new ChartSeries(symbol, out, previousClose);
            }

            JSONArray opens = quote0.optJSONArray("open");
            JSONArray highs = quote0.optJSONArray("high");
            JSONArray lows = quote0.optJSONArray("low");
            JSONArray volumes = quote0.optJSONArray("volume");

            int n = Math.min(timestamps.length(), closes.length());
            for (int i = 0; i < n; i++) {
                long epoch = timestamps.optLong(i, 0L);
                double close = valueOrFallback(closes, i, Double.NaN);
                if (epoch <= 0 || !Double.isFinite(close) || close <= 0.0) {
                    continue;
                }
                double open = valueOrFallback(opens, i, close);
                double high = Math.max(valueOrFallback(highs, i, close), Math.max(open, close));
                double low = Math.min(valueOrFallback(lows, i, close), Math.min(open, close));
                double volume = Math.max(0.0, valueOrFallback(volumes, i, 0.0));
                out.add(new PriceBar(Instant.ofEpochSecond(epoch), open, high, low, close, volume));
            }
            out.sort(Comparator.comparing(bar -> bar.time));
            return new ChartSeries(symbol, out, previousClose);
        } catch (JSONException e) {
            throw new MarketDataException(symbol, "malformed chart payload", e);
        }
    }

    private static double valueOrFallback(JSONArray arr, int index, double fallback) {
        if (arr == null || index < 0 || index >= arr.length() || arr.isNull(index)) {
            return fallback;
        }
        double value = arr.optDouble(index, Double.NaN);
        return Double.isFinite(value) ? value : fallback;
    }
}
