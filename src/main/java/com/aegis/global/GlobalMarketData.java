package com.aegis.global;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One snapshot of U.S. indices, coupling stocks, USD/KRW and index futures.
 * Symbols that failed to load are absent from the maps.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class GlobalMarketData {
    public final Map<String, IndexData> indices;
    public final Map<String, IndexData> stocks;
    public final double usdKrw;
    public final double usdKrwChangePct;
    public final Map<String, IndexData> futures;
    public final MarketSentiment overallSentiment;
    public final Map<String, MarketSentiment> sectorSentiments;
    public final MarketSession marketSession;
    public final Instant fetchedAt;

    public IndexData nasdaqFutures() {
        return futures == null ? null : futures.get("NQ=F");
    }

    /** Price of the given index, or null when it was not fetched. */
    public Double indexPrice(String symbol) {
        IndexData data = indices == null ? null : indices.get(symbol);
        return data == null ? null : data.price;
    }
}
