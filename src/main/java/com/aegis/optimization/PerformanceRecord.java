package com.aegis.optimization;

import java.time.Instant;
import java.util.Map;

/** One recorded outcome of a signal taken with a given weight set. */
public record PerformanceRecord(Instant timestamp,
                                Regime regime,
                                MarketVolatility volatility,
                                Map<WeightCategory, Double> weights,
                                String signal,
                                double actualReturn,
                                boolean success) {

    /** BUY wins on a positive return, SELL on a negative one; anything else counts as a success. */
    public static boolean isSuccess(String signal, double actualReturn) {
        if ("BUY".equalsIgnoreCase(signal)) {
            return actualReturn > 0;
        }
        if ("SELL".equalsIgnoreCase(signal)) {
            return actualReturn < 0;
        }
        return true;
    }
}
