package com.aegis.data;

/**
 * Raised when a quote or chart cannot be fetched or parsed.
 */
public class MarketDataException extends RuntimeException {
    private final String symbol;

    public MarketDataException(String symbol, String message) {
        super(symbol + ": " + message);
        this.symbol = symbol;
    }

    public MarketDataException(String symbol, String message, Throwable cause) {
        super(symbol + ": " + message, cause);
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
