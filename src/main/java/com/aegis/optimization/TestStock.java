package com.aegis.optimization;

/**
 * Panel member for robustness runs. {@code profile} is one of stable,
 * large_cap, volatile, cyclical, growth; anything else uses default figures.
 */
public record TestStock(String ticker, String name, String profile) {
}
