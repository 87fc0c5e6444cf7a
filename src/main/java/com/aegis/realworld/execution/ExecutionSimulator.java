package com.aegis.realworld.execution;

import com.aegis.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalTime;
import java.util.Locale;

/**
 * Turns a decision into the P&amp;L a trader would actually see on KRX: one or
 * more ticks of slippage against the order, brokerage fee on both legs and
 * the transaction tax on the sell leg.
 */
public class ExecutionSimulator {
    private static final Logger LOG = LogManager.getLogger(ExecutionSimulator.class);

    public static final double DEFAULT_BUY_COST_RATE = 0.00015;
    public static final double DEFAULT_SELL_COST_RATE = 0.0023;

    private static final double[] TICK_LIMITS = {2_000, 5_000, 20_000, 50_000, 200_000, 500_000};
    private static final int[] TICK_SIZES = {1, 5, 10, 50, 100, 500};
    private static final int TOP_TICK = 1_000;

    private final double buyCostRate;
    private final double sellCostRate;
    private final Clock clock;

    public ExecutionSimulator(Config config, Clock clock) {
        this(config.getDouble("execution.buy_cost_rate", DEFAULT_BUY_COST_RATE),
                config.getDouble("execution.sell_cost_rate", DEFAULT_SELL_COST_RATE),
                clock);
    }

    public ExecutionSimulator(double buyCostRate, double sellCostRate, Clock clock) {
        this.buyCostRate = buyCostRate;
        this.sellCostRate = sellCostRate;
        this.clock = clock;
    }

    public TimeSegment getCurrentTimeSegment() {
        return TimeSegment.at(LocalTime.now(clock));
    }

    public double getTimeBasedWeightAdjustment() {
        return getTimeBasedWeightAdjustment(StrategyType.TREND_FOLLOWING);
    }

    public double getTimeBasedWeightAdjustment(StrategyType strategy) {
        return strategy.weightIn(getCurrentTimeSegment());
    }

    public static int getTickSize(double price) {
        for (int i = 0; i < TICK_LIMITS.length; i++) {
            if (price < TICK_LIMITS[i]) {
                return TICK_SIZES[i];
            }
        }
        return TOP_TICK;
    }

    /** Expected fill price after moving {@code ticks} ticks against the order. */
    public static double calculateSlippage(double price, OrderSide side, int ticks) {
        double amount = slippageAmount(price, ticks);
        return side == OrderSide.BUY ? price + amount : price - amount;
    }

    private static double slippageAmount(double price, int ticks) {
        return (double) getTickSize(price) * ticks;
    }

    public ExecutionResult simulateBuy(String ticker, double price, int quantity) {
        return simulate(ticker, OrderSide.BUY, price, quantity, 1);
    }

    public ExecutionResult simulateBuy(String ticker, double price, int quantity, int slippageTicks) {
        return simulate(ticker, OrderSide.BUY, price, quantity, slippageTicks);
    }

    public ExecutionResult simulateSell(String ticker, double price, int quantity) {
        return simulate(ticker, OrderSide.SELL, price, quantity, 1);
    }

    public ExecutionResult simulateSell(String ticker, double price, int quantity, int slippageTicks) {
        return simulate(ticker, OrderSide.SELL, price, quantity, slippageTicks);
    }

    private ExecutionResult simulate(String ticker, OrderSide side, double price, int quantity, int ticks) {
        requirePositive(price, "price");
        TimeSegment segment = getCurrentTimeSegment();
        double slippage = slippageAmount(price, ticks);
        double expected = calculateSlippage(price, side, ticks);
        double rate = side == OrderSide.BUY ? buyCostRate : sellCostRate;

        double gross = expected * quantity;
        double taxFee = gross * rate;
        double net = side == OrderSide.BUY ? gross + taxFee : gross - taxFee;

        return ExecutionResult.builder()
                .ticker(ticker)
                .side(side)
                .signalPrice(price)
                .expectedPrice(expected)
                .slippage(slippage)
                .slippagePct(slippage / price * 100.0)
                .taxFee(taxFee)
                .taxFeePct(rate * 100.0)
                .quantity(quantity)
                .grossAmount(gross)
                .netAmount(net)
                .timeSegment(segment)
                .weightAdjustment(StrategyType.TREND_FOLLOWING.weightIn(segment))
                .simulatedAt(clock.instant())
                .build();
    }

    public PnLSimulation simulateRoundTrip(String ticker, double buyPrice, double sellPrice, int quantity) {
        return simulateRoundTrip(ticker, buyPrice, sellPrice, quantity, 1);
    }

    public PnLSimulation simulateRoundTrip(String ticker, double buyPrice, double sellPrice,
                                           int quantity, int slippageTicks) {
        requirePositive(buyPrice, "buyPrice");
        requirePositive(sellPrice, "sellPrice");
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + quantity);
        }

        double buySlippage = slippageAmount(buyPrice, slippageTicks);
        double buyFill = buyPrice + buySlippage;
        double buyAmount = buyFill * quantity;
        double buyCost = buyAmount * buyCostRate;

        double sellSlippage = slippageAmount(sellPrice, slippageTicks);
        double sellFill = sellPrice - sellSlippage;
        double sellAmount = sellFill * quantity;
        double sellCost = sellAmount * sellCostRate;

        double gross = sellAmount - buyAmount;
        double totalCost = buyCost + sellCost;
        double net = gross - totalCost;
        double netPct = net / buyAmount * 100.0;
        double breakeven = (buyCostRate + sellCostRate + buySlippage / buyPrice + sellSlippage / sellPrice) * 100.0;

        LOG.debug("{} round trip {} -> {} x{}: net {}", ticker, buyPrice, sellPrice, quantity, Math.round(net));
        return PnLSimulation.builder()
                .ticker(ticker)
                .buyPrice(buyFill)
                .buySlippage(buySlippage)
                .buyCost(buyCost)
                .sellPrice(sellFill)
                .sellSlippage(sellSlippage)
                .sellCost(sellCost)
                .grossProfit(Math.round(gross))
                .totalCost(Math.round(totalCost))
                .netProfit(Math.round(net))
                .netProfitPct(round(netPct, 2))
                .breakevenPct(round(breakeven, 2))
                .build();
    }

    /** Rise needed to cover one tick of slippage on each leg plus both legs' costs. */
    public BreakevenEstimate estimateBreakeven(double price) {
        requirePositive(price, "price");
        int tick = getTickSize(price);
        double slippagePct = tick / price * 100.0;
        double buyCostPct = buyCostRate * 100.0;
        double sellCostPct = sellCostRate * 100.0;
        double total = slippagePct * 2 + buyCostPct + sellCostPct;
        return BreakevenEstimate.builder()
                .price(price)
                .tickSize(tick)
                .buySlippagePct(round(slippagePct, 3))
                .sellSlippagePct(round(slippagePct, 3))
                .buyCostPct(round(buyCostPct, 3))
                .sellCostPct(round(sellCostPct, 3))
                .totalBreakevenPct(round(total, 3))
                .note(String.format(Locale.US, "최소 %.2f%% 상승해야 본전", total))
                .build();
    }

    private static void requirePositive(double price, String name) {
        if (!(price > 0.0)) {
            throw new IllegalArgumentException(name + " must be positive: " + price);
        }
    }

    static double round(double v, int places) {
        double scale = Math.pow(10, places);
        return Math.round(v * scale) / scale;
    }
}
