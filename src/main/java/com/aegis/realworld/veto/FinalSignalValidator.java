package com.aegis.realworld.veto;

import com.aegis.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Last gate before a signal is acted on. Applies hard cutoffs that override
 * any composite score.
 *
 * <p>Order: a trading halt forces a sell and skips everything else; otherwise
 * all reasons are collected, hard reasons block buys, soft reasons turn a buy
 * into hold-only, and a clean run passes.
 */
public class FinalSignalValidator {
    private static final Logger LOG = LogManager.getLogger(FinalSignalValidator.class);

    private static final Set<BlockReason> REDUCE_POSITION = EnumSet.of(
            BlockReason.MARKET_PANIC, BlockReason.CALENDAR_CRITICAL, BlockReason.HIGH_VOLATILITY);

    private final double minFundamentalScore;
    private final double minMarketContextScore;
    private final double minTradedValue;
    private final double maxDailyVolatility;
    private final Clock clock;

    public FinalSignalValidator(Config config, Clock clock) {
        this(config.getDouble("veto.min_fundamental_score", -2.0),
                config.getDouble("veto.min_market_context_score", -2.0),
                config.getDouble("veto.min_traded_value", 10_000_000_000.0),
                config.getDouble("veto.max_daily_volatility", 15.0),
                clock);
    }

    public FinalSignalValidator(double minFundamentalScore, double minMarketContextScore,
                                double minTradedValue, double maxDailyVolatility, Clock clock) {
        this.minFundamentalScore = minFundamentalScore;
        this.minMarketContextScore = minMarketContextScore;
        this.minTradedValue = minTradedValue;
        this.maxDailyVolatility = maxDailyVolatility;
        this.clock = clock;
    }

    public ValidationResult validate(String ticker, FusionResult fusion, double avgTradedValue5d) {
        return validate(ticker, fusion, avgTradedValue5d, null);
    }

    /**
     * @param avgTradedValue5d five-day average traded value in KRW
     * @param dailyVolatility  daily volatility in percent, null when unknown
     */
    public ValidationResult validate(String ticker, FusionResult fusion, double avgTradedValue5d,
                                     Double dailyVolatility) {
        Objects.requireNonNull(fusion, "fusion");
        TradeSignal signal = Objects.requireNonNull(fusion.signal, "signal");

        if (fusion.tradingHalt) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("halt_reason", fusion.haltReason);
            LOG.warn("{}: trading halt, forcing sell ({})", ticker, fusion.haltReason);
            return ValidationResult.builder()
                    .ticker(ticker)
                    .decision(ValidationDecision.FORCE_SELL)
                    .reasons(List.of(BlockReason.DISCLOSURE_HALT))
                    .details(Collections.unmodifiableMap(details))
                    .originalSignal(signal)
                    .originalScore(fusion.finalScore)
                    .adjustedScore(null)
                    .adjustedSignal(TradeSignal.FORCE_SELL)
                    .warnings(List.of("Trading Halt detected - Force Sell required"))
                    .validatedAt(clock.instant())
                    .build();
        }

        List<BlockReason> reasons = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, Object> details = new LinkedHashMap<>();

        if (fusion.fundamentalScore < minFundamentalScore) {
            reasons.add(BlockReason.FUNDAMENTAL_RISK);
            details.put("fundamental_score", fusion.fundamentalScore);
            warnings.add(String.format(Locale.US, "Fundamental score (%.2f) below threshold (%.1f)",
                    fusion.fundamentalScore, minFundamentalScore));
        }
        if (fusion.marketContextScore < minMarketContextScore) {
            reasons.add(BlockReason.MARKET_PANIC);
            details.put("market_context_score", fusion.marketContextScore);
            warnings.add(String.format(Locale.US, "Market in panic mode (score: %.2f)", fusion.marketContextScore));
        }
        if (avgTradedValue5d < minTradedValue) {
            reasons.add(BlockReason.LIQUIDITY_TRAP);
            details.put("avg_traded_value_5d", avgTradedValue5d);
            details.put("min_required", minTradedValue);
            warnings.add(String.format(Locale.US, "Low liquidity: %.1f억 (min: %.0f억)",
                    avgTradedValue5d / 1e8, minTradedValue / 1e8));
        }

        String calendarRisk = String.valueOf(fusion.detail("calendar_risk_level", "low"));
        if ("critical".equalsIgnoreCase(calendarRisk)) {
            Object calendarWarning = fusion.detail("calendar_warning", null);
            reasons.add(BlockReason.CALENDAR_CRITICAL);
            details.put("calendar_risk", calendarRisk);
            details.put("calendar_warning", calendarWarning);
            warnings.add("Critical calendar event: " + calendarWarning);
        }

        String condition = String.valueOf(fusion.detail("market_condition", "neutral"));
        if ("panic".equalsIgnoreCase(condition) || "fear".equalsIgnoreCase(condition)) {
            Object fearGreed = fusion.detail("fear_greed_score", 50);
            reasons.add(BlockReason.OVERHEATED_MARKET);
            details.put("market_condition", condition);
            details.put("fear_greed_score", fearGreed);
            warnings.add("Market in " + condition + " mode (F&G: " + fearGreed + ")");
        }

        if (dailyVolatility != null && dailyVolatility > maxDailyVolatility) {
            reasons.add(BlockReason.HIGH_VOLATILITY);
            details.put("daily_volatility", dailyVolatility);
            warnings.add(String.format(Locale.US, "High volatility: %.1f%% (max: %.1f%%)",
                    dailyVolatility, maxDailyVolatility));
        }

        ValidationDecision decision = decide(reasons, signal);
        Double adjustedScore = null;
        TradeSignal adjustedSignal = null;
        switch (decision) {
            case BLOCK_BUY, HOLD_ONLY -> {
                if (signal.isBuy()) {
                    adjustedScore = 0.0;
                    adjustedSignal = TradeSignal.HOLD;
                } else {
                    adjustedScore = fusion.finalScore;
                    adjustedSignal = signal;
                }
            }
            case PASS, BLOCK_SELL, FORCE_SELL -> {
            }
        }

        if (decision != ValidationDecision.PASS) {
            LOG.info("{}: {} {} -> {}", ticker, decision, reasons, adjustedSignal);
        }
        return ValidationResult.builder()
                .ticker(ticker)
                .decision(decision)
                .reasons(List.copyOf(reasons))
                .details(Collections.unmodifiableMap(details))
                .originalSignal(signal)
                .originalScore(fusion.finalScore)
                .adjustedScore(adjustedScore)
                .adjustedSignal(adjustedSignal)
                .warnings(List.copyOf(warnings))
                .validatedAt(clock.instant())
                .build();
    }

    static ValidationDecision decide(List<BlockReason> reasons, TradeSignal signal) {
        if (reasons.contains(BlockReason.FUNDAMENTAL_RISK) || reasons.contains(BlockReason.LIQUIDITY_TRAP)) {
            return ValidationDecision.BLOCK_BUY;
        }
        boolean soft = false;
        for (BlockReason r : reasons) {
            soft |= !r.isHard();
        }
        if (soft && signal.isBuy()) {
            return ValidationDecision.HOLD_ONLY;
        }
        return ValidationDecision.PASS;
    }

    /** A (1000억+), B (500억+), C (100억+), D (50억+) or F by five-day average traded value. */
    public String getLiquidityGrade(double avgTradedValue) {
        if (avgTradedValue >= 100_000_000_000.0) {
            return "A";
        }
        if (avgTradedValue >= 50_000_000_000.0) {
            return "B";
        }
        if (avgTradedValue >= 10_000_000_000.0) {
            return "C";
        }
        if (avgTradedValue >= 5_000_000_000.0) {
            return "D";
        }
        return "F";
    }

    public boolean shouldReducePosition(ValidationResult result) {
        for (BlockReason r : result.reasons) {
            if (REDUCE_POSITION.contains(r)) {
                return true;
            }
        }
        return false;
    }
}
