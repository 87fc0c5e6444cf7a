package com.aegis.realworld.veto;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FinalSignalValidatorTest {

    private static final double LIQUID = 20_000_000_000.0;

    private final Clock clock = Clock.fixed(Instant.parse("2026-10-19T00:30:00Z"), ZoneOffset.UTC);
    private final FinalSignalValidator validator =
            new FinalSignalValidator(-2.0, -2.0, 10_000_000_000.0, 15.0, clock);

    private static FusionResult.FusionResultBuilder fusion(TradeSignal signal, double score) {
        return FusionResult.builder()
                .signal(signal)
                .finalScore(score)
                .fundamentalScore(0.5)
                .marketContextScore(0.0)
                .details(Map.of());
    }

    @Test
    void tradingHaltShouldForceSellAndSkipOtherChecks() {
        FusionResult halted = fusion(TradeSignal.BUY, 2.5)
                .tradingHalt(true)
                .haltReason("거래정지 공시")
                .fundamentalScore(-5.0)
                .build();

        ValidationResult result = validator.validate("005930", halted, 1.0);

        assertEquals(ValidationDecision.FORCE_SELL, result.decision);
        assertEquals(List.of(BlockReason.DISCLOSURE_HALT), result.reasons);
        assertEquals(TradeSignal.FORCE_SELL, result.adjustedSignal);
        assertNull(result.adjustedScore);
        assertEquals("거래정지 공시", result.details.get("halt_reason"));
        assertEquals(List.of("Trading Halt detected - Force Sell required"), result.warnings);
    }

    @Test
    void hardReasonsShouldBlockBuy() {
        FusionResult weak = fusion(TradeSignal.STRONG_BUY, 3.0).fundamentalScore(-2.5).build();

        ValidationResult result = validator.validate("035720", weak, 5_000_000_000.0);

        assertEquals(ValidationDecision.BLOCK_BUY, result.decision);
        assertEquals(List.of(BlockReason.FUNDAMENTAL_RISK, BlockReason.LIQUIDITY_TRAP), result.reasons);
        assertEquals(TradeSignal.HOLD, result.adjustedSignal);
        assertEquals(0.0, result.adjustedScore);
        assertTrue(result.warnings.contains("Low liquidity: 50.0억 (min: 100억)"));
        assertEquals(TradeSignal.STRONG_BUY, result.originalSignal);
        assertEquals(3.0, result.originalScore);
    }

    @Test
    void softReasonsShouldTurnBuyIntoHoldOnly() {
        FusionResult risky = fusion(TradeSignal.BUY, 1.8)
                .details(Map.of("calendar_risk_level", "CRITICAL", "calendar_warning", "FOMC D-0"))
                .build();

        ValidationResult result = validator.validate("000660", risky, LIQUID, 16.0);

        assertEquals(ValidationDecision.HOLD_ONLY, result.decision);
        assertEquals(List.of(BlockReason.CALENDAR_CRITICAL, BlockReason.HIGH_VOLATILITY), result.reasons);
        assertEquals(TradeSignal.HOLD, result.adjustedSignal);
        assertEquals("FOMC D-0", result.details.get("calendar_warning"));
        assertTrue(validator.shouldReducePosition(result));
    }

    @Test
    void fearfulMarketShouldFlagOverheatedMarket() {
        FusionResult fearful = fusion(TradeSignal.BUY, 1.2)
                .details(Map.of("market_condition", "fear", "fear_greed_score", 22))
                .build();

        ValidationResult result = validator.validate("005930", fearful, LIQUID);

        assertEquals(List.of(BlockReason.OVERHEATED_MARKET), result.reasons);
        assertEquals(ValidationDecision.HOLD_ONLY, result.decision);
        assertEquals("Market in fear mode (F&G: 22)", result.warnings.get(0));
        assertFalse(validator.shouldReducePosition(result));
    }

    @Test
    void sellSignalShouldKeepItsValuesWhenBlocked() {
        FusionResult sell = fusion(TradeSignal.SELL, -1.5).marketContextScore(-3.0).build();

        ValidationResult soft = validator.validate("005930", sell, LIQUID);
        ValidationResult hard = validator.validate("005930", sell, 1_000_000_000.0);

        assertEquals(ValidationDecision.PASS, soft.decision);
        assertEquals(List.of(BlockReason.MARKET_PANIC), soft.reasons);
        assertNull(soft.adjustedSignal);
        assertEquals(ValidationDecision.BLOCK_BUY, hard.decision);
        assertEquals(TradeSignal.SELL, hard.adjustedSignal);
        assertEquals(-1.5, hard.adjustedScore);
    }

    @Test
    void cleanSignalShouldPassUntouched() {
        ValidationResult result = validator.validate("005930", fusion(TradeSignal.BUY, 1.0).details(null).build(),
                LIQUID, 3.0);

        assertEquals(ValidationDecision.PASS, result.decision);
        assertTrue(result.reasons.isEmpty());
        assertTrue(result.warnings.isEmpty());
        assertNull(result.adjustedScore);
        assertNull(result.adjustedSignal);
        assertEquals(clock.instant(), result.validatedAt);
    }

    @Test
    void liquidityGradeShouldFollowThresholds() {
        assertEquals("A", validator.getLiquidityGrade(100_000_000_000.0));
        assertEquals("B", validator.getLiquidityGrade(60_000_000_000.0));
        assertEquals("C", validator.getLiquidityGrade(10_000_000_000.0));
        assertEquals("D", validator.getLiquidityGrade(5_000_000_000.0));
        assertEquals("F", validator.getLiquidityGrade(4_999_999_999.0));
    }

    @Test
    void missingFusionOrSignalShouldBeRejected() {
        FusionResult noSignal = fusion(null, 1.0).build();

        NullPointerException e = assertThrows(NullPointerException.class,
                () -> validator.validate("005930", noSignal, LIQUID));
        assertEquals("signal", e.getMessage());
        assertThrows(NullPointerException.class, () -> validator.validate("005930", null, LIQUID));
    }

    @Test
    void decideShouldIgnoreSoftReasonsForNonBuySignals() {
        assertEquals(ValidationDecision.PASS,
                FinalSignalValidator.decide(List.of(BlockReason.HIGH_VOLATILITY), TradeSignal.HOLD));
        assertEquals(ValidationDecision.BLOCK_BUY,
                FinalSignalValidator.decide(List.of(BlockReason.LIQUIDITY_TRAP), TradeSignal.STRONG_SELL));
    }
}
