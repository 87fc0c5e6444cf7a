package com.aegis.context.sentiment;

import com.aegis.config.Config;
import com.aegis.core.TtlCache;
import com.aegis.data.MarketDataException;
import com.aegis.data.MarketDataService;
import com.aegis.global.GlobalMarketFetcher;
import com.aegis.model.PriceBar;
import com.aegis.model.Quote;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fear/greed meter for the Korean market built from VIX, KOSPI RSI, an
 * estimated credit-balance ratio and market breadth.
 *
 * <p>Every indicator degrades to a neutral value on failure, so {@link #analyze}
 * never throws for data problems.
 */
public class MarketSentimentMeter {
    private static final Logger LOG = LogManager.getLogger(MarketSentimentMeter.class);

    static final double DEFAULT_VIX = 20.0;
    static final double DEFAULT_RSI = 50.0;
    static final double DEFAULT_CREDIT = 3.0;
    static final double DEFAULT_ADR = 1.0;
    static final int RSI_PERIOD = 14;

    private final MarketDataService market;
    private final GlobalMarketFetcher global;
    private final Clock clock;
    private final String indexSymbol;
    private final List<String> breadthSymbols;
    private final TtlCache<SentimentResult> cache;

    public MarketSentimentMeter(MarketDataService market, GlobalMarketFetcher global, Config config, Clock clock) {
        this.market = market;
        this.global = global;
        this.clock = clock;
        this.indexSymbol = config.getString("sentiment.index_symbol", "^KS11");
        this.breadthSymbols = config.getList("sentiment.breadth_symbols");
        this.cache = new TtlCache<>(config.getSeconds("sentiment.cache_ttl_sec", 600), clock);
    }

    public SentimentResult analyze() {
        return analyze(false);
    }

    public SentimentResult analyze(boolean forceRefresh) {
        return cache.getOrRefresh(this::compute, forceRefresh);
    }

    public void clearCache() {
        cache.clear();
    }

    private SentimentResult compute() {
        double vix = fetchVix();
        List<PriceBar> history = fetchIndexHistory();
        double rsi = marketRsi(closesSince(history, clock.instant().minus(Duration.ofDays(60))));
        double credit = creditRatio(closesSince(history, clock.instant().minus(Duration.ofDays(30))));
        double adr = advanceDeclineRatio();

        SentimentResult result = evaluate(vix, rsi, credit, adr, clock.instant());
        LOG.info("market sentiment: score={} condition={} vix={} rsi={} credit={} adr={}",
                result.sentimentScore, result.marketCondition.code(), vix, rsi, credit, adr);
        return result;
    }

    /** Pure classification of already-measured indicators. */
    static SentimentResult evaluate(double vix, double rsi, double credit, double adr, Instant at) {
        VixLevel vixLevel = VixLevel.of(vix);
        RsiSignal rsiSignal = RsiSignal.of(rsi);
        CreditSignal creditSignal = CreditSignal.of(credit);

        int score = sentimentScore(vix, rsi, credit, adr);
        MarketCondition condition = marketCondition(vixLevel, rsiSignal, creditSignal, score);

        String warning = condition.warning();
        if (creditSignal == CreditSignal.WARNING && warning == null) {
            warning = "신용잔고 과다 - 반대매매 리스크";
        }

        return SentimentResult.builder()
                .vix(vix)
                .vixLevel(vixLevel)
                .marketRsi(rsi)
                .rsiSignal(rsiSignal)
                .creditBalanceRatio(credit)
                .creditSignal(creditSignal)
                .advanceDeclineRatio(adr)
                .putCallRatio(null)
                .sentimentScore(score)
                .sentimentLevel(SentimentLevel.of(score))
                .marketCondition(condition)
                .positionMultiplier(condition.positionMultiplier())
                .riskWarning(warning != null)
                .warningMessage(warning)
                .analyzedAt(at)
                .build();
    }

    static int sentimentScore(double vix, double rsi, double credit, double adr) {
        double vixScore;
        if (vix < 12) vixScore = 90;
        else if (vix < 20) vixScore = 70;
        else if (vix < 25) vixScore = 50;
        else if (vix < 35) vixScore = 30;
        else vixScore = 10;

        double creditScore;
        if (credit < 2) creditScore = 30;
        else if (credit < 4) creditScore = 50;
        else if (credit < 6) creditScore = 70;
        else creditScore = 85;

        double adrScore;
        if (adr < 0.5) adrScore = 15;
        else if (adr < 0.8) adrScore = 35;
        else if (adr < 1.2) adrScore = 50;
        else if (adr < 1.5) adrScore = 65;
        else adrScore = 80;

        int score = (int) (vixScore * 0.35 + rsi * 0.25 + creditScore * 0.20 + adrScore * 0.20);
        return Math.max(0, Math.min(100, score));
    }

    static MarketCondition marketCondition(VixLevel vix, RsiSignal rsi, CreditSignal credit, int score) {
        if (vix == VixLevel.EXTREME) {
            return MarketCondition.PANIC;
        }
        if (vix == VixLevel.HIGH && score < 30) {
            return MarketCondition.FEAR;
        }
        if (vix == VixLevel.LOW && rsi == RsiSignal.OVERBOUGHT && credit.isElevated()) {
            return MarketCondition.EUPHORIA;
        }
        if (rsi == RsiSignal.OVERBOUGHT && credit.isElevated()) {
            return MarketCondition.OVERHEATED;
        }
        if (rsi == RsiSignal.OVERSOLD && (vix == VixLevel.ELEVATED || vix == VixLevel.HIGH)) {
            return MarketCondition.FEAR;
        }
        if (score >= 70) {
            return MarketCondition.BULLISH;
        }
        if (score >= 45) {
            return MarketCondition.NEUTRAL;
        }
        if (score >= 30) {
            return MarketCondition.CAUTIOUS;
        }
        return MarketCondition.FEAR;
    }

    /** Simple-average RSI over the last {@value #RSI_PERIOD} changes. */
    static double marketRsi(List<Double> closes) {
        if (closes.size() < RSI_PERIOD + 1) {
            return DEFAULT_RSI;
        }
        double gain = 0.0;
        double loss = 0.0;
        for (int i = closes.size() - RSI_PERIOD; i < closes.size(); i++) {
            double delta = closes.get(i) - closes.get(i - 1);
            if (delta > 0) {
                gain += delta;
            } else {
                loss -= delta;
            }
        }
        gain /= RSI_PERIOD;
        loss /= RSI_PERIOD;
        if (loss == 0.0) {
            return gain == 0.0 ? DEFAULT_RSI : 100.0;
        }
        double rsi = 100.0 - 100.0 / (1.0 + gain / loss);
        return Math.round(rsi * 100.0) / 100.0;
    }

    /** Credit-balance ratio inferred from the index's trailing 30-day return. */
    static double creditRatio(List<Double> closes) {
        if (closes.size() < 2 || closes.get(0) <= 0.0) {
            return DEFAULT_CREDIT;
        }
        double ret = (closes.get(closes.size() - 1) / closes.get(0) - 1.0) * 100.0;
        if (ret > 10) return 5.5;
        if (ret > 5) return 4.5;
        if (ret > 0) return 3.5;
        if (ret > -5) return 3.0;
        return 2.5;
    }

    static double advanceDeclineRatio(int advances, int declines) {
        if (declines == 0) {
            return advances > 0 ? 2.0 : 1.0;
        }
        return Math.round((double) advances / declines * 100.0) / 100.0;
    }

    private double fetchVix() {
        try {
            Double vix = global.fetch().indexPrice("^VIX");
            if (vix == null) {
                LOG.warn("VIX not in global snapshot, using {}", DEFAULT_VIX);
                return DEFAULT_VIX;
            }
            return vix;
        } catch (RuntimeException e) {
            LOG.warn("VIX fetch failed, using {}: {}", DEFAULT_VIX, e.getMessage());
            return DEFAULT_VIX;
        }
    }

    private List<PriceBar> fetchIndexHistory() {
        try {
            return market.fetchDailyBars(indexSymbol, "3mo");
        } catch (MarketDataException e) {
            LOG.warn("index history unavailable for {}: {}", indexSymbol, e.getMessage());
            return List.of();
        }
    }

    private double advanceDeclineRatio() {
        int advances = 0;
        int declines = 0;
        int seen = 0;
        for (String symbol : breadthSymbols) {
            try {
                Quote quote = market.fetchQuote(symbol);
                seen++;
                if (quote.change > 0.0) {
                    advances++;
                } else if (quote.change < 0.0) {
                    declines++;
                }
            } catch (MarketDataException e) {
                LOG.debug("breadth symbol {} skipped: {}", symbol, e.getMessage());
            }
        }
        if (seen == 0) {
            LOG.warn("no breadth data, using ADR {}", DEFAULT_ADR);
            return DEFAULT_ADR;
        }
        return advanceDeclineRatio(advances, declines);
    }

    private static List<Double> closesSince(List<PriceBar> bars, Instant from) {
        List<Double> out = new ArrayList<>();
        for (PriceBar bar : bars) {
            if (!bar.time.isBefore(from)) {
                out.add(bar.close);
            }
        }
        return out;
    }
}
