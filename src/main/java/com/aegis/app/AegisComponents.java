package com.aegis.app;

import com.aegis.config.CalendarData;
import com.aegis.config.Config;
import com.aegis.context.calendar.MacroCalendarFetcher;
import com.aegis.context.passive.PassiveFundTracker;
import com.aegis.context.sector.SectorEventMonitor;
import com.aegis.context.sentiment.MarketSentimentMeter;
import com.aegis.data.MarketDataService;
import com.aegis.data.http.HttpClientEx;
import com.aegis.global.CouplingAnalyzer;
import com.aegis.global.GlobalMarketFetcher;
import com.aegis.optimization.DynamicWeightOptimizer;
import com.aegis.realworld.execution.ExecutionSimulator;
import com.aegis.realworld.integrity.DataIntegrityManager;
import com.aegis.realworld.veto.FinalSignalValidator;

import java.time.Clock;

/**
 * Builds every component once and shares the market data client and the
 * global fetcher between them.
 *
 * <p>{@link #close()} shuts down the global fetcher's thread pool; the other
 * components hold no resources.
 */
public final class AegisComponents implements AutoCloseable {
    public final Config config;
    public final Clock clock;
    public final CalendarData calendar;
    public final MarketDataService market;
    public final GlobalMarketFetcher globalMarket;
    public final MarketSentimentMeter sentiment;
    public final MacroCalendarFetcher macroCalendar;
    public final PassiveFundTracker passiveFunds;
    public final SectorEventMonitor sectorEvents;
    public final CouplingAnalyzer coupling;
    public final DynamicWeightOptimizer weights;
    public final FinalSignalValidator validator;
    public final DataIntegrityManager integrity;
    public final ExecutionSimulator execution;

    public AegisComponents(Config config, Clock clock) {
        this(config, clock, new MarketDataService(new HttpClientEx(config), config));
    }

    public AegisComponents(Config config, Clock clock, MarketDataService market) {
        this.config = config;
        this.clock = clock;
        this.calendar = CalendarData.load(config);
        this.market = market;
        this.globalMarket = new GlobalMarketFetcher(market, config, clock);
        this.sentiment = new MarketSentimentMeter(market, globalMarket, config, clock);
        this.macroCalendar = new MacroCalendarFetcher(calendar, clock);
        this.passiveFunds = new PassiveFundTracker(calendar, clock);
        this.sectorEvents = new SectorEventMonitor(calendar, clock);
        this.coupling = new CouplingAnalyzer(globalMarket, clock);
        this.weights = new DynamicWeightOptimizer(market, config, clock);
        this.validator = new FinalSignalValidator(config, clock);
        this.integrity = new DataIntegrityManager(market, config, clock);
        this.execution = new ExecutionSimulator(config, clock);
    }

    @Override
    public void close() {
        globalMarket.close();
    }
}
