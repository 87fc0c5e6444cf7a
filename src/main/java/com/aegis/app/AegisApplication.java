package com.aegis.app;

import com.aegis.config.Config;
import com.aegis.context.calendar.CalendarResult;
import com.aegis.context.calendar.EconomicEvent;
import com.aegis.context.passive.PassiveFlowResult;
import com.aegis.context.passive.RebalanceEvent;
import com.aegis.context.sector.SectorAnalysisResult;
import com.aegis.context.sector.SectorEvent;
import com.aegis.context.sentiment.SentimentResult;
import com.aegis.global.CouplingResult;
import com.aegis.optimization.WeightAdjustment;
import com.aegis.optimization.WeightCategory;
import com.aegis.realworld.execution.BreakevenEstimate;
import com.aegis.realworld.integrity.DataHealthReport;
import com.aegis.realworld.integrity.GlobexData;
import com.aegis.realworld.integrity.PremarketSignal;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Command-line front end. Each option prints one component's report; several
 * options may be combined in one run.
 */
public final class AegisApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new AegisApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("aegis", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help") || cmd.getOptions().length == 0) {
            new HelpFormatter().printHelp("aegis", options);
            return 0;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir);
        installLogRoutingIfNeeded(config);
        Clock clock = Clock.system(config.getZone("app.zone", ZoneId.of("Asia/Seoul")));

        try (AegisComponents components = new AegisComponents(config, clock)) {
            if (cmd.hasOption("sentiment")) {
                printSentiment(components.sentiment.analyze());
            }
            if (cmd.hasOption("calendar")) {
                printCalendar(components.macroCalendar.analyze());
            }
            if (cmd.hasOption("passive")) {
                String code = cmd.getOptionValue("passive");
                printPassive(code == null ? components.passiveFunds.analyze() : components.passiveFunds.analyze(code));
            }
            if (cmd.hasOption("sector")) {
                printSector(components.sectorEvents.analyze());
            }
            if (cmd.hasOption("coupling")) {
                String code = cmd.getOptionValue("coupling");
                printCoupling(components.coupling.analyze(code, code, cmd.getOptionValue("sector-name")));
            }
            if (cmd.hasOption("weights")) {
                printWeights(components.weights.getOptimizedWeights(cmd.getOptionValue("weights")));
            }
            if (cmd.hasOption("premarket")) {
                Optional<GlobexData> nq = components.integrity.getNqFutures();
                if (nq.isPresent()) {
                    printPremarket(nq.get(), components.integrity.getPremarketSignal(nq.get()));
                } else {
                    System.out.println("NQ futures unavailable");
                }
            }
            if (cmd.hasOption("health")) {
                printHealth(components.integrity.checkDataHealth());
            }
            if (cmd.hasOption("breakeven")) {
                double price = parsePrice(cmd.getOptionValue("breakeven"));
                printBreakeven(components.execution.estimateBreakeven(price));
            }
            return 0;
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        } catch (RuntimeException e) {
            LogManager.getLogger(AegisApplication.class).error("aegis run failed", e);
            return 1;
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("sentiment").desc("market sentiment meter (VIX, RSI, credit, breadth)").build());
        options.addOption(Option.builder().longOpt("calendar").desc("macro event calendar risk").build());
        options.addOption(Option.builder().longOpt("passive").hasArg().optionalArg(true).argName("code")
                .desc("passive fund rebalance windows, optionally for one stock").build());
        options.addOption(Option.builder().longOpt("sector").desc("sector event monitor").build());
        options.addOption(Option.builder().longOpt("coupling").hasArg().argName("code")
                .desc("U.S. market coupling for a stock code").build());
        options.addOption(Option.builder().longOpt("sector-name").hasArg().argName("sector")
                .desc("sector tag used by --coupling when the code has no mapping").build());
        options.addOption(Option.builder().longOpt("weights").hasArg().argName("regime")
                .desc("volatility-adjusted weights for bull, bear or sideway").build());
        options.addOption(Option.builder().longOpt("premarket").desc("premarket gap signal from Nasdaq futures").build());
        options.addOption(Option.builder().longOpt("health").desc("data freshness report").build());
        options.addOption(Option.builder().longOpt("breakeven").hasArg().argName("price")
                .desc("round-trip break-even rise for a price").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (AegisApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = logDir(config);
                Files.createDirectories(logDir);
                System.setProperty("aegis.log.dir", logDir.toAbsolutePath().toString());

                // Log4j must be initialised before the swap so the console appender keeps the real streams.
                LogManager.getLogger(AegisApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (IOException | RuntimeException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    static Path logDir(Config config) {
        return config.getPath("outputs.dir").resolve("log");
    }

    static double parsePrice(String raw) {
        try {
            return Double.parseDouble(raw.trim().replace(",", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid price: " + raw, e);
        }
    }

    private static void printSentiment(SentimentResult r) {
        System.out.printf(Locale.US, "sentiment score=%d level=%s condition=%s position=%.1f%n",
                r.sentimentScore, r.sentimentLevel.code(), r.marketCondition.code(), r.positionMultiplier);
        System.out.printf(Locale.US, "  vix=%.2f (%s) rsi=%.1f (%s) credit=%.1f (%s) adr=%.1f%n",
                r.vix, r.vixLevel.code(), r.marketRsi, r.rsiSignal.code(),
                r.creditBalanceRatio, r.creditSignal.code(), r.advanceDeclineRatio);
        if (r.riskWarning) {
            System.out.println("  warning: " + r.warningMessage);
        }
    }

    private static void printCalendar(CalendarResult r) {
        System.out.printf(Locale.US, "calendar risk=%s score=%.1f position=%.2f reduce=%s%n",
                r.riskLevel.code(), r.riskScore, r.positionAdjustment, r.shouldReduceExposure);
        for (EconomicEvent e : r.todayEvents) {
            System.out.println("  today  " + e.name() + " [" + e.impact() + "]");
        }
        for (EconomicEvent e : r.upcomingEvents) {
            System.out.println("  D-" + e.dDay() + "  " + e.date() + " " + e.name() + " [" + e.impact() + "]");
        }
        if (r.warningMessage != null) {
            System.out.println("  warning: " + r.warningMessage);
        }
    }

    private static void printPassive(PassiveFlowResult r) {
        System.out.println("passive next rebalance=" + r.nextRebalanceDate + " days=" + r.daysUntilRebalance
                + " inMajorIndex=" + r.stockInMajorIndex + " weight=" + r.estimatedPassiveWeight);
        for (RebalanceEvent e : r.upcomingAdditions) {
            System.out.println("  + " + e.indexType() + " " + e.stockCode() + " " + e.stockName() + " " + e.effectiveDate());
        }
        for (RebalanceEvent e : r.upcomingDeletions) {
            System.out.println("  - " + e.indexType() + " " + e.stockCode() + " " + e.stockName() + " " + e.effectiveDate());
        }
    }

    private static void printSector(SectorAnalysisResult r) {
        System.out.println("sector hot=" + r.hotSectors + " candidates=" + r.buyCandidates);
        for (SectorEvent e : r.activeEvents) {
            System.out.println("  now  " + e.name() + " " + e.startDate() + ".." + e.endDate());
        }
        for (SectorEvent e : r.upcomingEvents) {
            System.out.println("  next " + e.name() + " " + e.startDate() + " " + e.tradingStrategy());
        }
    }

    private static void printCoupling(CouplingResult r) {
        System.out.printf(Locale.US, "coupling %s strength=%s score=%+.1f factor=%.3f%n",
                r.stockCode, r.strength.code(), r.couplingScore, r.adjustmentFactor);
        System.out.println("  " + r.analysisReason);
    }

    private static void printWeights(WeightAdjustment r) {
        System.out.println("weights regime=" + r.regime + " volatility=" + r.volatility.code()
                + " confidence=" + r.confidence);
        for (Map.Entry<WeightCategory, Double> e : r.adjustedWeights.entrySet()) {
            System.out.printf(Locale.US, "  %-12s %.4f (base %.4f)%n",
                    e.getKey().key(), e.getValue(), r.originalWeights.get(e.getKey()));
        }
        System.out.println("  " + r.reason);
    }

    private static void printPremarket(GlobexData nq, PremarketSignal s) {
        System.out.printf(Locale.US, "premarket NQ=%.2f (%+.2f%%) signal=%s bias=%s weight=%.1f%n",
                nq.price, nq.changePct, s.signal.code(), s.bias, s.weightAdjustment);
        System.out.println("  " + s.recommendation);
    }

    private static void printHealth(DataHealthReport r) {
        System.out.println("data health=" + r.overallStatus.code() + " sources=" + r.sources);
        for (String w : r.warnings) {
            System.out.println("  warning: " + w);
        }
    }

    private static void printBreakeven(BreakevenEstimate b) {
        System.out.printf(Locale.US, "breakeven price=%.0f tick=%d total=%.3f%%%n",
                b.price, b.tickSize, b.totalBreakevenPct);
        System.out.println("  " + b.note);
    }
}
