package com.backtester;

import com.backtester.config.BacktestConfig;
import com.backtester.core.data.CandleJsonLoader;
import com.backtester.core.data.TimeseriesTable;
import com.backtester.core.model.Candle;
import com.backtester.metrics.BacktestResults;
import com.backtester.metrics.PerformanceMetrics;
import com.backtester.portfolio.Portfolio;
import com.backtester.risk.DefaultRiskManager;
import com.backtester.runner.AccountValue;
import com.backtester.runner.BacktestException;
import com.backtester.runner.IndicatorConfig;
import com.backtester.runner.Runner;
import com.backtester.strategy.SmaCrossoverStrategy;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: runs the SMA crossover strategy over a JSON price file.
 *
 * <pre>
 * java com.backtester.BacktestApp [config.properties] [prices.json]
 * </pre>
 */
public final class BacktestApp {
    private static final Logger logger = LoggerFactory.getLogger(BacktestApp.class);

    public record BacktestReport(
        @JsonProperty("results") BacktestResults results,
        @JsonProperty("equity_curve") List<AccountValue> equityCurve
    ) {}

    private BacktestApp() {
    }

    public static void main(String[] args) {
        BacktestConfig config = args.length > 0 ? BacktestConfig.load(Path.of(args[0])) : BacktestConfig.load();
        Path dataFile = Path.of(args.length > 1 ? args[1] : config.getDataFile());
        try {
            BacktestReport report = run(config, dataFile);
            PerformanceMetrics.printDashboard(report.results(), System.out);
            Path resultsFile = Path.of(config.getResultsFile());
            writeReport(report, resultsFile);
            logger.info("Results written to {}", resultsFile.toAbsolutePath());
        } catch (IOException e) {
            logger.error("Failed to read or write backtest files", e);
            System.exit(1);
        } catch (BacktestException e) {
            logger.error("Backtest failed", e);
            System.exit(2);
        }
    }

    /**
     * Runs the configured SMA crossover backtest over {@code dataFile}.
     */
    public static BacktestReport run(BacktestConfig config, Path dataFile) throws IOException {
        TimeseriesTable<Candle> data = new CandleJsonLoader().load(dataFile);
        SmaCrossoverStrategy strategy = new SmaCrossoverStrategy(
                config.getSmaFastPeriod(), config.getSmaSlowPeriod(), config.getAllocationDecimal());

        Runner runner = Runner.builder(strategy)
                .portfolio(new Portfolio(config.toPortfolioSettings()))
                .riskManager(new DefaultRiskManager(config.toRiskSettings()))
                .data(data)
                .indicators(new IndicatorConfig(strategy.indicators()))
                .riskFreeRate(config.getRiskFreeRateDecimal())
                .build();

        List<AccountValue> equityCurve = runner.run();
        return new BacktestReport(runner.results(), equityCurve);
    }

    static void writeReport(BacktestReport report, Path target) throws IOException {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        mapper.writeValue(target.toFile(), report);
    }
}
