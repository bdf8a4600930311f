package com.backtester.config;

import com.backtester.portfolio.PortfolioSettings;
import com.backtester.risk.RiskSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Backtest configuration loaded from {@code backtest.properties}.
 *
 * Percent values are written as percentages in the file (STOP_LOSS_PERCENT=5 means 5%);
 * use the {@code getXDecimal()} getters for calculations. Missing or invalid values fall
 * back to defaults with a warning.
 */
public final class BacktestConfig {
    private static final Logger logger = LoggerFactory.getLogger(BacktestConfig.class);
    public static final String DEFAULT_FILE = "backtest.properties";

    private final Properties properties;

    // Account
    private final double initialCapital;
    private final boolean enableShorts;
    private final double defaultLeverage;

    // Risk limits
    private final double maxLeverage;                 // 0 = unlimited
    private final double maxPositionAllocationPercent; // 0 = unlimited
    private final double riskPerTradePercent;

    // Exit rules
    private final boolean useStopLoss;
    private final double stopLossPercent;
    private final boolean useTakeProfit;
    private final double takeProfitPercent;
    private final boolean useTrailingStop;
    private final double trailingStopPercent;

    // Metrics
    private final double riskFreeRatePercent;

    // Example strategy
    private final int smaFastPeriod;
    private final int smaSlowPeriod;
    private final double allocationPercent;

    // Files
    private final String dataFile;
    private final String resultsFile;

    private BacktestConfig(Properties props) {
        this.properties = props;

        this.initialCapital = parseDouble("INITIAL_CAPITAL", 10000.0);
        this.enableShorts = parseBoolean("ENABLE_SHORTS", false);
        this.defaultLeverage = parseDouble("DEFAULT_LEVERAGE", 1.0);

        this.maxLeverage = parseNonNegative("MAX_LEVERAGE", 0.0);
        this.maxPositionAllocationPercent = parseNonNegative("MAX_POSITION_ALLOCATION_PERCENT", 0.0);
        this.riskPerTradePercent = parseNonNegative("RISK_PER_TRADE_PERCENT", 1.0);
        if (maxLeverage > 0 && defaultLeverage > maxLeverage) {
            logger.warn("DEFAULT_LEVERAGE {}x exceeds MAX_LEVERAGE {}x; entries without their own leverage will be rejected",
                    defaultLeverage, maxLeverage);
        }

        this.useStopLoss = parseBoolean("USE_STOP_LOSS", true);
        this.stopLossPercent = parseNonNegative("STOP_LOSS_PERCENT", 5.0);
        this.useTakeProfit = parseBoolean("USE_TAKE_PROFIT", true);
        this.takeProfitPercent = parseNonNegative("TAKE_PROFIT_PERCENT", 10.0);
        this.useTrailingStop = parseBoolean("USE_TRAILING_STOP", false);
        this.trailingStopPercent = parseNonNegative("TRAILING_STOP_PERCENT", 3.0);

        this.riskFreeRatePercent = parseNonNegative("RISK_FREE_RATE_PERCENT", 4.0);

        this.smaFastPeriod = (int) parseLong("SMA_FAST_PERIOD", 5);
        this.smaSlowPeriod = (int) parseLong("SMA_SLOW_PERIOD", 20);
        this.allocationPercent = parseNonNegative("ALLOCATION_PERCENT", 95.0);

        this.dataFile = properties.getProperty("DATA_FILE", "prices.json").trim();
        this.resultsFile = properties.getProperty("RESULTS_FILE", "results.json").trim();

        logger.info("📊 Backtest Configuration Loaded:");
        logger.info("   Initial Capital: ${}", String.format("%.2f", initialCapital));
        logger.info("   Stop-Loss: {}", useStopLoss ? String.format("%.2f%%", stopLossPercent) : "off");
        logger.info("   Take-Profit: {}", useTakeProfit ? String.format("%.2f%%", takeProfitPercent) : "off");
        logger.info("   Trailing-Stop: {}", useTrailingStop ? String.format("%.2f%%", trailingStopPercent) : "off");
        logger.info("   Risk per Trade: {}%", String.format("%.2f", riskPerTradePercent));
    }

    /**
     * Parse a non-negative value; percents are whole numbers (5 means 5%).
     */
    private double parseNonNegative(String key, double defaultValue) {
        double parsed = parseDouble(key, defaultValue);
        if (parsed < 0) {
            logger.warn("Negative {} value '{}', using default {}", key, parsed, defaultValue);
            return defaultValue;
        }
        return parsed;
    }

    private double parseDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private long parseLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private boolean parseBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Load {@code backtest.properties} from the working directory, else the classpath,
     * else use defaults.
     */
    public static BacktestConfig load() {
        return load(Path.of(DEFAULT_FILE));
    }

    /**
     * Load from {@code configPath}, falling back to {@code backtest.properties} on the
     * classpath, then to defaults.
     */
    public static BacktestConfig load(Path configPath) {
        Properties props = new Properties();

        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                props.load(is);
                logger.info("Loaded config from: {}", configPath.toAbsolutePath());
                return new BacktestConfig(props);
            } catch (IOException e) {
                logger.warn("Failed to load {} from filesystem: {}", configPath, e.getMessage());
            }
        }

        try (InputStream is = BacktestConfig.class.getClassLoader().getResourceAsStream(DEFAULT_FILE)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded config from classpath");
                return new BacktestConfig(props);
            }
        } catch (IOException e) {
            logger.warn("Failed to load {} from classpath: {}", DEFAULT_FILE, e.getMessage());
        }

        logger.warn("No {} found, using defaults", DEFAULT_FILE);
        return new BacktestConfig(new Properties());
    }

    /**
     * Create a test instance with custom properties.
     */
    public static BacktestConfig forTest(Properties testProps) {
        return new BacktestConfig(testProps);
    }

    public PortfolioSettings toPortfolioSettings() {
        return new PortfolioSettings(initialCapital, enableShorts, defaultLeverage);
    }

    public RiskSettings toRiskSettings() {
        return new RiskSettings(
                maxLeverage,
                getMaxPositionAllocationDecimal(),
                getRiskPerTradeDecimal(),
                useStopLoss, getStopLossDecimal(),
                useTakeProfit, getTakeProfitDecimal(),
                useTrailingStop, getTrailingStopDecimal());
    }

    // ========== Getters ==========

    public double getInitialCapital() {
        return initialCapital;
    }

    public boolean isShortsEnabled() {
        return enableShorts;
    }

    public double getDefaultLeverage() {
        return defaultLeverage;
    }

    /** Max leverage (e.g., 2 = 2x); 0 means unlimited */
    public double getMaxLeverage() {
        return maxLeverage;
    }

    public double getMaxPositionAllocationPercent() {
        return maxPositionAllocationPercent;
    }

    public double getMaxPositionAllocationDecimal() {
        return maxPositionAllocationPercent / 100.0;
    }

    /** Risk per trade percentage (e.g., 1.0 = 1%) */
    public double getRiskPerTradePercent() {
        return riskPerTradePercent;
    }

    public double getRiskPerTradeDecimal() {
        return riskPerTradePercent / 100.0;
    }

    public boolean isStopLossEnabled() {
        return useStopLoss;
    }

    /** Stop-loss percentage (e.g., 5 = 5%) - for calculations use getStopLossDecimal() */
    public double getStopLossPercent() {
        return stopLossPercent;
    }

    /** Stop-loss as decimal (e.g., 0.05 for 5%) */
    public double getStopLossDecimal() {
        return stopLossPercent / 100.0;
    }

    public boolean isTakeProfitEnabled() {
        return useTakeProfit;
    }

    public double getTakeProfitPercent() {
        return takeProfitPercent;
    }

    public double getTakeProfitDecimal() {
        return takeProfitPercent / 100.0;
    }

    public boolean isTrailingStopEnabled() {
        return useTrailingStop;
    }

    public double getTrailingStopPercent() {
        return trailingStopPercent;
    }

    public double getTrailingStopDecimal() {
        return trailingStopPercent / 100.0;
    }

    public double getRiskFreeRateDecimal() {
        return riskFreeRatePercent / 100.0;
    }

    public int getSmaFastPeriod() {
        return smaFastPeriod;
    }

    public int getSmaSlowPeriod() {
        return smaSlowPeriod;
    }

    /** Share of cash each SMA crossover entry commits, as decimal */
    public double getAllocationDecimal() {
        return allocationPercent / 100.0;
    }

    public String getDataFile() {
        return dataFile;
    }

    public String getResultsFile() {
        return resultsFile;
    }

    /** Get raw property value */
    public String getProperty(String key) {
        return properties.getProperty(key);
    }
}
