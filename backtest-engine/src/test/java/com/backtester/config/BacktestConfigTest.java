package com.backtester.config;

import com.backtester.portfolio.PortfolioSettings;
import com.backtester.risk.RiskSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BacktestConfig
 * Percent properties are whole numbers; the Decimal getters divide by 100
 */
@DisplayName("BacktestConfig Tests")
class BacktestConfigTest {

    private static final double DELTA = 1e-9;

    private static BacktestConfig config(String... keyValues) {
        Properties props = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            props.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return BacktestConfig.forTest(props);
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Should use defaults for an empty config")
        void testDefaults() {
            BacktestConfig config = config();

            assertEquals(10000.0, config.getInitialCapital(), DELTA);
            assertFalse(config.isShortsEnabled());
            assertEquals(1.0, config.getDefaultLeverage(), DELTA);
            assertEquals(0.0, config.getMaxLeverage(), DELTA);
            assertTrue(config.isStopLossEnabled());
            assertEquals(0.05, config.getStopLossDecimal(), DELTA);
            assertTrue(config.isTakeProfitEnabled());
            assertEquals(0.10, config.getTakeProfitDecimal(), DELTA);
            assertFalse(config.isTrailingStopEnabled());
            assertEquals(0.04, config.getRiskFreeRateDecimal(), DELTA);
            assertEquals(5, config.getSmaFastPeriod());
            assertEquals(20, config.getSmaSlowPeriod());
            assertEquals(0.95, config.getAllocationDecimal(), DELTA);
            assertEquals("prices.json", config.getDataFile());
            assertEquals("results.json", config.getResultsFile());
        }

        @Test
        @DisplayName("Should fall back on unparseable values")
        void testInvalidValues() {
            BacktestConfig config = config(
                    "INITIAL_CAPITAL", "lots",
                    "STOP_LOSS_PERCENT", "NaN",
                    "SMA_FAST_PERIOD", "5.5",
                    "TAKE_PROFIT_PERCENT", "Infinity");

            assertEquals(10000.0, config.getInitialCapital(), DELTA);
            assertEquals(5.0, config.getStopLossPercent(), DELTA);
            assertEquals(5, config.getSmaFastPeriod());
            assertEquals(10.0, config.getTakeProfitPercent(), DELTA);
        }

        @Test
        @DisplayName("Should fall back on negative percents and leverage")
        void testNegativeValues() {
            BacktestConfig config = config(
                    "STOP_LOSS_PERCENT", "-5",
                    "MAX_LEVERAGE", "-2",
                    "MAX_POSITION_ALLOCATION_PERCENT", "-10");

            assertEquals(5.0, config.getStopLossPercent(), DELTA);
            assertEquals(0.0, config.getMaxLeverage(), DELTA);
            assertEquals(0.0, config.getMaxPositionAllocationPercent(), DELTA);
            assertDoesNotThrow(config::toRiskSettings);
        }
    }

    @Test
    @DisplayName("Should build risk settings with decimal rates")
    void testToRiskSettings() {
        RiskSettings settings = config(
                "MAX_LEVERAGE", "3",
                "MAX_POSITION_ALLOCATION_PERCENT", "25",
                "STOP_LOSS_PERCENT", "2.5",
                "USE_TAKE_PROFIT", "false",
                "USE_TRAILING_STOP", "true",
                "TRAILING_STOP_PERCENT", "1.5").toRiskSettings();

        assertEquals(3.0, settings.maxLeverage(), DELTA);
        assertEquals(0.25, settings.maxPositionAllocationRate(), DELTA);
        assertEquals(0.01, settings.riskPerTradeRate(), DELTA);
        assertTrue(settings.useStopLoss());
        assertEquals(0.025, settings.stopLossRate(), DELTA);
        assertFalse(settings.useTakeProfit());
        assertTrue(settings.useTrailingStop());
        assertEquals(0.015, settings.trailingStopRate(), DELTA);
    }

    @Test
    @DisplayName("Should build portfolio settings")
    void testToPortfolioSettings() {
        PortfolioSettings settings = config(
                "INITIAL_CAPITAL", "50000",
                "ENABLE_SHORTS", "true",
                "DEFAULT_LEVERAGE", "2").toPortfolioSettings();

        assertEquals(50000.0, settings.initialCapital(), DELTA);
        assertTrue(settings.enableShorts());
        assertEquals(2.0, settings.defaultLeverage(), DELTA);
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("Should load from a file")
        void testLoadFromFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("custom.properties");
            Files.writeString(file, "INITIAL_CAPITAL=2500\nDATA_FILE = data/spy.json \n");

            BacktestConfig config = BacktestConfig.load(file);

            assertEquals(2500.0, config.getInitialCapital(), DELTA);
            assertEquals("data/spy.json", config.getDataFile());
            assertEquals("2500", config.getProperty("INITIAL_CAPITAL"));
        }

        @Test
        @DisplayName("Should fall back to the bundled properties")
        void testLoadFromClasspath(@TempDir Path dir) {
            BacktestConfig config = BacktestConfig.load(dir.resolve("missing.properties"));

            assertEquals(2.0, config.getMaxLeverage(), DELTA);
            assertEquals(100.0, config.getMaxPositionAllocationPercent(), DELTA);
        }
    }
}
