package com.backtester.portfolio;

/**
 * Account setup for a {@link Portfolio}.
 *
 * @param initialCapital  starting cash
 * @param enableShorts    whether short entries are accepted
 * @param defaultLeverage leverage for entries that carry none (1x); values below 1 mean 1
 */
public record PortfolioSettings(
    double initialCapital,
    boolean enableShorts,
    double defaultLeverage
) {
    public PortfolioSettings {
        if (initialCapital < 0 || Double.isNaN(initialCapital)) {
            throw new IllegalArgumentException("Initial capital cannot be negative: " + initialCapital);
        }
        if (defaultLeverage < 1.0) {
            defaultLeverage = 1.0;
        }
    }

    /** Long-only, unlevered account. */
    public static PortfolioSettings of(double initialCapital) {
        return new PortfolioSettings(initialCapital, false, 1.0);
    }

    public PortfolioSettings withShorts(boolean enabled) {
        return new PortfolioSettings(initialCapital, enabled, defaultLeverage);
    }

    public PortfolioSettings withDefaultLeverage(double leverage) {
        return new PortfolioSettings(initialCapital, enableShorts, leverage);
    }
}
