package com.backtester.core.indicator;

/**
 * MACD line, signal line and histogram ({@code macd - signal}) at one candle.
 */
public record MacdValue(double macd, double signal, double histogram) {

    public static MacdValue of(double macd, double signal) {
        return new MacdValue(macd, signal, macd - signal);
    }
}
