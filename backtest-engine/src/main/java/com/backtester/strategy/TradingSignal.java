package com.backtester.strategy;

/**
 * Per-instrument decision of a signal-based strategy.
 */
public sealed interface TradingSignal permits TradingSignal.Buy, TradingSignal.Sell, TradingSignal.Hold {

    record Buy(String reason) implements TradingSignal {}

    record Sell(String reason) implements TradingSignal {}

    record Hold(String reason) implements TradingSignal {}

    String reason();
}
