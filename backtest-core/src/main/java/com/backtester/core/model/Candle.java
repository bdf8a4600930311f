package com.backtester.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * OHLCV data for a single period of one instrument, plus the indicator values
 * computed for it.
 *
 * Price fields are immutable. Indicator values are attached after the fact by
 * the time-series table, keyed by {@code Indicator.name()}.
 */
public final class Candle {
    private final Instant time;
    private final double open;
    private final double high;
    private final double low;
    private final double close;
    private final long volume;
    private final Map<String, Object> indicators;

    public Candle(Instant time, double open, double high, double low, double close, long volume) {
        this.time = time;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
        this.indicators = new HashMap<>();
    }

    /**
     * Candle carrying only a close price. Used when a derived series (e.g. a MACD line)
     * is fed back into another indicator.
     */
    public static Candle ofClose(Instant time, double close) {
        return new Candle(time, close, close, close, close, 0);
    }

    public Instant time() {
        return time;
    }

    public double open() {
        return open;
    }

    public double high() {
        return high;
    }

    public double low() {
        return low;
    }

    public double close() {
        return close;
    }

    public long volume() {
        return volume;
    }

    public void setIndicator(String name, Object value) {
        Objects.requireNonNull(name, "indicator name");
        indicators.put(name, value);
    }

    /**
     * Indicator value stored under {@code name}. Empty if the indicator was never applied
     * or had insufficient history at this candle.
     */
    public Optional<Object> getIndicator(String name) {
        return Optional.ofNullable(indicators.get(name));
    }

    /**
     * Numeric indicator value. Composite values (see {@code MacdValue}) are not numbers
     * and return empty.
     */
    public Optional<Double> getIndicatorAsDouble(String name) {
        Object value = indicators.get(name);
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        return Optional.empty();
    }

    public boolean hasIndicator(String name) {
        return indicators.containsKey(name);
    }

    public Map<String, Object> getAllIndicators() {
        return Collections.unmodifiableMap(indicators);
    }

    @Override
    public String toString() {
        return String.format("Candle[%s O=%.4f H=%.4f L=%.4f C=%.4f V=%d]",
            time, open, high, low, close, volume);
    }
}
