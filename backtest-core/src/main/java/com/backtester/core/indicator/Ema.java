package com.backtester.core.indicator;

import com.backtester.core.model.Candle;

import java.util.ArrayList;
import java.util.List;

/**
 * Exponential moving average of closing prices.
 *
 * <p>The first value (at index {@code period - 1}) is the simple average of the first
 * {@code period} closes; after that {@code ema = (close - ema) * k + ema} with
 * {@code k = 2 / (period + 1)}.
 */
public final class Ema implements Indicator<Double> {
    private final int period;

    public Ema(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("EMA period must be positive, got " + period);
        }
        this.period = period;
    }

    @Override
    public List<Double> calculate(List<Candle> candles) {
        List<Double> closes = new ArrayList<>(candles.size());
        for (Candle candle : candles) {
            closes.add(candle.close());
        }
        return calculateSeries(closes);
    }

    /**
     * Same computation over raw values. Used by {@link Macd} to smooth the MACD line.
     */
    List<Double> calculateSeries(List<Double> values) {
        List<Double> result = new ArrayList<>(values.size());
        double multiplier = 2.0 / (period + 1);
        double ema = 0.0;
        double seedSum = 0.0;
        for (int i = 0; i < values.size(); i++) {
            double value = values.get(i);
            if (i + 1 < period) {
                seedSum += value;
                result.add(null);
            } else if (i + 1 == period) {
                seedSum += value;
                ema = seedSum / period;
                result.add(ema);
            } else {
                ema = (value - ema) * multiplier + ema;
                result.add(ema);
            }
        }
        return result;
    }

    @Override
    public String name() {
        return "EMA_" + period;
    }

    public int getPeriod() {
        return period;
    }
}
