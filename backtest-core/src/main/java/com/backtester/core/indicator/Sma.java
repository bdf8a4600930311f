package com.backtester.core.indicator;

import com.backtester.core.model.Candle;

import java.util.ArrayList;
import java.util.List;

/**
 * Simple moving average of closing prices over {@code period} candles.
 */
public final class Sma implements Indicator<Double> {
    private final int period;

    public Sma(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("SMA period must be positive, got " + period);
        }
        this.period = period;
    }

    @Override
    public List<Double> calculate(List<Candle> candles) {
        List<Double> result = new ArrayList<>(candles.size());
        double windowSum = 0.0;
        for (int i = 0; i < candles.size(); i++) {
            windowSum += candles.get(i).close();
            if (i >= period) {
                windowSum -= candles.get(i - period).close();
            }
            result.add(i + 1 < period ? null : windowSum / period);
        }
        return result;
    }

    @Override
    public String name() {
        return "SMA_" + period;
    }

    public int getPeriod() {
        return period;
    }
}
