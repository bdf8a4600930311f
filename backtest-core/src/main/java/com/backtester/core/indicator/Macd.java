package com.backtester.core.indicator;

import com.backtester.core.model.Candle;

import java.util.ArrayList;
import java.util.List;

/**
 * Moving Average Convergence Divergence.
 *
 * <p>MACD line = fast EMA - slow EMA. The signal line is an EMA of the MACD line,
 * seeded once the MACD line has {@code signalPeriod} values, so the first non-null
 * result appears at index {@code max(fast, slow) + signal - 2}.
 */
public final class Macd implements Indicator<MacdValue> {
    private final Ema fastEma;
    private final Ema slowEma;
    private final Ema signalEma;

    public Macd(int fastPeriod, int slowPeriod, int signalPeriod) {
        this.fastEma = new Ema(fastPeriod);
        this.slowEma = new Ema(slowPeriod);
        this.signalEma = new Ema(signalPeriod);
    }

    /** Standard 12/26/9 configuration. */
    public static Macd standard() {
        return new Macd(12, 26, 9);
    }

    @Override
    public List<MacdValue> calculate(List<Candle> candles) {
        List<Double> fast = fastEma.calculate(candles);
        List<Double> slow = slowEma.calculate(candles);

        int firstMacd = -1;
        List<Double> macdLine = new ArrayList<>();
        for (int i = 0; i < candles.size(); i++) {
            if (fast.get(i) != null && slow.get(i) != null) {
                if (firstMacd < 0) {
                    firstMacd = i;
                }
                macdLine.add(fast.get(i) - slow.get(i));
            }
        }

        List<MacdValue> result = new ArrayList<>(candles.size());
        for (int i = 0; i < candles.size(); i++) {
            result.add(null);
        }
        if (firstMacd < 0) {
            return result;
        }
        List<Double> signal = signalEma.calculateSeries(macdLine);
        for (int j = 0; j < macdLine.size(); j++) {
            if (signal.get(j) != null) {
                result.set(firstMacd + j, MacdValue.of(macdLine.get(j), signal.get(j)));
            }
        }
        return result;
    }

    @Override
    public String name() {
        return "MACD_" + fastEma.getPeriod() + "_" + slowEma.getPeriod() + "_" + signalEma.getPeriod();
    }

    @Override
    public List<Indicator<?>> dependencies() {
        return List.of(fastEma, slowEma, signalEma);
    }
}
