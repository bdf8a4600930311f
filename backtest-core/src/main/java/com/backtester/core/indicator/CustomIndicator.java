package com.backtester.core.indicator;

import com.backtester.core.model.Candle;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Indicator backed by a user-supplied function. The function must return one entry per
 * candle, {@code null} where no value is available.
 */
public final class CustomIndicator<V> implements Indicator<V> {
    private final String name;
    private final Function<List<Candle>, List<V>> calculation;
    private final List<Indicator<?>> dependencies;

    public CustomIndicator(String name, Function<List<Candle>, List<V>> calculation) {
        this(name, calculation, List.of());
    }

    public CustomIndicator(String name, Function<List<Candle>, List<V>> calculation,
                           List<? extends Indicator<?>> dependencies) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Indicator name cannot be empty");
        }
        this.name = name;
        this.calculation = Objects.requireNonNull(calculation, "calculation");
        this.dependencies = List.copyOf(dependencies);
    }

    @Override
    public List<V> calculate(List<Candle> candles) {
        return calculation.apply(candles);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Indicator<?>> dependencies() {
        return dependencies;
    }
}
