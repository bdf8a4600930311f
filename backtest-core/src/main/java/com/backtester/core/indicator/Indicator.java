package com.backtester.core.indicator;

import com.backtester.core.model.Candle;

import java.util.List;

/**
 * A technical indicator computed over a candle series.
 *
 * @param <V> value type produced per candle
 */
public interface Indicator<V> {

    /**
     * Computes one value per input candle, in the same order. An entry is {@code null}
     * where there is not enough history yet.
     */
    List<V> calculate(List<Candle> candles);

    /** Unique name; also the key the value is stored under on each candle. */
    String name();

    /** Indicators that must be applied before this one. */
    default List<Indicator<?>> dependencies() {
        return List.of();
    }
}
