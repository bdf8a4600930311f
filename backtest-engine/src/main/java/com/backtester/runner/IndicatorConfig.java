package com.backtester.runner;

import com.backtester.core.indicator.Indicator;

import java.util.Arrays;
import java.util.List;

/**
 * Indicators to compute over the whole price table before the first tick.
 * Dependencies are pulled in automatically.
 */
public record IndicatorConfig(List<Indicator<?>> indicators) {

    public IndicatorConfig {
        indicators = List.copyOf(indicators);
    }

    public static IndicatorConfig of(Indicator<?>... indicators) {
        return new IndicatorConfig(Arrays.asList(indicators));
    }

    public boolean isEmpty() {
        return indicators.isEmpty();
    }
}
