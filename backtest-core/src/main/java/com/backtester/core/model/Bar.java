package com.backtester.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Wire form of one OHLCV bar in a JSON price file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Bar(
    @JsonProperty("t") Instant timestamp,
    @JsonProperty("o") double open,
    @JsonProperty("h") double high,
    @JsonProperty("l") double low,
    @JsonProperty("c") double close,
    @JsonProperty("v") long volume
) {
    public Bar {
        if (timestamp == null) {
            throw new IllegalArgumentException("Bar timestamp is required");
        }
        if (close <= 0) {
            throw new IllegalArgumentException("Close price must be positive");
        }
    }

    public Candle toCandle() {
        return new Candle(timestamp, open, high, low, close, volume);
    }
}
