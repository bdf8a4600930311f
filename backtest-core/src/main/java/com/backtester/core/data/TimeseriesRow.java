package com.backtester.core.data;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One timestamped row of a {@link TimeseriesTable}. Values are keyed by column;
 * columns without a value are absent from the map. Keys iterate in column order.
 */
public record TimeseriesRow<T>(Instant timestamp, Map<String, T> values) {

    public TimeseriesRow {
        if (timestamp == null) {
            throw new IllegalArgumentException("Row timestamp cannot be null");
        }
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Optional<T> get(String column) {
        return Optional.ofNullable(values.get(column));
    }
}
