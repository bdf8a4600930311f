package com.backtester.core.data;

import com.backtester.core.indicator.Indicator;
import com.backtester.core.indicator.IndicatorValidator;
import com.backtester.core.model.Candle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A {@link Table} keyed by timestamp. Each timestamp owns exactly one row; a second
 * row for the same instant is rejected. Iteration is always in increasing time order.
 *
 * <p>The time index is kept in insertion order and sorted lazily the first time rows
 * are read after a write, so bulk loading costs a single sort.
 *
 * Not thread-safe.
 */
public final class TimeseriesTable<T> implements Iterable<TimeseriesRow<T>> {
    private static final Logger logger = LoggerFactory.getLogger(TimeseriesTable.class);

    private final Table table;
    private final Map<Instant, Integer> rowIndex = new HashMap<>();
    private final List<Instant> timeIndex = new ArrayList<>();
    private boolean dirty;

    public TimeseriesTable(List<String> columns) {
        this.table = new Table(columns);
    }

    /**
     * Adds a row at {@code timestamp}.
     *
     * @throws IllegalArgumentException if the timestamp already has a row or a key is not
     *                                  a column; nothing is added in either case
     */
    public void addRow(Instant timestamp, Map<String, T> values) {
        if (timestamp == null) {
            throw new IllegalArgumentException("Timestamp cannot be null");
        }
        if (rowIndex.containsKey(timestamp)) {
            throw new IllegalArgumentException("Row for timestamp " + timestamp + " already exists");
        }
        int index = table.addRow(values);
        rowIndex.put(timestamp, index);
        timeIndex.add(timestamp);
        dirty = true;
    }

    /** Adds an empty row at {@code timestamp}. */
    public void createRow(Instant timestamp) {
        addRow(timestamp, Map.of());
    }

    /** Overwrites the given cells of an existing row. */
    public void setRow(Instant timestamp, Map<String, T> values) {
        table.setRow(requireRow(timestamp), values);
    }

    public Optional<TimeseriesRow<T>> getRow(Instant timestamp) {
        Integer index = rowIndex.get(timestamp);
        if (index == null) {
            return Optional.empty();
        }
        return Optional.of(toRow(timestamp, index));
    }

    @SuppressWarnings("unchecked")
    public Optional<T> getValue(Instant timestamp, String column) {
        Integer index = rowIndex.get(timestamp);
        if (index == null) {
            return Optional.empty();
        }
        return table.get(index, column).map(value -> (T) value);
    }

    public void setValue(Instant timestamp, String column, T value) {
        table.set(requireRow(timestamp), column, value);
    }

    /** Rows in increasing time order. */
    public List<TimeseriesRow<T>> rows() {
        List<Instant> sorted = sortedTimestamps();
        List<TimeseriesRow<T>> rows = new ArrayList<>(sorted.size());
        for (Instant timestamp : sorted) {
            rows.add(toRow(timestamp, rowIndex.get(timestamp)));
        }
        return rows;
    }

    @Override
    public Iterator<TimeseriesRow<T>> iterator() {
        Iterator<Instant> timestamps = sortedTimestamps().iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return timestamps.hasNext();
            }

            @Override
            public TimeseriesRow<T> next() {
                Instant timestamp = timestamps.next();
                return toRow(timestamp, rowIndex.get(timestamp));
            }
        };
    }

    /** Values of one column in increasing time order; rows without a value are skipped. */
    @SuppressWarnings("unchecked")
    public List<T> columnValues(String column) {
        if (!table.hasColumn(column)) {
            throw new IllegalArgumentException("Column " + column + " does not exist");
        }
        List<T> values = new ArrayList<>();
        for (Instant timestamp : sortedTimestamps()) {
            table.get(rowIndex.get(timestamp), column).ifPresent(value -> values.add((T) value));
        }
        return values;
    }

    public List<Instant> timestamps() {
        return List.copyOf(sortedTimestamps());
    }

    public List<String> columns() {
        return table.columns();
    }

    public int size() {
        return timeIndex.size();
    }

    public boolean isEmpty() {
        return timeIndex.isEmpty();
    }

    /**
     * Computes {@code indicator} over every column holding candles and stores each value
     * on its candle under the indicator's name. Dependencies are applied first.
     */
    public void applyIndicator(Indicator<?> indicator) {
        applyIndicators(List.of(indicator));
    }

    /**
     * Applies the indicators, and everything they depend on, to every column in
     * dependency order.
     *
     * @throws IllegalArgumentException if the dependency graph has a cycle
     */
    public void applyIndicators(List<? extends Indicator<?>> indicators) {
        List<Indicator<?>> ordered = IndicatorValidator.executionOrder(indicators);
        for (String column : table.columns()) {
            applyOrdered(ordered, column);
        }
    }

    /** As {@link #applyIndicators(List)} but for a single column. */
    public void applyIndicatorsToColumn(List<? extends Indicator<?>> indicators, String column) {
        if (!table.hasColumn(column)) {
            throw new IllegalArgumentException("Column " + column + " does not exist");
        }
        applyOrdered(IndicatorValidator.executionOrder(indicators), column);
    }

    private void applyOrdered(List<Indicator<?>> ordered, String column) {
        List<Candle> candles = new ArrayList<>();
        for (T value : columnValues(column)) {
            if (value instanceof Candle candle) {
                candles.add(candle);
            }
        }
        if (candles.isEmpty()) {
            logger.debug("Column {} holds no candles, skipping indicators", column);
            return;
        }
        for (Indicator<?> indicator : ordered) {
            List<?> results = indicator.calculate(candles);
            if (results.size() != candles.size()) {
                throw new IllegalStateException("Indicator " + indicator.name() + " returned "
                        + results.size() + " values for " + candles.size() + " candles");
            }
            for (int i = 0; i < candles.size(); i++) {
                Object result = results.get(i);
                if (result != null) {
                    candles.get(i).setIndicator(indicator.name(), result);
                }
            }
        }
        logger.debug("Applied {} indicators to {} ({} candles)", ordered.size(), column, candles.size());
    }

    private List<Instant> sortedTimestamps() {
        if (dirty) {
            Collections.sort(timeIndex);
            dirty = false;
        }
        return timeIndex;
    }

    private int requireRow(Instant timestamp) {
        Integer index = rowIndex.get(timestamp);
        if (index == null) {
            throw new IllegalArgumentException("No row for timestamp " + timestamp);
        }
        return index;
    }

    @SuppressWarnings("unchecked")
    private TimeseriesRow<T> toRow(Instant timestamp, int index) {
        Map<String, T> values = new LinkedHashMap<>();
        for (String column : table.columns()) {
            table.get(index, column).ifPresent(value -> values.put(column, (T) value));
        }
        return new TimeseriesRow<>(timestamp, values);
    }
}
