package com.backtester.core.data;

import com.backtester.core.indicator.CustomIndicator;
import com.backtester.core.indicator.Indicator;
import com.backtester.core.indicator.Macd;
import com.backtester.core.indicator.Sma;
import com.backtester.core.model.Candle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimeseriesTable Tests")
class TimeseriesTableTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static Instant day(int n) {
        return T0.plusSeconds(86400L * n);
    }

    @Nested
    @DisplayName("Row storage")
    class RowStorage {

        private TimeseriesTable<Double> table;

        @BeforeEach
        void setUp() {
            table = new TimeseriesTable<>(List.of("AAPL", "MSFT"));
        }

        @Test
        @DisplayName("Should iterate rows in increasing time regardless of insertion order")
        void testSortedIteration() {
            table.addRow(day(2), Map.of("AAPL", 3.0));
            table.addRow(day(0), Map.of("AAPL", 1.0));
            table.addRow(day(1), Map.of("AAPL", 2.0));

            List<Instant> seen = new ArrayList<>();
            for (TimeseriesRow<Double> row : table) {
                seen.add(row.timestamp());
            }

            assertEquals(List.of(day(0), day(1), day(2)), seen);
            assertEquals(List.of(1.0, 2.0, 3.0), table.columnValues("AAPL"));
        }

        @Test
        @DisplayName("Should re-sort after rows are added later")
        void testResortAfterWrite() {
            table.addRow(day(5), Map.of("AAPL", 5.0));
            assertEquals(List.of(day(5)), table.timestamps());

            table.addRow(day(3), Map.of("AAPL", 3.0));

            assertEquals(List.of(day(3), day(5)), table.timestamps());
        }

        @Test
        @DisplayName("Should reject a duplicate timestamp")
        void testDuplicateTimestamp() {
            table.addRow(day(0), Map.of("AAPL", 1.0));

            assertThrows(IllegalArgumentException.class, () -> table.addRow(day(0), Map.of("MSFT", 2.0)));
            assertEquals(1, table.size());
            assertTrue(table.getValue(day(0), "MSFT").isEmpty());
        }

        @Test
        @DisplayName("Should reject an unknown column without adding the row")
        void testUnknownColumn() {
            assertThrows(IllegalArgumentException.class, () -> table.addRow(day(0), Map.of("TSLA", 1.0)));
            assertTrue(table.isEmpty());
            assertTrue(table.getRow(day(0)).isEmpty());
        }

        @Test
        @DisplayName("Should set and read single values")
        void testSetValue() {
            table.createRow(day(0));
            table.setValue(day(0), "MSFT", 42.0);
            table.setRow(day(0), Map.of("AAPL", 7.0));

            TimeseriesRow<Double> row = table.getRow(day(0)).orElseThrow();
            assertEquals(42.0, row.get("MSFT").orElseThrow());
            assertEquals(7.0, table.getValue(day(0), "AAPL").orElseThrow());
            assertThrows(IllegalArgumentException.class, () -> table.setValue(day(9), "AAPL", 1.0));
        }

        @Test
        @DisplayName("Should keep column order in row values")
        void testRowKeysFollowColumns() {
            List<String> columns = List.of("MSFT", "AAPL", "TSLA", "GOOG", "AMZN");
            TimeseriesTable<Double> wide = new TimeseriesTable<>(columns);
            Map<String, Double> values = new HashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                values.put(columns.get(i), (double) i);
            }
            wide.addRow(day(0), values);

            TimeseriesRow<Double> row = wide.iterator().next();

            assertEquals(columns, new ArrayList<>(row.values().keySet()));
            assertEquals(columns, new ArrayList<>(wide.getRow(day(0)).orElseThrow().values().keySet()));
            assertThrows(UnsupportedOperationException.class, () -> row.values().put("IBM", 1.0));
        }
    }

    @Nested
    @DisplayName("Indicator application")
    class IndicatorApplication {

        private TimeseriesTable<Candle> table;

        @BeforeEach
        void setUp() {
            table = new TimeseriesTable<>(List.of("AAPL", "MSFT"));
            for (int i = 0; i < 40; i++) {
                table.addRow(day(i), Map.of(
                        "AAPL", Candle.ofClose(day(i), 100 + i),
                        "MSFT", Candle.ofClose(day(i), 200 - i)));
            }
        }

        @Test
        @DisplayName("Should apply indicators to every column")
        void testAllColumns() {
            table.applyIndicator(new Sma(3));

            Candle aapl = table.getValue(day(2), "AAPL").orElseThrow();
            Candle msft = table.getValue(day(2), "MSFT").orElseThrow();
            assertEquals(101.0, aapl.getIndicatorAsDouble("SMA_3").orElseThrow(), 1e-9);
            assertEquals(199.0, msft.getIndicatorAsDouble("SMA_3").orElseThrow(), 1e-9);
            assertFalse(table.getValue(day(1), "AAPL").orElseThrow().hasIndicator("SMA_3"));
        }

        @Test
        @DisplayName("Should apply dependencies before the dependent indicator")
        void testDependenciesApplied() {
            table.applyIndicators(List.of(new Macd(12, 26, 9)));

            Candle last = table.getValue(day(39), "AAPL").orElseThrow();
            assertTrue(last.hasIndicator("EMA_12"));
            assertTrue(last.hasIndicator("EMA_26"));
            assertTrue(last.hasIndicator("MACD_12_26_9"));
        }

        @Test
        @DisplayName("Should let a custom indicator read its dependency from the candles")
        void testCustomReadsDependency() {
            Sma sma = new Sma(2);
            Indicator<Double> spread = new CustomIndicator<>("SPREAD", candles -> {
                List<Double> values = new ArrayList<>();
                for (Candle candle : candles) {
                    values.add(candle.getIndicatorAsDouble("SMA_2")
                            .map(avg -> candle.close() - avg)
                            .orElse(null));
                }
                return values;
            }, List.of(sma));

            table.applyIndicatorsToColumn(List.of(spread), "AAPL");

            assertEquals(0.5, table.getValue(day(1), "AAPL").orElseThrow()
                    .getIndicatorAsDouble("SPREAD").orElseThrow(), 1e-9);
            assertFalse(table.getValue(day(1), "MSFT").orElseThrow().hasIndicator("SPREAD"));
        }

        @Test
        @DisplayName("Should fail when an indicator returns the wrong number of values")
        void testWrongLength() {
            Indicator<Double> broken = new CustomIndicator<>("BROKEN", candles -> List.of(1.0));

            assertThrows(IllegalStateException.class, () -> table.applyIndicator(broken));
        }
    }
}
