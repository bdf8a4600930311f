package com.backtester.core.data;

import com.backtester.core.model.Bar;
import com.backtester.core.model.Candle;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads candle history from JSON of the form
 * <pre>
 * { "AAPL": [ {"t": "2024-01-02T00:00:00Z", "o": 1, "h": 1, "l": 1, "c": 1, "v": 100}, ... ],
 *   "MSFT": [ ... ] }
 * </pre>
 * into a {@link TimeseriesTable} with one column per instrument. Instruments need not
 * share timestamps; a row only holds candles for the instruments that traded then.
 */
public final class CandleJsonLoader {
    private static final Logger logger = LoggerFactory.getLogger(CandleJsonLoader.class);
    private static final TypeReference<LinkedHashMap<String, List<Bar>>> PRICE_FILE =
            new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public CandleJsonLoader() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());
    }

    public TimeseriesTable<Candle> load(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            TimeseriesTable<Candle> table = read(is);
            logger.info("Loaded {} ticks for {} instruments from {}",
                    table.size(), table.columns().size(), path.toAbsolutePath());
            return table;
        }
    }

    public TimeseriesTable<Candle> read(InputStream is) throws IOException {
        return toTable(objectMapper.readValue(is, PRICE_FILE));
    }

    public TimeseriesTable<Candle> parse(String json) throws IOException {
        return toTable(objectMapper.readValue(json, PRICE_FILE));
    }

    private TimeseriesTable<Candle> toTable(Map<String, List<Bar>> bars) {
        TimeseriesTable<Candle> table = new TimeseriesTable<>(new ArrayList<>(bars.keySet()));
        bars.forEach((instrument, series) -> {
            if (series == null) {
                return;
            }
            for (Bar bar : series) {
                if (table.getRow(bar.timestamp()).isEmpty()) {
                    table.createRow(bar.timestamp());
                } else if (table.getValue(bar.timestamp(), instrument).isPresent()) {
                    throw new IllegalArgumentException("Duplicate bar for " + instrument + " at " + bar.timestamp());
                }
                table.setValue(bar.timestamp(), instrument, bar.toCandle());
            }
        });
        return table;
    }
}
