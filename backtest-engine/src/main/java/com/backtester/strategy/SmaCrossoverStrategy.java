package com.backtester.strategy;

import com.backtester.core.indicator.Indicator;
import com.backtester.core.indicator.Sma;
import com.backtester.core.model.Candle;
import com.backtester.portfolio.Order;
import com.backtester.portfolio.OrderSide;
import com.backtester.portfolio.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Long-only moving-average crossover.
 * - Buy when the fast SMA crosses above the slow SMA and there is no position
 * - Sell the whole position when the fast SMA crosses back below
 *
 * Reads the SMA values the runner attached to each candle, so {@link #indicators()}
 * must be part of the run's indicator configuration.
 */
public final class SmaCrossoverStrategy extends BaseStrategy {
    private static final Logger logger = LoggerFactory.getLogger(SmaCrossoverStrategy.class);

    private final Sma fast;
    private final Sma slow;
    private final double allocationRate;
    private final Map<String, Double> previousSpread = new HashMap<>();

    /**
     * @param allocationRate share of available cash committed to each new entry (0..1]
     */
    public SmaCrossoverStrategy(int fastPeriod, int slowPeriod, double allocationRate) {
        if (fastPeriod >= slowPeriod) {
            throw new IllegalArgumentException("Fast period must be shorter than slow period");
        }
        if (allocationRate <= 0 || allocationRate > 1) {
            throw new IllegalArgumentException("Allocation rate must be in (0, 1], got " + allocationRate);
        }
        this.fast = new Sma(fastPeriod);
        this.slow = new Sma(slowPeriod);
        this.allocationRate = allocationRate;
    }

    public List<Indicator<?>> indicators() {
        return List.of(fast, slow);
    }

    @Override
    public List<Order> onTick(Map<String, Candle> data) {
        List<Order> orders = new ArrayList<>();
        double budget = portfolio.cash() * allocationRate;
        for (Map.Entry<String, Candle> entry : data.entrySet()) {
            String instrument = entry.getKey();
            Candle candle = entry.getValue();
            TradingSignal signal = evaluate(instrument, candle);

            if (signal instanceof TradingSignal.Buy && !hasPosition(instrument)) {
                int quantity = (int) (budget / candle.close());
                if (quantity > 0) {
                    logger.info("{}: BUY {} - {}", instrument, quantity, signal.reason());
                    orders.add(Order.entry(instrument, OrderSide.LONG, quantity));
                    budget -= quantity * candle.close();
                }
            } else if (signal instanceof TradingSignal.Sell && hasPosition(instrument)) {
                Position position = portfolio.positions().get(instrument);
                logger.info("{}: SELL {} - {}", instrument, position.getQuantity(), signal.reason());
                orders.add(Order.exit(instrument, OrderSide.SHORT, position.getQuantity()));
            }
        }
        return orders;
    }

    /**
     * Crossover signal for one candle. Updates the remembered spread, so call once per tick.
     */
    TradingSignal evaluate(String instrument, Candle candle) {
        Optional<Double> fastValue = candle.getIndicatorAsDouble(fast.name());
        Optional<Double> slowValue = candle.getIndicatorAsDouble(slow.name());
        if (fastValue.isEmpty() || slowValue.isEmpty()) {
            return new TradingSignal.Hold("Insufficient history for " + slow.name());
        }

        double spread = fastValue.get() - slowValue.get();
        Double previous = previousSpread.put(instrument, spread);
        if (previous == null) {
            return new TradingSignal.Hold("First " + slow.name() + " value");
        }

        if (previous <= 0 && spread > 0) {
            return new TradingSignal.Buy(String.format("%s crossed above %s (%.2f > %.2f)",
                    fast.name(), slow.name(), fastValue.get(), slowValue.get()));
        }
        if (previous >= 0 && spread < 0) {
            return new TradingSignal.Sell(String.format("%s crossed below %s (%.2f < %.2f)",
                    fast.name(), slow.name(), fastValue.get(), slowValue.get()));
        }
        return new TradingSignal.Hold(String.format("%s=%.2f, %s=%.2f", fast.name(), fastValue.get(),
                slow.name(), slowValue.get()));
    }

    @Override
    public void onPositionClosed(Position position) {
        logger.info("{}: position closed, realized ${}", position.getInstrument(),
                String.format("%.2f", position.getRealizedPnL()));
    }
}
