package com.backtester.portfolio;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immutable order intent. An order is unfilled until {@link #fill(double, Instant)} stamps
 * an execution price and time on a copy.
 *
 * <p>A price of {@code 0} on an unfilled order means "fill at the current close".
 * Leverage is always at least 1.
 */
public record Order(
    String id,
    String instrument,
    OrderSide side,
    OrderType type,
    int quantity,
    double price,
    double leverage,
    Instant filledAt
) {
    private static final AtomicLong SEQUENCE = new AtomicLong();

    public Order {
        if (instrument == null) {
            throw new IllegalArgumentException("Instrument cannot be null");
        }
        if (side == null || type == null) {
            throw new IllegalArgumentException("Order side and type are required");
        }
        if (leverage <= 0) {
            leverage = 1.0;
        }
    }

    /**
     * New unfilled order at market.
     *
     * @throws IllegalArgumentException if quantity is not positive
     */
    public static Order of(String instrument, OrderSide side, OrderType type, int quantity, double leverage) {
        return of(instrument, side, type, quantity, 0.0, leverage);
    }

    /** New unfilled order with a requested price. */
    public static Order of(String instrument, OrderSide side, OrderType type, int quantity,
                           double price, double leverage) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive, got " + quantity);
        }
        return new Order(nextId(), instrument, side, type, quantity, price, leverage, null);
    }

    public static Order entry(String instrument, OrderSide side, int quantity) {
        return of(instrument, side, OrderType.ENTRY, quantity, 1.0);
    }

    public static Order entry(String instrument, OrderSide side, int quantity, double price, double leverage) {
        return of(instrument, side, OrderType.ENTRY, quantity, price, leverage);
    }

    /** Exit order; {@code side} is the side of the trade, i.e. opposite to the position. */
    public static Order exit(String instrument, OrderSide side, int quantity) {
        return of(instrument, side, OrderType.EXIT, quantity, 1.0);
    }

    public static Order exit(String instrument, OrderSide side, int quantity, double price) {
        return of(instrument, side, OrderType.EXIT, quantity, price, 1.0);
    }

    /**
     * Filled copy of this order.
     *
     * @throws IllegalStateException if already filled
     */
    public Order fill(double executionPrice, Instant at) {
        if (isFilled()) {
            throw new IllegalStateException("Order " + id + " already filled at " + filledAt);
        }
        if (at == null) {
            throw new IllegalArgumentException("Fill time is required");
        }
        return new Order(id, instrument, side, type, quantity, executionPrice, leverage, at);
    }

    public Order withLeverage(double newLeverage) {
        return new Order(id, instrument, side, type, quantity, price, newLeverage, filledAt);
    }

    public boolean isFilled() {
        return filledAt != null;
    }

    public boolean isEntry() {
        return type == OrderType.ENTRY;
    }

    /** Notional value at the order price, before leverage. */
    public double notional() {
        return quantity * price;
    }

    private static String nextId() {
        return "ord_" + SEQUENCE.incrementAndGet();
    }
}
