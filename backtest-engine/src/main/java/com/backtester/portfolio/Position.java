package com.backtester.portfolio;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Aggregate of all filled orders for one instrument while it is held.
 *
 * <p>The open price is the quantity-weighted average of every entry. Realized PnL
 * accumulates as exits reduce the quantity; unrealized PnL is marked on the remaining
 * quantity by {@link #updatePrice(double)}. Both are scaled by leverage.
 *
 * <p>Only {@link Portfolio} mutates a position. Not thread-safe.
 */
public final class Position {
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String id;
    private final String instrument;
    private final OrderSide side;
    private final double leverage;
    private final Instant openTime;
    private final List<Order> orders = new ArrayList<>();

    private int quantity;
    private int enteredQuantity;
    private double openPrice;
    private double closePrice;
    private Instant closeTime;
    private PositionStatus status;

    private double stopLoss;
    private double takeProfit;
    private double highestPrice;
    private double lowestPrice;
    private double lastPrice;
    private double maxDrawdown;
    private double unrealizedPnL;
    private double realizedPnL;
    private double trailingStopHigh;

    private Position(Order entry) {
        this.id = "pos_" + SEQUENCE.incrementAndGet();
        this.instrument = entry.instrument();
        this.side = entry.side();
        this.leverage = Math.max(1.0, entry.leverage());
        this.openTime = entry.filledAt();
        this.quantity = entry.quantity();
        this.enteredQuantity = entry.quantity();
        this.openPrice = entry.price();
        this.status = PositionStatus.OPEN;
        this.highestPrice = entry.price();
        this.lowestPrice = entry.price();
        this.lastPrice = entry.price();
        this.trailingStopHigh = entry.price();
        this.orders.add(entry);
    }

    /**
     * Opens a position from a filled entry order.
     *
     * @throws OrderRejectedException with {@link RejectionReason#INVALID_ORDER} if the order
     *                                is not an entry or its quantity is not positive
     */
    static Position open(Order entry) {
        if (entry.type() != OrderType.ENTRY) {
            throw new OrderRejectedException(RejectionReason.INVALID_ORDER, entry,
                    "cannot open a position from a " + entry.type() + " order");
        }
        if (entry.quantity() <= 0) {
            throw new OrderRejectedException(RejectionReason.INVALID_ORDER, entry,
                    "invalid order quantity: " + entry.quantity());
        }
        return new Position(entry);
    }

    /**
     * Applies a further entry (average in) or an exit (reduce and realize PnL).
     * On failure the position is unchanged.
     */
    void addOrder(Order order) {
        if (!instrument.equals(order.instrument())) {
            throw new OrderRejectedException(RejectionReason.INVALID_ORDER, order,
                    "order instrument " + order.instrument() + " does not match position instrument " + instrument);
        }
        if (order.quantity() <= 0) {
            throw new OrderRejectedException(RejectionReason.INVALID_ORDER, order,
                    "invalid order quantity: " + order.quantity());
        }

        if (order.type() == OrderType.ENTRY) {
            double totalCost = openPrice * quantity + order.price() * order.quantity();
            quantity += order.quantity();
            enteredQuantity += order.quantity();
            openPrice = totalCost / quantity;
        } else {
            if (order.quantity() > quantity) {
                throw new OrderRejectedException(RejectionReason.EXIT_EXCEEDS_SIZE, order,
                        "exit quantity " + order.quantity() + " exceeds position size " + quantity);
            }
            realizedPnL += pnl(order.quantity(), order.price());
            quantity -= order.quantity();
            if (quantity == 0) {
                status = PositionStatus.CLOSED;
                closePrice = order.price();
                closeTime = order.filledAt();
            } else {
                status = PositionStatus.PARTIALLY_OPEN;
            }
        }
        lastPrice = order.price();
        unrealizedPnL = pnl(quantity, lastPrice);
        orders.add(order);
    }

    /**
     * Marks the position to {@code price}: extremes, unrealized PnL, drawdown and the
     * trailing-stop anchor, which only moves in the position's favour.
     */
    void updatePrice(double price) {
        lastPrice = price;
        highestPrice = Math.max(highestPrice, price);
        lowestPrice = Math.min(lowestPrice, price);
        unrealizedPnL = pnl(quantity, price);

        double drawdown = side == OrderSide.LONG
                ? (highestPrice - price) / highestPrice
                : (price - lowestPrice) / lowestPrice;
        maxDrawdown = Math.max(maxDrawdown, drawdown);

        trailingStopHigh = side == OrderSide.LONG
                ? Math.max(trailingStopHigh, price)
                : Math.min(trailingStopHigh, price);
    }

    void setProtectiveLevels(double stopLoss, double takeProfit) {
        this.stopLoss = stopLoss;
        this.takeProfit = takeProfit;
    }

    private double pnl(int qty, double price) {
        double move = side == OrderSide.LONG ? price - openPrice : openPrice - price;
        return qty * move * leverage;
    }

    /**
     * Total PnL over the capital committed at the average open price. For a closed
     * position the committed capital is everything that was ever entered.
     */
    public double roi() {
        int basisQuantity = quantity > 0 ? quantity : enteredQuantity;
        double investment = openPrice * basisQuantity;
        if (investment == 0) {
            return 0.0;
        }
        return (realizedPnL + unrealizedPnL) / investment;
    }

    /** Open to close, or open to the wall clock while still open. */
    public Duration duration() {
        return duration(Instant.now());
    }

    /** Open to close, or open to {@code asOf} while still open. */
    public Duration duration(Instant asOf) {
        if (openTime == null) {
            return Duration.ZERO;
        }
        Instant end = status == PositionStatus.CLOSED && closeTime != null ? closeTime : asOf;
        return Duration.between(openTime, end);
    }

    /** Leveraged notional of the remaining quantity at {@code price}. */
    public double value(double price) {
        return quantity * price * leverage;
    }

    public boolean isOpen() {
        return status != PositionStatus.CLOSED;
    }

    public String getId() {
        return id;
    }

    public String getInstrument() {
        return instrument;
    }

    public OrderSide getSide() {
        return side;
    }

    public int getQuantity() {
        return quantity;
    }

    public double getOpenPrice() {
        return openPrice;
    }

    public double getClosePrice() {
        return closePrice;
    }

    public Instant getOpenTime() {
        return openTime;
    }

    public Instant getCloseTime() {
        return closeTime;
    }

    public PositionStatus getStatus() {
        return status;
    }

    public double getLeverage() {
        return leverage;
    }

    public List<Order> getOrders() {
        return Collections.unmodifiableList(orders);
    }

    /** Stop-loss price attached when the position was opened; 0 if none. */
    public double getStopLoss() {
        return stopLoss;
    }

    /** Take-profit price attached when the position was opened; 0 if none. */
    public double getTakeProfit() {
        return takeProfit;
    }

    public double getHighestPrice() {
        return highestPrice;
    }

    public double getLowestPrice() {
        return lowestPrice;
    }

    public double getMaxDrawdown() {
        return maxDrawdown;
    }

    public double getUnrealizedPnL() {
        return unrealizedPnL;
    }

    public double getRealizedPnL() {
        return realizedPnL;
    }

    /** Best price seen since entry: the high for longs, the low for shorts. */
    public double getTrailingStopHigh() {
        return trailingStopHigh;
    }

    @Override
    public String toString() {
        return String.format("Position[%s %s %s qty=%d @ %.2f, %s, realized=%.2f, unrealized=%.2f]",
                id, side, instrument, quantity, openPrice, status, realizedPnL, unrealizedPnL);
    }
}
