package com.backtester.portfolio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simulated account: cash, one open position per instrument, closed-position history
 * and the history of every committed order.
 *
 * <p>Cash model: an entry debits {@code quantity * price / leverage}; an exit credits
 * {@code quantity * price}. {@link #value()} is cash plus the unrealized PnL of open
 * positions. Slippage, brokerage and taxes are not modelled.
 *
 * <p>Not thread-safe; the runner is the only writer.
 */
public final class Portfolio implements PortfolioManager {
    private static final Logger logger = LoggerFactory.getLogger(Portfolio.class);

    private final PortfolioSettings settings;
    private final Map<String, Position> openPositions = new LinkedHashMap<>();
    private final List<Position> closedPositions = new ArrayList<>();
    private final List<Order> orderHistory = new ArrayList<>();
    private double cash;

    public Portfolio(PortfolioSettings settings) {
        this.settings = settings;
        this.cash = settings.initialCapital();
        logger.info("Portfolio initialized with ${} (shorts {}, default leverage {}x)",
                String.format("%.2f", cash), settings.enableShorts() ? "enabled" : "disabled",
                settings.defaultLeverage());
    }

    public Portfolio(double initialCapital) {
        this(PortfolioSettings.of(initialCapital));
    }

    @Override
    public Order processOrder(Order order) {
        validateOrder(order);
        return switch (order.type()) {
            case ENTRY -> handleEntryOrder(resolveLeverage(order));
            case EXIT -> handleExitOrder(order);
        };
    }

    /** Entries get the order's leverage if above 1, else the default leverage; never below 1. */
    @Override
    public Order resolveLeverage(Order order) {
        if (order.type() != OrderType.ENTRY) {
            return order;
        }
        double leverage = effectiveLeverage(order);
        return leverage == order.leverage() ? order : order.withLeverage(leverage);
    }

    @Override
    public void updatePositions(Map<String, Double> prices) {
        for (Position position : openPositions.values()) {
            Double price = prices.get(position.getInstrument());
            if (price != null) {
                position.updatePrice(price);
            }
        }
    }

    @Override
    public double value() {
        double value = cash;
        for (Position position : openPositions.values()) {
            value += position.getUnrealizedPnL();
        }
        return value;
    }

    @Override
    public double cash() {
        return cash;
    }

    @Override
    public Map<String, Position> positions() {
        return Collections.unmodifiableMap(openPositions);
    }

    @Override
    public void setProtectiveLevels(String instrument, double stopLoss, double takeProfit) {
        requireOpenPosition(instrument).setProtectiveLevels(stopLoss, takeProfit);
    }

    @Override
    public List<Position> closedPositions() {
        return Collections.unmodifiableList(closedPositions);
    }

    public List<Order> orderHistory() {
        return Collections.unmodifiableList(orderHistory);
    }

    public PortfolioSettings settings() {
        return settings;
    }

    /**
     * Metrics of an open position, with duration measured to the wall clock.
     *
     * @throws OrderRejectedException with {@link RejectionReason#NO_POSITION_FOUND}
     */
    public PositionMetrics positionMetrics(String instrument) {
        Position position = requireOpenPosition(instrument);
        return PositionMetrics.of(position, position.duration());
    }

    /** As {@link #positionMetrics(String)} with duration measured to {@code asOf}. */
    public PositionMetrics positionMetrics(String instrument, Instant asOf) {
        Position position = requireOpenPosition(instrument);
        return PositionMetrics.of(position, position.duration(asOf));
    }

    @Override
    public PortfolioStats stats() {
        int winningPositions = 0;
        int losingPositions = 0;
        double totalUnrealized = 0.0;
        for (Position position : openPositions.values()) {
            if (position.getUnrealizedPnL() > 0) {
                winningPositions++;
            } else {
                losingPositions++;
            }
            totalUnrealized += position.getUnrealizedPnL();
        }

        int winningTrades = 0;
        int losingTrades = 0;
        double totalRealized = 0.0;
        for (Position position : closedPositions) {
            if (position.getRealizedPnL() > 0) {
                winningTrades++;
            } else {
                losingTrades++;
            }
            totalRealized += position.getRealizedPnL();
        }

        return new PortfolioStats(value(), cash, openPositions.size(), closedPositions.size(),
                winningPositions, losingPositions, winningTrades, losingTrades,
                totalUnrealized, totalRealized);
    }

    private void validateOrder(Order order) {
        if (order.quantity() <= 0) {
            throw reject(RejectionReason.INVALID_ORDER, order, "invalid order quantity: " + order.quantity());
        }
        if (!(order.price() > 0) || Double.isInfinite(order.price())) {
            throw reject(RejectionReason.INVALID_ORDER, order, "order has no execution price");
        }
        if (order.instrument().isBlank()) {
            throw reject(RejectionReason.INVALID_ORDER, order, "order has no instrument");
        }

        Position existing = openPositions.get(order.instrument());
        if (order.type() == OrderType.ENTRY) {
            if (order.side() == OrderSide.SHORT && !settings.enableShorts()) {
                throw reject(RejectionReason.SHORTS_DISABLED, order, "short positions not allowed");
            }
            double leverage = effectiveLeverage(order);
            if (existing != null && existing.getSide() != order.side()) {
                throw reject(RejectionReason.INVALID_ORDER, order, "cannot add " + order.side()
                        + " entry to open " + existing.getSide() + " position in " + order.instrument());
            }
            if (existing != null && existing.getLeverage() != leverage) {
                throw reject(RejectionReason.INVALID_ORDER, order, String.format(
                        "cannot add %.2fx entry to open %.2fx position in %s",
                        leverage, existing.getLeverage(), order.instrument()));
            }
            double required = order.notional() / leverage;
            if (required > cash) {
                throw reject(RejectionReason.INSUFFICIENT_CASH, order, String.format(
                        "insufficient cash: have %.2f, need %.2f", cash, required));
            }
        } else {
            if (existing == null) {
                throw reject(RejectionReason.NO_OPEN_POSITION, order, "no open position for " + order.instrument());
            }
            if (order.quantity() > existing.getQuantity()) {
                throw reject(RejectionReason.EXIT_EXCEEDS_SIZE, order, "exit quantity " + order.quantity()
                        + " exceeds position size " + existing.getQuantity());
            }
        }
    }

    private Order handleEntryOrder(Order order) {
        Position position = openPositions.get(order.instrument());
        if (position == null) {
            openPositions.put(order.instrument(), Position.open(order));
        } else {
            position.addOrder(order);
        }

        double cost = order.notional() / order.leverage();
        cash -= cost;
        orderHistory.add(order);
        logger.debug("Entry {} {} {} @ ${} ({}x) - cash now ${}", order.side(), order.quantity(),
                order.instrument(), String.format("%.2f", order.price()), order.leverage(),
                String.format("%.2f", cash));
        return order;
    }

    private Order handleExitOrder(Order order) {
        Position position = openPositions.get(order.instrument());
        if (position == null) {
            throw reject(RejectionReason.NO_POSITION_FOUND, order, "no position found for " + order.instrument());
        }
        position.addOrder(order);

        cash += order.notional();
        if (position.getStatus() == PositionStatus.CLOSED) {
            openPositions.remove(order.instrument());
            closedPositions.add(position);
            logger.debug("Closed {} {}: realized ${}", position.getSide(), order.instrument(),
                    String.format("%.2f", position.getRealizedPnL()));
        }
        orderHistory.add(order);
        return order;
    }

    private double effectiveLeverage(Order order) {
        double leverage = order.leverage() > 1.0 ? order.leverage() : settings.defaultLeverage();
        return Math.max(1.0, leverage);
    }

    private Position requireOpenPosition(String instrument) {
        Position position = openPositions.get(instrument);
        if (position == null) {
            throw new OrderRejectedException(RejectionReason.NO_POSITION_FOUND, null,
                    "no position found for " + instrument);
        }
        return position;
    }

    private static OrderRejectedException reject(RejectionReason reason, Order order, String message) {
        return new OrderRejectedException(reason, order, message);
    }
}
