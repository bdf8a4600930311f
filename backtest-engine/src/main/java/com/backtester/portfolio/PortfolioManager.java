package com.backtester.portfolio;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Account the runner trades against. Implementations own all position and cash state;
 * callers only get read-only views.
 */
public interface PortfolioManager {

    /**
     * Applies a filled order, either fully or not at all.
     *
     * @return the order as committed (leverage resolved)
     * @throws OrderRejectedException if the order is rejected
     */
    Order processOrder(Order order);

    /**
     * The order with the leverage {@link #processOrder(Order)} would commit it at.
     * Exits are returned unchanged.
     */
    default Order resolveLeverage(Order order) {
        return order;
    }

    /** Marks every open position that has a price in {@code prices}. */
    void updatePositions(Map<String, Double> prices);

    /** Total account value. */
    double value();

    double cash();

    /** Open positions by instrument, read-only. */
    Map<String, Position> positions();

    default Optional<Position> position(String instrument) {
        return Optional.ofNullable(positions().get(instrument));
    }

    /** Positions closed so far, oldest first. */
    List<Position> closedPositions();

    /** Read-side summary; no state is changed. */
    PortfolioStats stats();

    /** Attaches informational stop-loss / take-profit prices to an open position. */
    void setProtectiveLevels(String instrument, double stopLoss, double takeProfit);
}
