package com.backtester.risk;

import com.backtester.portfolio.Order;
import com.backtester.portfolio.OrderRejectedException;
import com.backtester.portfolio.PortfolioManager;
import com.backtester.portfolio.Position;

import java.util.List;
import java.util.Map;

/**
 * Pre-trade checks and forced exits. Implementations hold no state between calls;
 * all position state lives in the portfolio.
 */
public interface RiskManager {

    /**
     * @throws OrderRejectedException with reason {@code RISK_VALIDATION_FAILED} if the order
     *                                breaches a limit
     */
    void validateOrder(PortfolioManager portfolio, Order order);

    /**
     * Exit orders for open positions whose exit rules trigger at {@code prices}. At most one
     * order per position. Does not modify the portfolio.
     */
    List<Order> checkPositionExits(PortfolioManager portfolio, Map<String, Double> prices);

    /** Exit levels and exposure of {@code position} at {@code price}. */
    PositionRisk positionRisk(Position position, double price);
}
