package com.backtester.strategy;

import com.backtester.core.model.Candle;
import com.backtester.portfolio.Order;
import com.backtester.portfolio.PortfolioManager;
import com.backtester.portfolio.Position;

import java.util.List;
import java.util.Map;

/**
 * Trading logic driven by the runner, one tick at a time.
 */
public interface Strategy {

    /**
     * Decides what to trade on this tick.
     *
     * @param data candles of this tick by instrument, with precomputed indicators attached
     * @return orders to submit; unfilled orders are filled at their own price, or at the
     *         instrument's close when they carry none
     */
    List<Order> onTick(Map<String, Candle> data);

    /** Called once before the first tick. */
    void setPortfolio(PortfolioManager portfolio);

    /** Called after each order the portfolio accepts, including forced exits. */
    void onOrderFilled(Order order);

    void onPositionOpened(Position position);

    void onPositionClosed(Position position);
}
