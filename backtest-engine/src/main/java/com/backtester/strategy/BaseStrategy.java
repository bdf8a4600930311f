package com.backtester.strategy;

import com.backtester.core.model.Candle;
import com.backtester.portfolio.Order;
import com.backtester.portfolio.PortfolioManager;
import com.backtester.portfolio.Position;

import java.util.List;
import java.util.Map;

/**
 * No-op {@link Strategy}; subclasses override what they need. Holds the portfolio handle.
 */
public abstract class BaseStrategy implements Strategy {
    protected PortfolioManager portfolio;

    @Override
    public List<Order> onTick(Map<String, Candle> data) {
        return List.of();
    }

    @Override
    public void setPortfolio(PortfolioManager portfolio) {
        this.portfolio = portfolio;
    }

    @Override
    public void onOrderFilled(Order order) {
    }

    @Override
    public void onPositionOpened(Position position) {
    }

    @Override
    public void onPositionClosed(Position position) {
    }

    protected boolean hasPosition(String instrument) {
        return portfolio != null && portfolio.positions().containsKey(instrument);
    }
}
