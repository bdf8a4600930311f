package com.backtester.runner;

import com.backtester.core.data.TimeseriesRow;
import com.backtester.core.data.TimeseriesTable;
import com.backtester.core.model.Candle;
import com.backtester.metrics.BacktestResults;
import com.backtester.metrics.PerformanceMetrics;
import com.backtester.portfolio.Order;
import com.backtester.portfolio.OrderRejectedException;
import com.backtester.portfolio.PortfolioManager;
import com.backtester.portfolio.Position;
import com.backtester.portfolio.RejectionReason;
import com.backtester.risk.PositionRisk;
import com.backtester.risk.RiskManager;
import com.backtester.strategy.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays a price table through a strategy, tick by tick, in increasing time order.
 *
 * <p>Per tick: mark open positions to the close, submit the risk manager's forced exits,
 * submit the strategy's orders, then record an {@link AccountValue}. Every order goes
 * through fill, leverage resolution, risk validation, portfolio commit and strategy
 * notification.
 *
 * <p>The first failure aborts the run with a {@link BacktestException} carrying the tick
 * timestamp. A runner runs once.
 */
public final class Runner {
    private static final Logger logger = LoggerFactory.getLogger(Runner.class);

    private final Strategy strategy;
    private final PortfolioManager portfolio;
    private final RiskManager riskManager;
    private final TimeseriesTable<Candle> data;
    private final IndicatorConfig indicators;
    private final double riskFreeRate;
    private final List<AccountValue> equityCurve = new ArrayList<>();

    private Instant currentTime;
    private double initialCapital;
    private boolean started;

    private Runner(Builder builder) {
        this.strategy = builder.strategy;
        this.portfolio = builder.portfolio;
        this.riskManager = builder.riskManager;
        this.data = builder.data;
        this.indicators = builder.indicators;
        this.riskFreeRate = builder.riskFreeRate;
    }

    public static Builder builder(Strategy strategy) {
        return new Builder(strategy);
    }

    /**
     * Runs the whole table.
     *
     * @return the equity curve, one entry per tick
     * @throws MissingComponentException if strategy, portfolio, risk manager or data is unset
     * @throws BacktestException         if any tick fails
     */
    public List<AccountValue> run() {
        preflight();
        if (started) {
            throw new IllegalStateException("Runner has already run");
        }
        started = true;

        strategy.setPortfolio(portfolio);
        initialCapital = portfolio.value();

        if (indicators != null && !indicators.isEmpty()) {
            try {
                data.applyIndicators(indicators.indicators());
            } catch (RuntimeException e) {
                logger.error("Indicator precomputation failed: {}", e.getMessage());
                throw new BacktestException(null, "Indicator precomputation failed: " + e.getMessage(), e);
            }
        }

        logger.info("Starting backtest: {} ticks, {} instruments, ${} capital",
                data.size(), data.columns().size(), String.format("%.2f", initialCapital));

        for (TimeseriesRow<Candle> row : data) {
            currentTime = row.timestamp();
            try {
                processTick(row.values());
            } catch (RuntimeException e) {
                logger.error("Backtest aborted at {}: {}", currentTime, e.getMessage());
                throw new BacktestException(currentTime, "Backtest aborted at " + currentTime + ": " + e.getMessage(), e);
            }
        }

        logger.info("Backtest complete: final value ${}", String.format("%.2f", portfolio.value()));
        return equityCurve();
    }

    /**
     * Summary of the run so far.
     *
     * @throws IllegalStateException if {@link #run()} has not been called
     */
    public BacktestResults results() {
        if (!started) {
            throw new IllegalStateException("Runner has not run yet");
        }
        List<Double> tradePnLs = new ArrayList<>();
        for (Position position : portfolio.closedPositions()) {
            tradePnLs.add(position.getRealizedPnL());
        }
        return PerformanceMetrics.summarize(initialCapital, riskFreeRate, equityCurve, portfolio.stats(), tradePnLs);
    }

    public List<AccountValue> equityCurve() {
        return Collections.unmodifiableList(equityCurve);
    }

    /** Timestamp of the tick being (or last) processed. */
    public Instant currentTime() {
        return currentTime;
    }

    private void preflight() {
        if (strategy == null) {
            throw new MissingComponentException("Strategy");
        }
        if (portfolio == null) {
            throw new MissingComponentException("Portfolio");
        }
        if (riskManager == null) {
            throw new MissingComponentException("RiskManager");
        }
        if (data == null) {
            throw new MissingComponentException("Data");
        }
    }

    private void processTick(Map<String, Candle> candles) {
        Map<String, Double> prices = new LinkedHashMap<>();
        candles.forEach((instrument, candle) -> prices.put(instrument, candle.close()));

        portfolio.updatePositions(prices);

        for (Order exit : riskManager.checkPositionExits(portfolio, prices)) {
            execute(exit, prices);
        }

        List<Order> orders = strategy.onTick(candles);
        if (orders != null) {
            for (Order order : orders) {
                execute(order, prices);
            }
        }

        equityCurve.add(snapshot());
    }

    private void execute(Order order, Map<String, Double> prices) {
        Order filled = portfolio.resolveLeverage(order.isFilled() ? order : fill(order, prices));
        riskManager.validateOrder(portfolio, filled);

        Position before = portfolio.positions().get(filled.instrument());
        Order committed = portfolio.processOrder(filled);
        strategy.onOrderFilled(committed);

        Position after = portfolio.positions().get(committed.instrument());
        if (before == null && after != null) {
            PositionRisk risk = riskManager.positionRisk(after, committed.price());
            portfolio.setProtectiveLevels(committed.instrument(), risk.stopLossPrice(), risk.takeProfitPrice());
            logger.debug("Opened {} {} x{} @ ${}", after.getSide(), after.getInstrument(), after.getQuantity(),
                    String.format("%.2f", after.getOpenPrice()));
            strategy.onPositionOpened(after);
        } else if (before != null && after == null) {
            strategy.onPositionClosed(before);
        }
    }

    private Order fill(Order order, Map<String, Double> prices) {
        Double close = prices.get(order.instrument());
        if (close == null) {
            throw new OrderRejectedException(RejectionReason.INVALID_ORDER, order,
                    "no price for " + order.instrument() + " at " + currentTime);
        }
        double price = order.price() > 0 ? order.price() : close;
        return order.fill(price, currentTime);
    }

    private AccountValue snapshot() {
        double unrealized = 0.0;
        for (Position position : portfolio.positions().values()) {
            unrealized += position.getUnrealizedPnL();
        }
        return new AccountValue(currentTime, portfolio.value(), portfolio.cash(),
                portfolio.positions().size(), unrealized);
    }

    public static final class Builder {
        private final Strategy strategy;
        private PortfolioManager portfolio;
        private RiskManager riskManager;
        private TimeseriesTable<Candle> data;
        private IndicatorConfig indicators;
        private double riskFreeRate = PerformanceMetrics.DEFAULT_RISK_FREE_RATE;

        private Builder(Strategy strategy) {
            this.strategy = strategy;
        }

        public Builder portfolio(PortfolioManager portfolio) {
            this.portfolio = portfolio;
            return this;
        }

        public Builder riskManager(RiskManager riskManager) {
            this.riskManager = riskManager;
            return this;
        }

        public Builder data(TimeseriesTable<Candle> data) {
            this.data = data;
            return this;
        }

        public Builder indicators(IndicatorConfig indicators) {
            this.indicators = indicators;
            return this;
        }

        /** Annual risk-free rate for Sharpe/Sortino, as a decimal. */
        public Builder riskFreeRate(double riskFreeRate) {
            this.riskFreeRate = riskFreeRate;
            return this;
        }

        public Runner build() {
            return new Runner(this);
        }
    }
}
