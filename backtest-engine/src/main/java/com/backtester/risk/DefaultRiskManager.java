package com.backtester.risk;

import com.backtester.portfolio.Order;
import com.backtester.portfolio.OrderRejectedException;
import com.backtester.portfolio.OrderSide;
import com.backtester.portfolio.OrderType;
import com.backtester.portfolio.PortfolioManager;
import com.backtester.portfolio.Position;
import com.backtester.portfolio.RejectionReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rate-based risk rules: allocation and leverage limits on new orders, and stop-loss,
 * take-profit and trailing-stop exits measured from the position's average open price.
 *
 * Exit rules are checked in that order and the first one that triggers wins, so a
 * position gets at most one exit per tick.
 */
public final class DefaultRiskManager implements RiskManager {
    private static final Logger logger = LoggerFactory.getLogger(DefaultRiskManager.class);

    private final RiskSettings settings;

    public DefaultRiskManager(RiskSettings settings) {
        this.settings = settings;
        logger.info("RiskManager initialized: SL={}%, TP={}%, Trail={}%, MaxLeverage={}x, MaxAllocation={}%",
                settings.useStopLoss() ? String.format("%.2f", settings.stopLossRate() * 100) : "off",
                settings.useTakeProfit() ? String.format("%.2f", settings.takeProfitRate() * 100) : "off",
                settings.useTrailingStop() ? String.format("%.2f", settings.trailingStopRate() * 100) : "off",
                settings.maxLeverage() > 0 ? settings.maxLeverage() : "unlimited",
                settings.maxPositionAllocationRate() > 0
                        ? String.format("%.2f", settings.maxPositionAllocationRate() * 100) : "unlimited");
    }

    /**
     * Only entries are checked; exits reduce exposure. Expects the entry's leverage to be
     * resolved already, see {@link PortfolioManager#resolveLeverage(Order)}.
     */
    @Override
    public void validateOrder(PortfolioManager portfolio, Order order) {
        if (order.type() != OrderType.ENTRY) {
            return;
        }
        if (settings.maxPositionAllocationRate() > 0) {
            double portfolioValue = portfolio.value();
            double positionValue = order.notional();
            double maxAllowed = portfolioValue * settings.maxPositionAllocationRate();
            if (positionValue > maxAllowed) {
                throw new OrderRejectedException(RejectionReason.RISK_VALIDATION_FAILED, order, String.format(
                        "position size %.2f (%.2f%% of portfolio) exceeds maximum allowed %.2f (%.2f%% of portfolio)",
                        positionValue, portfolioValue == 0 ? 0.0 : positionValue / portfolioValue * 100,
                        maxAllowed, settings.maxPositionAllocationRate() * 100));
            }
        }

        if (settings.maxLeverage() > 0 && order.leverage() > settings.maxLeverage()) {
            throw new OrderRejectedException(RejectionReason.RISK_VALIDATION_FAILED, order, String.format(
                    "order leverage %.2fx exceeds maximum %.2fx", order.leverage(), settings.maxLeverage()));
        }
    }

    @Override
    public List<Order> checkPositionExits(PortfolioManager portfolio, Map<String, Double> prices) {
        List<Order> exits = new ArrayList<>();
        if (!settings.hasExitRules()) {
            return exits;
        }
        for (Position position : portfolio.positions().values()) {
            Double price = prices.get(position.getInstrument());
            if (price == null || !position.isOpen() || position.getQuantity() == 0) {
                continue;
            }
            Optional<ExitReason> reason = evaluateExit(position, price);
            if (reason.isPresent()) {
                exits.add(Order.of(position.getInstrument(), position.getSide().opposite(), OrderType.EXIT,
                        position.getQuantity(), price, position.getLeverage()));
                logger.info("Exit condition met for {}: {} at ${} (open ${}, qty {})",
                        position.getInstrument(), reason.get(), String.format("%.2f", price),
                        String.format("%.2f", position.getOpenPrice()), position.getQuantity());
            }
        }
        return exits;
    }

    /**
     * First exit rule that triggers for {@code position} at {@code price}, if any.
     * The trailing anchor is read, never moved; the portfolio ratchets it on each mark.
     */
    public Optional<ExitReason> evaluateExit(Position position, double price) {
        boolean isLong = position.getSide() == OrderSide.LONG;
        double open = position.getOpenPrice();

        if (settings.useStopLoss()) {
            double stop = isLong ? open * (1 - settings.stopLossRate()) : open * (1 + settings.stopLossRate());
            if (isLong ? price <= stop : price >= stop) {
                return Optional.of(ExitReason.STOP_LOSS);
            }
        }

        if (settings.useTakeProfit()) {
            double target = isLong ? open * (1 + settings.takeProfitRate()) : open * (1 - settings.takeProfitRate());
            if (isLong ? price >= target : price <= target) {
                return Optional.of(ExitReason.TAKE_PROFIT);
            }
        }

        if (settings.useTrailingStop()) {
            double trailingStop = trailingStopPrice(position, price);
            if (isLong ? price <= trailingStop : price >= trailingStop) {
                return Optional.of(ExitReason.TRAILING_STOP);
            }
        }

        return Optional.empty();
    }

    /**
     * Stop and target levels come from the open price. Max loss and risk/reward are measured
     * from {@code price}, the stop level still applying at a rate of 0 when stop-loss is off.
     */
    @Override
    public PositionRisk positionRisk(Position position, double price) {
        boolean isLong = position.getSide() == OrderSide.LONG;
        double open = position.getOpenPrice();

        double stopLevel = isLong ? open * (1 - settings.stopLossRate()) : open * (1 + settings.stopLossRate());
        double targetLevel = isLong ? open * (1 + settings.takeProfitRate()) : open * (1 - settings.takeProfitRate());
        double trailingStop = settings.useTrailingStop() ? trailingStopPrice(position, price) : 0.0;

        double risk = Math.abs(price - stopLevel);
        double maxLoss = position.getQuantity() * risk * position.getLeverage();

        double riskReward = 0.0;
        if (settings.useStopLoss() && settings.useTakeProfit() && risk != 0) {
            riskReward = Math.abs(targetLevel - price) / risk;
        }

        return new PositionRisk(
                settings.useStopLoss() ? stopLevel : 0.0,
                settings.useTakeProfit() ? targetLevel : 0.0,
                trailingStop, maxLoss, riskReward);
    }

    public RiskSettings getSettings() {
        return settings;
    }

    private double trailingStopPrice(Position position, double price) {
        if (position.getSide() == OrderSide.LONG) {
            double anchor = Math.max(position.getTrailingStopHigh(), price);
            return anchor * (1 - settings.trailingStopRate());
        }
        double anchor = Math.min(position.getTrailingStopHigh(), price);
        return anchor * (1 + settings.trailingStopRate());
    }
}
