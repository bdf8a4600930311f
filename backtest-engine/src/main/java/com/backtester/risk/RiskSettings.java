package com.backtester.risk;

/**
 * Risk limits and exit rules. All rates are decimals (0.05 = 5%).
 * A limit of 0 is not enforced.
 *
 * @param maxLeverage               highest leverage an order may carry
 * @param maxPositionAllocationRate largest entry notional as a share of portfolio value
 * @param riskPerTradeRate          share of portfolio value a strategy should risk per trade;
 *                                  used for sizing, not enforced
 */
public record RiskSettings(
    double maxLeverage,
    double maxPositionAllocationRate,
    double riskPerTradeRate,
    boolean useStopLoss,
    double stopLossRate,
    boolean useTakeProfit,
    double takeProfitRate,
    boolean useTrailingStop,
    double trailingStopRate
) {
    public RiskSettings {
        requireNonNegative("maxLeverage", maxLeverage);
        requireNonNegative("maxPositionAllocationRate", maxPositionAllocationRate);
        requireNonNegative("riskPerTradeRate", riskPerTradeRate);
        requireNonNegative("stopLossRate", stopLossRate);
        requireNonNegative("takeProfitRate", takeProfitRate);
        requireNonNegative("trailingStopRate", trailingStopRate);
    }

    /** No limits and no exit rules. */
    public static RiskSettings none() {
        return new RiskSettings(0, 0, 0, false, 0, false, 0, false, 0);
    }

    public RiskSettings withMaxLeverage(double leverage) {
        return new RiskSettings(leverage, maxPositionAllocationRate, riskPerTradeRate,
                useStopLoss, stopLossRate, useTakeProfit, takeProfitRate, useTrailingStop, trailingStopRate);
    }

    public RiskSettings withMaxPositionAllocation(double rate) {
        return new RiskSettings(maxLeverage, rate, riskPerTradeRate,
                useStopLoss, stopLossRate, useTakeProfit, takeProfitRate, useTrailingStop, trailingStopRate);
    }

    public RiskSettings withRiskPerTrade(double rate) {
        return new RiskSettings(maxLeverage, maxPositionAllocationRate, rate,
                useStopLoss, stopLossRate, useTakeProfit, takeProfitRate, useTrailingStop, trailingStopRate);
    }

    public RiskSettings withStopLoss(double rate) {
        return new RiskSettings(maxLeverage, maxPositionAllocationRate, riskPerTradeRate,
                true, rate, useTakeProfit, takeProfitRate, useTrailingStop, trailingStopRate);
    }

    public RiskSettings withTakeProfit(double rate) {
        return new RiskSettings(maxLeverage, maxPositionAllocationRate, riskPerTradeRate,
                useStopLoss, stopLossRate, true, rate, useTrailingStop, trailingStopRate);
    }

    public RiskSettings withTrailingStop(double rate) {
        return new RiskSettings(maxLeverage, maxPositionAllocationRate, riskPerTradeRate,
                useStopLoss, stopLossRate, useTakeProfit, takeProfitRate, true, rate);
    }

    public boolean hasExitRules() {
        return useStopLoss || useTakeProfit || useTrailingStop;
    }

    private static void requireNonNegative(String name, double value) {
        if (value < 0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(name + " cannot be negative: " + value);
        }
    }
}
