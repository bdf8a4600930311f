package com.backtester.risk;

/**
 * Exit levels and exposure of one position at a given price. A price of 0 means the
 * corresponding rule is disabled.
 *
 * @param maxLoss         loss from {@code price} down to the stop level; with stop-loss off the
 *                        stop level is the open price
 * @param riskRewardRatio distance from {@code price} to take-profit over distance from
 *                        {@code price} to stop-loss; 0 unless both rules are on
 */
public record PositionRisk(
    double stopLossPrice,
    double takeProfitPrice,
    double trailingStopPrice,
    double maxLoss,
    double riskRewardRatio
) {}
