package com.backtester.portfolio;

/**
 * Read-only summary of a portfolio. Positions and trades at exactly zero PnL count as losing.
 */
public record PortfolioStats(
    double totalValue,
    double cash,
    int openPositions,
    int closedPositions,
    int winningPositions,
    int losingPositions,
    int winningTrades,
    int losingTrades,
    double totalUnrealizedPnL,
    double totalRealizedPnL
) {
    public double winRate() {
        int trades = winningTrades + losingTrades;
        return trades == 0 ? 0.0 : (double) winningTrades / trades;
    }
}
