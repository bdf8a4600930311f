package com.backtester.metrics;

import com.backtester.portfolio.PortfolioStats;
import com.backtester.runner.AccountValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Performance metrics over an equity curve and a list of closed-trade PnLs:
 * Sharpe and Sortino ratios, max drawdown, win rate, profit factor.
 *
 * Each equity point is treated as one trading day when annualizing.
 */
public final class PerformanceMetrics {
    private static final Logger logger = LoggerFactory.getLogger(PerformanceMetrics.class);
    public static final double DEFAULT_RISK_FREE_RATE = 0.04; // 4% annual
    private static final int TRADING_DAYS_PER_YEAR = 252;

    private final List<Double> tradePnLs = new ArrayList<>();
    private final List<Double> periodReturns = new ArrayList<>();
    private final List<Double> equityCurve = new ArrayList<>();
    private final double riskFreeRate;

    private final double initialCapital;
    private double currentEquity;
    private double peakEquity;
    private double maxDrawdown;
    private double currentDrawdown;

    public PerformanceMetrics(double initialCapital) {
        this(initialCapital, DEFAULT_RISK_FREE_RATE);
    }

    public PerformanceMetrics(double initialCapital, double riskFreeRate) {
        this.initialCapital = initialCapital;
        this.riskFreeRate = riskFreeRate;
        this.currentEquity = initialCapital;
        this.peakEquity = initialCapital;
        equityCurve.add(initialCapital);
    }

    /**
     * Summarizes a run from its equity curve and the portfolio's closed positions.
     */
    public static BacktestResults summarize(double initialCapital, double riskFreeRate,
                                            List<AccountValue> curve, PortfolioStats stats,
                                            List<Double> closedTradePnLs) {
        PerformanceMetrics metrics = new PerformanceMetrics(initialCapital, riskFreeRate);
        for (AccountValue point : curve) {
            metrics.recordEquity(point.value());
        }
        closedTradePnLs.forEach(metrics::recordTrade);

        Map<String, Double> extra = new LinkedHashMap<>();
        extra.put("annualized_return", metrics.getAnnualizedReturn());
        extra.put("calmar_ratio", metrics.getCalmarRatio());
        extra.put("win_rate", metrics.getWinRate());
        extra.put("profit_factor", metrics.getProfitFactor());
        extra.put("average_win", metrics.getAverageWin());
        extra.put("average_loss", metrics.getAverageLoss());
        extra.put("realized_pnl", stats.totalRealizedPnL());
        extra.put("unrealized_pnl", stats.totalUnrealizedPnL());

        BacktestResults results = new BacktestResults(
                curve.isEmpty() ? null : curve.get(0).time(),
                curve.isEmpty() ? null : curve.get(curve.size() - 1).time(),
                initialCapital,
                metrics.getCurrentEquity(),
                stats.closedPositions(),
                stats.winningTrades(),
                stats.losingTrades(),
                metrics.getMaxDrawdown(),
                metrics.getSharpeRatio(),
                metrics.getSortinoRatio(),
                metrics.getTotalReturn(),
                extra);
        logger.debug("Summarized {} equity points and {} trades", curve.size(), closedTradePnLs.size());
        return results;
    }

    public void recordEquity(double equity) {
        double previous = currentEquity;
        currentEquity = equity;
        equityCurve.add(equity);

        if (currentEquity > peakEquity) {
            peakEquity = currentEquity;
            currentDrawdown = 0.0;
        } else if (peakEquity > 0) {
            currentDrawdown = (peakEquity - currentEquity) / peakEquity;
            maxDrawdown = Math.max(maxDrawdown, currentDrawdown);
        }

        if (previous != 0) {
            periodReturns.add((currentEquity - previous) / previous);
        }
    }

    public void recordTrade(double profitLoss) {
        tradePnLs.add(profitLoss);
    }

    public double getTotalReturn() {
        if (initialCapital == 0) return 0.0;
        return (currentEquity - initialCapital) / initialCapital;
    }

    public double getAnnualizedReturn() {
        if (periodReturns.isEmpty()) return 0.0;
        var avgReturn = average(periodReturns);
        return Math.pow(1 + avgReturn, TRADING_DAYS_PER_YEAR) - 1;
    }

    public double getSharpeRatio() {
        if (periodReturns.size() < 2) return 0.0;

        var avgReturn = average(periodReturns);
        var variance = periodReturns.stream()
                .mapToDouble(r -> Math.pow(r - avgReturn, 2))
                .average()
                .orElse(0.0);
        var stdDev = Math.sqrt(variance);
        if (stdDev == 0) return 0.0;

        var excessReturn = avgReturn - dailyRiskFreeRate();
        return (excessReturn / stdDev) * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    /** Like Sharpe, but only returns below the risk-free rate count as volatility. */
    public double getSortinoRatio() {
        if (periodReturns.size() < 2) return 0.0;

        var target = dailyRiskFreeRate();
        var downsideVariance = periodReturns.stream()
                .mapToDouble(r -> Math.pow(Math.min(0.0, r - target), 2))
                .average()
                .orElse(0.0);
        var downsideDev = Math.sqrt(downsideVariance);
        if (downsideDev == 0) return 0.0;

        return ((average(periodReturns) - target) / downsideDev) * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    public double getMaxDrawdown() {
        return maxDrawdown;
    }

    public double getCurrentDrawdown() {
        return currentDrawdown;
    }

    public double getWinRate() {
        if (tradePnLs.isEmpty()) return 0.0;
        long winningTrades = tradePnLs.stream()
                .filter(pnl -> pnl > 0)
                .count();
        return (double) winningTrades / tradePnLs.size();
    }

    public double getProfitFactor() {
        var grossProfit = tradePnLs.stream()
                .filter(pnl -> pnl > 0)
                .mapToDouble(Double::doubleValue)
                .sum();
        var grossLoss = Math.abs(tradePnLs.stream()
                .filter(pnl -> pnl < 0)
                .mapToDouble(Double::doubleValue)
                .sum());
        return grossLoss == 0 ? 0.0 : grossProfit / grossLoss;
    }

    public double getAverageWin() {
        return tradePnLs.stream()
                .filter(pnl -> pnl > 0)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
    }

    public double getAverageLoss() {
        return tradePnLs.stream()
                .filter(pnl -> pnl < 0)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
    }

    public double getCalmarRatio() {
        if (maxDrawdown == 0) return 0.0;
        return getAnnualizedReturn() / maxDrawdown;
    }

    public int getTotalTrades() {
        return tradePnLs.size();
    }

    public double getCurrentEquity() {
        return currentEquity;
    }

    /**
     * Human-readable summary of {@code results}.
     */
    public static void printDashboard(BacktestResults results, PrintStream out) {
        out.println("\n" + "=".repeat(70));
        out.println("                    BACKTEST RESULTS");
        out.println("=".repeat(70));

        out.println("\n📊 RETURNS");
        out.printf("   Period:                %s -> %s%n", results.startTime(), results.endTime());
        out.printf("   Initial Capital:       $%,.2f%n", results.initialCapital());
        out.printf("   Final Equity:          $%,.2f%n", results.finalCapital());
        out.printf("   Total Return:          %.2f%%%n", results.returns() * 100);

        out.println("\n⚠️  RISK METRICS");
        out.printf("   Sharpe Ratio:          %.2f %s%n", results.sharpeRatio(),
                getRating(results.sharpeRatio(), 1.0, 2.0));
        out.printf("   Sortino Ratio:         %.2f%n", results.sortinoRatio());
        out.printf("   Maximum Drawdown:      %.2f%% %s%n", results.maxDrawdown() * 100,
                getDrawdownRating(results.maxDrawdown()));

        out.println("\n📈 TRADING STATISTICS");
        out.printf("   Total Trades:          %d%n", results.totalTrades());
        out.printf("   Winning / Losing:      %d / %d%n", results.winningTrades(), results.losingTrades());
        results.metrics().forEach((name, value) -> out.printf("   %-22s %.4f%n", name + ":", value));

        out.println("\n" + "=".repeat(70) + "\n");
    }

    private double dailyRiskFreeRate() {
        return riskFreeRate / TRADING_DAYS_PER_YEAR;
    }

    private static double average(List<Double> values) {
        return values.stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
    }

    private static String getRating(double value, double goodThreshold, double excellentThreshold) {
        if (value >= excellentThreshold) return "⭐⭐⭐ EXCELLENT";
        if (value >= goodThreshold) return "⭐⭐ GOOD";
        if (value >= goodThreshold * 0.7) return "⭐ ACCEPTABLE";
        return "⚠️  NEEDS IMPROVEMENT";
    }

    private static String getDrawdownRating(double drawdown) {
        if (drawdown < 0.10) return "⭐⭐⭐ EXCELLENT";
        if (drawdown < 0.20) return "⭐⭐ GOOD";
        if (drawdown < 0.30) return "⭐ ACCEPTABLE";
        return "⚠️  HIGH RISK";
    }
}
