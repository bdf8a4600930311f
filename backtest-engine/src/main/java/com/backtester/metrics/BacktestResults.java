package com.backtester.metrics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Summary of a completed run. Ratios and drawdown are decimals (0.05 = 5%).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BacktestResults(
    @JsonProperty("start_time") Instant startTime,
    @JsonProperty("end_time") Instant endTime,
    @JsonProperty("initial_capital") double initialCapital,
    @JsonProperty("final_capital") double finalCapital,
    @JsonProperty("total_trades") int totalTrades,
    @JsonProperty("winning_trades") int winningTrades,
    @JsonProperty("losing_trades") int losingTrades,
    @JsonProperty("max_drawdown") double maxDrawdown,
    @JsonProperty("sharpe_ratio") double sharpeRatio,
    @JsonProperty("sortino_ratio") double sortinoRatio,
    @JsonProperty("returns") double returns,
    @JsonProperty("metrics") Map<String, Double> metrics
) {
    public BacktestResults {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }
}
