package com.backtester.portfolio;

import java.time.Duration;

/**
 * Point-in-time metrics of one position.
 */
public record PositionMetrics(
    double roi,
    Duration duration,
    double maxDrawdown,
    double realizedPnL,
    double unrealizedPnL
) {
    static PositionMetrics of(Position position, Duration duration) {
        return new PositionMetrics(
                position.roi(),
                duration,
                position.getMaxDrawdown(),
                position.getRealizedPnL(),
                position.getUnrealizedPnL());
    }
}
