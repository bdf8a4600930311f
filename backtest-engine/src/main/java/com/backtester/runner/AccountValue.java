package com.backtester.runner;

import java.time.Instant;

/**
 * Account snapshot taken after a tick has been fully processed.
 */
public record AccountValue(
    Instant time,
    double value,
    double cash,
    int openPositions,
    double unrealizedPnL
) {}
