package com.backtester.risk;

/** Rule that forced a position exit, in evaluation order. */
public enum ExitReason {
    STOP_LOSS,
    TAKE_PROFIT,
    TRAILING_STOP
}
