package com.backtester.portfolio;

/** Whether an order opens/adds to a position or reduces/closes it. */
public enum OrderType {
    ENTRY,
    EXIT
}
