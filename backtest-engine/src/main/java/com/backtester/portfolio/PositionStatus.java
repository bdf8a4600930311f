package com.backtester.portfolio;

public enum PositionStatus {
    OPEN,
    PARTIALLY_OPEN,
    CLOSED
}
