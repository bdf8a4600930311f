package com.backtester.portfolio;

/** Why an order was not applied. */
public enum RejectionReason {
    INVALID_ORDER,
    INSUFFICIENT_CASH,
    SHORTS_DISABLED,
    EXIT_EXCEEDS_SIZE,
    NO_OPEN_POSITION,
    NO_POSITION_FOUND,
    RISK_VALIDATION_FAILED
}
