package com.backtester.portfolio;

/**
 * Thrown when an order is rejected by the portfolio or a risk check.
 * Nothing has been applied when this is thrown.
 */
public class OrderRejectedException extends RuntimeException {
    private final RejectionReason reason;
    private final transient Order order;

    public OrderRejectedException(RejectionReason reason, Order order, String message) {
        super(reason + ": " + message);
        this.reason = reason;
        this.order = order;
    }

    public RejectionReason getReason() {
        return reason;
    }

    /** The offending order; may be {@code null} for lookups that carry no order. */
    public Order getOrder() {
        return order;
    }
}
