package com.backtester.portfolio;

public enum OrderSide {
    LONG,
    SHORT;

    public OrderSide opposite() {
        return this == LONG ? SHORT : LONG;
    }
}
