package com.backtester.runner;

/** Thrown before the first tick when a required collaborator was not supplied. */
public class MissingComponentException extends BacktestException {
    private final String component;

    public MissingComponentException(String component) {
        super(component + " is required but was not set");
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
