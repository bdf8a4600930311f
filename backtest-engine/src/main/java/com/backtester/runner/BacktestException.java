package com.backtester.runner;

import java.time.Instant;

/**
 * A run was aborted. The run cannot be resumed; its partial results are inconclusive.
 */
public class BacktestException extends RuntimeException {
    private final transient Instant tick;

    public BacktestException(Instant tick, String message, Throwable cause) {
        super(message, cause);
        this.tick = tick;
    }

    public BacktestException(String message) {
        super(message);
        this.tick = null;
    }

    /** Timestamp of the tick that failed; {@code null} if the run failed before the first tick. */
    public Instant getTick() {
        return tick;
    }
}
