package com.limitbook.engine.core.error;

import lombok.Getter;

/**
 * Internal consistency check failed (crossed book, level total mismatch, stale snapshot).
 * Aborts the current shard operation.
 */
@Getter
public class InternalInvariantViolationException extends EngineException {
    private final String symbol;

    public InternalInvariantViolationException(String symbol, String message) {
        super(symbol + ": " + message);
        this.symbol = symbol;
    }
}
