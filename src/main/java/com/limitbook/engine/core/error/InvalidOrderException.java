package com.limitbook.engine.core.error;

/**
 * Order rejected before any book mutation: unknown symbol, non-positive or misaligned price,
 * non-positive quantity.
 */
public class InvalidOrderException extends EngineException {

    public InvalidOrderException(String message) {
        super(message);
    }
}
